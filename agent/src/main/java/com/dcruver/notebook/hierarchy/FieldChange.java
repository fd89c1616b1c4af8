package com.dcruver.notebook.hierarchy;

import lombok.Builder;
import lombok.Value;

/**
 * One edit made to a frontmatter key during reconciliation.
 */
@Value
@Builder
public class FieldChange {
    String key;
    ChangeType type;
    Object oldValue;
    Object newValue;

    // The old value had the wrong shape (list, number, map...) and was overwritten
    boolean malformed;

    public enum ChangeType {
        ADDED,
        CORRECTED,
        REMOVED
    }

    public static FieldChange added(String key, Object oldValue, Object newValue) {
        return FieldChange.builder().key(key).type(ChangeType.ADDED)
            .oldValue(oldValue).newValue(newValue).build();
    }

    public static FieldChange corrected(String key, Object oldValue, Object newValue) {
        return FieldChange.builder().key(key).type(ChangeType.CORRECTED)
            .oldValue(oldValue).newValue(newValue)
            .malformed(!(oldValue instanceof String))
            .build();
    }

    public static FieldChange removed(String key, Object oldValue) {
        return FieldChange.builder().key(key).type(ChangeType.REMOVED)
            .oldValue(oldValue).build();
    }

    /**
     * Short audit line, e.g. {@code CORRECTED index-type: 'course' -> 'program'}
     */
    public String describe() {
        return switch (type) {
            case ADDED -> "ADDED " + key + ": '" + newValue + "'";
            case CORRECTED -> "CORRECTED " + key + ": '" + oldValue + "' -> '" + newValue + "'"
                + (malformed ? " (malformed value)" : "");
            case REMOVED -> "REMOVED " + key + ": '" + oldValue + "'";
        };
    }
}
