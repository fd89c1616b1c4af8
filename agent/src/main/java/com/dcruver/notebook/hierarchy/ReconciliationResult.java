package com.dcruver.notebook.hierarchy;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Updated frontmatter plus the change log that produced it.
 * Classification and index-type check are filled in when produced by
 * {@link MetadataHierarchyDetector}; a bare reconcile leaves them null.
 */
@Value
@Builder(toBuilder = true)
public class ReconciliationResult {
    Frontmatter frontmatter;

    @Singular
    List<FieldChange> changes;

    IndexType indexType;
    int maxLevel;

    PathClassification classification;
    IndexTypeCheck indexTypeCheck;

    public boolean hasChanges() {
        return !changes.isEmpty();
    }

    public List<FieldChange> changesOf(FieldChange.ChangeType type) {
        return changes.stream().filter(c -> c.getType() == type).toList();
    }

    public boolean hasMalformedValues() {
        return changes.stream().anyMatch(FieldChange::isMalformed);
    }
}
