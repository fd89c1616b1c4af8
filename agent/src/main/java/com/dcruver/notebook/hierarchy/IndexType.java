package com.dcruver.notebook.hierarchy;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of index file a note is, derived from its position in the vault.
 * {@link #NONE} marks a content file, which never carries an {@code index-type} key.
 */
public enum IndexType {
    NONE(-1, null),
    MAIN(0, "main"),
    PROGRAM(1, "program"),
    COURSE(2, "course"),
    CLASS(3, "class"),
    MODULE(4, "module");

    public static final String FRONTMATTER_KEY = "index-type";

    // Older vaults wrote "program-index", "class-index" and so on
    private static final String LEGACY_SUFFIX = "-index";

    private final int maxLevel;
    private final String value;

    IndexType(int maxLevel, String value) {
        this.maxLevel = maxLevel;
        this.value = value;
    }

    /**
     * Deepest hierarchy level an index file of this type may carry.
     * Undefined for {@link #NONE}; content files use their folder depth instead.
     */
    public int getMaxLevel() {
        if (this == NONE) {
            throw new IllegalStateException("Content files have no index-type max level");
        }
        return maxLevel;
    }

    /**
     * Frontmatter value, or null for {@link #NONE}
     */
    public String getValue() {
        return value;
    }

    public boolean isIndex() {
        return this != NONE;
    }

    /**
     * Index type for an index file at the given (capped) hierarchy depth.
     */
    public static IndexType forDepth(int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("Depth must not be negative: " + depth);
        }
        return switch (Math.min(depth, HierarchyField.MAX_LEVEL)) {
            case 0 -> MAIN;
            case 1 -> PROGRAM;
            case 2 -> COURSE;
            case 3 -> CLASS;
            default -> MODULE;
        };
    }

    /**
     * Lenient parse of a stored frontmatter value. Only used to describe what was stored;
     * the stored value never decides the outcome.
     */
    public static Optional<IndexType> fromValue(Object stored) {
        if (!(stored instanceof String) || ((String) stored).isBlank()) {
            return Optional.empty();
        }
        String normalized = ((String) stored).trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith(LEGACY_SUFFIX)) {
            normalized = normalized.substring(0, normalized.length() - LEGACY_SUFFIX.length());
        }
        for (IndexType type : values()) {
            if (type.value != null && type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
