package com.dcruver.notebook.hierarchy;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The four hierarchy levels of the vault taxonomy, in order.
 * Each level is written to frontmatter under its lower-case key.
 */
public enum HierarchyField {
    PROGRAM(1, "program"),
    COURSE(2, "course"),
    CLASS(3, "class"),
    MODULE(4, "module");

    public static final int MAX_LEVEL = 4;

    private static final List<HierarchyField> ORDERED = List.of(values());

    private final int level;
    private final String key;

    HierarchyField(int level, String key) {
        this.level = level;
        this.key = key;
    }

    public int getLevel() {
        return level;
    }

    public String getKey() {
        return key;
    }

    /**
     * Fields whose level is at most {@code maxLevel}, in level order
     */
    public static List<HierarchyField> upTo(int maxLevel) {
        return ORDERED.stream().filter(f -> f.level <= maxLevel).toList();
    }

    /**
     * Fields whose level is above {@code maxLevel}, in level order
     */
    public static List<HierarchyField> above(int maxLevel) {
        return ORDERED.stream().filter(f -> f.level > maxLevel).toList();
    }

    public static Optional<HierarchyField> fromKey(String key) {
        return Arrays.stream(values()).filter(f -> f.key.equals(key)).findFirst();
    }

    public static boolean isHierarchyKey(String key) {
        return fromKey(key).isPresent();
    }
}
