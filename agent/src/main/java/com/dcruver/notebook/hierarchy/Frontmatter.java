package com.dcruver.notebook.hierarchy;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, ordered view of a note's YAML frontmatter.
 *
 * <p>Hierarchy keys ({@code program}, {@code course}, {@code class}, {@code module}) and
 * {@code index-type} have typed accessors; every other key is opaque passthrough data owned
 * by the caller and is kept in its original order.
 */
@EqualsAndHashCode
@ToString
public final class Frontmatter {

    private static final Frontmatter EMPTY = new Frontmatter(new LinkedHashMap<>());

    private final Map<String, Object> entries;

    private Frontmatter(LinkedHashMap<String, Object> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static Frontmatter empty() {
        return EMPTY;
    }

    /**
     * Copy of the given mapping. Null keys are dropped; null values are kept.
     */
    public static Frontmatter of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key != null) {
                copy.put(key, value);
            }
        });
        return new Frontmatter(copy);
    }

    public Object get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public Object getHierarchyValue(HierarchyField field) {
        return entries.get(field.getKey());
    }

    public Object getIndexType() {
        return entries.get(IndexType.FRONTMATTER_KEY);
    }

    /**
     * Hierarchy keys that are present, in file order
     */
    public Map<String, Object> getHierarchyFields() {
        LinkedHashMap<String, Object> result = new LinkedHashMap<>();
        entries.forEach((key, value) -> {
            if (HierarchyField.isHierarchyKey(key)) {
                result.put(key, value);
            }
        });
        return Collections.unmodifiableMap(result);
    }

    /**
     * Everything except hierarchy keys and {@code index-type}, in file order
     */
    public Map<String, Object> getPassthrough() {
        LinkedHashMap<String, Object> result = new LinkedHashMap<>();
        entries.forEach((key, value) -> {
            if (!HierarchyField.isHierarchyKey(key) && !IndexType.FRONTMATTER_KEY.equals(key)) {
                result.put(key, value);
            }
        });
        return Collections.unmodifiableMap(result);
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Mutable ordered copy, e.g. for serialization
     */
    public Map<String, Object> toMap() {
        return new LinkedHashMap<>(entries);
    }

    public Editor edit() {
        return new Editor(new LinkedHashMap<>(entries));
    }

    /**
     * True for a missing value: null, a blank string or an empty collection.
     */
    public static boolean isBlankValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String) {
            return ((String) value).isBlank();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        return false;
    }

    /**
     * Ordered edits on a copy. Replacing an existing key keeps its position; new keys go last.
     */
    public static final class Editor {
        private final LinkedHashMap<String, Object> entries;

        private Editor(LinkedHashMap<String, Object> entries) {
            this.entries = entries;
        }

        public Editor put(String key, Object value) {
            entries.put(key, value);
            return this;
        }

        public Editor remove(String key) {
            entries.remove(key);
            return this;
        }

        public Frontmatter build() {
            return entries.isEmpty() ? EMPTY : new Frontmatter(new LinkedHashMap<>(entries));
        }
    }
}
