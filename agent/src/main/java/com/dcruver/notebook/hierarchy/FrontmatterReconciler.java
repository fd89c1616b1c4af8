package com.dcruver.notebook.hierarchy;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Brings existing frontmatter in line with the canonical hierarchy values.
 *
 * <ol>
 *   <li>Fields up to {@code maxLevel} are filled when missing or blank and overwritten when
 *       they differ from the canonical value, whatever shape the stored value has.</li>
 *   <li>Fields above {@code maxLevel} are removed.</li>
 *   <li>{@code index-type} is set for index files and removed from content files.</li>
 *   <li>All other keys pass through untouched and in order.</li>
 * </ol>
 *
 * Reconciling the output a second time yields no changes. Data-shape problems never throw.
 */
@Component
public class FrontmatterReconciler {

    public ReconciliationResult reconcile(Frontmatter existing,
                                          Map<HierarchyField, String> canonical,
                                          int maxLevel,
                                          IndexType indexType) {
        checkArguments(canonical, maxLevel, indexType);

        Frontmatter.Editor editor = existing.edit();
        List<FieldChange> changes = new ArrayList<>();

        for (HierarchyField field : HierarchyField.upTo(maxLevel)) {
            applyExpected(existing, editor, changes, field.getKey(), canonical.get(field));
        }

        for (HierarchyField field : HierarchyField.above(maxLevel)) {
            removeIfPresent(existing, editor, changes, field.getKey());
        }

        if (indexType.isIndex()) {
            applyExpected(existing, editor, changes, IndexType.FRONTMATTER_KEY, indexType.getValue());
        } else {
            removeIfPresent(existing, editor, changes, IndexType.FRONTMATTER_KEY);
        }

        return ReconciliationResult.builder()
            .frontmatter(changes.isEmpty() ? existing : editor.build())
            .changes(changes)
            .indexType(indexType)
            .maxLevel(maxLevel)
            .build();
    }

    private static void applyExpected(Frontmatter existing, Frontmatter.Editor editor,
                                      List<FieldChange> changes, String key, String expected) {
        Object current = existing.get(key);
        if (!existing.containsKey(key) || Frontmatter.isBlankValue(current)) {
            editor.put(key, expected);
            changes.add(FieldChange.added(key, current, expected));
        } else if (!expected.equals(current)) {
            editor.put(key, expected);
            changes.add(FieldChange.corrected(key, current, expected));
        }
    }

    private static void removeIfPresent(Frontmatter existing, Frontmatter.Editor editor,
                                        List<FieldChange> changes, String key) {
        if (existing.containsKey(key)) {
            editor.remove(key);
            changes.add(FieldChange.removed(key, existing.get(key)));
        }
    }

    private static void checkArguments(Map<HierarchyField, String> canonical, int maxLevel, IndexType indexType) {
        if (maxLevel < 0 || maxLevel > HierarchyField.MAX_LEVEL) {
            throw new IllegalArgumentException("maxLevel must be between 0 and "
                + HierarchyField.MAX_LEVEL + ": " + maxLevel);
        }
        if (indexType.isIndex() && indexType.getMaxLevel() != maxLevel) {
            throw new IllegalArgumentException("maxLevel " + maxLevel + " does not match index type " + indexType);
        }
        for (HierarchyField field : HierarchyField.values()) {
            String value = canonical.get(field);
            if (field.getLevel() <= maxLevel && (value == null || value.isBlank())) {
                throw new IllegalArgumentException("Missing canonical value for " + field.getKey());
            }
            if (field.getLevel() > maxLevel && value != null) {
                throw new IllegalArgumentException("Canonical value for " + field.getKey()
                    + " is above maxLevel " + maxLevel);
            }
        }
    }
}
