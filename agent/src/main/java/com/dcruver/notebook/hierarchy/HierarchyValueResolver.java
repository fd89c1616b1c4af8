package com.dcruver.notebook.hierarchy;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps a classified path to the hierarchy values it should carry.
 *
 * <p>Values are the folder names exactly as they appear on disk; case and punctuation are
 * display-facing and left alone.
 */
@Component
public class HierarchyValueResolver {

    /**
     * Deepest applicable hierarchy level: the index-type's level for index files,
     * the (capped) folder depth for content files.
     */
    public int maxLevel(PathClassification classification, IndexType indexType) {
        if (indexType == IndexType.NONE) {
            return Math.min(classification.getDepth(), HierarchyField.MAX_LEVEL);
        }
        return indexType.getMaxLevel();
    }

    /**
     * Canonical value per applicable field, in level order. Empty for the main index.
     */
    public Map<HierarchyField, String> resolveCanonicalValues(PathClassification classification, IndexType indexType) {
        int maxLevel = maxLevel(classification, indexType);
        if (maxLevel > classification.getSegments().size()) {
            throw new IllegalArgumentException("Index type " + indexType + " needs " + maxLevel
                + " folders but " + classification.getFilePath() + " has " + classification.getSegments().size());
        }

        Map<HierarchyField, String> values = new EnumMap<>(HierarchyField.class);
        for (HierarchyField field : HierarchyField.upTo(maxLevel)) {
            values.put(field, classification.folderAt(field.getLevel()));
        }
        return Collections.unmodifiableMap(values);
    }
}
