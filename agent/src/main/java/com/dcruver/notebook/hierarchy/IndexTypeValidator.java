package com.dcruver.notebook.hierarchy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Derives the index-type of a file from its path.
 *
 * <p>The derived type always wins over whatever {@code index-type} the file already carries;
 * a stored value is only compared and reported.
 */
@Component
@Slf4j
public class IndexTypeValidator {

    /**
     * Index files map depth 0..4 to main..module; anything else is a content file.
     */
    public IndexType deriveIndexType(PathClassification classification) {
        if (!classification.isIndexFile()) {
            return IndexType.NONE;
        }
        return IndexType.forDepth(classification.getDepth());
    }

    /**
     * Compare the stored index-type against the derived one and warn on mismatch.
     */
    public IndexTypeCheck validate(PathClassification classification, Frontmatter existing) {
        IndexType derived = deriveIndexType(classification);
        Object stored = existing.getIndexType();

        boolean mismatch;
        if (derived == IndexType.NONE) {
            // Content files must not carry the key at all, even with an empty value
            mismatch = existing.containsKey(IndexType.FRONTMATTER_KEY);
        } else {
            mismatch = !derived.getValue().equals(stored);
        }

        if (mismatch && existing.containsKey(IndexType.FRONTMATTER_KEY)) {
            log.warn("Stored index-type '{}' does not match path-derived '{}' for {}",
                stored, derived.isIndex() ? derived.getValue() : "none", classification.getFilePath());
        } else if (mismatch) {
            log.debug("No index-type stored for index file {}; derived '{}'",
                classification.getFilePath(), derived.getValue());
        }

        return new IndexTypeCheck(stored, derived, mismatch);
    }
}
