package com.dcruver.notebook.hierarchy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

/**
 * Single entry point for hierarchy metadata: classify the path, derive the index-type,
 * resolve canonical values and reconcile the file's frontmatter against them.
 *
 * <p>Pure per call: no filesystem access and no state kept between calls, so distinct files
 * may be processed concurrently. Every change is logged with the file path for auditing.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MetadataHierarchyDetector {

    private final PathClassifier classifier;
    private final IndexTypeValidator indexTypeValidator;
    private final HierarchyValueResolver valueResolver;
    private final FrontmatterReconciler reconciler;

    /**
     * Detector wired with default collaborators, for use outside a Spring context
     */
    public static MetadataHierarchyDetector create(PathClassifier classifier) {
        return new MetadataHierarchyDetector(classifier, new IndexTypeValidator(),
            new HierarchyValueResolver(), new FrontmatterReconciler());
    }

    public PathClassifier getClassifier() {
        return classifier;
    }

    /**
     * Reconcile raw path strings and a plain map, as handed over by a note pipeline.
     *
     * @throws OutOfVaultException if the file is outside the vault
     * @throws AmbiguousDepthException if the depth cannot be determined
     */
    public ReconciliationResult detect(String vaultRoot, String filePath, Map<String, ?> existing) {
        return detect(classifier.classify(vaultRoot, filePath), Frontmatter.of(existing));
    }

    public ReconciliationResult detect(Path vaultRoot, Path filePath, Frontmatter existing) {
        return detect(classifier.classify(vaultRoot, filePath), existing);
    }

    public ReconciliationResult detect(ClassificationCache cache, Path filePath, Frontmatter existing) {
        return detect(cache.classify(filePath), existing);
    }

    public ReconciliationResult detect(PathClassification classification, Frontmatter existing) {
        IndexType indexType = indexTypeValidator.deriveIndexType(classification);
        IndexTypeCheck check = indexTypeValidator.validate(classification, existing);

        int maxLevel = valueResolver.maxLevel(classification, indexType);
        Map<HierarchyField, String> canonical = valueResolver.resolveCanonicalValues(classification, indexType);

        ReconciliationResult result = reconciler.reconcile(existing, canonical, maxLevel, indexType);
        logChanges(classification.getFilePath(), result);

        return result.toBuilder()
            .classification(classification)
            .indexTypeCheck(check)
            .build();
    }

    private void logChanges(String filePath, ReconciliationResult result) {
        if (!result.hasChanges()) {
            log.debug("Hierarchy metadata already correct for {}", filePath);
            return;
        }
        for (FieldChange change : result.getChanges()) {
            if (change.isMalformed()) {
                log.warn("{}: {} had malformed value '{}', replaced with '{}'",
                    filePath, change.getKey(), change.getOldValue(), change.getNewValue());
            } else {
                log.info("{}: {}", filePath, change.describe());
            }
        }
    }
}
