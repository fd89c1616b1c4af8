package com.dcruver.notebook.hierarchy;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Caller-owned memo of path classifications for a single vault root.
 *
 * <p>Entries are only valid for the root the cache was created with; {@link #rebind(String)}
 * hands back a fresh cache when the root changes. Safe to share between worker threads.
 */
@Slf4j
public class ClassificationCache {

    private final String vaultRoot;
    private final String rootKey;
    private final PathClassifier classifier;
    private final Map<String, PathClassification> entries = new ConcurrentHashMap<>();

    public ClassificationCache(Path vaultRoot, PathClassifier classifier) {
        this(vaultRoot.toString(), classifier);
    }

    public ClassificationCache(String vaultRoot, PathClassifier classifier) {
        this.vaultRoot = vaultRoot;
        this.rootKey = PathClassifier.normalizedKey(vaultRoot);
        this.classifier = classifier;
    }

    public String getVaultRoot() {
        return vaultRoot;
    }

    /**
     * Classify a file, reusing a previous result for the same normalized path.
     * Classification errors are not cached.
     */
    public PathClassification classify(Path filePath) {
        return classify(filePath.toString());
    }

    public PathClassification classify(String filePath) {
        String key = PathClassifier.normalizedKey(filePath);
        PathClassification cached = entries.get(key);
        if (cached != null) {
            return cached;
        }
        PathClassification computed = classifier.classify(vaultRoot, filePath);
        PathClassification previous = entries.putIfAbsent(key, computed);
        return previous != null ? previous : computed;
    }

    /**
     * This cache if the root is unchanged, otherwise a new empty cache for the new root.
     */
    public ClassificationCache rebind(String newVaultRoot) {
        if (rootKey.equals(PathClassifier.normalizedKey(newVaultRoot))) {
            return this;
        }
        log.debug("Vault root changed from {} to {}; discarding {} cached classifications",
            vaultRoot, newVaultRoot, entries.size());
        return new ClassificationCache(newVaultRoot, classifier);
    }

    public void invalidate() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
