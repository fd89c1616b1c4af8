package com.dcruver.notebook.hierarchy;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Where a file sits in the vault, as computed from its path alone.
 */
@Value
@Builder
public class PathClassification {
    // Normalized forms, '/'-separated
    String vaultRoot;
    String filePath;

    String fileName;

    // Folder names between the vault root and the file, exactly as on disk
    List<String> segments;

    // Number of folders, capped at the module level
    int depth;

    // Number of folders, uncapped (lesson/topic folders below a module count here only)
    int folderDepth;

    // Named after its containing folder (or the configured root index file at depth 0)
    boolean indexFile;

    /**
     * Folder name at a hierarchy level (1-based), or null when the file is shallower
     */
    public String folderAt(int level) {
        if (level < 1 || level > segments.size()) {
            return null;
        }
        return segments.get(level - 1);
    }

    public String getContainingFolder() {
        return segments.isEmpty() ? null : segments.get(segments.size() - 1);
    }
}
