package com.dcruver.notebook.hierarchy;

/**
 * The hierarchy depth of a path cannot be determined, e.g. the path is the vault root itself.
 */
public class AmbiguousDepthException extends HierarchyClassificationException {

    public AmbiguousDepthException(String reason, String vaultRoot, String filePath) {
        super("Cannot determine hierarchy depth for " + filePath + ": " + reason, vaultRoot, filePath);
    }
}
