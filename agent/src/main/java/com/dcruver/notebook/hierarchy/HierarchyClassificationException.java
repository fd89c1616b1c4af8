package com.dcruver.notebook.hierarchy;

import lombok.Getter;

/**
 * A file's position in the vault could not be classified.
 * Fatal for that file only; batch callers skip the file and carry on.
 */
@Getter
public class HierarchyClassificationException extends RuntimeException {

    private final String vaultRoot;
    private final String filePath;

    public HierarchyClassificationException(String message, String vaultRoot, String filePath) {
        super(message);
        this.vaultRoot = vaultRoot;
        this.filePath = filePath;
    }
}
