package com.dcruver.notebook.hierarchy;

/**
 * The file does not lie under the configured vault root.
 */
public class OutOfVaultException extends HierarchyClassificationException {

    public OutOfVaultException(String vaultRoot, String filePath) {
        super("File is not inside the vault: " + filePath + " (vault root: " + vaultRoot + ")",
            vaultRoot, filePath);
    }
}
