package com.dcruver.notebook.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Vault settings. The root is read once per run and treated as immutable while a batch runs.
 */
@Component
@ConfigurationProperties(prefix = "vault")
@Data
public class VaultProperties {

    /**
     * Absolute path of the vault root folder
     */
    private String root;

    /**
     * Extra file name accepted as the main index directly under the root
     */
    private String rootIndexFilename = "index.md";

    /**
     * Folder under the root for backups and change reports; never scanned
     */
    private String agentDir = ".vault-agent";

    private boolean backupEnabled = true;

    private ExecutionMode executionMode = ExecutionMode.DRY_RUN;

    private RequiredFields requiredFields = new RequiredFields();

    public Path getRootPath() {
        if (root == null || root.isBlank()) {
            throw new IllegalStateException("vault.root is not configured");
        }
        return Path.of(root).toAbsolutePath().normalize();
    }

    public Path getAgentPath() {
        return getRootPath().resolve(agentDir);
    }

    /**
     * Template fields filled in after hierarchy reconciliation. Off unless enabled.
     */
    @Data
    public static class RequiredFields {
        private boolean enabled = false;

        private String publisher = "University of Illinois at Urbana-Champaign";
    }

    public enum ExecutionMode {
        DRY_RUN,
        APPLY
    }
}
