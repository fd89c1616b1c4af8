package com.dcruver.notebook.app;

import com.dcruver.notebook.config.VaultProperties;
import com.dcruver.notebook.config.VaultProperties.ExecutionMode;
import com.dcruver.notebook.hierarchy.HierarchyClassificationException;
import com.dcruver.notebook.hierarchy.HierarchyValueResolver;
import com.dcruver.notebook.hierarchy.IndexType;
import com.dcruver.notebook.hierarchy.IndexTypeValidator;
import com.dcruver.notebook.hierarchy.PathClassification;
import com.dcruver.notebook.hierarchy.PathClassifier;
import com.dcruver.notebook.io.ChangeReport;
import com.dcruver.notebook.io.ChangeReportWriter;
import com.dcruver.notebook.vault.BatchResult;
import com.dcruver.notebook.vault.EnsureOutcome;
import com.dcruver.notebook.vault.MetadataEnsureProcessor;
import com.dcruver.notebook.vault.VaultMetadataBatchProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;
import java.util.List;

/**
 * Spring Shell commands for the vault agent.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class VaultShellCommands {

    private final PathClassifier classifier;
    private final IndexTypeValidator indexTypeValidator;
    private final HierarchyValueResolver valueResolver;
    private final MetadataEnsureProcessor ensureProcessor;
    private final VaultMetadataBatchProcessor batchProcessor;
    private final ChangeReportWriter reportWriter;
    private final VaultProperties properties;

    @ShellMethod(key = "classify", value = "Show where a file sits in the vault hierarchy")
    public String classify(@ShellOption(help = "File to classify") String path) {
        try {
            PathClassification c = classifier.classify(properties.getRootPath(), absolute(path));
            IndexType indexType = indexTypeValidator.deriveIndexType(c);
            int maxLevel = valueResolver.maxLevel(c, indexType);

            StringBuilder result = new StringBuilder();
            result.append(String.format("File: %s\n", c.getFilePath()));
            result.append(String.format("- Folders: %s\n", c.getSegments()));
            result.append(String.format("- Depth: %d (folders: %d)\n", c.getDepth(), c.getFolderDepth()));
            result.append(String.format("- Index file: %s\n", c.isIndexFile() ? "yes" : "no"));
            result.append(String.format("- Index type: %s\n", indexType.isIndex() ? indexType.getValue() : "none"));
            result.append(String.format("- Max level: %d\n", maxLevel));
            valueResolver.resolveCanonicalValues(c, indexType).forEach((field, value) ->
                result.append(String.format("  %s: %s\n", field.getKey(), value)));
            return result.toString();
        } catch (HierarchyClassificationException e) {
            return "Cannot classify: " + e.getMessage();
        }
    }

    @ShellMethod(key = "ensure-metadata", value = "Reconcile hierarchy metadata of one note")
    public String ensureMetadata(
            @ShellOption(help = "Markdown file to update") String path,
            @ShellOption(defaultValue = "false", help = "Report changes without writing") boolean dryRun) {
        boolean effectiveDryRun = isDryRun(dryRun);
        EnsureOutcome outcome = ensureProcessor.ensureMetadata(absolute(path), effectiveDryRun);
        return formatOutcome(outcome);
    }

    @ShellMethod(key = "ensure-vault", value = "Reconcile hierarchy metadata of every note in the vault")
    public String ensureVault(
            @ShellOption(defaultValue = ShellOption.NULL, help = "Folder inside the vault (defaults to the root)") String path,
            @ShellOption(defaultValue = "false", help = "Report changes without writing") boolean dryRun) {
        boolean effectiveDryRun = isDryRun(dryRun);
        try {
            BatchResult batch = path == null
                ? batchProcessor.ensureVault(effectiveDryRun)
                : batchProcessor.ensureFolder(absolute(path), effectiveDryRun);

            StringBuilder result = new StringBuilder();
            result.append(effectiveDryRun ? "Dry run completed.\n\n" : "Metadata run completed.\n\n");
            result.append(String.format("- Files: %d\n", batch.getTotal()));
            result.append(String.format("- Updated: %d\n", batch.count(EnsureOutcome.Status.UPDATED)));
            result.append(String.format("- Would update: %d\n", batch.count(EnsureOutcome.Status.WOULD_UPDATE)));
            result.append(String.format("- Unchanged: %d\n", batch.count(EnsureOutcome.Status.UNCHANGED)));
            result.append(String.format("- Skipped: %d\n", batch.count(EnsureOutcome.Status.SKIPPED)));
            result.append(String.format("- Failed: %d\n", batch.count(EnsureOutcome.Status.FAILED)));
            for (EnsureOutcome failure : batch.getFailures()) {
                result.append(String.format("  ! %s: %s\n", failure.getFilePath(), failure.getMessage()));
            }
            return result.toString();
        } catch (Exception e) {
            log.error("Metadata run failed", e);
            return "Metadata run failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "reports", value = "List stored change reports")
    public String reports() {
        try {
            List<ChangeReport> reports = reportWriter.listReports();
            if (reports.isEmpty()) {
                return "No change reports.";
            }
            StringBuilder result = new StringBuilder();
            result.append(String.format("%d change report(s):\n\n", reports.size()));
            for (ChangeReport report : reports) {
                result.append(String.format("%s [%s] %s (%d change(s))\n",
                    report.getId(), report.getStatus(), report.getFilePath(), report.getChanges().size()));
            }
            return result.toString();
        } catch (Exception e) {
            log.error("Failed to list reports", e);
            return "Failed to list reports: " + e.getMessage();
        }
    }

    private boolean isDryRun(boolean requested) {
        return requested || properties.getExecutionMode() == ExecutionMode.DRY_RUN;
    }

    private static Path absolute(String path) {
        return Path.of(path).toAbsolutePath().normalize();
    }

    private static String formatOutcome(EnsureOutcome outcome) {
        StringBuilder result = new StringBuilder();
        result.append(String.format("%s: %s\n", outcome.getStatus(), outcome.getFilePath()));
        if (outcome.getResult() != null) {
            outcome.getResult().getChanges().forEach(change ->
                result.append("  ").append(change.describe()).append("\n"));
        }
        if (outcome.getMessage() != null) {
            result.append("  ").append(outcome.getMessage()).append("\n");
        }
        if (outcome.getReportId() != null) {
            result.append("  report: ").append(outcome.getReportId()).append("\n");
        }
        return result.toString();
    }
}
