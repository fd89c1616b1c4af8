package com.dcruver.notebook.vault;

import com.dcruver.notebook.config.VaultProperties;
import com.dcruver.notebook.hierarchy.ClassificationCache;
import com.dcruver.notebook.hierarchy.FieldChange;
import com.dcruver.notebook.hierarchy.HierarchyClassificationException;
import com.dcruver.notebook.hierarchy.MetadataHierarchyDetector;
import com.dcruver.notebook.hierarchy.OutOfVaultException;
import com.dcruver.notebook.hierarchy.ReconciliationResult;
import com.dcruver.notebook.io.ChangeReport;
import com.dcruver.notebook.io.ChangeReport.ReportStatus;
import com.dcruver.notebook.io.ChangeReportWriter;
import com.dcruver.notebook.io.FrontmatterParseException;
import com.dcruver.notebook.io.MarkdownFileReader;
import com.dcruver.notebook.io.MarkdownFileWriter;
import com.dcruver.notebook.io.MarkdownNote;
import com.dcruver.notebook.vault.EnsureOutcome.Status;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Ensures one note's hierarchy metadata matches its location in the vault.
 *
 * <p>Reads the note, reconciles its frontmatter, optionally fills missing template fields and
 * either reports the changes (dry run) or writes the file back after taking a backup.
 * Every failure is scoped to the file.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MetadataEnsureProcessor {

    private final MetadataHierarchyDetector detector;
    private final TemplateFieldsFiller templateFiller;
    private final MarkdownFileReader reader;
    private final MarkdownFileWriter writer;
    private final ChangeReportWriter reportWriter;
    private final VaultProperties properties;

    public EnsureOutcome ensureMetadata(Path filePath, boolean dryRun) {
        return ensureMetadata(filePath, dryRun, new ClassificationCache(properties.getRootPath(), detector.getClassifier()));
    }

    /**
     * Process a single file, reusing the caller's classification cache.
     */
    public EnsureOutcome ensureMetadata(Path path, boolean dryRun, ClassificationCache cache) {
        Path filePath = path != null ? path.toAbsolutePath().normalize() : null;
        if (filePath == null || !Files.isRegularFile(filePath)) {
            log.warn("File not found: {}", filePath);
            return EnsureOutcome.of(filePath, Status.SKIPPED, "file not found");
        }
        if (!filePath.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".md")) {
            log.debug("Skipping non-markdown file: {}", filePath);
            return EnsureOutcome.of(filePath, Status.SKIPPED, "not a markdown file");
        }

        try {
            MarkdownNote note = reader.read(filePath);
            ReconciliationResult hierarchy = detector.detect(cache, filePath, note.getFrontmatter());
            ReconciliationResult result = templateFiller.fill(filePath, hierarchy);

            if (!result.hasChanges()) {
                log.debug("No metadata changes needed for: {}", filePath);
                return EnsureOutcome.builder().filePath(filePath).status(Status.UNCHANGED).result(result).build();
            }

            MarkdownNote updated = writer.updateFrontmatter(note, result);
            String revisedContent = writer.buildContent(updated);

            if (dryRun) {
                log.info("DRY RUN: Would update metadata for: {}", filePath);
                logChangeSummary(filePath, result);
                String reportId = storeReport(filePath, result, ReportStatus.DRY_RUN,
                    note.getRawContent(), revisedContent, null);
                return EnsureOutcome.builder().filePath(filePath).status(Status.WOULD_UPDATE)
                    .result(result).reportId(reportId).build();
            }

            Path backup = properties.isBackupEnabled() ? reportWriter.backupNote(filePath, note.getRawContent()) : null;
            writer.write(updated, filePath);
            log.info("Updated metadata for: {}", filePath);

            String reportId = storeReport(filePath, result, ReportStatus.APPLIED,
                note.getRawContent(), revisedContent, backup);
            return EnsureOutcome.builder().filePath(filePath).status(Status.UPDATED)
                .result(result).reportId(reportId).build();

        } catch (OutOfVaultException e) {
            log.warn("Skipping {}: {}", filePath, e.getMessage());
            return EnsureOutcome.of(filePath, Status.SKIPPED, e.getMessage());
        } catch (HierarchyClassificationException e) {
            log.error("Cannot classify {}: {}", filePath, e.getMessage());
            return EnsureOutcome.of(filePath, Status.FAILED, e.getMessage());
        } catch (FrontmatterParseException e) {
            log.error("Leaving {} untouched: {}", filePath, e.getMessage());
            return EnsureOutcome.of(filePath, Status.FAILED, e.getMessage());
        } catch (IOException e) {
            log.error("Failed to process metadata for file: {}", filePath, e);
            return EnsureOutcome.of(filePath, Status.FAILED, e.getMessage());
        }
    }

    /**
     * Reports are an audit trail; a failure to write one does not undo the file update.
     */
    private String storeReport(Path filePath, ReconciliationResult result, ReportStatus status,
                               String original, String revised, Path backup) {
        try {
            ChangeReport report = reportWriter.createReport(filePath, result, status, original, revised, backup);
            return report.getId();
        } catch (IOException e) {
            log.error("Failed to write change report for {}", filePath, e);
            return null;
        }
    }

    private void logChangeSummary(Path filePath, ReconciliationResult result) {
        StringBuilder summary = new StringBuilder();
        summary.append("--- Metadata changes for ").append(filePath).append(" ---");
        for (FieldChange change : result.getChanges()) {
            summary.append("\n    ").append(change.describe());
        }
        log.info(summary.toString());
    }
}
