package com.dcruver.notebook.io;

import com.dcruver.notebook.config.VaultProperties;
import com.dcruver.notebook.hierarchy.ReconciliationResult;
import com.dcruver.notebook.io.ChangeReport.ReportStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Audit trail for metadata updates: one JSON report and one patch per touched note, plus a
 * copy of the note as it was read before an applied update. Everything lives under the
 * vault's agent directory.
 */
@Component
@Slf4j
public class ChangeReportWriter {

    private static final DateTimeFormatter BACKUP_SUFFIX =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);
    private static final int DIFF_CONTEXT = 3;

    private final ObjectMapper objectMapper;
    private final Path backupDir;
    private final Path reportsDir;

    @Autowired
    public ChangeReportWriter(VaultProperties properties) {
        this(properties.getAgentPath());
    }

    public ChangeReportWriter(Path agentDir) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.backupDir = agentDir.resolve("backups");
        this.reportsDir = agentDir.resolve("reports");
    }

    public Path getReportsDir() {
        return reportsDir;
    }

    /**
     * Save the content a note had when it was read, before it gets overwritten.
     * The backup holds exactly the text the report's patch starts from.
     */
    public Path backupNote(Path note, String contentAsRead) throws IOException {
        Files.createDirectories(backupDir);
        Path backup = backupDir.resolve(note.getFileName() + "." + BACKUP_SUFFIX.format(Instant.now()) + ".bak");
        Files.writeString(backup, contentAsRead);
        log.info("Saved {} to {}", note.getFileName(), backup);
        return backup;
    }

    /**
     * Store a report and its patch for one note. {@code backup} is the copy taken before an
     * applied update, or null.
     */
    public ChangeReport createReport(Path filePath, ReconciliationResult result, ReportStatus status,
                                     String originalContent, String revisedContent, Path backup) throws IOException {
        Files.createDirectories(reportsDir);

        String reportId = UUID.randomUUID().toString();
        String name = filePath.getFileName().toString();
        String patch = unifiedPatch(name, originalContent, revisedContent);

        ChangeReport report = ChangeReport.builder()
            .id(reportId)
            .filePath(filePath.toString())
            .indexType(result.getIndexType() != null && result.getIndexType().isIndex()
                ? result.getIndexType().getValue() : "none")
            .maxLevel(result.getMaxLevel())
            .createdAt(Instant.now())
            .status(status)
            .changes(result.getChanges().stream().map(ChangeReport.FieldEntry::from).toList())
            .patchContent(patch)
            .backupPath(backup != null ? backup.toString() : null)
            .build();

        String baseName = stem(name) + "-" + reportId;
        objectMapper.writerWithDefaultPrettyPrinter()
            .writeValue(reportsDir.resolve(baseName + ".json").toFile(), report);
        Files.writeString(reportsDir.resolve(baseName + ".patch"), patch);

        log.info("Created {} change report {} for {}", status, reportId, filePath);
        return report;
    }

    /**
     * All stored reports, newest first
     */
    public List<ChangeReport> listReports() throws IOException {
        if (!Files.exists(reportsDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(reportsDir)) {
            return files
                .filter(p -> p.toString().endsWith(".json"))
                .map(this::readReport)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(ChangeReport::getCreatedAt,
                    Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
        }
    }

    /**
     * Get a specific report by ID, or null
     */
    public ChangeReport getReport(String reportId) throws IOException {
        return listReports().stream()
            .filter(r -> reportId.equals(r.getId()))
            .findFirst()
            .orElse(null);
    }

    // Header lines name the note as a/<name> and b/<name>, git style
    private static String unifiedPatch(String name, String before, String after) {
        List<String> beforeLines = before.lines().toList();
        Patch<String> patch = DiffUtils.diff(beforeLines, after.lines().toList());
        List<String> lines = UnifiedDiffUtils.generateUnifiedDiff("a/" + name, "b/" + name,
            beforeLines, patch, DIFF_CONTEXT);
        return lines.isEmpty() ? "" : String.join("\n", lines) + "\n";
    }

    private ChangeReport readReport(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), ChangeReport.class);
        } catch (IOException e) {
            log.error("Failed to read change report: {}", file, e);
            return null;
        }
    }

    private static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
