package com.dcruver.notebook.vault;

import com.dcruver.notebook.config.VaultProperties;
import com.dcruver.notebook.hierarchy.FieldChange.ChangeType;
import com.dcruver.notebook.hierarchy.MetadataHierarchyDetector;
import com.dcruver.notebook.hierarchy.PathClassifier;
import com.dcruver.notebook.io.ChangeReport;
import com.dcruver.notebook.io.ChangeReportWriter;
import com.dcruver.notebook.io.MarkdownFileReader;
import com.dcruver.notebook.io.MarkdownFileWriter;
import com.dcruver.notebook.io.MarkdownNote;
import com.dcruver.notebook.vault.EnsureOutcome.Status;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class MetadataEnsureProcessorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-09-02T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path vault;
    private VaultProperties properties;
    private ChangeReportWriter reportWriter;
    private MetadataEnsureProcessor processor;

    @BeforeEach
    void setUp() throws Exception {
        vault = Files.createDirectories(tempDir.resolve("vault"));
        properties = new VaultProperties();
        properties.setRoot(vault.toString());

        reportWriter = new ChangeReportWriter(properties);
        processor = new MetadataEnsureProcessor(
            MetadataHierarchyDetector.create(new PathClassifier()),
            new TemplateFieldsFiller(properties, CLOCK),
            new MarkdownFileReader(),
            new MarkdownFileWriter(),
            reportWriter,
            properties);
    }

    private Path note(String relative, String content) throws Exception {
        Path file = vault.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testDryRunLeavesFileUntouchedAndWritesReport() throws Exception {
        String content = "---\ntitle: Lecture 1\n---\nNotes\n";
        Path file = note("MBA/Finance/lecture-1.md", content);

        EnsureOutcome outcome = processor.ensureMetadata(file, true);

        assertEquals(Status.WOULD_UPDATE, outcome.getStatus());
        assertTrue(outcome.isChanged());
        assertEquals(content, Files.readString(file));
        assertNotNull(outcome.getReportId());

        ChangeReport report = reportWriter.getReport(outcome.getReportId());
        assertEquals(ChangeReport.ReportStatus.DRY_RUN, report.getStatus());
        assertEquals("none", report.getIndexType());
        assertTrue(report.getPatchContent().contains("+program: MBA"));
        assertTrue(report.getPatchContent().contains("+course: Finance"));
    }

    @Test
    void testApplyWritesFileAndBackup() throws Exception {
        Path file = note("MBA/MBA.md", "---\ntitle: MBA\nindex-type: course\ncourse: Stale\n---\n# MBA\n");

        EnsureOutcome outcome = processor.ensureMetadata(file, false);

        assertEquals(Status.UPDATED, outcome.getStatus());
        assertEquals(List.of(ChangeType.ADDED, ChangeType.CORRECTED, ChangeType.REMOVED),
            outcome.getResult().getChanges().stream().map(c -> c.getType()).distinct().sorted().toList());
        assertEquals("---\ntitle: MBA\nindex-type: program\nprogram: MBA\n---\n# MBA\n", Files.readString(file));

        try (Stream<Path> backups = Files.list(properties.getAgentPath().resolve("backups"))) {
            assertEquals(1, backups.count());
        }
        ChangeReport report = reportWriter.getReport(outcome.getReportId());
        assertEquals("---\ntitle: MBA\nindex-type: course\ncourse: Stale\n---\n# MBA\n",
            Files.readString(Path.of(report.getBackupPath())));
    }

    @Test
    void testSecondRunIsUnchanged() throws Exception {
        Path file = note("MBA/Finance/Week 1/Week 1.md", "Body only\n");

        assertEquals(Status.UPDATED, processor.ensureMetadata(file, false).getStatus());
        String afterFirst = Files.readString(file);

        EnsureOutcome second = processor.ensureMetadata(file, false);

        assertEquals(Status.UNCHANGED, second.getStatus());
        assertFalse(second.isChanged());
        assertEquals(afterFirst, Files.readString(file));
        assertTrue(afterFirst.startsWith("---\nprogram: MBA\ncourse: Finance\nclass: Week 1\nindex-type: class\n---\n"));
    }

    @Test
    void testBackupCanBeDisabled() throws Exception {
        properties.setBackupEnabled(false);
        Path file = note("MBA/note.md", "text\n");

        assertEquals(Status.UPDATED, processor.ensureMetadata(file, false).getStatus());
        assertFalse(Files.exists(properties.getAgentPath().resolve("backups")));
    }

    @Test
    void testBrokenFrontmatterFailsWithoutWriting() throws Exception {
        String content = "---\ntitle: [oops\n---\nBody\n";
        Path file = note("MBA/broken.md", content);

        EnsureOutcome outcome = processor.ensureMetadata(file, false);

        assertEquals(Status.FAILED, outcome.getStatus());
        assertNotNull(outcome.getMessage());
        assertEquals(content, Files.readString(file));
    }

    @Test
    void testFileOutsideVaultIsSkipped() throws Exception {
        Path outside = tempDir.resolve("elsewhere/note.md");
        Files.createDirectories(outside.getParent());
        Files.writeString(outside, "text\n");

        EnsureOutcome outcome = processor.ensureMetadata(outside, false);

        assertEquals(Status.SKIPPED, outcome.getStatus());
        assertEquals("text\n", Files.readString(outside));
    }

    @Test
    void testMissingAndNonMarkdownFilesAreSkipped() throws Exception {
        Path text = note("MBA/data.txt", "x");

        assertEquals(Status.SKIPPED, processor.ensureMetadata(vault.resolve("MBA/missing.md"), false).getStatus());
        assertEquals(Status.SKIPPED, processor.ensureMetadata(text, false).getStatus());
    }

    @Test
    void testUntouchedHeaderLinesKeepTheirSpelling() throws Exception {
        Path file = note("MBA/Finance/notes.md", """
            ---
            version: 1.10
            title: Notes # weekly
            empty:
            program: Wrong
            tags:
              - finance

              - review
            class: Stray
            ---
            Body
            """);

        assertEquals(Status.UPDATED, processor.ensureMetadata(file, false).getStatus());

        assertEquals("""
            ---
            version: 1.10
            title: Notes # weekly
            empty:
            program: MBA
            tags:
              - finance

              - review
            course: Finance
            ---
            Body
            """, Files.readString(file));
        assertEquals(Status.UNCHANGED, processor.ensureMetadata(file, false).getStatus());
    }

    @Test
    void testTemplateFieldsAreFilledWhenEnabled() throws Exception {
        properties.getRequiredFields().setEnabled(true);
        Path file = note("MBA/Finance/Week 1/lecture.md", "---\ntitle: Lecture\nstatus: read\n---\nBody\n");
        Files.writeString(file.resolveSibling("lecture.mp4"), "");

        EnsureOutcome outcome = processor.ensureMetadata(file, false);

        assertEquals(Status.UPDATED, outcome.getStatus());
        MarkdownNote written = new MarkdownFileReader().read(file);
        assertEquals("video-reference", written.getFrontmatter().get("template-type"));
        assertEquals("note/video-note", written.getFrontmatter().get("type"));
        assertEquals("read", written.getFrontmatter().get("status"));
        assertEquals("writable", written.getFrontmatter().get("auto-generated-state"));
        assertEquals("2024-09-02", written.getFrontmatter().get("date-created"));
        assertEquals("00:00:00", written.getFrontmatter().get("video-duration"));
        assertEquals("", written.getFrontmatter().get("tags"));
        assertEquals("Week 1", written.getFrontmatter().get("class"));

        List<String> added = outcome.getResult().changesOf(ChangeType.ADDED).stream().map(c -> c.getKey()).toList();
        assertTrue(added.contains("template-type"));
        assertFalse(added.contains("status"));

        ChangeReport report = reportWriter.getReport(outcome.getReportId());
        assertTrue(report.getChanges().stream().anyMatch(c -> c.key().equals("publisher")));

        assertEquals(Status.UNCHANGED, processor.ensureMetadata(file, false).getStatus());
    }

    @Test
    void testTemplateFieldsAreNotFilledByDefault() throws Exception {
        Path file = note("MBA/Finance/Finance.md", "Body\n");

        processor.ensureMetadata(file, false);

        assertEquals("---\nprogram: MBA\ncourse: Finance\nindex-type: course\n---\nBody\n", Files.readString(file));
    }
}
