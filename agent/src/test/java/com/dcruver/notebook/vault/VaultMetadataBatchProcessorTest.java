package com.dcruver.notebook.vault;

import com.dcruver.notebook.config.VaultProperties;
import com.dcruver.notebook.hierarchy.MetadataHierarchyDetector;
import com.dcruver.notebook.hierarchy.PathClassifier;
import com.dcruver.notebook.io.ChangeReportWriter;
import com.dcruver.notebook.io.MarkdownFileReader;
import com.dcruver.notebook.io.MarkdownFileWriter;
import com.dcruver.notebook.vault.EnsureOutcome.Status;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class VaultMetadataBatchProcessorTest {

    @TempDir
    Path tempDir;

    private Path vault;
    private VaultMetadataBatchProcessor batchProcessor;

    @BeforeEach
    void setUp() throws Exception {
        vault = Files.createDirectories(tempDir.resolve("vault"));
        VaultProperties properties = new VaultProperties();
        properties.setRoot(vault.toString());

        MetadataHierarchyDetector detector = MetadataHierarchyDetector.create(new PathClassifier());
        MetadataEnsureProcessor ensureProcessor = new MetadataEnsureProcessor(detector,
            new TemplateFieldsFiller(properties), new MarkdownFileReader(), new MarkdownFileWriter(),
            new ChangeReportWriter(properties), properties);
        batchProcessor = new VaultMetadataBatchProcessor(ensureProcessor, detector, properties);

        write("index.md", "---\ntitle: Home\n---\n");
        write("Prog/Prog.md", "# Prog\n");
        write("Prog/Course/Course.md", "---\nprogram: Prog\ncourse: Course\nindex-type: course\n---\n");
        write("Prog/Course/Class/case-study.md", "---\nprogram: Wrong\n---\nCase\n");
        write("Prog/Course/Class/Module1/note.md", "Plain note\n");
        write("Prog/Course/broken.md", "---\ntitle: [oops\n---\n");
        write("Prog/Course/attachment.txt", "not a note");
        write(".vault-agent/reports/ignored.md", "# Not part of the vault\n");
    }

    private void write(String relative, String content) throws IOException {
        Path file = vault.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void testApplyRunUpdatesEveryOutOfDateNote() throws Exception {
        BatchResult result = batchProcessor.ensureVault(false);

        assertEquals(6, result.getTotal());
        assertEquals(4, result.count(Status.UPDATED));
        assertEquals(1, result.count(Status.UNCHANGED));
        assertEquals(1, result.count(Status.FAILED));
        assertFalse(result.isSuccessful());
        assertEquals(vault.resolve("Prog/Course/broken.md"), result.getFailures().get(0).getFilePath());

        assertEquals("---\ntitle: Home\nindex-type: main\n---\n", Files.readString(vault.resolve("index.md")));
        assertEquals("---\nprogram: Prog\ncourse: Course\nclass: Class\n---\nCase\n",
            Files.readString(vault.resolve("Prog/Course/Class/case-study.md")));
        assertEquals("# Not part of the vault\n", Files.readString(vault.resolve(".vault-agent/reports/ignored.md")));
    }

    @Test
    void testSecondRunChangesNothing() throws Exception {
        batchProcessor.ensureVault(false);

        BatchResult second = batchProcessor.ensureVault(false);

        assertEquals(5, second.count(Status.UNCHANGED));
        assertEquals(1, second.count(Status.FAILED));
        assertEquals(0, second.count(Status.UPDATED));
    }

    @Test
    void testDryRunReportsWithoutWriting() throws Exception {
        BatchResult result = batchProcessor.ensureVault(true);

        assertTrue(result.isDryRun());
        assertEquals(4, result.count(Status.WOULD_UPDATE));
        assertEquals("# Prog\n", Files.readString(vault.resolve("Prog/Prog.md")));
    }

    @Test
    void testSubfolderRunUsesVaultRootForDepth() throws Exception {
        BatchResult result = batchProcessor.ensureFolder(vault.resolve("Prog/Course/Class"), false);

        assertEquals(2, result.getTotal());
        assertEquals(2, result.count(Status.UPDATED));
        assertTrue(Files.readString(vault.resolve("Prog/Course/Class/Module1/note.md"))
            .startsWith("---\nprogram: Prog\ncourse: Course\nclass: Class\nmodule: Module1\n---\n"));
    }

    @Test
    void testFolderOutsideVaultIsRejected() throws Exception {
        Path outside = Files.createDirectories(tempDir.resolve("other"));

        assertThrows(IllegalArgumentException.class, () -> batchProcessor.ensureFolder(outside, false));
        assertThrows(IOException.class, () -> batchProcessor.ensureFolder(vault.resolve("missing"), false));
    }
}
