package com.dcruver.notebook.hierarchy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PathClassifierTest {

    private static final String ROOT = "/vault/MBA";

    private PathClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new PathClassifier();
    }

    @Test
    void testContentFileInheritsFolderDepth() {
        PathClassification c = classifier.classify(ROOT, "/vault/MBA/Prog/Course/Class/Module1/note.md");

        assertEquals(List.of("Prog", "Course", "Class", "Module1"), c.getSegments());
        assertEquals(4, c.getDepth());
        assertEquals(4, c.getFolderDepth());
        assertFalse(c.isIndexFile());
        assertEquals("note.md", c.getFileName());
        assertEquals("Module1", c.getContainingFolder());
    }

    @Test
    void testIndexFileNamedAfterFolder() {
        PathClassification c = classifier.classify(ROOT, "/vault/MBA/Program/Program.md");

        assertEquals(1, c.getDepth());
        assertTrue(c.isIndexFile());
        assertEquals("Program", c.folderAt(1));
        assertNull(c.folderAt(2));
    }

    @Test
    void testIndexFileMatchIgnoresCase() {
        assertTrue(classifier.classify(ROOT, "/vault/MBA/Finance/finance.MD").isIndexFile());
        assertFalse(classifier.classify(ROOT, "/vault/MBA/Finance/finance-notes.md").isIndexFile());
        assertFalse(classifier.classify(ROOT, "/vault/MBA/Finance/Finance.pdf").isIndexFile());
    }

    @Test
    void testRootIndexFiles() {
        PathClassification byName = classifier.classify(ROOT, "/vault/MBA/MBA.md");
        assertEquals(0, byName.getDepth());
        assertTrue(byName.isIndexFile());

        PathClassification configured = classifier.classify(ROOT, "/vault/MBA/index.md");
        assertEquals(0, configured.getDepth());
        assertTrue(configured.isIndexFile());

        // The configured root index name only counts directly under the root
        assertFalse(classifier.classify(ROOT, "/vault/MBA/Prog/index.md").isIndexFile());
        assertFalse(classifier.classify(ROOT, "/vault/MBA/readme.md").isIndexFile());
    }

    @Test
    void testCustomRootIndexFileName() {
        PathClassifier custom = new PathClassifier("Home.md");

        assertTrue(custom.classify(ROOT, "/vault/MBA/home.md").isIndexFile());
        assertFalse(custom.classify(ROOT, "/vault/MBA/index.md").isIndexFile());
    }

    @Test
    void testNestingBelowModuleStaysAtModuleLevel() {
        PathClassification c = classifier.classify(ROOT, "/vault/MBA/P/C/K/M/Lesson 1/Topic/note.md");

        assertEquals(4, c.getDepth());
        assertEquals(6, c.getFolderDepth());
        assertEquals("M", c.folderAt(4));
    }

    @Test
    void testSeparatorsAndTrailingSlashesAreNormalized() {
        PathClassification c = classifier.classify("C:\\Vault\\MBA\\", "C:\\Vault\\MBA\\Prog\\Course\\note.md");

        assertEquals(List.of("Prog", "Course"), c.getSegments());
        assertEquals(2, c.getDepth());

        PathClassification mixed = classifier.classify("/vault/MBA/", "/vault/MBA/./Prog\\Course/../Course/note.md");
        assertEquals(List.of("Prog", "Course"), mixed.getSegments());
    }

    @Test
    void testRootMatchIsCaseSensitive() {
        PathClassification c = classifier.classify(ROOT, "/vault/MBA/Finance & Accounting/note.md");
        assertEquals(List.of("Finance & Accounting"), c.getSegments());

        assertThrows(OutOfVaultException.class, () -> classifier.classify(ROOT, "/Vault/mba/Finance/note.md"));
        assertThrows(OutOfVaultException.class, () -> classifier.classify("/Vault", "/vault/P/x.md"));
    }

    @Test
    void testDriveLetterIgnoresCase() {
        PathClassification c = classifier.classify("C:\\Vault", "c:\\Vault\\Prog\\note.md");

        assertEquals(List.of("Prog"), c.getSegments());
        assertThrows(OutOfVaultException.class, () -> classifier.classify("C:\\Vault", "c:\\vault\\Prog\\note.md"));
    }

    @Test
    void testMixedAbsoluteAndRelativeIsRejected() {
        assertThrows(AmbiguousDepthException.class, () -> classifier.classify("/v", "v/P/x.md"));
        assertThrows(AmbiguousDepthException.class, () -> classifier.classify("v", "/v/P/x.md"));

        PathClassification relative = classifier.classify("vault", "vault/P/x.md");
        assertEquals(1, relative.getDepth());
    }

    @Test
    void testFileOutsideVaultIsRejected() {
        assertThrows(OutOfVaultException.class, () -> classifier.classify(ROOT, "/other/Prog/note.md"));
        assertThrows(OutOfVaultException.class, () -> classifier.classify(ROOT, "/vault/MBA2/Prog/note.md"));
        assertThrows(OutOfVaultException.class, () -> classifier.classify(ROOT, "/vault/MBA/../escape.md"));
        assertThrows(OutOfVaultException.class, () -> classifier.classify(ROOT, "/vault"));
    }

    @Test
    void testVaultRootItselfIsAmbiguous() {
        AmbiguousDepthException e = assertThrows(AmbiguousDepthException.class,
            () -> classifier.classify(ROOT, "/vault/MBA/"));
        assertEquals("/vault/MBA", e.getFilePath());

        assertThrows(AmbiguousDepthException.class, () -> classifier.classify(ROOT, ""));
        assertThrows(AmbiguousDepthException.class, () -> classifier.classify("", "/vault/MBA/x.md"));
    }
}
