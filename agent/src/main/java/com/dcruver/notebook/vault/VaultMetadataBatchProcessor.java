package com.dcruver.notebook.vault;

import com.dcruver.notebook.config.VaultProperties;
import com.dcruver.notebook.hierarchy.ClassificationCache;
import com.dcruver.notebook.hierarchy.MetadataHierarchyDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Runs {@link MetadataEnsureProcessor} over every Markdown note below a vault folder.
 * One classification cache is shared for the whole run, bound to the configured root.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VaultMetadataBatchProcessor {

    private final MetadataEnsureProcessor ensureProcessor;
    private final MetadataHierarchyDetector detector;
    private final VaultProperties properties;

    public BatchResult ensureVault(boolean dryRun) throws IOException {
        return ensureFolder(properties.getRootPath(), dryRun);
    }

    /**
     * Process all .md files under {@code folder}, which must lie inside the vault.
     * A failure on one file is recorded and never stops the rest.
     */
    public BatchResult ensureFolder(Path folder, boolean dryRun) throws IOException {
        Path root = properties.getRootPath();
        Path start = folder.toAbsolutePath().normalize();
        if (!start.startsWith(root)) {
            throw new IllegalArgumentException("Folder is not inside the vault: " + start + " (vault root: " + root + ")");
        }
        if (!Files.isDirectory(start)) {
            throw new IOException("Not a directory: " + start);
        }

        Instant started = Instant.now();
        Path agentDir = properties.getAgentPath();
        log.info("Ensuring metadata under {} (dryRun={})", start, dryRun);

        List<Path> notes;
        try (Stream<Path> paths = Files.walk(start)) {
            notes = paths
                .filter(Files::isRegularFile)
                .filter(p -> !p.startsWith(agentDir))
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".md"))
                .sorted()
                .toList();
        }
        log.info("Found {} markdown files", notes.size());

        ClassificationCache cache = new ClassificationCache(root, detector.getClassifier());
        List<EnsureOutcome> outcomes = new ArrayList<>(notes.size());
        for (Path note : notes) {
            try {
                outcomes.add(ensureProcessor.ensureMetadata(note, dryRun, cache));
            } catch (RuntimeException e) {
                log.error("Unexpected failure processing {}", note, e);
                outcomes.add(EnsureOutcome.of(note, EnsureOutcome.Status.FAILED, e.getMessage()));
            }
        }

        BatchResult result = BatchResult.builder()
            .folder(start)
            .dryRun(dryRun)
            .outcomes(List.copyOf(outcomes))
            .elapsed(Duration.between(started, Instant.now()))
            .build();

        log.info("Metadata run finished: {} files, {} updated, {} would update, {} unchanged, {} skipped, {} failed",
            result.getTotal(),
            result.count(EnsureOutcome.Status.UPDATED),
            result.count(EnsureOutcome.Status.WOULD_UPDATE),
            result.count(EnsureOutcome.Status.UNCHANGED),
            result.count(EnsureOutcome.Status.SKIPPED),
            result.count(EnsureOutcome.Status.FAILED));
        return result;
    }
}
