package com.dcruver.notebook.vault;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Aggregate outcome of an ensure-metadata run over a folder.
 */
@Data
@Builder
public class BatchResult {
    private final Path folder;
    private final boolean dryRun;
    private final List<EnsureOutcome> outcomes;
    private final Duration elapsed;

    public int getTotal() {
        return outcomes.size();
    }

    public int count(EnsureOutcome.Status status) {
        return (int) outcomes.stream().filter(o -> o.getStatus() == status).count();
    }

    public List<EnsureOutcome> getFailures() {
        return outcomes.stream().filter(o -> o.getStatus() == EnsureOutcome.Status.FAILED).toList();
    }

    public boolean isSuccessful() {
        return getFailures().isEmpty();
    }
}
