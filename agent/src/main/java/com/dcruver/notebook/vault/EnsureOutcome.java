package com.dcruver.notebook.vault;

import com.dcruver.notebook.hierarchy.ReconciliationResult;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * What happened to one file during an ensure-metadata run.
 */
@Value
@Builder
public class EnsureOutcome {
    Path filePath;
    Status status;

    // Null when the file was skipped or failed before reconciliation
    ReconciliationResult result;

    String reportId;
    String message;

    public enum Status {
        UPDATED,
        WOULD_UPDATE,  // dry run
        UNCHANGED,
        SKIPPED,
        FAILED
    }

    public boolean isChanged() {
        return status == Status.UPDATED || status == Status.WOULD_UPDATE;
    }

    static EnsureOutcome of(Path filePath, Status status, String message) {
        return EnsureOutcome.builder().filePath(filePath).status(status).message(message).build();
    }
}
