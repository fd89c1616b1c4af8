package com.dcruver.notebook.io;

import com.dcruver.notebook.hierarchy.FieldChange;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Audit record of the metadata changes made (or proposed, in a dry run) to one note.
 * Stored as JSON next to a unified diff of the file.
 */
@Data
@Builder
public class ChangeReport {
    private final String id;
    private final String filePath;
    private final String indexType;
    private final int maxLevel;
    private final Instant createdAt;
    private final ReportStatus status;
    private final List<FieldEntry> changes;

    // Unified diff of the note
    private final String patchContent;

    // Copy of the note taken before an applied update, null for dry runs
    private final String backupPath;

    @JsonCreator
    public ChangeReport(
            @JsonProperty("id") String id,
            @JsonProperty("filePath") String filePath,
            @JsonProperty("indexType") String indexType,
            @JsonProperty("maxLevel") int maxLevel,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("status") ReportStatus status,
            @JsonProperty("changes") List<FieldEntry> changes,
            @JsonProperty("patchContent") String patchContent,
            @JsonProperty("backupPath") String backupPath) {
        this.id = id;
        this.filePath = filePath;
        this.indexType = indexType;
        this.maxLevel = maxLevel;
        this.createdAt = createdAt;
        this.status = status;
        this.changes = changes != null ? List.copyOf(changes) : List.of();
        this.patchContent = patchContent;
        this.backupPath = backupPath;
    }

    public enum ReportStatus {
        DRY_RUN,
        APPLIED
    }

    /**
     * Serializable copy of a {@link FieldChange}
     */
    public record FieldEntry(String key, FieldChange.ChangeType type, Object oldValue, Object newValue, boolean malformed) {

        public static FieldEntry from(FieldChange change) {
            return new FieldEntry(change.getKey(), change.getType(),
                change.getOldValue(), change.getNewValue(), change.isMalformed());
        }
    }
}
