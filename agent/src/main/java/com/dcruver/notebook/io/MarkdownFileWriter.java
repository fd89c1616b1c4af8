package com.dcruver.notebook.io;

import com.dcruver.notebook.hierarchy.FieldChange;
import com.dcruver.notebook.hierarchy.Frontmatter;
import com.dcruver.notebook.hierarchy.ReconciliationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Writes Markdown notes back with an updated YAML header and the original body.
 *
 * <p>Only the header lines of changed keys are rewritten. Every other line, comments and
 * original scalar spelling included, is written back as it was read.
 */
@Component
@Slf4j
public class MarkdownFileWriter {

    /**
     * Write a note to file
     */
    public void write(MarkdownNote note, Path outputPath) throws IOException {
        Files.writeString(outputPath, buildContent(note));
        log.debug("Wrote note to: {}", outputPath);
    }

    public MarkdownNote updateFrontmatter(MarkdownNote note, ReconciliationResult result) {
        return updateFrontmatter(note, result.getFrontmatter(), result.getChanges());
    }

    /**
     * Replace the note's frontmatter, keeping the body. {@code changes} lists the keys that
     * differ between the note's frontmatter and {@code frontmatter}; only their lines are edited.
     */
    public MarkdownNote updateFrontmatter(MarkdownNote note, Frontmatter frontmatter, List<FieldChange> changes) {
        String raw = note.isHasFrontmatter() && note.getRawFrontmatter() != null ? note.getRawFrontmatter() : "";
        String edited = editRaw(raw, frontmatter, changes);

        if (!sameFrontmatter(edited, frontmatter)) {
            log.warn("Could not edit frontmatter of {} line by line; rewriting the whole header", note.getFilePath());
            edited = serialize(frontmatter);
        }

        return note.withFrontmatter(frontmatter)
            .withHasFrontmatter(note.isHasFrontmatter() || !frontmatter.isEmpty())
            .withRawFrontmatter(edited);
    }

    /**
     * Build file content from a note. A note that never had frontmatter and still has none
     * is written as its body alone.
     */
    public String buildContent(MarkdownNote note) {
        Frontmatter frontmatter = note.getFrontmatter() != null ? note.getFrontmatter() : Frontmatter.empty();
        String body = note.getBody() != null ? note.getBody() : "";

        if (!note.isHasFrontmatter() && frontmatter.isEmpty()) {
            return body;
        }

        String header = note.getRawFrontmatter() != null ? note.getRawFrontmatter() : serialize(frontmatter);
        StringBuilder sb = new StringBuilder();
        sb.append(FrontmatterYaml.FENCE).append("\n");
        sb.append(header);
        if (!header.isEmpty() && !header.endsWith("\n")) {
            sb.append("\n");
        }
        sb.append(FrontmatterYaml.FENCE).append("\n");
        sb.append(body);
        return sb.toString();
    }

    /**
     * YAML for the header, without fences; empty string for empty frontmatter
     */
    public String serialize(Frontmatter frontmatter) {
        if (frontmatter.isEmpty()) {
            return "";
        }
        return toYaml(frontmatter.toMap());
    }

    private String editRaw(String raw, Frontmatter frontmatter, List<FieldChange> changes) {
        FrontmatterLineEditor editor = new FrontmatterLineEditor(raw);
        for (FieldChange change : changes) {
            String key = change.getKey();
            if (change.getType() == FieldChange.ChangeType.REMOVED) {
                editor.remove(key);
            } else {
                String entry = toYaml(Collections.singletonMap(key, frontmatter.get(key)));
                editor.set(key, entry.lines().toList());
            }
        }
        return editor.text();
    }

    // Guards against keys the line editor cannot address, such as flow-style headers
    private static boolean sameFrontmatter(String yaml, Frontmatter expected) {
        try {
            return FrontmatterYaml.parse(yaml).equals(expected);
        } catch (JsonProcessingException e) {
            log.debug("Edited frontmatter does not parse: {}", e.getOriginalMessage());
            return false;
        }
    }

    private static String toYaml(Object value) {
        try {
            String yaml = FrontmatterYaml.MAPPER.writeValueAsString(value);
            return yaml.endsWith("\n") ? yaml : yaml + "\n";
        } catch (JsonProcessingException e) {
            // Values came out of a YAML parse or are plain strings, so this is a bug
            throw new UncheckedIOException("Cannot serialize frontmatter", e);
        }
    }
}
