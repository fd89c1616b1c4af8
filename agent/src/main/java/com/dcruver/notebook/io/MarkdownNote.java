package com.dcruver.notebook.io;

import com.dcruver.notebook.hierarchy.Frontmatter;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.nio.file.Path;

/**
 * A Markdown note split into YAML frontmatter and body.
 * The body is kept byte-for-byte so writing back only touches the header.
 */
@Data
@Builder
@With
public class MarkdownNote {
    private final Path filePath;
    private final String rawContent;  // Original file content

    private final boolean hasFrontmatter;
    private final String rawFrontmatter;  // YAML between the fences, null without frontmatter
    private final Frontmatter frontmatter;

    // Everything after the closing fence (or the whole file without frontmatter)
    private final String body;

    public String getFileName() {
        return filePath != null ? filePath.getFileName().toString() : null;
    }
}
