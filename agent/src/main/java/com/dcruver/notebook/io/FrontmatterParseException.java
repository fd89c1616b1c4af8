package com.dcruver.notebook.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The YAML header of a note could not be parsed into a mapping.
 */
public class FrontmatterParseException extends IOException {

    private final transient Path filePath;

    public FrontmatterParseException(Path filePath, String message, Throwable cause) {
        super("Invalid frontmatter in " + filePath + ": " + message, cause);
        this.filePath = filePath;
    }

    public Path getFilePath() {
        return filePath;
    }
}
