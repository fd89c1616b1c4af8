package com.dcruver.notebook.io;

import com.dcruver.notebook.hierarchy.Frontmatter;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads Markdown notes and parses their YAML frontmatter.
 */
@Component
@Slf4j
public class MarkdownFileReader {

    private static final String BOM = "\uFEFF";
    private static final String ALT_CLOSING_FENCE = "...";

    /**
     * Read and parse a Markdown file
     */
    public MarkdownNote read(Path filePath) throws IOException {
        String content = Files.readString(filePath);
        return parse(filePath, content);
    }

    /**
     * Split content into frontmatter and body. A note without a leading fence, or with an
     * unterminated one, has empty frontmatter and the whole content as body.
     */
    public MarkdownNote parse(Path filePath, String content) throws FrontmatterParseException {
        String text = content.startsWith(BOM) ? content.substring(1) : content;

        int firstLineEnd = lineEnd(text, 0);
        if (!isFence(text.substring(0, firstLineEnd), false)) {
            return withoutFrontmatter(filePath, content);
        }

        int yamlStart = nextLine(text, firstLineEnd);
        int lineStart = yamlStart;
        while (lineStart < text.length()) {
            int end = lineEnd(text, lineStart);
            if (isFence(text.substring(lineStart, end), true)) {
                String yaml = text.substring(yamlStart, lineStart);
                String body = text.substring(nextLine(text, end));
                return MarkdownNote.builder()
                    .filePath(filePath)
                    .rawContent(content)
                    .hasFrontmatter(true)
                    .rawFrontmatter(yaml)
                    .frontmatter(parseYaml(filePath, yaml))
                    .body(body)
                    .build();
            }
            lineStart = nextLine(text, end);
        }

        log.warn("Unterminated frontmatter in {}; treating whole file as body", filePath);
        return withoutFrontmatter(filePath, content);
    }

    private Frontmatter parseYaml(Path filePath, String yaml) throws FrontmatterParseException {
        try {
            return FrontmatterYaml.parse(yaml);
        } catch (JsonProcessingException e) {
            throw new FrontmatterParseException(filePath, e.getOriginalMessage(), e);
        }
    }

    private static MarkdownNote withoutFrontmatter(Path filePath, String content) {
        return MarkdownNote.builder()
            .filePath(filePath)
            .rawContent(content)
            .hasFrontmatter(false)
            .frontmatter(Frontmatter.empty())
            .body(content)
            .build();
    }

    private static boolean isFence(String line, boolean closing) {
        String trimmed = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
        trimmed = trimmed.stripTrailing();
        return trimmed.equals(FrontmatterYaml.FENCE) || (closing && trimmed.equals(ALT_CLOSING_FENCE));
    }

    // Index of the '\n' ending the line that starts at from, or text length
    private static int lineEnd(String text, int from) {
        int idx = text.indexOf('\n', from);
        return idx < 0 ? text.length() : idx;
    }

    private static int nextLine(String text, int lineEnd) {
        return Math.min(lineEnd + 1, text.length());
    }
}
