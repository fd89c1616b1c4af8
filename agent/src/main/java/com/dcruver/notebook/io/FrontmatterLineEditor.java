package com.dcruver.notebook.io;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Line-level edits of a raw YAML header. Only top-level keys are addressed; every line that
 * is not replaced or removed is kept exactly as it was, comments included.
 *
 * <p>A key's block is its own line plus the indented or {@code -} prefixed lines under it.
 */
final class FrontmatterLineEditor {

    private final List<String> lines;
    private final String newline;

    FrontmatterLineEditor(String raw) {
        this.newline = raw.contains("\r\n") ? "\r\n" : "\n";
        this.lines = new ArrayList<>(Arrays.asList(raw.split("\r?\n", -1)));
        // split leaves one empty element after the final line break
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
    }

    /**
     * Replace the block of {@code key} with {@code entry}, or append it when the key is absent
     */
    void set(String key, List<String> entry) {
        int start = find(key);
        if (start < 0) {
            lines.addAll(entry);
            return;
        }
        lines.subList(start, blockEnd(start)).clear();
        lines.addAll(start, entry);
    }

    /**
     * Remove the block of {@code key}; false when the key has no top-level line
     */
    boolean remove(String key) {
        int start = find(key);
        if (start < 0) {
            return false;
        }
        lines.subList(start, blockEnd(start)).clear();
        return true;
    }

    String text() {
        if (lines.isEmpty()) {
            return "";
        }
        return String.join(newline, lines) + newline;
    }

    private int find(String key) {
        for (int i = 0; i < lines.size(); i++) {
            if (key.equals(topLevelKey(lines.get(i)))) {
                return i;
            }
        }
        return -1;
    }

    private int blockEnd(int start) {
        int end = start + 1;
        while (end < lines.size()) {
            if (isContinuation(lines.get(end))) {
                end++;
                continue;
            }
            // blank lines inside a literal block belong to it
            int next = end;
            while (next < lines.size() && lines.get(next).isBlank()) {
                next++;
            }
            if (next > end && next < lines.size() && isContinuation(lines.get(next))) {
                end = next + 1;
            } else {
                break;
            }
        }
        return end;
    }

    private static boolean isContinuation(String line) {
        if (line.isEmpty()) {
            return false;
        }
        char first = line.charAt(0);
        return first == ' ' || first == '\t' || (first == '-' && !line.startsWith(FrontmatterYaml.FENCE));
    }

    /**
     * Key of a {@code key: value} line at column 0, plain or quoted; null for anything else
     */
    static String topLevelKey(String line) {
        if (line.isEmpty() || isContinuation(line) || line.charAt(0) == '#') {
            return null;
        }
        char first = line.charAt(0);
        String key;
        int after;
        if (first == '"' || first == '\'') {
            int close = line.indexOf(first, 1);
            if (close < 0) {
                return null;
            }
            key = line.substring(1, close);
            after = close + 1;
            while (after < line.length() && line.charAt(after) == ' ') {
                after++;
            }
            if (after >= line.length() || line.charAt(after) != ':') {
                return null;
            }
        } else {
            after = line.indexOf(':');
            while (after >= 0 && after + 1 < line.length() && !Character.isWhitespace(line.charAt(after + 1))) {
                after = line.indexOf(':', after + 1);
            }
            if (after <= 0) {
                return null;
            }
            key = line.substring(0, after).stripTrailing();
        }
        boolean endsKey = after + 1 >= line.length() || Character.isWhitespace(line.charAt(after + 1));
        return endsKey ? key : null;
    }
}
