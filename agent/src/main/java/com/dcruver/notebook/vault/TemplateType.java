package com.dcruver.notebook.vault;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Note templates and the fields each one is expected to carry, with their defaults.
 */
public enum TemplateType {
    PDF_REFERENCE("pdf-reference", fields(
        "type", "note/case-study",
        "comprehension", 0,
        "status", "unread",
        "completion-date", "",
        "date-modified", "",
        "date-review", "",
        "onedrive-shared-link", "",
        "onedrive_fullpath_file_reference", "",
        "pdf-size", "",
        "pdf-uploaded", "",
        "page-count", "",
        "pages", "",
        "authors", "",
        "tags", "")),
    VIDEO_REFERENCE("video-reference", fields(
        "type", "note/video-note",
        "comprehension", 0,
        "status", "unwatched",
        "completion-date", "",
        "date-modified", "",
        "date-review", "",
        "onedrive-shared-link", "",
        "onedrive_fullpath_file_reference", "",
        "publication-year", "",
        "video-codec", "",
        "video-duration", "00:00:00",
        "video-resolution", "",
        "video-size", "0 MB",
        "video-uploaded", "",
        "author", "",
        "tags", "")),
    RESOURCE_READING("resource-reading", fields(
        "type", "note/reading",
        "comprehension", 0,
        "status", "unread",
        "completion-date", "",
        "date-modified", "",
        "date-review", "",
        "onedrive-shared-link", "",
        "onedrive_fullpath_file_reference", "",
        "page-count", "",
        "pages", "",
        "authors", "",
        "tags", ""));

    public static final String FRONTMATTER_KEY = "template-type";

    // Notes without a known template only get tags
    public static final Map<String, Object> BASIC_FIELDS = fields("tags", "");

    private final String value;
    private final Map<String, Object> requiredFields;

    TemplateType(String value, Map<String, Object> requiredFields) {
        this.value = value;
        this.requiredFields = requiredFields;
    }

    public String getValue() {
        return value;
    }

    public Map<String, Object> getRequiredFields() {
        return requiredFields;
    }

    public static Optional<TemplateType> fromValue(Object stored) {
        if (!(stored instanceof String)) {
            return Optional.empty();
        }
        String normalized = ((String) stored).trim();
        for (TemplateType type : values()) {
            if (type.value.equalsIgnoreCase(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private static Map<String, Object> fields(Object... keyValues) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put((String) keyValues[i], keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(fields);
    }
}
