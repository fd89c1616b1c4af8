package com.dcruver.notebook.io;

import com.dcruver.notebook.hierarchy.Frontmatter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.util.LinkedHashMap;

/**
 * Shared YAML mapper settings for frontmatter: no document marker, minimal quoting.
 */
final class FrontmatterYaml {

    static final String FENCE = "---";

    static final YAMLMapper MAPPER = new YAMLMapper(YAMLFactory.builder()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
        // folder names like 2024 must stay strings across a write and re-read
        .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
        .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
        .build());

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private FrontmatterYaml() {
    }

    /**
     * Parse a header block (without fences). A blank block is empty frontmatter.
     */
    static Frontmatter parse(String yaml) throws JsonProcessingException {
        if (yaml.isBlank()) {
            return Frontmatter.empty();
        }
        LinkedHashMap<String, Object> values = MAPPER.readValue(yaml, MAP_TYPE);
        return values == null ? Frontmatter.empty() : Frontmatter.of(values);
    }
}
