package com.dcruver.notebook.vault;

import com.dcruver.notebook.config.VaultProperties;
import com.dcruver.notebook.hierarchy.FieldChange;
import com.dcruver.notebook.hierarchy.Frontmatter;
import com.dcruver.notebook.hierarchy.ReconciliationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fills template metadata that is missing from a note: {@code template-type} inferred from the
 * file name and its neighbouring files, then the fields every note and its template require.
 *
 * <p>Only absent keys are written. Existing values are never changed, and hierarchy keys are
 * left to the reconciler.
 */
@Component
@Slf4j
public class TemplateFieldsFiller {

    static final String AUTO_GENERATED_STATE = "auto-generated-state";
    static final String DATE_CREATED = "date-created";
    static final String PUBLISHER = "publisher";

    private static final String INSTRUCTIONS_SUFFIX = "-instructions.md";
    private static final List<String> VIDEO_EXTENSIONS = List.of(".mp4", ".mov", ".avi");

    private final VaultProperties properties;
    private final Clock clock;

    @Autowired
    public TemplateFieldsFiller(VaultProperties properties) {
        this(properties, Clock.systemDefaultZone());
    }

    public TemplateFieldsFiller(VaultProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return properties.getRequiredFields().isEnabled();
    }

    /**
     * Extend a hierarchy result with template fields for {@code filePath}. Returns the result
     * unchanged when disabled or when nothing is missing.
     */
    public ReconciliationResult fill(Path filePath, ReconciliationResult hierarchy) {
        if (!isEnabled()) {
            return hierarchy;
        }

        Frontmatter current = hierarchy.getFrontmatter();
        Frontmatter.Editor editor = current.edit();
        List<FieldChange> changes = new ArrayList<>();

        Optional<TemplateType> templateType = TemplateType.fromValue(current.get(TemplateType.FRONTMATTER_KEY));
        if (Frontmatter.isBlankValue(current.get(TemplateType.FRONTMATTER_KEY))) {
            templateType = inferTemplateType(filePath);
            templateType.ifPresent(type -> {
                editor.put(TemplateType.FRONTMATTER_KEY, type.getValue());
                changes.add(FieldChange.added(TemplateType.FRONTMATTER_KEY,
                    current.get(TemplateType.FRONTMATTER_KEY), type.getValue()));
            });
        }

        addIfAbsent(current, editor, changes, AUTO_GENERATED_STATE, "writable");
        addIfAbsent(current, editor, changes, DATE_CREATED, LocalDate.now(clock).toString());
        addIfAbsent(current, editor, changes, PUBLISHER, properties.getRequiredFields().getPublisher());

        Map<String, Object> required = templateType.map(TemplateType::getRequiredFields)
            .orElse(TemplateType.BASIC_FIELDS);
        required.forEach((key, value) -> addIfAbsent(current, editor, changes, key, value));

        if (changes.isEmpty()) {
            return hierarchy;
        }
        log.debug("Filling {} template field(s) for {}", changes.size(), filePath);
        return hierarchy.toBuilder()
            .frontmatter(editor.build())
            .changes(changes)
            .build();
    }

    /**
     * Template implied by the file name or by a PDF or video with the same stem next to it
     */
    public Optional<TemplateType> inferTemplateType(Path filePath) {
        String fileName = filePath.getFileName().toString();
        if (fileName.toLowerCase(Locale.ROOT).endsWith(INSTRUCTIONS_SUFFIX)) {
            return Optional.of(TemplateType.RESOURCE_READING);
        }

        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        Path folder = filePath.getParent();
        if (folder == null) {
            return Optional.empty();
        }
        if (Files.exists(folder.resolve(stem + ".pdf"))) {
            return Optional.of(TemplateType.PDF_REFERENCE);
        }
        for (String extension : VIDEO_EXTENSIONS) {
            if (Files.exists(folder.resolve(stem + extension))) {
                return Optional.of(TemplateType.VIDEO_REFERENCE);
            }
        }
        return Optional.empty();
    }

    private static void addIfAbsent(Frontmatter current, Frontmatter.Editor editor, List<FieldChange> changes,
                                    String key, Object value) {
        if (!current.containsKey(key) && changes.stream().noneMatch(c -> c.getKey().equals(key))) {
            editor.put(key, value);
            changes.add(FieldChange.added(key, null, value));
        }
    }
}
