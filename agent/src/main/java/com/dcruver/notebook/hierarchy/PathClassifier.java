package com.dcruver.notebook.hierarchy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Computes hierarchy depth and index-file status of a vault file from its path.
 *
 * <p>Paths are compared lexically: both '/' and '\' separate segments, trailing separators,
 * "." and ".." are resolved, and the vault root prefix must match segment for segment with
 * the same case. Only a Windows drive letter is compared ignoring case. Root and file must
 * both be absolute or both be relative. The filesystem is never touched.
 */
@Component
@Slf4j
public class PathClassifier {

    public static final String DEFAULT_ROOT_INDEX_FILENAME = "index.md";

    private static final String MARKDOWN_SUFFIX = ".md";

    private final String rootIndexFileName;

    public PathClassifier() {
        this(DEFAULT_ROOT_INDEX_FILENAME);
    }

    @Autowired
    public PathClassifier(@Value("${vault.root-index-filename:index.md}") String rootIndexFileName) {
        this.rootIndexFileName = rootIndexFileName == null || rootIndexFileName.isBlank()
            ? DEFAULT_ROOT_INDEX_FILENAME
            : rootIndexFileName.trim();
    }

    public String getRootIndexFileName() {
        return rootIndexFileName;
    }

    public PathClassification classify(Path vaultRoot, Path filePath) {
        return classify(vaultRoot.toString(), filePath.toString());
    }

    /**
     * Classify a file against a vault root.
     *
     * @throws OutOfVaultException if the file is not under the root
     * @throws AmbiguousDepthException if the path is the root itself, has no file name, or
     *         only one of root and file is absolute
     */
    public PathClassification classify(String vaultRoot, String filePath) {
        if (vaultRoot == null || vaultRoot.isBlank()) {
            throw new AmbiguousDepthException("vault root is not set", vaultRoot, filePath);
        }
        if (filePath == null || filePath.isBlank()) {
            throw new AmbiguousDepthException("file path is empty", vaultRoot, filePath);
        }

        if (isAbsolute(vaultRoot) != isAbsolute(filePath)) {
            throw new AmbiguousDepthException("vault root and file path must both be absolute or both relative",
                vaultRoot, filePath);
        }

        List<String> rootParts = normalize(vaultRoot);
        List<String> fileParts = normalize(filePath);
        String rootDisplay = join(rootParts, vaultRoot);
        String fileDisplay = join(fileParts, filePath);

        if (fileParts.size() < rootParts.size() || !startsWith(fileParts, rootParts)) {
            throw new OutOfVaultException(rootDisplay, fileDisplay);
        }
        if (fileParts.size() == rootParts.size()) {
            throw new AmbiguousDepthException("path is the vault root itself", rootDisplay, fileDisplay);
        }

        List<String> segments = List.copyOf(fileParts.subList(rootParts.size(), fileParts.size() - 1));
        String fileName = fileParts.get(fileParts.size() - 1);
        int depth = Math.min(segments.size(), HierarchyField.MAX_LEVEL);

        String containingFolder = segments.isEmpty()
            ? (rootParts.isEmpty() ? "" : rootParts.get(rootParts.size() - 1))
            : segments.get(segments.size() - 1);
        boolean indexFile = isNamedAfter(fileName, containingFolder)
            || (segments.isEmpty() && fileName.equalsIgnoreCase(rootIndexFileName));

        log.debug("Classified {}: depth={}, folders={}, indexFile={}",
            fileDisplay, depth, segments.size(), indexFile);

        return PathClassification.builder()
            .vaultRoot(rootDisplay)
            .filePath(fileDisplay)
            .fileName(fileName)
            .segments(segments)
            .depth(depth)
            .folderDepth(segments.size())
            .indexFile(indexFile)
            .build();
    }

    /**
     * Normalized key for a path, stable across separator style and redundant segments
     */
    static String normalizedKey(String path) {
        return join(normalize(path), path);
    }

    private static boolean isNamedAfter(String fileName, String folderName) {
        if (folderName.isEmpty() || !fileName.toLowerCase(Locale.ROOT).endsWith(MARKDOWN_SUFFIX)) {
            return false;
        }
        String stem = fileName.substring(0, fileName.length() - MARKDOWN_SUFFIX.length());
        return stem.equalsIgnoreCase(folderName);
    }

    private static boolean startsWith(List<String> parts, List<String> prefix) {
        for (int i = 0; i < prefix.size(); i++) {
            String part = parts.get(i);
            String expected = prefix.get(i);
            boolean same = i == 0 && isDriveLetter(expected)
                ? part.equalsIgnoreCase(expected)
                : part.equals(expected);
            if (!same) {
                return false;
            }
        }
        return true;
    }

    private static boolean isAbsolute(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("/") || trimmed.startsWith("\\")) {
            return true;
        }
        return trimmed.length() >= 3 && isDriveLetter(trimmed.substring(0, 2))
            && (trimmed.charAt(2) == '/' || trimmed.charAt(2) == '\\');
    }

    // "C:" style first segment
    private static boolean isDriveLetter(String part) {
        return part.length() == 2 && part.charAt(1) == ':' && Character.isLetter(part.charAt(0));
    }

    private static List<String> normalize(String raw) {
        Deque<String> parts = new ArrayDeque<>();
        for (String part : raw.trim().replace('\\', '/').split("/")) {
            if (part.isEmpty() || part.equals(".")) {
                continue;
            }
            if (part.equals("..") && !parts.isEmpty() && !parts.peekLast().equals("..")) {
                parts.removeLast();
            } else {
                parts.addLast(part);
            }
        }
        return List.copyOf(parts);
    }

    private static String join(List<String> parts, String original) {
        String joined = String.join("/", parts);
        String trimmed = original.trim();
        return trimmed.startsWith("/") || trimmed.startsWith("\\") ? "/" + joined : joined;
    }
}
