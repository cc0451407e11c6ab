package com.indentlint.plugins;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.indentlint.util.LoggerUtil;

/**
 * File types the linter knows about. Detection looks at the extension first and falls
 * back to the head of the file; results are cached per path.
 */
public enum FileType {
    JAVA("java"),
    UNKNOWN("");

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);
    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;
    private static final int HEAD_BYTES = 4096;

    private static final Pattern JAVA_DECLARATION = Pattern.compile(
            "^\\s*(?:package\\s+[\\w.]+\\s*;|import\\s+(?:static\\s+)?[\\w.*]+\\s*;"
                    + "|(?:public\\s+|final\\s+|abstract\\s+)*(?:class|interface|enum|record)\\s+\\w+)",
            Pattern.MULTILINE);

    private final String extension;

    FileType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static FileType detect(Path filePath) {
        FileType cachedType = typeCache.get(filePath);
        if (cachedType != null) {
            return cachedType;
        }

        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }

        FileType detected = _detectByExtension(filePath);
        if (detected == UNKNOWN) {
            detected = _detectByContent(filePath);
        }
        typeCache.put(filePath, detected);
        return detected;
    }

    private static FileType _detectByExtension(Path filePath) {
        Path name = filePath.getFileName();
        if (name == null) {
            return UNKNOWN;
        }
        String fileName = name.toString().toLowerCase(Locale.ROOT);
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return UNKNOWN;
        }

        return switch (fileName.substring(dot + 1)) {
            case "java" -> JAVA;
            default -> UNKNOWN;
        };
    }

    /**
     * Extension-less files count as Java when their head declares a package, an import or
     * a top-level type.
     */
    private static FileType _detectByContent(Path filePath) {
        if (!Files.isRegularFile(filePath)) {
            return UNKNOWN;
        }
        try {
            String head = _readHead(filePath);
            return JAVA_DECLARATION.matcher(head).find() ? JAVA : UNKNOWN;
        } catch (IOException e) {
            logger.log(Level.FINE, "Error reading file for type detection: " + filePath, e);
            return UNKNOWN;
        }
    }

    private static String _readHead(Path filePath) throws IOException {
        try (InputStream in = Files.newInputStream(filePath)) {
            byte[] head = in.readNBytes(HEAD_BYTES);
            return new String(head, StandardCharsets.UTF_8);
        }
    }

    public static void clearCache() {
        typeCache.clear();
        logger.fine("File type detection cache cleared");
    }

    public static int getCacheSize() {
        return typeCache.size();
    }

    public String getDescription() {
        return switch (this) {
            case JAVA -> "Java source file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
