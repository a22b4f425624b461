package com.vyperformatter.plugins;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.vyperformatter.util.LoggerUtil;

/**
 * Source kinds the formatter knows about.
 */
public enum FileType {
    VYPER,
    VYPER_INTERFACE,
    UNKNOWN;

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);
    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;
    private static final int PRAGMA_SCAN_LINES = 5;

    private static final Pattern VERSION_PRAGMA = Pattern.compile(
            "^#\\s*(?:@version|pragma\\s+version)\\b");

    /**
     * Detects the type of a file, by extension first. Files without a known extension
     * are recognized by a version pragma near the top.
     */
    public static FileType detect(Path filePath) {
        FileType cachedType = typeCache.get(filePath);
        if (cachedType != null) {
            return cachedType;
        }

        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }

        FileType type = detectByExtension(filePath);
        if (type == UNKNOWN && Files.isRegularFile(filePath)) {
            type = detectByContent(filePath);
        }
        typeCache.put(filePath, type);
        return type;
    }

    public static FileType detectByExtension(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return UNKNOWN;
        }
        String name = fileName.toString().toLowerCase();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return UNKNOWN;
        }

        return switch (name.substring(dot + 1)) {
            case "vy" -> VYPER;
            case "vyi" -> VYPER_INTERFACE;
            default -> UNKNOWN;
        };
    }

    private static FileType detectByContent(Path filePath) {
        try (BufferedReader reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8)) {
            for (int i = 0; i < PRAGMA_SCAN_LINES; i++) {
                String line = reader.readLine();
                if (line == null) {
                    break;
                }
                if (VERSION_PRAGMA.matcher(line.strip()).find()) {
                    return VYPER;
                }
            }
            return UNKNOWN;
        } catch (IOException e) {
            logger.log(Level.FINE, "Error reading file for type detection: " + filePath, e);
            return UNKNOWN;
        }
    }

    public static void clearCache() {
        typeCache.clear();
    }

    public String getDescription() {
        return switch (this) {
            case VYPER -> "Vyper contract";
            case VYPER_INTERFACE -> "Vyper interface file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
