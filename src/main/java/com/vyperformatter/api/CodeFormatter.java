package com.vyperformatter.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * Entry point for formatting single sources and whole directory trees.
 */
public interface CodeFormatter {
    FormatterResult formatFile(Path filePath, String sourceCode);
    Map<Path, FormatterResult> formatDirectory(Path directory);
}
