package com.vyperformatter.api;

import java.nio.file.Path;

import com.vyperformatter.config.FormatterConfig;

/**
 * Formats the sources of one language.
 */
public interface FormatterPlugin {
    /**
     * Called once, before the first {@link #format}, with the effective configuration.
     */
    void initialize(FormatterConfig config);

    /**
     * Formats one source. Implementations report problems through the result and do
     * not throw.
     */
    FormatterResult format(Path filePath, String sourceCode);
}
