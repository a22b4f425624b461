package com.vyperformatter.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.vyperformatter.api.CodeFormatter;
import com.vyperformatter.api.FormatterPlugin;
import com.vyperformatter.api.FormatterResult;
import com.vyperformatter.api.error.FormatterError;
import com.vyperformatter.api.error.Severity;
import com.vyperformatter.config.FormatterConfig;
import com.vyperformatter.plugins.FileType;
import com.vyperformatter.util.LoggerUtil;

/**
 * Dispatches sources to the plugin registered for their file type and formats
 * batches of files on a fixed thread pool.
 * <p>
 * Files are independent: a failure in one is recorded in its result and never stops
 * the batch.
 */
public class VyperCodeFormatter implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(VyperCodeFormatter.class);
    private static final long BATCH_TIMEOUT_MINUTES = 30;

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger changedCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public VyperCodeFormatter(FormatterConfig config) {
        this.config = config;
    }

    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugin.initialize(config);
        plugins.put(fileType, plugin);
        logger.fine("Registered plugin for file type: " + fileType.getDescription());
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        FileType fileType = FileType.detect(filePath);
        FormatterPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return FormatterResult.failure(sourceCode, new FormatterError(
                    Severity.ERROR, "No plugin registered for file type: " + fileType, 1, 1));
        }

        processedFileCount.incrementAndGet();
        try {
            FormatterResult result = plugin.format(filePath, sourceCode);

            if (!result.isSuccessful()) {
                errorCount.incrementAndGet();
                logger.warning("Failed to format: " + filePath + " - " +
                        result.getErrors().stream()
                                .filter(FormatterError::isBlocking)
                                .map(e -> e.getSeverity() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
            } else if (result.isChanged()) {
                changedCount.incrementAndGet();
                logger.fine("Reformatted: " + filePath);
            } else {
                logger.fine("Already formatted: " + filePath);
            }
            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);
            return FormatterResult.failure(sourceCode, new FormatterError(
                    Severity.FATAL, "Unexpected error: " + e.getMessage(), 1, 1));
        }
    }

    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        return formatDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        try {
            return formatFiles(collectFiles(directory, null), threadCount);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return new ConcurrentHashMap<>();
        }
    }

    /**
     * Reads and formats every file on a pool of {@code threadCount} threads. Nothing
     * is written back.
     */
    public Map<Path, FormatterResult> formatFiles(List<Path> files, int threadCount) {
        ConcurrentHashMap<Path, FormatterResult> results = new ConcurrentHashMap<>();
        if (files.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        Map<Path, Future<FormatterResult>> pending = new LinkedHashMap<>();
        try {
            for (Path file : files) {
                pending.put(file, executor.submit(() -> _readAndFormat(file)));
            }
        } finally {
            executor.shutdown();
        }

        try {
            if (!executor.awaitTermination(BATCH_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for file processing to complete");
                executor.shutdownNow();
            }
            for (Map.Entry<Path, Future<FormatterResult>> entry : pending.entrySet()) {
                results.put(entry.getKey(), _collect(entry.getKey(), entry.getValue()));
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Processing interrupted", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("Processed " + results.size() + " files");
        return results;
    }

    /**
     * Result of a finished task. Errors thrown by a plugin (a stack overflow on deeply
     * nested code, for one) end up here instead of in {@link #formatFile}.
     */
    private FormatterResult _collect(Path file, Future<FormatterResult> future) throws InterruptedException {
        if (!future.isDone()) {
            future.cancel(true);
            errorCount.incrementAndGet();
            return FormatterResult.failure(null, new FormatterError(
                    Severity.FATAL, "Timed out after " + BATCH_TIMEOUT_MINUTES + " minutes", 1, 1));
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + file, cause);
            return FormatterResult.failure(null, new FormatterError(
                    Severity.FATAL, "Unexpected error: " + cause, 1, 1));
        }
    }

    private FormatterResult _readAndFormat(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            errorCount.incrementAndGet();
            logger.log(Level.WARNING, "Failed to read file: " + file, e);
            return FormatterResult.failure(null, new FormatterError(
                    Severity.FATAL, "Failed to read file: " + e.getMessage(), 1, 1));
        }
        return formatFile(file, content);
    }

    /**
     * Lists the formattable files under {@code root}, or {@code root} itself when it is
     * a file. Configured ignore patterns and the optional include glob are applied to
     * paths relative to {@code root}.
     */
    public List<Path> collectFiles(Path root, String includePattern) throws IOException {
        if (Files.isRegularFile(root)) {
            return List.of(root);
        }

        List<PathMatcher> ignored = new ArrayList<>();
        for (String pattern : config.getIgnoreFiles()) {
            ignored.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }
        PathMatcher include = includePattern == null || includePattern.isEmpty()
                ? null
                : FileSystems.getDefault().getPathMatcher("glob:" + includePattern);

        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> plugins.containsKey(FileType.detectByExtension(p)))
                    .filter(p -> include == null || include.matches(p.getFileName()))
                    .filter(p -> !_isIgnored(root.relativize(p), ignored))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static boolean _isIgnored(Path relative, List<PathMatcher> ignored) {
        for (PathMatcher matcher : ignored) {
            if (matcher.matches(relative)) {
                return true;
            }
        }
        return false;
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getChangedCount() {
        return changedCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    @Override
    public void close() {
        logger.fine("Closing formatter: processed=" + processedFileCount.get() +
                ", changed=" + changedCount.get() + ", errors=" + errorCount.get());
        plugins.clear();
    }
}
