package com.vyperformatter.cli;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.vyperformatter.api.FormatterResult;
import com.vyperformatter.api.error.FormatterError;
import com.vyperformatter.api.error.Severity;
import com.vyperformatter.config.ConfigurationLoader;
import com.vyperformatter.config.FormatterConfig;
import com.vyperformatter.core.VyperCodeFormatter;
import com.vyperformatter.plugins.FileType;
import com.vyperformatter.plugins.vyper.VyperFormatter;
import com.vyperformatter.util.AtomicFiles;
import com.vyperformatter.util.ErrorFormatter;
import com.vyperformatter.util.LoggerUtil;

/**
 * Command line entry point.
 * <p>
 * Exit codes: 0 when nothing changed, 1 when files were (or for {@code check} and
 * {@code --diff} would be) reformatted, 2 for usage errors and 123 when any file
 * failed.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    private static final int DIFF_CONTEXT_LINES = 5;

    public static final int EXIT_UNCHANGED = 0;
    public static final int EXIT_CHANGED = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_FAILED = 123;

    private final PrintStream out;
    private final PrintStream console;
    private final ErrorFormatter errorFormatter;
    private final boolean quiet;
    private final boolean verbose;

    private FormatterCli(PrintStream out, PrintStream err, String[] args) {
        this.out = out;
        this.console = _hasOption(args, "--stdout") || _hasOption(args, "--diff") ? err : out;
        this.errorFormatter = new ErrorFormatter(!_hasOption(args, "--no-color"));
        this.quiet = _hasOption(args, "--quiet");
        this.verbose = _hasOption(args, "--verbose");
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args, new FileOutputStream(FileDescriptor.out), new FileOutputStream(FileDescriptor.err));
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs with both streams encoded as UTF-8, whatever the platform charset is.
     */
    public static int run(String[] args, OutputStream out, OutputStream err) {
        return run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        FormatterCli cli = new FormatterCli(out, err, args);
        if (cli.verbose) {
            LoggerUtil.setConsoleLevel(Level.FINE);
        } else if (cli.quiet) {
            LoggerUtil.setConsoleLevel(Level.SEVERE);
        } else {
            LoggerUtil.setConsoleLevel(Level.WARNING);
        }

        if (args.length < 1) {
            cli._printUsage();
            return EXIT_USAGE;
        }

        try {
            return switch (args[0]) {
                case "format" -> cli._process(args, false);
                case "check" -> cli._process(args, true);
                case "init" -> cli._initializeConfig(args);
                case "--version", "-v" -> {
                    out.println("vyper-formatter " + VERSION);
                    yield EXIT_UNCHANGED;
                }
                case "--help", "-h" -> {
                    cli._printUsage();
                    yield EXIT_UNCHANGED;
                }
                default -> {
                    cli._printError("Unknown command: " + args[0]);
                    cli._printUsage();
                    yield EXIT_USAGE;
                }
            };
        } catch (UsageException e) {
            cli._printError(e.getMessage());
            return EXIT_USAGE;
        } catch (IOException | RuntimeException e) {
            cli._printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            return EXIT_FAILED;
        }
    }

    private void _printUsage() {
        console.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "Vyper Formatter v" + VERSION));
        console.println("Usage:");
        console.println("  vyper-formatter format <path>...   - Format .vy and .vyi files in place");
        console.println("  vyper-formatter check <path>...    - Report files that would be reformatted");
        console.println("  vyper-formatter init [--force]     - Write a default " + ConfigurationLoader.CONFIG_FILE_NAME);
        console.println("  vyper-formatter --help|-h          - Show this help");
        console.println("  vyper-formatter --version|-v       - Show version information");
        console.println();
        console.println("Options:");
        console.println("  --config=<file>                    - Use specific config file (default: " + ConfigurationLoader.CONFIG_FILE_NAME + ")");
        console.println("  --line-length=<n>                  - Maximum line length (default: " + ConfigurationLoader.DEFAULT_LINE_LENGTH + ")");
        console.println("  --safe=<true|false>                - Verify the output against the source (default: true)");
        console.println("  --stdout                           - Print formatted code instead of writing files");
        console.println("  --diff                             - Print a unified diff per file instead of writing files");
        console.println("  --include=<glob>                   - Only include file names matching pattern");
        console.println("  --threads=<num>                    - Number of threads to use (default: available processors)");
        console.println("  --verbose                          - Show detailed output");
        console.println("  --quiet                            - Only report errors");
        console.println("  --no-color                         - Disable colored output");
    }

    private int _process(String[] args, boolean checkOnly) throws IOException {
        List<Path> targets = _positionalPaths(args);
        if (targets.isEmpty()) {
            throw new UsageException("Missing path argument");
        }
        for (Path target : targets) {
            if (!Files.exists(target)) {
                throw new UsageException("Path does not exist: " + target);
            }
        }

        FormatterConfig config = _loadConfig(args);
        boolean toStdout = _hasOption(args, "--stdout");
        boolean diff = _hasOption(args, "--diff");
        boolean dryRun = checkOnly || diff;
        int threads = _threadCount(args);

        try (VyperCodeFormatter formatter = _createFormatter(config)) {
            Set<Path> files = new LinkedHashSet<>();
            for (Path target : targets) {
                files.addAll(formatter.collectFiles(target, _getOptionValue(args, "--include")));
            }
            if (verbose) {
                _printInfo("Found " + files.size() + " files");
            }

            Instant start = Instant.now();
            Map<Path, FormatterResult> results = formatter.formatFiles(new ArrayList<>(files), threads);

            int changed = 0;
            int unchanged = 0;
            int failed = 0;
            Map<Path, List<FormatterError>> errorsByFile = new LinkedHashMap<>();

            for (Path file : files) {
                FormatterResult result = results.get(file);
                if (result == null) {
                    result = FormatterResult.failure(null, new FormatterError(
                            Severity.FATAL, "File was not processed", 1, 1));
                }
                errorsByFile.put(file, result.getErrors());
                _printDiagnostics(file, result.getErrors());

                if (!result.isSuccessful()) {
                    _printError("error: cannot format " + file);
                    failed++;
                    continue;
                }

                if (toStdout) {
                    out.print(result.getFormattedCode());
                }
                if (!result.isChanged()) {
                    unchanged++;
                    if (verbose) {
                        _printInfo(file + " already well formatted");
                    }
                    continue;
                }

                if (diff) {
                    out.print(_unifiedDiff(file, result.getFormattedCode()));
                }
                if (dryRun) {
                    _printStatus("would reformat " + file);
                } else if (!toStdout) {
                    try {
                        AtomicFiles.writeString(file, result.getFormattedCode());
                    } catch (IOException e) {
                        logger.log(Level.WARNING, "Failed to write " + file, e);
                        _printError("error: cannot write " + file + ": " + e.getMessage());
                        failed++;
                        continue;
                    }
                    _printStatus("reformatted " + file);
                }
                changed++;
            }

            Duration duration = Duration.between(start, Instant.now());
            _printSummary(dryRun, changed, unchanged, failed, duration);
            if (failed > 0 && !quiet) {
                console.println(errorFormatter.formatErrorSummary(errorsByFile));
            }

            if (failed > 0) {
                return EXIT_FAILED;
            }
            return changed > 0 ? EXIT_CHANGED : EXIT_UNCHANGED;
        }
    }

    /**
     * Unified diff of a file against its formatted code, colored like the console
     * output.
     */
    private String _unifiedDiff(Path file, String formatted) throws IOException {
        List<String> original = Files.readString(file, StandardCharsets.UTF_8).lines()
                .collect(Collectors.toList());
        List<String> revised = formatted.lines().collect(Collectors.toList());
        Patch<String> patch = DiffUtils.diff(original, revised);
        List<String> lines = UnifiedDiffUtils.generateUnifiedDiff(
                file + "\t(original)", file + "\t(formatted)", original, patch, DIFF_CONTEXT_LINES);

        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(_colorDiffLine(line)).append('\n');
        }
        return sb.toString();
    }

    private String _colorDiffLine(String line) {
        if (line.startsWith("+++") || line.startsWith("---")) {
            return errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, line);
        }
        if (line.startsWith("@@")) {
            return errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, line);
        }
        if (line.startsWith("+")) {
            return errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, line);
        }
        if (line.startsWith("-")) {
            return errorFormatter.colorize(ErrorFormatter.ANSI_RED, line);
        }
        return line;
    }

    private int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : ConfigurationLoader.CONFIG_FILE_NAME);

        if (Files.exists(configPath) && !_hasOption(args, "--force")) {
            _printWarning("Configuration file already exists: " + configPath);
            console.println("Use --force to overwrite it");
            return EXIT_CHANGED;
        }

        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), configPath);
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_UNCHANGED;
    }

    private FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        FormatterConfig config;
        if (configFile != null) {
            if (!Files.exists(Paths.get(configFile))) {
                throw new UsageException("Config file does not exist: " + configFile);
            }
            config = ConfigurationLoader.loadConfig(Paths.get(configFile));
        } else {
            config = ConfigurationLoader.loadConfig(Paths.get(ConfigurationLoader.CONFIG_FILE_NAME));
        }

        String lineLength = _getOptionValue(args, "--line-length");
        if (lineLength != null) {
            int value;
            try {
                value = Integer.parseInt(lineLength);
            } catch (NumberFormatException e) {
                throw new UsageException("Invalid line length: " + lineLength);
            }
            if (value < ConfigurationLoader.MIN_LINE_LENGTH || value > ConfigurationLoader.MAX_LINE_LENGTH) {
                throw new UsageException("Line length must be between " + ConfigurationLoader.MIN_LINE_LENGTH
                        + " and " + ConfigurationLoader.MAX_LINE_LENGTH + ": " + lineLength);
            }
            config = config.with(FormatterConfig.LINE_LENGTH, value);
        }

        String safe = _getOptionValue(args, "--safe");
        if (safe != null) {
            if (!safe.equalsIgnoreCase("true") && !safe.equalsIgnoreCase("false")) {
                throw new UsageException("Invalid value for --safe: " + safe);
            }
            config = config.with(FormatterConfig.SAFETY_CHECK, Boolean.parseBoolean(safe));
        }
        return config;
    }

    private int _threadCount(String[] args) {
        int threads = Runtime.getRuntime().availableProcessors();
        String threadsStr = _getOptionValue(args, "--threads");
        if (threadsStr != null) {
            try {
                threads = Integer.parseInt(threadsStr);
            } catch (NumberFormatException e) {
                _printWarning("Invalid thread count: " + threadsStr + ", using default");
            }
        }
        return Math.max(1, threads);
    }

    private VyperCodeFormatter _createFormatter(FormatterConfig config) {
        VyperCodeFormatter formatter = new VyperCodeFormatter(config);
        formatter.registerPlugin(FileType.VYPER, new VyperFormatter());
        formatter.registerPlugin(FileType.VYPER_INTERFACE, new VyperFormatter());
        return formatter;
    }

    private void _printDiagnostics(Path file, List<FormatterError> errors) {
        for (FormatterError error : errors) {
            if (error.isBlocking()) {
                _printError(errorFormatter.formatError(file, error));
            } else if (!quiet) {
                _printWarning(errorFormatter.formatError(file, error));
            }
        }
    }

    private void _printSummary(boolean checkOnly, int changed, int unchanged, int failed, Duration duration) {
        if (quiet) {
            return;
        }
        List<String> parts = new ArrayList<>();
        if (changed > 0) {
            parts.add(_files(changed) + (checkOnly ? " would be reformatted" : " reformatted"));
        }
        if (unchanged > 0) {
            parts.add(_files(unchanged) + (checkOnly ? " would be left unchanged" : " left unchanged"));
        }
        if (failed > 0) {
            parts.add(_files(failed) + (checkOnly ? " would fail to reformat" : " failed to reformat"));
        }
        if (parts.isEmpty()) {
            parts.add("No Vyper files found");
        }
        console.println(String.join(", ", parts) + ".");
        if (verbose) {
            console.println("Done in " + _formatDuration(duration));
        }
    }

    private static String _files(int count) {
        return count + (count == 1 ? " file" : " files");
    }

    private static List<Path> _positionalPaths(String[] args) {
        List<Path> paths = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            if (args[i].startsWith("--")) {
                continue;
            }
            paths.add(Paths.get(args[i]));
        }
        return paths;
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        }
        return String.format("%d min %d sec", seconds / 60, seconds % 60);
    }

    private void _printStatus(String message) {
        if (!quiet) {
            console.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, message));
        }
    }

    private void _printSuccess(String message) {
        console.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private void _printError(String message) {
        console.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private void _printWarning(String message) {
        if (!quiet) {
            console.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
        }
    }

    private void _printInfo(String message) {
        console.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }

    /**
     * Bad command line; reported without a stack trace.
     */
    private static class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
