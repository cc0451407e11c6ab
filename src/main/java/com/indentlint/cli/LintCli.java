package com.indentlint.cli;

import com.indentlint.api.CheckResult;
import com.indentlint.api.error.LintError;
import com.indentlint.api.error.Severity;
import com.indentlint.config.ConfigurationLoader;
import com.indentlint.config.LintConfig;
import com.indentlint.core.LintEngine;
import com.indentlint.plugins.FileType;
import com.indentlint.plugins.java.JavaLintPlugin;
import com.indentlint.util.ErrorFormatter;
import com.indentlint.util.LoggerUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Command line interface for indent-lint.
 */
public class LintCli {
    private static final Logger logger = LoggerUtil.getLogger(LintCli.class);
    private static final String VERSION = "1.0.0";
    static final String CONFIG_FILE_NAME = ".indentlint.yml";
    private static ErrorFormatter errorFormatter = new ErrorFormatter(false);

    public static void main(String[] args) {
        int status;
        try {
            status = run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(status);
    }

    /**
     * Runs one command and returns the process exit status.
     */
    static int run(String[] args) {
        errorFormatter = new ErrorFormatter(!_hasOption(args, "--no-color"));

        if (args.length < 1) {
            _printUsage();
            return 1;
        }

        if (_hasOption(args, "--verbose")) {
            LoggerUtil.setConsoleLevel(Level.FINE);
        } else {
            LoggerUtil.setConsoleLevel(Level.WARNING);
        }
        String logFile = _getOptionValue(args, "--log-file");
        if (logFile != null) {
            LoggerUtil.setLogFilePath(Paths.get(logFile));
        }

        try {
            String command = args[0];
            switch (command) {
                case "check":
                    return _checkFiles(args, false);
                case "fix":
                    return _checkFiles(args, true);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    _printVersion();
                    return 0;
                case "--help":
                case "-h":
                    _printUsage();
                    return 0;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return 1;
            }
        } catch (Exception e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);

            if (_hasOption(args, "--verbose")) {
                e.printStackTrace();
            } else {
                _printInfo("Use --verbose for stack trace");
            }
            return 1;
        }
    }

    private static void _printVersion() {
        System.out.println("indent-lint version " + VERSION);
    }

    private static void _printUsage() {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "indent-lint v" + VERSION));
        System.out.println("Usage:");
        System.out.println("  indentlint init [--force]         - Write a default " + CONFIG_FILE_NAME);
        System.out.println("  indentlint check <path>           - Report indentation violations");
        System.out.println("  indentlint fix <path>             - Apply safe fixes and report what is left");
        System.out.println("  indentlint --help|-h              - Show this help");
        System.out.println("  indentlint --version|-v           - Show version information");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config=<file>                   - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        System.out.println("  --verbose                         - Show detailed output");
        System.out.println("  --ci                              - CI friendly output (simplified)");
        System.out.println("  --no-color                        - Disable colored output");
        System.out.println("  --include=<glob>                  - Only include files matching pattern");
        System.out.println("  --log-file=<file>                 - Write the log to this file (default: indent-lint.log)");
        System.out.println("  --threads=<num>                   - Number of threads to use (default: available processors)");
        System.out.println("  --force                           - Force overwrite (with init command)");
    }

    private static int _checkFiles(String[] args, boolean fix) throws Exception {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return 1;
        }

        Path path = Paths.get(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + args[1]);
            return 1;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        String includePattern = _getOptionValue(args, "--include");
        int threads = _threadCount(args);
        LintConfig config = _loadConfig(args);

        try (LintEngine engine = _createEngine(config)) {
            List<Path> files = _findFiles(path,
                    config.getGeneralConfig("ignoreFiles", new ArrayList<String>()),
                    includePattern);
            if (!ciMode) {
                _printInfo("Found " + files.size() + " files to " + (fix ? "fix" : "check"));
            }

            Instant start = Instant.now();
            Map<Path, CheckResult> results = fix
                    ? engine.fixFiles(files, threads)
                    : engine.checkFiles(files, threads);

            int violations = 0;
            int failed = 0;
            int fixedFiles = 0;
            int appliedFixes = 0;
            Map<Path, List<LintError>> errorsByFile = new TreeMap<>();

            for (Path file : files) {
                CheckResult result = results.get(file);
                if (result == null) {
                    failed++;
                    continue;
                }

                if (fix && result.getFixedCode() != null && !result.getAppliedFixes().isEmpty()) {
                    Files.writeString(file, result.getFixedCode(), StandardCharsets.UTF_8);
                    fixedFiles++;
                    appliedFixes += result.getAppliedFixes().size();
                    if (verbose) {
                        _printSuccess("Fixed " + result.getAppliedFixes().size() + " lines in " + file);
                    }
                }

                if (!result.isSuccessful()) {
                    failed++;
                }
                if (result.hasViolations()) {
                    errorsByFile.put(file, result.getErrors());
                    for (LintError error : result.getErrors()) {
                        if (error.getSeverity() == Severity.WARNING || error.getSeverity() == Severity.INFO) {
                            violations++;
                        }
                        _printLocated(file, error, verbose);
                    }
                } else if (verbose) {
                    _printSuccess("  OK: " + file);
                }
            }

            Duration duration = Duration.between(start, Instant.now());

            if (ciMode) {
                System.out.println("RESULT:files=" + files.size() + ",violations=" + violations
                        + ",failed=" + failed + (fix ? ",fixed=" + appliedFixes : ""));
            } else {
                System.out.println("\n" + (fix ? "Fix" : "Check") + " complete in " + _formatDuration(duration) + ":");
                System.out.println("  Checked files: " + files.size());
                if (fix) {
                    System.out.println("  Files rewritten: " + fixedFiles);
                    System.out.println("  Lines fixed: " + appliedFixes);
                }
                System.out.println("  Remaining violations: " + violations);
                System.out.println("  Files with processing errors: " + failed);
                if (!errorsByFile.isEmpty()) {
                    System.out.println("\n" + errorFormatter.formatErrorSummary(errorsByFile));
                }
            }

            return violations > 0 || failed > 0 ? 1 : 0;
        }
    }

    private static int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            System.out.println("Use --force to overwrite it or specify a different path with --config");
            return 1;
        }

        LintConfig config = ConfigurationLoader.loadDefaultConfig();
        ConfigurationLoader.saveConfig(config, configPath);
        _printSuccess("Created configuration file: " + configPath);
        return 0;
    }

    private static LintConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        if (configFile != null) {
            logger.fine("Using config file: " + configFile);
            return ConfigurationLoader.loadConfig(Paths.get(configFile));
        }
        return ConfigurationLoader.loadConfig(Paths.get(CONFIG_FILE_NAME));
    }

    private static LintEngine _createEngine(LintConfig config) {
        LintEngine engine = new LintEngine(config);
        engine.registerPlugin(FileType.JAVA, new JavaLintPlugin());
        return engine;
    }

    private static int _threadCount(String[] args) {
        String threadsStr = _getOptionValue(args, "--threads");
        int threads = Runtime.getRuntime().availableProcessors();
        if (threadsStr != null) {
            try {
                threads = Math.max(1, Integer.parseInt(threadsStr));
            } catch (NumberFormatException e) {
                _printWarning("Invalid thread count: " + threadsStr + ", using default");
            }
        }
        return threads;
    }

    static List<Path> _findFiles(Path path, List<String> ignorePatterns, String includePattern) throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }

        try (Stream<Path> walk = Files.walk(path)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(p -> FileType.detect(p) == FileType.JAVA)
                    .filter(p -> _matchesIncludePattern(p, includePattern))
                    .filter(p -> !_isIgnored(p, path, ignorePatterns))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            _printError("Error scanning directory: " + e.getMessage());
            throw e;
        }
    }

    static boolean _matchesIncludePattern(Path file, String includePattern) {
        if (includePattern == null || includePattern.isEmpty()) {
            return true;
        }

        String fileName = file.getFileName().toString();

        if (includePattern.startsWith("*.")) {
            return fileName.endsWith(includePattern.substring(1));
        } else if (includePattern.contains("*") || includePattern.contains("?")) {
            return fileName.matches(_globToRegex(includePattern));
        } else {
            return fileName.contains(includePattern);
        }
    }

    static boolean _isIgnored(Path file, Path basePath, List<String> ignorePatterns) {
        if (ignorePatterns == null || ignorePatterns.isEmpty()) {
            return false;
        }

        String relativePath = basePath.relativize(file).toString().replace("\\", "/");

        for (String pattern : ignorePatterns) {
            if (pattern.startsWith("**/")) {
                if (relativePath.endsWith(pattern.substring(3))) {
                    return true;
                }
            } else if (pattern.endsWith("/**")) {
                if (relativePath.startsWith(pattern.substring(0, pattern.length() - 3))) {
                    return true;
                }
            } else if (pattern.contains("*")) {
                if (relativePath.matches(_globToRegex(pattern))) {
                    return true;
                }
            } else if (pattern.equals(relativePath)) {
                return true;
            }
        }

        return false;
    }

    private static String _globToRegex(String glob) {
        return glob
                .replace(".", "\\.")
                .replace("*", ".*")
                .replace("?", ".");
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

    private static void _printLocated(Path file, LintError error, boolean verbose) {
        String line = verbose
                ? file + ": " + errorFormatter.formatError(error)
                : errorFormatter.formatLocation(file, error);
        switch (error.getSeverity()) {
            case FATAL:
            case ERROR:
                _printError(line);
                break;
            case WARNING:
                _printWarning(line);
                break;
            case INFO:
                _printInfo(line);
                break;
        }
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        }
        return String.format("%d min %d sec", seconds / 60, seconds % 60);
    }

    private static void _printSuccess(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private static void _printError(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private static void _printWarning(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private static void _printInfo(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
