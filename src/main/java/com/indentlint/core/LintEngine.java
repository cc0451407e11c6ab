package com.indentlint.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.indentlint.api.CheckResult;
import com.indentlint.api.CheckerPlugin;
import com.indentlint.api.CodeChecker;
import com.indentlint.api.error.LintError;
import com.indentlint.api.error.Severity;
import com.indentlint.config.LintConfig;
import com.indentlint.plugins.FileType;
import com.indentlint.util.LoggerUtil;

/**
 * Routes files to the plugin registered for their type and keeps per-run counters.
 * Safe to share between threads.
 */
public class LintEngine implements CodeChecker, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(LintEngine.class);

    private final Map<FileType, CheckerPlugin> plugins = new ConcurrentHashMap<>();
    private final LintConfig config;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger cleanCount = new AtomicInteger(0);
    private final AtomicInteger failedCount = new AtomicInteger(0);

    public LintEngine(LintConfig config) {
        this.config = config;
        logger.fine("Lint engine created");
    }

    /**
     * Registers and initializes the plugin responsible for {@code fileType}.
     */
    public void registerPlugin(FileType fileType, CheckerPlugin plugin) {
        plugins.put(fileType, plugin);
        plugin.initialize(config);
        logger.info("Registered plugin for file type: " + fileType.getDescription());
    }

    @Override
    public CheckResult checkFile(Path filePath, String sourceCode) {
        return _run(filePath, sourceCode, CheckerPlugin::check, "check");
    }

    @Override
    public CheckResult fixFile(Path filePath, String sourceCode) {
        return _run(filePath, sourceCode, CheckerPlugin::fix, "fix");
    }

    private CheckResult _run(Path filePath, String sourceCode,
                             PluginCall call, String action) {
        FileType fileType = FileType.detect(filePath);
        CheckerPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return CheckResult.builder()
                    .successful(false)
                    .fixedCode(sourceCode)
                    .addError(new LintError(
                            Severity.ERROR,
                            "No plugin registered for file type: " + fileType,
                            1, 1))
                    .build();
        }

        try {
            processedFileCount.incrementAndGet();
            CheckResult result = call.apply(plugin, filePath, sourceCode);

            if (!result.isSuccessful()) {
                failedCount.incrementAndGet();
                logger.warning("Failed to " + action + ": " + filePath + " - " +
                        result.getErrors().stream()
                                .filter(e -> e.getSeverity() == Severity.FATAL || e.getSeverity() == Severity.ERROR)
                                .map(e -> e.getSeverity() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
            } else if (!result.hasViolations()) {
                cleanCount.incrementAndGet();
                logger.fine("No violations: " + filePath);
            } else {
                logger.fine(result.getErrors().size() + " violations in " + filePath);
            }

            return result;
        } catch (Exception e) {
            failedCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error during " + action + " of file: " + filePath, e);

            return CheckResult.builder()
                    .successful(false)
                    .fixedCode(sourceCode)
                    .addError(new LintError(
                            Severity.FATAL,
                            "Unexpected error: " + e.getMessage(),
                            1, 1))
                    .build();
        }
    }

    @Override
    public Map<Path, CheckResult> checkDirectory(Path directory) {
        return checkDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Checks every supported file under {@code directory} on {@code threadCount} workers.
     *
     * @throws UncheckedIOException if the directory cannot be scanned
     */
    public Map<Path, CheckResult> checkDirectory(Path directory, int threadCount) {
        return _processDirectory(directory, threadCount, this::checkFile);
    }

    /**
     * Checks an explicit list of files on {@code threadCount} workers.
     */
    public Map<Path, CheckResult> checkFiles(List<Path> files, int threadCount) {
        return _processFiles(files, threadCount, this::checkFile);
    }

    /**
     * Fixes an explicit list of files. Results carry the fixed text; writing it back is left
     * to the caller.
     */
    public Map<Path, CheckResult> fixFiles(List<Path> files, int threadCount) {
        return _processFiles(files, threadCount, this::fixFile);
    }

    private Map<Path, CheckResult> _processDirectory(Path directory, int threadCount,
                                                      BiFunction<Path, String, CheckResult> action) {
        if (!Files.exists(directory)) {
            logger.warning("Directory does not exist: " + directory);
            return new ConcurrentHashMap<>();
        }
        if (!Files.isDirectory(directory)) {
            logger.warning("Path is not a directory: " + directory);
            return new ConcurrentHashMap<>();
        }

        List<Path> filesToProcess;
        try (Stream<Path> walk = Files.walk(directory)) {
            filesToProcess = walk
                    .filter(Files::isRegularFile)
                    .filter(path -> {
                        FileType type = FileType.detect(path);
                        return type != FileType.UNKNOWN && plugins.containsKey(type);
                    })
                    .toList();
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            throw new UncheckedIOException("Error scanning directory: " + directory, e);
        }

        logger.info("Found " + filesToProcess.size() + " files to process in " + directory);
        return _processFiles(filesToProcess, threadCount, action);
    }

    private Map<Path, CheckResult> _processFiles(List<Path> files, int threadCount,
                                                 BiFunction<Path, String, CheckResult> action) {
        ConcurrentHashMap<Path, CheckResult> results = new ConcurrentHashMap<>();
        if (files.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        for (Path file : files) {
            executor.submit(() -> {
                try {
                    String content = Files.readString(file, StandardCharsets.UTF_8);
                    results.put(file, action.apply(file, content));
                } catch (IOException e) {
                    failedCount.incrementAndGet();
                    logger.log(Level.WARNING, "Failed to read file: " + file, e);
                    results.put(file, _failure("Failed to read file: " + e.getMessage()));
                }
            });
        }

        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for file processing to complete");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Processing interrupted", e);
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        logger.info("Processed " + results.size() + " files");
        return results;
    }

    private static CheckResult _failure(String message) {
        return CheckResult.builder()
                .successful(false)
                .fixedCode(null)
                .addError(new LintError(Severity.FATAL, message, 1, 1))
                .build();
    }

    // Getters
    public int getProcessedFileCount() { return processedFileCount.get(); }
    public int getCleanCount() { return cleanCount.get(); }
    public int getFailedCount() { return failedCount.get(); }
    public LintConfig getConfig() { return config; }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    public int getPluginCount() {
        return plugins.size();
    }

    /**
     * Closes every plugin that holds resources. All plugins are closed even when one fails;
     * the first failure is rethrown afterwards.
     */
    @Override
    public void close() throws Exception {
        logger.info("Closing lint engine: processed=" + processedFileCount.get() +
                ", clean=" + cleanCount.get() + ", failed=" + failedCount.get());

        Exception firstException = null;
        for (Map.Entry<FileType, CheckerPlugin> entry : plugins.entrySet()) {
            CheckerPlugin plugin = entry.getValue();
            if (plugin instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) plugin).close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin for file type: " + entry.getKey(), e);
                    if (firstException == null) {
                        firstException = e;
                    }
                }
            }
        }
        plugins.clear();

        if (firstException != null) {
            throw firstException;
        }
    }

    @FunctionalInterface
    private interface PluginCall {
        CheckResult apply(CheckerPlugin plugin, Path filePath, String sourceCode);
    }
}
