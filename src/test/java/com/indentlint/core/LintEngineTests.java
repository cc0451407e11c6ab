package com.indentlint.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.indentlint.api.CheckResult;
import com.indentlint.api.CheckerPlugin;
import com.indentlint.api.error.Severity;
import com.indentlint.config.ConfigurationLoader;
import com.indentlint.config.LintConfig;
import com.indentlint.plugins.FileType;
import com.indentlint.plugins.java.JavaLintPlugin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LintEngineTests {
    private static final String CLEAN = "class Clean {\n    int x;\n}\n";
    private static final String MISINDENTED = "class Bad {\n  int x;\n}\n";

    @TempDir
    Path tempDir;

    private LintEngine engine;

    @BeforeEach
    void setup() {
        engine = new LintEngine(ConfigurationLoader.loadDefaultConfig());
        engine.registerPlugin(FileType.JAVA, new JavaLintPlugin());
    }

    @AfterEach
    void tearDown() throws Exception {
        engine.close();
    }

    // ------------------------------------------------------------------
    // single files
    // ------------------------------------------------------------------

    @Test
    void testRegistration() {
        Assertions.assertTrue(engine.hasPluginFor(FileType.JAVA));
        Assertions.assertFalse(engine.hasPluginFor(FileType.UNKNOWN));
        Assertions.assertEquals(1, engine.getPluginCount());
        Assertions.assertSame(ConfigurationLoader.loadDefaultConfig(), engine.getConfig());
    }

    @Test
    void testUnknownFileTypeIsAnError() {
        CheckResult result = engine.checkFile(tempDir.resolve("notes.txt"), "hello");

        Assertions.assertFalse(result.isSuccessful());
        Assertions.assertEquals(Severity.ERROR, result.getErrors().get(0).getSeverity());
        Assertions.assertEquals("No plugin registered for file type: UNKNOWN", result.getErrors().get(0).getMessage());
        Assertions.assertEquals(0, engine.getProcessedFileCount());
    }

    @Test
    void testCountersFollowOutcomes() {
        engine.checkFile(Path.of("Clean.java"), CLEAN);
        engine.checkFile(Path.of("Bad.java"), MISINDENTED);
        engine.checkFile(Path.of("Broken.java"), "class {");

        Assertions.assertEquals(3, engine.getProcessedFileCount());
        Assertions.assertEquals(1, engine.getCleanCount());
        Assertions.assertEquals(1, engine.getFailedCount());
    }

    @Test
    void testFixFileReturnsFixedText() {
        CheckResult result = engine.fixFile(Path.of("Bad.java"), MISINDENTED);
        Assertions.assertEquals("class Bad {\n    int x;\n}\n", result.getFixedCode());
        Assertions.assertFalse(result.hasViolations());
    }

    @Test
    void testPluginExceptionBecomesFatalResult() {
        LintEngine failing = new LintEngine(ConfigurationLoader.loadDefaultConfig());
        failing.registerPlugin(FileType.JAVA, new ThrowingPlugin());

        CheckResult result = failing.checkFile(Path.of("A.java"), CLEAN);

        Assertions.assertFalse(result.isSuccessful());
        Assertions.assertEquals(Severity.FATAL, result.getErrors().get(0).getSeverity());
        Assertions.assertEquals("Unexpected error: boom", result.getErrors().get(0).getMessage());
        Assertions.assertEquals(1, failing.getFailedCount());
    }

    // ------------------------------------------------------------------
    // batches
    // ------------------------------------------------------------------

    @Test
    void testCheckDirectory() throws IOException {
        Path nested = Files.createDirectories(tempDir.resolve("src"));
        Path clean = Files.writeString(tempDir.resolve("Clean.java"), CLEAN);
        Path bad = Files.writeString(nested.resolve("Bad.java"), MISINDENTED);
        Files.writeString(tempDir.resolve("README.txt"), "not code");

        Map<Path, CheckResult> results = engine.checkDirectory(tempDir, 2);

        Assertions.assertEquals(2, results.size());
        Assertions.assertFalse(results.get(clean).hasViolations());
        Assertions.assertEquals(1, results.get(bad).getErrors().size());
        Assertions.assertEquals(1, engine.getCleanCount());
    }

    @Test
    void testMissingDirectoryGivesNoResults() {
        Assertions.assertTrue(engine.checkDirectory(tempDir.resolve("absent")).isEmpty());
    }

    @Test
    void testUnreadableFileIsReportedAsFailure() {
        Path missing = tempDir.resolve("Gone.java");
        Map<Path, CheckResult> results = engine.checkFiles(List.of(missing), 1);

        CheckResult result = results.get(missing);
        Assertions.assertFalse(result.isSuccessful());
        Assertions.assertTrue(result.getErrors().get(0).getMessage().startsWith("Failed to read file: "));
        Assertions.assertEquals(1, engine.getFailedCount());
    }

    @Test
    void testFixFilesLeavesDiskUntouched() throws IOException {
        Path bad = Files.writeString(tempDir.resolve("Bad.java"), MISINDENTED);

        Map<Path, CheckResult> results = engine.fixFiles(List.of(bad), 1);

        Assertions.assertEquals(1, results.get(bad).getAppliedFixes().size());
        Assertions.assertEquals(MISINDENTED, Files.readString(bad));
    }

    @Test
    void testCloseClearsPlugins() throws Exception {
        engine.close();
        Assertions.assertEquals(0, engine.getPluginCount());
    }

    private static final class ThrowingPlugin implements CheckerPlugin {
        @Override
        public void initialize(LintConfig config) {
        }

        @Override
        public CheckResult check(Path filePath, String sourceCode) {
            throw new IllegalStateException("boom");
        }

        @Override
        public CheckResult fix(Path filePath, String sourceCode) {
            throw new IllegalStateException("boom");
        }
    }
}
