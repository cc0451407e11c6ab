package com.indentlint.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.indentlint.config.ConfigurationLoader;
import com.indentlint.config.LintConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LintCliTests {
    private static final String CLEAN = "class Clean {\n    int x;\n}\n";
    private static final String MISINDENTED = "class Bad {\n  int x;\n}\n";

    @TempDir
    Path tempDir;

    private String[] args(String command, Path path, String... extra) {
        String[] base = {command, path.toString(), "--no-color", "--threads=1",
                "--config=" + tempDir.resolve("absent.yml")};
        String[] all = new String[base.length + extra.length];
        System.arraycopy(base, 0, all, 0, base.length);
        System.arraycopy(extra, 0, all, base.length, extra.length);
        return all;
    }

    // ------------------------------------------------------------------
    // commands
    // ------------------------------------------------------------------

    @Test
    void testCheckCleanTreeSucceeds() throws IOException {
        Path src = Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(src.resolve("Clean.java"), CLEAN);
        Assertions.assertEquals(0, LintCli.run(args("check", src)));
    }

    @Test
    void testCheckWithViolationsFails() throws IOException {
        Path src = Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(src.resolve("Clean.java"), CLEAN);
        Path bad = Files.writeString(src.resolve("Bad.java"), MISINDENTED);

        Assertions.assertEquals(1, LintCli.run(args("check", src, "--ci")));
        Assertions.assertEquals(MISINDENTED, Files.readString(bad));
    }

    @Test
    void testFixRewritesFiles() throws IOException {
        Path bad = Files.writeString(tempDir.resolve("Bad.java"), MISINDENTED);

        Assertions.assertEquals(0, LintCli.run(args("fix", bad)));
        Assertions.assertEquals("class Bad {\n    int x;\n}\n", Files.readString(bad));
        Assertions.assertEquals(0, LintCli.run(args("check", bad)));
    }

    @Test
    void testIgnoreFilesFromConfig() throws IOException {
        Path src = Files.createDirectories(tempDir.resolve("src"));
        Files.createDirectories(src.resolve("generated"));
        Files.writeString(src.resolve("generated").resolve("Bad.java"), MISINDENTED);
        Files.writeString(src.resolve("Clean.java"), CLEAN);
        Path config = tempDir.resolve("lint.yml");
        Files.writeString(config, "general:\n  ignoreFiles:\n    - \"generated/**\"\n");

        Assertions.assertEquals(0, LintCli.run(new String[]{"check", src.toString(), "--no-color",
                "--config=" + config}));
    }

    @Test
    void testMissingPathFails() {
        Assertions.assertEquals(1, LintCli.run(args("check", tempDir.resolve("absent"))));
        Assertions.assertEquals(1, LintCli.run(new String[]{"check"}));
    }

    @Test
    void testInitWritesDefaultsOnce() {
        Path config = tempDir.resolve(LintCli.CONFIG_FILE_NAME);
        String[] init = {"init", "--no-color", "--config=" + config};

        Assertions.assertEquals(0, LintCli.run(init));
        Assertions.assertTrue(Files.exists(config));
        LintConfig loaded = ConfigurationLoader.loadConfig(config);
        Assertions.assertEquals(4, (int) loaded.getRuleConfig(ConfigurationLoader.INDENTATION_RULE, "basicOffset", 0));

        Assertions.assertEquals(1, LintCli.run(init));
        Assertions.assertEquals(0, LintCli.run(new String[]{"init", "--no-color", "--force", "--config=" + config}));
    }

    @Test
    void testHelpVersionAndUnknownCommand() {
        Assertions.assertEquals(0, LintCli.run(new String[]{"--help"}));
        Assertions.assertEquals(0, LintCli.run(new String[]{"-v"}));
        Assertions.assertEquals(1, LintCli.run(new String[]{"lint"}));
        Assertions.assertEquals(1, LintCli.run(new String[0]));
    }

    // ------------------------------------------------------------------
    // file selection
    // ------------------------------------------------------------------

    @Test
    void testIncludePattern() {
        Path file = Path.of("src", "FooTest.java");
        Assertions.assertTrue(LintCli._matchesIncludePattern(file, null));
        Assertions.assertTrue(LintCli._matchesIncludePattern(file, "*.java"));
        Assertions.assertTrue(LintCli._matchesIncludePattern(file, "*Test.java"));
        Assertions.assertFalse(LintCli._matchesIncludePattern(file, "Bar*"));
        Assertions.assertTrue(LintCli._matchesIncludePattern(file, "Foo"));
    }

    @Test
    void testIgnorePatterns() {
        Path base = Path.of("project");
        Path file = base.resolve("gen").resolve("Model.java");

        Assertions.assertTrue(LintCli._isIgnored(file, base, List.of("gen/**")));
        Assertions.assertTrue(LintCli._isIgnored(file, base, List.of("**/Model.java")));
        Assertions.assertTrue(LintCli._isIgnored(file, base, List.of("gen/*.java")));
        Assertions.assertTrue(LintCli._isIgnored(file, base, List.of("gen/Model.java")));
        Assertions.assertFalse(LintCli._isIgnored(file, base, List.of("src/**")));
        Assertions.assertFalse(LintCli._isIgnored(file, base, List.of()));
    }

    @Test
    void testFindFilesSkipsOtherTypes() throws IOException {
        Files.writeString(tempDir.resolve("A.java"), CLEAN);
        Files.writeString(tempDir.resolve("notes.md"), "# notes\n");

        List<Path> files = LintCli._findFiles(tempDir, List.of(), null);

        Assertions.assertEquals(List.of(tempDir.resolve("A.java")), files);
    }
}
