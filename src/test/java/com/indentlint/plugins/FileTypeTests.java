package com.indentlint.plugins;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileTypeTests {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setup() {
        FileType.clearCache();
    }

    @Test
    void testDetectByExtension() {
        Assertions.assertEquals(FileType.JAVA, FileType.detect(Path.of("src", "Foo.java")));
        Assertions.assertEquals(FileType.JAVA, FileType.detect(Path.of("Foo.JAVA")));
        Assertions.assertEquals(FileType.UNKNOWN, FileType.detect(Path.of("Foo.kt")));
    }

    @Test
    void testExtensionlessJavaIsDetectedByContent() throws IOException {
        Path file = Files.writeString(tempDir.resolve("Script"), "// header\npackage a;\n\nclass A {}\n");
        Assertions.assertEquals(FileType.JAVA, FileType.detect(file));
    }

    @Test
    void testExtensionlessTypeDeclaration() throws IOException {
        Path file = Files.writeString(tempDir.resolve("Plain"), "public final class A {\n}\n");
        Assertions.assertEquals(FileType.JAVA, FileType.detect(file));
    }

    @Test
    void testOtherContentIsUnknown() throws IOException {
        Path file = Files.writeString(tempDir.resolve("notes"), "classes start on monday\n");
        Assertions.assertEquals(FileType.UNKNOWN, FileType.detect(file));
    }

    @Test
    void testResultsAreCached() {
        FileType.detect(Path.of("Cached.java"));
        Assertions.assertEquals(1, FileType.getCacheSize());
        FileType.clearCache();
        Assertions.assertEquals(0, FileType.getCacheSize());
    }

    @Test
    void testDescriptions() {
        Assertions.assertEquals("java", FileType.JAVA.getExtension());
        Assertions.assertEquals("Java source file", FileType.JAVA.getDescription());
    }
}
