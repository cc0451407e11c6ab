package com.indentlint.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * Entry point used by the command line and by embedders.
 */
public interface CodeChecker {
    CheckResult checkFile(Path filePath, String sourceCode);
    CheckResult fixFile(Path filePath, String sourceCode);
    Map<Path, CheckResult> checkDirectory(Path directory);
}
