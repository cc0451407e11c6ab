package com.indentlint.api;

import java.nio.file.Path;

import com.indentlint.config.LintConfig;

/**
 * Language-specific set of rules behind the engine.
 */
public interface CheckerPlugin {
    /**
     * Initialize the plugin with the configuration.
     */
    void initialize(LintConfig config);

    /**
     * Report violations without changing the source.
     */
    CheckResult check(Path filePath, String sourceCode);

    /**
     * Apply every safe fix and report what is left afterwards.
     */
    CheckResult fix(Path filePath, String sourceCode);
}
