package com.indentlint.plugins.java;

import java.util.List;

import com.indentlint.api.error.LintError;
import com.indentlint.plugins.java.indentation.LineFix;

/**
 * Violations of one rule and the fixes that would remove them.
 */
public class RuleResult {
    private final List<LintError> errors;
    private final List<LineFix> fixes;

    public RuleResult(List<LintError> errors, List<LineFix> fixes) {
        this.errors = errors;
        this.fixes = fixes;
    }

    public List<LintError> getErrors() {
        return errors;
    }

    public List<LineFix> getFixes() {
        return fixes;
    }
}
