package com.indentlint.plugins.java.indentation;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.github.javaparser.ast.CompilationUnit;
import com.indentlint.api.error.LintError;
import com.indentlint.api.error.Severity;
import com.indentlint.config.LintConfig;
import com.indentlint.plugins.java.Rule;
import com.indentlint.plugins.java.RuleResult;
import com.indentlint.util.LoggerUtil;

/**
 * Checkstyle-compatible indentation check over a parsed compilation unit.
 */
public class IndentationRule implements Rule {
    private static final Logger logger = LoggerUtil.getLogger(IndentationRule.class);
    public static final String NAME = "Indentation";

    private final IndentConfig config;

    public IndentationRule(LintConfig config) {
        this(IndentConfig.from(config));
    }

    public IndentationRule(IndentConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean canAutoFix() {
        return true;
    }

    @Override
    public RuleResult check(CompilationUnit cu, String sourceCode) {
        List<LintError> errors = new ArrayList<>();
        List<LineFix> fixes = new ArrayList<>();

        for (IndentViolation violation : findViolations(cu, sourceCode)) {
            String suggestion = null;
            if (violation.fix().isPresent()) {
                LineFix fix = violation.fix().get();
                fixes.add(fix);
                suggestion = "Indent with " + fix.replacement().length() + " spaces";
            }
            errors.add(new LintError(Severity.WARNING, NAME, violation.message(),
                    violation.line(), violation.column(), suggestion));
        }
        return new RuleResult(errors, fixes);
    }

    /**
     * Runs the walker over {@code cu}; the violations come back sorted by position.
     */
    public List<IndentViolation> findViolations(CompilationUnit cu, String sourceCode) {
        CheckSession session = new CheckSession(sourceCode, config);
        new IndentationWalker(session).walk(cu);
        List<IndentViolation> violations = session.finish();
        logger.fine("Indentation check found " + violations.size() + " violations");
        return violations;
    }

    public IndentConfig getConfig() {
        return config;
    }
}
