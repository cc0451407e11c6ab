package com.indentlint.api;

import java.util.ArrayList;
import java.util.List;

import com.indentlint.api.error.LintError;

/**
 * Outcome of checking or fixing one file.
 * {@code fixedCode} holds the source after fixes; for a plain check it is the input unchanged.
 */
public class CheckResult {
    private final boolean successful;
    private final String fixedCode;
    private final List<LintError> errors;
    private final List<AppliedFix> appliedFixes;

    private CheckResult(Builder builder) {
        this.successful = builder.successful;
        this.fixedCode = builder.fixedCode;
        this.errors = List.copyOf(builder.errors);
        this.appliedFixes = List.copyOf(builder.appliedFixes);
    }

    public boolean isSuccessful() {
        return successful;
    }

    public String getFixedCode() {
        return fixedCode;
    }

    public List<LintError> getErrors() {
        return errors;
    }

    public List<AppliedFix> getAppliedFixes() {
        return appliedFixes;
    }

    public boolean hasViolations() {
        return !errors.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String fixedCode;
        private List<LintError> errors = new ArrayList<>();
        private List<AppliedFix> appliedFixes = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder fixedCode(String fixedCode) {
            this.fixedCode = fixedCode;
            return this;
        }

        public Builder addError(LintError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<LintError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public Builder addAppliedFix(AppliedFix fix) {
            this.appliedFixes.add(fix);
            return this;
        }

        public Builder appliedFixes(List<AppliedFix> fixes) {
            this.appliedFixes = new ArrayList<>(fixes);
            return this;
        }

        public CheckResult build() {
            return new CheckResult(this);
        }
    }
}
