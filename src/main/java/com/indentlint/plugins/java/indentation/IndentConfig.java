package com.indentlint.plugins.java.indentation;

import com.indentlint.config.ConfigurationLoader;
import com.indentlint.config.LintConfig;

/**
 * Options of the indentation rule.
 */
public final class IndentConfig {
    private final int basicOffset;
    private final int braceAdjustment;
    private final int caseIndent;
    private final int throwsIndent;
    private final int arrayInitIndent;
    private final int lineWrappingIndentation;
    private final boolean forceStrictCondition;
    private final int tabWidth;

    private IndentConfig(Builder builder) {
        this.basicOffset = builder.basicOffset;
        this.braceAdjustment = builder.braceAdjustment;
        this.caseIndent = builder.caseIndent;
        this.throwsIndent = builder.throwsIndent;
        this.arrayInitIndent = builder.arrayInitIndent;
        this.lineWrappingIndentation = builder.lineWrappingIndentation;
        this.forceStrictCondition = builder.forceStrictCondition;
        this.tabWidth = builder.tabWidth;
    }

    public static IndentConfig defaults() {
        return builder().build();
    }

    public static IndentConfig from(LintConfig config) {
        String rule = ConfigurationLoader.INDENTATION_RULE;
        return builder()
                .basicOffset(config.getRuleConfig(rule, "basicOffset", 4))
                .braceAdjustment(config.getRuleConfig(rule, "braceAdjustment", 0))
                .caseIndent(config.getRuleConfig(rule, "caseIndent", 4))
                .throwsIndent(config.getRuleConfig(rule, "throwsIndent", 4))
                .arrayInitIndent(config.getRuleConfig(rule, "arrayInitIndent", 4))
                .lineWrappingIndentation(config.getRuleConfig(rule, "lineWrappingIndentation", 4))
                .forceStrictCondition(config.getRuleConfig(rule, "forceStrictCondition", false))
                .tabWidth(config.getGeneralConfig("tabWidth", 4))
                .build();
    }

    // Getters
    public int basicOffset() { return basicOffset; }
    public int braceAdjustment() { return braceAdjustment; }
    public int caseIndent() { return caseIndent; }
    public int throwsIndent() { return throwsIndent; }
    public int arrayInitIndent() { return arrayInitIndent; }
    public int lineWrappingIndentation() { return lineWrappingIndentation; }
    public boolean forceStrictCondition() { return forceStrictCondition; }
    public int tabWidth() { return tabWidth; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int basicOffset = 4;
        private int braceAdjustment = 0;
        private int caseIndent = 4;
        private int throwsIndent = 4;
        private int arrayInitIndent = 4;
        private int lineWrappingIndentation = 4;
        private boolean forceStrictCondition = false;
        private int tabWidth = 4;

        public Builder basicOffset(int basicOffset) {
            this.basicOffset = basicOffset;
            return this;
        }

        public Builder braceAdjustment(int braceAdjustment) {
            this.braceAdjustment = braceAdjustment;
            return this;
        }

        public Builder caseIndent(int caseIndent) {
            this.caseIndent = caseIndent;
            return this;
        }

        public Builder throwsIndent(int throwsIndent) {
            this.throwsIndent = throwsIndent;
            return this;
        }

        public Builder arrayInitIndent(int arrayInitIndent) {
            this.arrayInitIndent = arrayInitIndent;
            return this;
        }

        public Builder lineWrappingIndentation(int lineWrappingIndentation) {
            this.lineWrappingIndentation = lineWrappingIndentation;
            return this;
        }

        public Builder forceStrictCondition(boolean forceStrictCondition) {
            this.forceStrictCondition = forceStrictCondition;
            return this;
        }

        public Builder tabWidth(int tabWidth) {
            this.tabWidth = tabWidth;
            return this;
        }

        public IndentConfig build() {
            return new IndentConfig(this);
        }
    }
}
