package com.indentlint.api;

/**
 * A whitespace correction that was written into the fixed source.
 */
public class AppliedFix {
    private final String ruleName;
    private final int line;
    private final String description;

    public AppliedFix(String ruleName, int line, String description) {
        this.ruleName = ruleName;
        this.line = line;
        this.description = description;
    }

    // Getters
    public String getRuleName() { return ruleName; }
    public int getLine() { return line; }
    public String getDescription() { return description; }
}
