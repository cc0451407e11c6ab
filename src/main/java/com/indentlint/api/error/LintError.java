package com.indentlint.api.error;

/**
 * A single diagnostic produced while checking a file.
 */
public class LintError {
    private final Severity severity;
    private final String ruleName;
    private final String message;
    private final int line;
    private final int column;
    private final String suggestion;

    public LintError(Severity severity, String message, int line, int column) {
        this(severity, null, message, line, column, null);
    }

    public LintError(Severity severity, String ruleName, String message, int line, int column, String suggestion) {
        this.severity = severity;
        this.ruleName = ruleName;
        this.message = message;
        this.line = line;
        this.column = column;
        this.suggestion = suggestion;
    }

    // Getters
    public Severity getSeverity() { return severity; }
    public String getRuleName() { return ruleName; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getSuggestion() { return suggestion; }

    @Override
    public String toString() {
        return line + ":" + column + ": " + (ruleName != null ? "[" + ruleName + "] " : "") + message;
    }
}
