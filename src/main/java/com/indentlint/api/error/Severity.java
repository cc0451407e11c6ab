package com.indentlint.api.error;

public enum Severity {
    FATAL,   // Source could not be parsed or checked at all
    ERROR,   // Problems with the run itself, e.g. no plugin for a file
    WARNING, // Rule violations
    INFO     // Notes about applied fixes
}
