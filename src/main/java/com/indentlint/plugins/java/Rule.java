package com.indentlint.plugins.java;

import com.github.javaparser.ast.CompilationUnit;

/**
 * A check that reads a parsed compilation unit and may offer line fixes.
 */
public interface Rule {
    String getName();
    RuleResult check(CompilationUnit cu, String sourceCode);
    boolean canAutoFix();
}
