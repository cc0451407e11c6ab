package com.indentlint.plugins.java.indentation;

import java.util.Optional;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationMemberDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.ArrayCreationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.InstanceOfExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;

/**
 * Every syntactic category the indentation check distinguishes. Anything else is {@link #OTHER}.
 */
enum ConstructKind {
    // Members of a class body
    FIELD,
    METHOD,
    CONSTRUCTOR,
    COMPACT_CONSTRUCTOR,
    TYPE,
    INITIALIZER,
    ENUM_CONSTANT,
    ANNOTATION_MEMBER,

    // Statements
    LOCAL_VARIABLE,
    EXPRESSION_STATEMENT,
    SIMPLE_STATEMENT,
    CONSTRUCTOR_CALL,
    YIELD,
    IF,
    FOR,
    WHILE,
    DO,
    TRY,
    SWITCH,
    SYNCHRONIZED,
    LABELED,
    BLOCK,
    LOCAL_TYPE,

    // Expressions
    LAMBDA,
    METHOD_CALL,
    OBJECT_CREATION,
    ARRAY_CREATION,
    ARRAY_INITIALIZER,
    ANNOTATION_ARRAY_INITIALIZER,
    INSTANCEOF,
    SWITCH_EXPRESSION,
    BINARY,
    ARRAY_ACCESS,

    OTHER;

    static ConstructKind of(Node node) {
        if (node instanceof FieldDeclaration) {
            return FIELD;
        } else if (node instanceof MethodDeclaration) {
            return METHOD;
        } else if (node instanceof ConstructorDeclaration) {
            return CONSTRUCTOR;
        } else if (node instanceof CompactConstructorDeclaration) {
            return COMPACT_CONSTRUCTOR;
        } else if (node instanceof TypeDeclaration) {
            return TYPE;
        } else if (node instanceof InitializerDeclaration) {
            return INITIALIZER;
        } else if (node instanceof EnumConstantDeclaration) {
            return ENUM_CONSTANT;
        } else if (node instanceof AnnotationMemberDeclaration) {
            return ANNOTATION_MEMBER;
        }
        return _statementKind(node).orElseGet(() -> _expressionKind(node));
    }

    private static Optional<ConstructKind> _statementKind(Node node) {
        ConstructKind kind = null;
        if (node instanceof ExpressionStmt) {
            kind = ((ExpressionStmt) node).getExpression() instanceof VariableDeclarationExpr
                    ? LOCAL_VARIABLE : EXPRESSION_STATEMENT;
        } else if (node instanceof ReturnStmt || node instanceof ThrowStmt || node instanceof BreakStmt
                || node instanceof ContinueStmt || node instanceof AssertStmt) {
            kind = SIMPLE_STATEMENT;
        } else if (node instanceof ExplicitConstructorInvocationStmt) {
            kind = CONSTRUCTOR_CALL;
        } else if (node instanceof YieldStmt) {
            kind = YIELD;
        } else if (node instanceof IfStmt) {
            kind = IF;
        } else if (node instanceof ForStmt || node instanceof ForEachStmt) {
            kind = FOR;
        } else if (node instanceof WhileStmt) {
            kind = WHILE;
        } else if (node instanceof DoStmt) {
            kind = DO;
        } else if (node instanceof TryStmt) {
            kind = TRY;
        } else if (node instanceof SwitchStmt) {
            kind = SWITCH;
        } else if (node instanceof SynchronizedStmt) {
            kind = SYNCHRONIZED;
        } else if (node instanceof LabeledStmt) {
            kind = LABELED;
        } else if (node instanceof BlockStmt) {
            kind = BLOCK;
        } else if (node instanceof LocalClassDeclarationStmt || node instanceof LocalRecordDeclarationStmt) {
            kind = LOCAL_TYPE;
        }
        return Optional.ofNullable(kind);
    }

    private static ConstructKind _expressionKind(Node node) {
        if (node instanceof LambdaExpr) {
            return LAMBDA;
        } else if (node instanceof MethodCallExpr) {
            return METHOD_CALL;
        } else if (node instanceof ObjectCreationExpr) {
            return OBJECT_CREATION;
        } else if (node instanceof ArrayCreationExpr) {
            return ARRAY_CREATION;
        } else if (node instanceof ArrayInitializerExpr) {
            return _isAnnotationValue(node) ? ANNOTATION_ARRAY_INITIALIZER : ARRAY_INITIALIZER;
        } else if (node instanceof InstanceOfExpr) {
            return INSTANCEOF;
        } else if (node instanceof SwitchExpr) {
            return SWITCH_EXPRESSION;
        } else if (node instanceof BinaryExpr || node instanceof ConditionalExpr) {
            return BINARY;
        } else if (node instanceof ArrayAccessExpr) {
            return ARRAY_ACCESS;
        }
        return OTHER;
    }

    /**
     * Array initializers written as annotation values, possibly nested.
     */
    private static boolean _isAnnotationValue(Node node) {
        Optional<Node> parent = node.getParentNode();
        while (parent.isPresent() && parent.get() instanceof ArrayInitializerExpr) {
            parent = parent.get().getParentNode();
        }
        return parent.isPresent() && (parent.get() instanceof AnnotationExpr
                || parent.get() instanceof MemberValuePair
                || parent.get() instanceof AnnotationMemberDeclaration);
    }
}
