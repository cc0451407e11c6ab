package com.indentlint.plugins.java.indentation;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationMemberDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.ArrayCreationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.InstanceOfExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;

/**
 * Routes every node to its handler. There are three entry points because the same node kind
 * means different things as a class member, as a statement and inside an expression; each
 * one is an exhaustive switch over {@link ConstructKind}.
 */
final class IndentationWalker {

    @FunctionalInterface
    interface Check {
        void apply(Node node, IndentLevel indent);
    }

    private static final Check SKIP = (node, indent) -> { };

    private final DeclarationHandler declarations;
    private final BlockHandler blocks;
    private final ControlFlowHandler controlFlow;
    private final TryHandler tries;
    private final SwitchHandler switches;
    private final ExpressionHandler expressions;
    private final LambdaHandler lambdas;
    private final MethodCallHandler methodCalls;
    private final ObjectCreationHandler objectCreations;
    private final ArrayHandler arrays;

    IndentationWalker(CheckSession session) {
        this.declarations = new DeclarationHandler(session, this);
        this.blocks = new BlockHandler(session, this);
        this.controlFlow = new ControlFlowHandler(session, this);
        this.tries = new TryHandler(session, this);
        this.switches = new SwitchHandler(session, this);
        this.expressions = new ExpressionHandler(session, this);
        this.lambdas = new LambdaHandler(session, this);
        this.methodCalls = new MethodCallHandler(session, this);
        this.objectCreations = new ObjectCreationHandler(session, this);
        this.arrays = new ArrayHandler(session, this);
    }

    void walk(CompilationUnit unit) {
        declarations.checkCompilationUnit(unit);
    }

    void checkMember(Node node, IndentLevel indent) {
        Check check = switch (ConstructKind.of(node)) {
            case FIELD -> (n, i) -> declarations.checkField((FieldDeclaration) n, i);
            case METHOD, CONSTRUCTOR -> (n, i) -> declarations.checkCallable((CallableDeclaration<?>) n, i);
            case COMPACT_CONSTRUCTOR ->
                    (n, i) -> declarations.checkCompactConstructor((CompactConstructorDeclaration) n, i);
            case TYPE -> (n, i) -> declarations.checkTypeDeclaration((TypeDeclaration<?>) n, i);
            case INITIALIZER -> (n, i) -> declarations.checkInitializer((InitializerDeclaration) n, i);
            case ENUM_CONSTANT -> (n, i) -> declarations.checkEnumConstant((EnumConstantDeclaration) n, i);
            case ANNOTATION_MEMBER ->
                    (n, i) -> declarations.checkAnnotationMember((AnnotationMemberDeclaration) n, i);
            case LOCAL_VARIABLE, EXPRESSION_STATEMENT, SIMPLE_STATEMENT, CONSTRUCTOR_CALL, YIELD, IF, FOR,
                 WHILE, DO, TRY, SWITCH, SYNCHRONIZED, LABELED, BLOCK, LOCAL_TYPE,
                 LAMBDA, METHOD_CALL, OBJECT_CREATION, ARRAY_CREATION, ARRAY_INITIALIZER,
                 ANNOTATION_ARRAY_INITIALIZER, INSTANCEOF, SWITCH_EXPRESSION, BINARY, ARRAY_ACCESS,
                 OTHER -> SKIP;
        };
        check.apply(node, indent);
    }

    void checkStatement(Node node, IndentLevel indent) {
        Check check = switch (ConstructKind.of(node)) {
            case LOCAL_VARIABLE -> (n, i) -> blocks.checkLocalVariable((ExpressionStmt) n, i);
            case EXPRESSION_STATEMENT, SIMPLE_STATEMENT -> (n, i) -> blocks.checkSimpleStatement((Statement) n, i);
            case CONSTRUCTOR_CALL ->
                    (n, i) -> blocks.checkConstructorCall((ExplicitConstructorInvocationStmt) n, i);
            case YIELD -> (n, i) -> blocks.checkYield((YieldStmt) n, i);
            case IF -> (n, i) -> controlFlow.checkIf((IfStmt) n, i);
            case FOR -> (n, i) -> controlFlow.checkFor((Statement) n, i);
            case WHILE -> (n, i) -> controlFlow.checkWhile((WhileStmt) n, i);
            case DO -> (n, i) -> controlFlow.checkDo((DoStmt) n, i);
            case TRY -> (n, i) -> tries.checkTry((TryStmt) n, i);
            case SWITCH -> (n, i) -> switches.checkSwitch((SwitchStmt) n, i);
            case SYNCHRONIZED -> (n, i) -> blocks.checkSynchronized((SynchronizedStmt) n, i);
            case LABELED -> (n, i) -> blocks.checkLabeled((LabeledStmt) n, i);
            case BLOCK -> (n, i) -> blocks.checkBlock((BlockStmt) n, i);
            case LOCAL_TYPE -> (n, i) -> declarations.checkTypeDeclaration(_localType(n), i);
            case FIELD, METHOD, CONSTRUCTOR, COMPACT_CONSTRUCTOR, TYPE, INITIALIZER, ENUM_CONSTANT,
                 ANNOTATION_MEMBER, LAMBDA, METHOD_CALL, OBJECT_CREATION, ARRAY_CREATION, ARRAY_INITIALIZER,
                 ANNOTATION_ARRAY_INITIALIZER, INSTANCEOF, SWITCH_EXPRESSION, BINARY, ARRAY_ACCESS,
                 OTHER -> SKIP;
        };
        check.apply(node, indent);
    }

    /**
     * Expression context: constructs with their own rules get their handler, everything else
     * is searched for nested constructs.
     */
    void checkExpression(Node node, IndentLevel indent) {
        Check check = switch (ConstructKind.of(node)) {
            case LAMBDA -> (n, i) -> lambdas.checkLambda((LambdaExpr) n, i);
            case METHOD_CALL -> (n, i) -> methodCalls.checkMethodCall((MethodCallExpr) n, i);
            case OBJECT_CREATION -> (n, i) -> objectCreations.checkObjectCreation((ObjectCreationExpr) n, i);
            case ARRAY_CREATION -> (n, i) -> arrays.checkArrayCreation((ArrayCreationExpr) n, i, false);
            case ARRAY_INITIALIZER -> (n, i) -> arrays.checkArrayInitializer((ArrayInitializerExpr) n, i);
            case ANNOTATION_ARRAY_INITIALIZER ->
                    (n, i) -> arrays.checkAnnotationArrayInitializer((ArrayInitializerExpr) n, i);
            case INSTANCEOF -> (n, i) -> expressions.checkInstanceOf((InstanceOfExpr) n, i);
            case SWITCH_EXPRESSION -> (n, i) -> switches.checkSwitchExpression((SwitchExpr) n, i);
            case BINARY -> (n, i) -> expressions.checkBinary((Expression) n, i);
            case ARRAY_ACCESS -> (n, i) -> expressions.checkArrayAccess((ArrayAccessExpr) n, i);
            case FIELD, METHOD, CONSTRUCTOR, COMPACT_CONSTRUCTOR, TYPE, INITIALIZER, ENUM_CONSTANT,
                 ANNOTATION_MEMBER, LOCAL_VARIABLE, EXPRESSION_STATEMENT, SIMPLE_STATEMENT, CONSTRUCTOR_CALL,
                 YIELD, IF, FOR, WHILE, DO, TRY, SWITCH, SYNCHRONIZED, LABELED, BLOCK, LOCAL_TYPE,
                 OTHER -> this::recurse;
        };
        check.apply(node, indent);
    }

    void recurse(Node node, IndentLevel indent) {
        for (Node child : Syntax.children(node)) {
            checkExpression(child, indent);
        }
    }

    private static TypeDeclaration<?> _localType(Node node) {
        if (node instanceof LocalClassDeclarationStmt) {
            return ((LocalClassDeclarationStmt) node).getClassDeclaration();
        }
        return ((LocalRecordDeclarationStmt) node).getRecordDeclaration();
    }

    // Handlers
    DeclarationHandler declarations() { return declarations; }
    BlockHandler blocks() { return blocks; }
    ExpressionHandler expressions() { return expressions; }
    LambdaHandler lambdas() { return lambdas; }
    ArrayHandler arrays() { return arrays; }
}
