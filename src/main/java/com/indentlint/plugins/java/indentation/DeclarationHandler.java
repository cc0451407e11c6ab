package com.indentlint.plugins.java.indentation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.github.javaparser.JavaToken;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.AnnotationMemberDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ArrayCreationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SingleMemberAnnotationExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.ReferenceType;

/**
 * Compilation unit, type declarations, class bodies and their members.
 */
final class DeclarationHandler extends ConstructHandler {

    DeclarationHandler(CheckSession session, IndentationWalker walker) {
        super(session, walker);
    }

    void checkCompilationUnit(CompilationUnit unit) {
        IndentLevel root = IndentLevel.of(0);
        unit.getPackageDeclaration().ifPresent(pkg -> checkPackage(pkg, root));
        for (ImportDeclaration importDeclaration : unit.getImports()) {
            checkImport(importDeclaration, root);
        }
        for (TypeDeclaration<?> type : unit.getTypes()) {
            checkTypeDeclaration(type, root);
        }
    }

    void checkPackage(PackageDeclaration pkg, IndentLevel indent) {
        JavaToken keyword = Syntax.findAtDepth(Syntax.firstToken(pkg), pkg, "package")
                .orElse(Syntax.firstToken(pkg));
        checkStart(keyword, "package def", indent);
        _checkNameLines(pkg.getName(), line(keyword), indent.withOffset(wrap()));
    }

    void checkImport(ImportDeclaration importDeclaration, IndentLevel indent) {
        checkStart(importDeclaration, "import", indent);
        _checkNameLines(importDeclaration.getName(), line(importDeclaration), indent.withOffset(wrap()));
    }

    /**
     * The first token of every continuation line of a qualified name.
     */
    private void _checkNameLines(Node name, int baseLine, IndentLevel expected) {
        Set<Integer> checkedLines = new HashSet<>();
        JavaToken last = Syntax.lastToken(name);
        Optional<JavaToken> current = Optional.of(Syntax.firstToken(name));
        while (current.isPresent()) {
            JavaToken token = current.get();
            if (Syntax.isSignificant(token)) {
                int tokenLine = line(token);
                if (tokenLine > baseLine && checkedLines.add(tokenLine)) {
                    checkChildContinuation(token, baseLine, "package def", expected);
                }
            }
            if (token == last) {
                break;
            }
            current = token.getNextToken();
        }
    }

    void checkTypeDeclaration(TypeDeclaration<?> type, IndentLevel indent) {
        String label = _typeLabel(type);
        checkStart(type, label, indent);

        int declLine = line(type);
        IndentLevel wrapped = indent.withOffset(wrap());
        List<Modifier> modifiers = _sorted(type.getModifiers());

        if (!modifiers.isEmpty()) {
            Modifier first = modifiers.get(0);
            if (line(first) != declLine && startsLine(first)) {
                int actual = lineStart(first);
                if (!exact(actual, indent)) {
                    error(first, label, actual, indent);
                }
            }
        }

        boolean firstTokenWrong = startsLine(type) && !exact(lineStart(declLine), indent);
        boolean hasKeywordModifier = !modifiers.isEmpty();
        boolean annotationType = type instanceof AnnotationDeclaration;

        checkModifierAnnotations(type, type.getAnnotations(), modifiers, indent, true);

        JavaToken nameToken = Syntax.firstToken(type.getName());
        Optional<JavaToken> keyword = Syntax.previousSignificant(nameToken);

        if (annotationType) {
            Optional<JavaToken> at = keyword.flatMap(Syntax::previousSignificant);
            if (at.isPresent() && line(at.get()) > declLine && startsLine(at.get())) {
                int actual = lineStart(at.get());
                IndentLevel expected = firstTokenWrong || !hasKeywordModifier ? indent : wrapped;
                if (!exact(actual, expected)) {
                    error(at.get(), "@interface", actual, expected);
                }
            }
        } else if (hasKeywordModifier && keyword.isPresent()) {
            if (line(keyword.get()) > declLine && startsLine(keyword.get())) {
                int actual = lineStart(keyword.get());
                IndentLevel expected = firstTokenWrong ? indent : wrapped;
                if (!lenient(actual, expected)) {
                    error(keyword.get(), keyword.get().getText(), actual, expected);
                }
            }
        }

        if ((hasKeywordModifier || annotationType) && line(nameToken) > declLine && startsLine(nameToken)) {
            int actual = lineStart(nameToken);
            boolean baseExpected = firstTokenWrong || annotationType;
            IndentLevel expected = baseExpected ? indent : wrapped;
            boolean acceptable = baseExpected ? exact(actual, expected) : lenient(actual, expected);
            if (!acceptable) {
                childError(nameToken, label, actual, expected);
            }
        }

        IndentLevel clauseExpected = firstTokenWrong ? indent : wrapped;
        if (type instanceof ClassOrInterfaceDeclaration) {
            ClassOrInterfaceDeclaration declaration = (ClassOrInterfaceDeclaration) type;
            if (!firstTokenWrong || strict()) {
                _checkPermits(declaration.getPermittedTypes(), declLine, clauseExpected);
                if (!declaration.isInterface() && !declaration.getExtendedTypes().isEmpty()) {
                    Syntax.tokenBefore(declaration.getExtendedTypes().get(0)).ifPresent(
                            extendsToken -> checkContinuation(extendsToken, declLine, "extends", clauseExpected));
                }
            }
            _checkImplements(declaration.getImplementedTypes(), declLine, clauseExpected);
        } else if (type instanceof EnumDeclaration) {
            _checkImplements(((EnumDeclaration) type).getImplementedTypes(), declLine, clauseExpected);
        } else if (type instanceof RecordDeclaration) {
            RecordDeclaration record = (RecordDeclaration) type;
            _checkRecordHeader(record, declLine, indent, clauseExpected);
            _checkImplements(record.getImplementedTypes(), declLine, clauseExpected);
        }

        Optional<JavaToken> lbrace = Syntax.findAtDepth(nameToken, type, "{");
        if (lbrace.isPresent()) {
            List<Node> members = new ArrayList<>();
            if (type instanceof EnumDeclaration) {
                members.addAll(((EnumDeclaration) type).getEntries());
            }
            members.addAll(type.getMembers());
            checkClassBody(lbrace.get(), Syntax.lastToken(type), members, indent);
        }
    }

    private void _checkPermits(NodeList<ClassOrInterfaceType> permitted, int declLine, IndentLevel expected) {
        if (permitted.isEmpty()) {
            return;
        }
        Optional<JavaToken> permits = Syntax.tokenBefore(permitted.get(0));
        if (permits.isEmpty()) {
            return;
        }
        checkContinuation(permits.get(), declLine, "permits", expected);
        int permitsLine = line(permits.get());
        for (ClassOrInterfaceType permittedType : permitted) {
            checkContinuation(permittedType, permitsLine, permittedType.asString(), expected);
        }
    }

    private void _checkImplements(NodeList<ClassOrInterfaceType> implemented, int declLine, IndentLevel expected) {
        if (implemented.isEmpty()) {
            return;
        }
        Syntax.tokenBefore(implemented.get(0)).ifPresent(
                keyword -> checkContinuation(keyword, declLine, "implements", expected));
        for (ClassOrInterfaceType implementedType : implemented) {
            checkContinuation(implementedType, declLine, "implements", expected);
        }
    }

    private void _checkRecordHeader(RecordDeclaration record, int declLine, IndentLevel indent, IndentLevel expected) {
        Optional<JavaToken> afterName = Syntax.nextSignificant(Syntax.lastToken(record.getName()));
        Optional<JavaToken> lparen = afterName.flatMap(token -> Syntax.findAtDepth(token, record, "("));
        if (lparen.isEmpty()) {
            return;
        }
        Optional<JavaToken> rparen = record.getParameters().isEmpty()
                ? Syntax.nextSignificant(lparen.get())
                : Syntax.tokenAfter(record.getParameters().get(record.getParameters().size() - 1));

        if (rparen.isPresent() && line(rparen.get()) > declLine && startsLine(rparen.get())) {
            int actual = column(rparen.get());
            if (!lenient(actual, indent)) {
                error(rparen.get(), "rparen", actual, indent);
            }
        }
        if (line(lparen.get()) > declLine && startsLine(lparen.get())) {
            int actual = column(lparen.get());
            if (!lenient(actual, expected)) {
                error(lparen.get(), "lparen", actual, expected);
            }
        }
    }

    private static String _typeLabel(TypeDeclaration<?> type) {
        if (type instanceof ClassOrInterfaceDeclaration) {
            return ((ClassOrInterfaceDeclaration) type).isInterface() ? "interface def" : "class def";
        } else if (type instanceof EnumDeclaration) {
            return "enum def";
        } else if (type instanceof AnnotationDeclaration) {
            return "annotation def";
        } else if (type instanceof RecordDeclaration) {
            return "record def";
        }
        return "type def";
    }

    /**
     * Braces of a class body at the owner's indent, members one level deeper.
     */
    void checkClassBody(JavaToken lbrace, JavaToken rbrace, List<? extends Node> members, IndentLevel indent) {
        checkBraces(lbrace, rbrace, indent, false);
        IndentLevel memberIndent = indent.withOffset(basic());
        List<Node> ordered = new ArrayList<>(members);
        ordered.sort(Comparator.comparingInt((Node n) -> Syntax.begin(n).line)
                .thenComparingInt(n -> Syntax.begin(n).column));
        for (Node member : ordered) {
            walker.checkMember(member, memberIndent);
        }
    }

    void checkField(FieldDeclaration field, IndentLevel indent) {
        checkStart(field, "member def", indent);

        List<Modifier> modifiers = _sorted(field.getModifiers());
        checkModifierAnnotations(field, field.getAnnotations(), modifiers, indent, false);

        int declLine = line(field);
        IndentLevel wrapped = indent.withOffset(wrap());
        boolean modifierOnDeclLine = modifiers.stream().anyMatch(modifier -> line(modifier) == declLine);
        if (modifierOnDeclLine) {
            checkContinuation(field.getElementType(), declLine, "member def", wrapped);
        }

        _checkDimensions(field, declLine, wrapped);
        checkVariableContinuation(field, field.getVariables(), indent);
    }

    /**
     * Array brackets of the declared type or of a declarator name on continuation lines.
     */
    private void _checkDimensions(FieldDeclaration field, int declLine, IndentLevel wrapped) {
        List<Expression> initializers = new ArrayList<>();
        for (VariableDeclarator variable : field.getVariables()) {
            variable.getInitializer().ifPresent(initializers::add);
        }
        JavaToken last = Syntax.lastToken(field);
        Optional<JavaToken> current = Optional.of(Syntax.firstToken(field.getElementType()));
        while (current.isPresent()) {
            JavaToken token = current.get();
            if (_insideAny(token, initializers)) {
                current = Syntax.nextSignificant(Syntax.lastToken(_containing(token, initializers)));
                continue;
            }
            String text = token.getText();
            if (text.equals("[") || text.equals("]")) {
                checkContinuation(token, declLine, "member def", wrapped);
            }
            if (token == last) {
                break;
            }
            current = Syntax.nextSignificant(token);
        }
    }

    private boolean _insideAny(JavaToken token, List<Expression> nodes) {
        return _containing(token, nodes) != null;
    }

    private Expression _containing(JavaToken token, List<Expression> nodes) {
        if (token.getRange().isEmpty()) {
            return null;
        }
        for (Expression node : nodes) {
            if (node.getRange().isPresent() && node.getRange().get().contains(token.getRange().get())) {
                return node;
            }
        }
        return null;
    }

    void checkCallable(CallableDeclaration<?> callable, IndentLevel indent) {
        String label = callable instanceof ConstructorDeclaration ? "ctor def" : "method def";
        checkStart(callable, label, indent);

        int methodLine = line(callable);
        IndentLevel wrapped = indent.withOffset(wrap());
        List<Modifier> modifiers = _sorted(callable.getModifiers());

        checkModifierAnnotations(callable, callable.getAnnotations(), modifiers, indent, false);

        if (!modifiers.isEmpty()) {
            int keywordLine = line(modifiers.get(0));
            for (Modifier modifier : modifiers.subList(1, modifiers.size())) {
                checkContinuation(modifier, keywordLine, modifier.getKeyword().asString(), wrapped);
            }
            if (callable instanceof MethodDeclaration) {
                MethodDeclaration method = (MethodDeclaration) callable;
                checkContinuation(method.getType(), keywordLine, method.getType().asString(), wrapped);
            }
            checkContinuation(callable.getName(), keywordLine, callable.getNameAsString(), wrapped);
        }

        List<Node> parameters = new ArrayList<>();
        callable.getReceiverParameter().ifPresent(parameters::add);
        parameters.addAll(callable.getParameters());
        for (Node parameter : parameters) {
            checkChildContinuation(parameter, methodLine, label, wrapped);
        }

        _closingParen(callable).ifPresent(rparen -> {
            if (line(rparen) > methodLine && startsLine(rparen)) {
                int actual = column(rparen);
                if (!exact(actual, indent)) {
                    error(rparen, "rparen", actual, indent);
                }
            }
        });

        NodeList<ReferenceType> thrown = callable.getThrownExceptions();
        if (!thrown.isEmpty()) {
            IndentLevel throwsExpected = indent.withOffset(session.config().throwsIndent());
            Optional<JavaToken> throwsKeyword = Syntax.tokenBefore(thrown.get(0));
            int throwsLine = throwsKeyword.map(this::line).orElse(methodLine);
            throwsKeyword.ifPresent(keyword ->
                    checkContinuation(keyword, methodLine, "throws", throwsExpected));
            for (ReferenceType exception : thrown) {
                checkChildContinuation(exception, throwsLine, "throws", throwsExpected);
            }
        }

        if (callable instanceof MethodDeclaration) {
            ((MethodDeclaration) callable).getBody().ifPresent(body -> walker.blocks().checkBlock(body, indent));
        } else if (callable instanceof ConstructorDeclaration) {
            walker.blocks().checkConstructorBody(((ConstructorDeclaration) callable).getBody(), indent);
        }
    }

    private Optional<JavaToken> _closingParen(CallableDeclaration<?> callable) {
        NodeList<Parameter> parameters = callable.getParameters();
        if (!parameters.isEmpty()) {
            return Syntax.tokenAfter(parameters.get(parameters.size() - 1));
        }
        if (callable.getReceiverParameter().isPresent()) {
            return Syntax.tokenAfter(callable.getReceiverParameter().get());
        }
        return Syntax.tokenAfter(callable.getName()).flatMap(Syntax::nextSignificant);
    }

    void checkCompactConstructor(CompactConstructorDeclaration constructor, IndentLevel indent) {
        checkStart(constructor, "ctor def", indent);
        walker.blocks().checkBlock(constructor.getBody(), indent);
    }

    void checkInitializer(InitializerDeclaration initializer, IndentLevel indent) {
        if (initializer.isStatic()) {
            checkStart(initializer, "static init", indent);
            walker.blocks().checkBlock(initializer.getBody(), indent);
            return;
        }
        JavaToken lcurly = Syntax.firstToken(initializer.getBody());
        JavaToken rcurly = Syntax.lastToken(initializer.getBody());
        _checkBraceExact(lcurly, "block lcurly", indent);
        _checkBraceExact(rcurly, "block rcurly", indent);
        IndentLevel childIndent = indent.withOffset(basic());
        initializer.getBody().getStatements().forEach(statement -> walker.checkStatement(statement, childIndent));
    }

    private void _checkBraceExact(JavaToken brace, String element, IndentLevel expected) {
        if (startsLine(brace)) {
            int actual = column(brace);
            if (!exact(actual, expected)) {
                error(brace, element, actual, expected);
            }
        }
    }

    void checkEnumConstant(EnumConstantDeclaration constant, IndentLevel indent) {
        checkStart(constant, "enum constant", indent);
        if (!constant.getClassBody().isEmpty()) {
            Syntax.findAtDepth(Syntax.firstToken(constant.getName()), constant, "{").ifPresent(
                    lbrace -> checkClassBody(lbrace, Syntax.lastToken(constant), constant.getClassBody(), indent));
        }
    }

    void checkAnnotationMember(AnnotationMemberDeclaration member, IndentLevel indent) {
        checkStart(member, "annotation field def", indent);
        member.getDefaultValue()
                .filter(value -> value instanceof ArrayInitializerExpr)
                .ifPresent(value -> walker.arrays().checkAnnotationArrayInitializer((ArrayInitializerExpr) value, indent));
    }

    /**
     * Annotations of a declaration. Type declarations check each annotation line exactly;
     * members only get their argument lists checked.
     */
    void checkModifierAnnotations(Node declaration, NodeList<AnnotationExpr> annotations,
                                  List<Modifier> modifiers, IndentLevel indent, boolean strictAnnotations) {
        if (annotations.isEmpty()) {
            return;
        }
        int modifiersLine = Integer.MAX_VALUE;
        for (AnnotationExpr annotation : annotations) {
            modifiersLine = Math.min(modifiersLine, line(annotation));
        }
        for (Modifier modifier : modifiers) {
            modifiersLine = Math.min(modifiersLine, line(modifier));
        }
        IndentLevel wrapped = indent.withOffset(wrap());

        for (AnnotationExpr annotation : annotations) {
            int atLine = line(annotation);
            if (strictAnnotations && atLine > modifiersLine && startsLine(annotation)) {
                int actual = lineStart(atLine);
                if (!exact(actual, indent)) {
                    error(annotation, "annotation def", actual, indent);
                }
            }

            if (annotation instanceof SingleMemberAnnotationExpr || annotation instanceof NormalAnnotationExpr) {
                Optional<JavaToken> lparen = Syntax.tokenAfter(annotation.getName());
                JavaToken rparen = Syntax.lastToken(annotation);
                if (lparen.isPresent() && line(lparen.get()) > atLine && startsLine(lparen.get())) {
                    int actual = column(lparen.get());
                    if (!lenient(actual, wrapped)) {
                        error(lparen.get(), "(", actual, wrapped);
                    }
                }
                if (line(rparen) > atLine && startsLine(rparen)) {
                    int actual = column(rparen);
                    IndentLevel expected = IndentLevel.of(column(annotation));
                    if (!exact(actual, expected)) {
                        error(rparen, ")", actual, expected);
                    }
                }
            }

            if (annotation instanceof SingleMemberAnnotationExpr) {
                Expression value = ((SingleMemberAnnotationExpr) annotation).getMemberValue();
                if (value instanceof ArrayInitializerExpr) {
                    walker.arrays().checkAnnotationArrayInitializer((ArrayInitializerExpr) value, indent);
                }
            } else if (annotation instanceof NormalAnnotationExpr) {
                for (MemberValuePair pair : ((NormalAnnotationExpr) annotation).getPairs()) {
                    if (pair.getValue() instanceof ArrayInitializerExpr) {
                        walker.arrays().checkAnnotationArrayInitializer(
                                (ArrayInitializerExpr) pair.getValue(), IndentLevel.of(lineStart(pair)));
                    }
                }
            }
        }
    }

    /**
     * Initializers of a field or local variable declaration, wrapped or not.
     */
    void checkVariableContinuation(Node declaration, NodeList<VariableDeclarator> variables, IndentLevel indent) {
        int declLine = line(declaration);
        IndentLevel wrapped = indent.withOffset(wrap());

        for (VariableDeclarator variable : variables) {
            if (variable.getInitializer().isEmpty()) {
                continue;
            }
            Expression value = variable.getInitializer().get();
            int valueLine = line(value);
            boolean lineWrapped = valueLine > declLine && startsLine(value);

            Optional<JavaToken> assign = Syntax.tokenBefore(value);
            if (assign.isPresent() && assign.get().getText().equals("=")
                    && line(assign.get()) > declLine && startsLine(assign.get())) {
                int actual = lineStart(assign.get());
                if (!lenient(actual, wrapped)) {
                    error(assign.get(), "assign", actual, wrapped);
                }
                lineWrapped = true;
            }

            Optional<TextBlockLiteralExpr> textBlock = _textBlockOf(value);
            if (textBlock.isPresent()) {
                walker.expressions().checkTextBlockDelimiters(textBlock.get(), declLine, wrapped);
                continue;
            }

            if (lineWrapped) {
                int actual = lineStart(valueLine);
                boolean arrayInit = value instanceof ArrayInitializerExpr;
                IndentLevel acceptable = arrayInit ? wrapped.combine(indent) : wrapped;
                if (!lenient(actual, acceptable)) {
                    error(value, _initializerLabel(value), actual, wrapped);
                }
                walker.checkExpression(value, acceptable);
            } else if (value instanceof ArrayCreationExpr) {
                walker.arrays().checkArrayCreation((ArrayCreationExpr) value, indent, true);
            } else {
                walker.checkExpression(value, indent);
            }
        }
    }

    private static Optional<TextBlockLiteralExpr> _textBlockOf(Expression value) {
        if (value instanceof TextBlockLiteralExpr) {
            return Optional.of((TextBlockLiteralExpr) value);
        }
        if (value instanceof EnclosedExpr && ((EnclosedExpr) value).getInner() instanceof TextBlockLiteralExpr) {
            return Optional.of((TextBlockLiteralExpr) ((EnclosedExpr) value).getInner());
        }
        return Optional.empty();
    }

    private static String _initializerLabel(Expression value) {
        if (value instanceof MethodCallExpr) {
            return "method call";
        } else if (value instanceof ObjectCreationExpr || value instanceof ArrayCreationExpr) {
            return "new";
        } else if (value instanceof ArrayInitializerExpr) {
            return "array initialization";
        }
        return "assign";
    }

    private List<Modifier> _sorted(NodeList<Modifier> modifiers) {
        List<Modifier> sorted = new ArrayList<>(modifiers);
        sorted.sort(Comparator.comparingInt((Modifier m) -> Syntax.begin(m).line)
                .thenComparingInt(m -> Syntax.begin(m).column));
        return sorted;
    }
}
