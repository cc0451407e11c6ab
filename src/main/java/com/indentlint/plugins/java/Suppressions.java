package com.indentlint.plugins.java;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.SingleMemberAnnotationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import com.indentlint.api.error.LintError;
import com.indentlint.plugins.java.indentation.LineFix;

/**
 * Regions of a file where rules are switched off, either by {@code CHECKSTYLE:OFF} /
 * {@code CHECKSTYLE:ON} comments or by {@code @SuppressWarnings} on a declaration.
 */
public class Suppressions {
    private static final Pattern TOGGLE = Pattern.compile("CHECKSTYLE:(OFF|ON)(?::(\\w+))?");
    private static final String ALL_RULES = "*";

    private final Map<String, List<Region>> regions = new HashMap<>();

    private static final class Region {
        private final Position start;
        private final Position end;

        private Region(Position start, Position end) {
            this.start = start;
            this.end = end;
        }

        private boolean contains(Position position) {
            return !position.isBefore(start) && (end == null || position.isBefore(end));
        }
    }

    private Suppressions() {
    }

    public static Suppressions none() {
        return new Suppressions();
    }

    public static Suppressions from(CompilationUnit cu) {
        Suppressions suppressions = new Suppressions();
        suppressions._parseComments(cu);
        suppressions._parseAnnotations(cu);
        return suppressions;
    }

    private void _parseComments(CompilationUnit cu) {
        List<Comment> comments = new ArrayList<>(cu.getAllComments());
        comments.sort((a, b) -> _begin(a).compareTo(_begin(b)));

        Map<String, Position> open = new HashMap<>();
        for (Comment comment : comments) {
            Matcher matcher = TOGGLE.matcher(comment.getContent());
            while (matcher.find()) {
                String rule = matcher.group(2) == null ? ALL_RULES : _normalize(matcher.group(2));
                if (matcher.group(1).equals("OFF")) {
                    open.putIfAbsent(rule, _begin(comment));
                } else {
                    Position start = open.remove(rule);
                    if (start != null) {
                        _addRegion(rule, new Region(start, _begin(comment)));
                    }
                }
            }
        }
        // unclosed regions run to the end of the file
        open.forEach((rule, start) -> _addRegion(rule, new Region(start, null)));
    }

    private void _parseAnnotations(CompilationUnit cu) {
        List<Node> declarations = new ArrayList<>();
        declarations.addAll(cu.findAll(TypeDeclaration.class));
        declarations.addAll(cu.findAll(MethodDeclaration.class));
        declarations.addAll(cu.findAll(ConstructorDeclaration.class));
        declarations.addAll(cu.findAll(FieldDeclaration.class));
        declarations.addAll(cu.findAll(VariableDeclarationExpr.class));

        for (Node declaration : declarations) {
            if (!(declaration instanceof NodeWithAnnotations) || declaration.getRange().isEmpty()) {
                continue;
            }
            Optional<AnnotationExpr> annotation =
                    ((NodeWithAnnotations<?>) declaration).getAnnotationByName("SuppressWarnings");
            if (annotation.isEmpty()) {
                continue;
            }
            Region region = new Region(declaration.getRange().get().begin, _after(declaration.getRange().get().end));
            for (String value : _annotationValues(annotation.get())) {
                String rule = _suppressedRule(value);
                if (rule != null) {
                    _addRegion(rule, region);
                }
            }
        }
    }

    private static Set<String> _annotationValues(AnnotationExpr annotation) {
        Set<String> values = new HashSet<>();
        Expression value = null;
        if (annotation instanceof SingleMemberAnnotationExpr) {
            value = ((SingleMemberAnnotationExpr) annotation).getMemberValue();
        } else if (annotation instanceof NormalAnnotationExpr) {
            for (MemberValuePair pair : ((NormalAnnotationExpr) annotation).getPairs()) {
                if (pair.getNameAsString().equals("value")) {
                    value = pair.getValue();
                }
            }
        }
        if (value instanceof StringLiteralExpr) {
            values.add(((StringLiteralExpr) value).getValue());
        } else if (value instanceof ArrayInitializerExpr) {
            for (Expression element : ((ArrayInitializerExpr) value).getValues()) {
                if (element instanceof StringLiteralExpr) {
                    values.add(((StringLiteralExpr) element).getValue());
                }
            }
        }
        return values;
    }

    /**
     * {@code "all"} switches off every rule; {@code "checkstyle:name"} and plain
     * {@code "name"} switch off that rule.
     */
    private static String _suppressedRule(String value) {
        String normalized = _normalize(value.trim());
        if (normalized.equals("all")) {
            return ALL_RULES;
        }
        if (normalized.startsWith("checkstyle:")) {
            normalized = normalized.substring("checkstyle:".length());
        }
        return normalized.isEmpty() ? null : normalized;
    }

    private void _addRegion(String rule, Region region) {
        regions.computeIfAbsent(rule, k -> new ArrayList<>()).add(region);
    }

    public boolean isSuppressed(String ruleName, int line, int column) {
        Position position = new Position(line, column);
        return _matches(regions.get(_normalize(ruleName)), position)
                || _matches(regions.get(ALL_RULES), position);
    }

    private static boolean _matches(List<Region> candidates, Position position) {
        if (candidates == null) {
            return false;
        }
        for (Region region : candidates) {
            if (region.contains(position)) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return regions.isEmpty();
    }

    /**
     * Drops suppressed violations, and with them the fixes of lines that have no violation left.
     */
    public RuleResult filter(String ruleName, RuleResult result) {
        if (regions.isEmpty()) {
            return result;
        }
        List<LintError> kept = new ArrayList<>();
        Set<Integer> keptLines = new HashSet<>();
        for (LintError error : result.getErrors()) {
            if (!isSuppressed(ruleName, error.getLine(), error.getColumn())) {
                kept.add(error);
                keptLines.add(error.getLine());
            }
        }
        List<LineFix> fixes = new ArrayList<>();
        for (LineFix fix : result.getFixes()) {
            if (keptLines.contains(fix.line() + 1)) {
                fixes.add(fix);
            }
        }
        return new RuleResult(kept, fixes);
    }

    private static Position _begin(Comment comment) {
        return comment.getBegin().orElse(new Position(1, 1));
    }

    private static Position _after(Position end) {
        return new Position(end.line, end.column + 1);
    }

    private static String _normalize(String rule) {
        return rule.toLowerCase(Locale.ROOT);
    }
}
