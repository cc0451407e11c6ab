package com.indentlint.plugins.java;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.indentlint.api.AppliedFix;
import com.indentlint.api.CheckResult;
import com.indentlint.api.CheckerPlugin;
import com.indentlint.api.error.LintError;
import com.indentlint.api.error.Severity;
import com.indentlint.config.ConfigurationLoader;
import com.indentlint.config.LintConfig;
import com.indentlint.plugins.java.indentation.IndentationRule;
import com.indentlint.plugins.java.indentation.LineFix;
import com.indentlint.util.LoggerUtil;

/**
 * Java plugin: parses with JavaParser, runs the enabled rules and drives the fix loop.
 * Parsed trees are cached per path and content.
 */
public class JavaLintPlugin implements CheckerPlugin, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(JavaLintPlugin.class);
    private static final int CACHE_SIZE = 100;

    private LintConfig config;
    private List<Rule> rules = new ArrayList<>();
    private boolean commentSuppression;
    private int maxFixPasses;

    private final Map<String, CachedUnit> astCache = new LinkedHashMap<String, CachedUnit>(CACHE_SIZE, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, CachedUnit> eldest) {
            return size() > CACHE_SIZE;
        }
    };

    private final ReentrantLock cacheLock = new ReentrantLock();

    @Override
    public void initialize(LintConfig config) {
        this.config = config;
        this.commentSuppression = config.getGeneralConfig("commentSuppression", true);
        this.maxFixPasses = config.getGeneralConfig("maxFixPasses", 10);

        rules = new ArrayList<>();
        if (config.isRuleEnabled(ConfigurationLoader.INDENTATION_RULE)) {
            rules.add(new IndentationRule(config));
        }
        logger.fine("Java plugin initialized with " + rules.size() + " rules");
    }

    public static ParseResult<CompilationUnit> parse(String sourceCode) {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_21);
        return new JavaParser(configuration).parse(sourceCode);
    }

    @Override
    public CheckResult check(Path filePath, String sourceCode) {
        String cacheKey = filePath.toString() + ":" + sourceCode.hashCode();
        CompilationUnit cu = null;

        // get() reorders an access-ordered map, so reads take the lock too
        cacheLock.lock();
        try {
            CachedUnit cached = astCache.get(cacheKey);
            if (cached != null && cached.source.equals(sourceCode)) {
                cu = cached.unit;
            }
        } finally {
            cacheLock.unlock();
        }

        if (cu == null) {
            ParseResult<CompilationUnit> parseResult = parse(sourceCode);
            if (!parseResult.isSuccessful() || parseResult.getResult().isEmpty()) {
                return handleParseError(filePath, parseResult, sourceCode);
            }
            cu = parseResult.getResult().get();

            cacheLock.lock();
            try {
                astCache.put(cacheKey, new CachedUnit(sourceCode, cu));
            } finally {
                cacheLock.unlock();
            }
        }

        List<LintError> errors = new ArrayList<>();
        for (RuleResult result : _runRules(cu, sourceCode)) {
            errors.addAll(result.getErrors());
        }

        boolean successful = errors.stream()
                .noneMatch(e -> e.getSeverity() == Severity.FATAL || e.getSeverity() == Severity.ERROR);

        return CheckResult.builder()
                .successful(successful)
                .fixedCode(sourceCode)
                .errors(errors)
                .build();
    }

    /**
     * Applies fixes, re-parses and re-checks until nothing changes or the pass limit is hit,
     * then reports what is left on the final text.
     */
    @Override
    public CheckResult fix(Path filePath, String sourceCode) {
        String current = sourceCode;
        List<AppliedFix> applied = new ArrayList<>();

        for (int pass = 0; pass < maxFixPasses; pass++) {
            ParseResult<CompilationUnit> parseResult = parse(current);
            if (!parseResult.isSuccessful() || parseResult.getResult().isEmpty()) {
                return handleParseError(filePath, parseResult, current);
            }
            CompilationUnit cu = parseResult.getResult().get();

            List<LineFix> passFixes = new ArrayList<>();
            List<String> passRuleNames = new ArrayList<>();
            List<RuleResult> results = _runRules(cu, current);
            for (int i = 0; i < results.size(); i++) {
                for (LineFix fix : results.get(i).getFixes()) {
                    passFixes.add(fix);
                    passRuleNames.add(rules.get(i).getName());
                }
            }

            List<LineFix> selected = FixApplier.selectNonOverlapping(passFixes);
            if (selected.isEmpty()) {
                break;
            }
            for (LineFix fix : selected) {
                String ruleName = passRuleNames.get(_indexOfIdentity(passFixes, fix));
                applied.add(new AppliedFix(ruleName, fix.line() + 1, fix.toString()));
            }
            current = FixApplier.apply(current, selected);
            logger.fine("Fix pass " + (pass + 1) + " on " + filePath + " applied " + selected.size() + " fixes");
        }

        CheckResult remaining = check(filePath, current);
        return CheckResult.builder()
                .successful(remaining.isSuccessful())
                .fixedCode(current)
                .errors(remaining.getErrors())
                .appliedFixes(applied)
                .build();
    }

    private static int _indexOfIdentity(List<LineFix> fixes, LineFix fix) {
        for (int i = 0; i < fixes.size(); i++) {
            if (fixes.get(i) == fix) {
                return i;
            }
        }
        return -1;
    }

    private List<RuleResult> _runRules(CompilationUnit cu, String sourceCode) {
        Suppressions suppressions = commentSuppression ? Suppressions.from(cu) : Suppressions.none();
        List<RuleResult> results = new ArrayList<>();
        for (Rule rule : rules) {
            results.add(suppressions.filter(rule.getName(), rule.check(cu, sourceCode)));
        }
        return results;
    }

    private CheckResult handleParseError(Path filePath, ParseResult<CompilationUnit> parseResult, String sourceCode) {
        String message = "Unknown error";
        int line = 1;
        int column = 1;
        if (!parseResult.getProblems().isEmpty()) {
            Problem problem = parseResult.getProblems().get(0);
            message = problem.getMessage();
            if (problem.getLocation().isPresent() && problem.getLocation().get().getBegin().getRange().isPresent()) {
                line = problem.getLocation().get().getBegin().getRange().get().begin.line;
                column = problem.getLocation().get().getBegin().getRange().get().begin.column;
            }
        }
        logger.warning("Failed to parse " + filePath + ": " + message);

        LintError error = new LintError(Severity.FATAL, "Failed to parse Java source code: " + message, line, column);
        return CheckResult.builder()
                .successful(false)
                .fixedCode(sourceCode)
                .addError(error)
                .build();
    }

    public List<Rule> getRules() {
        return List.copyOf(rules);
    }

    public LintConfig getConfig() {
        return config;
    }

    /**
     * Cleans up resources when the plugin is no longer needed.
     */
    @Override
    public void close() {
        cacheLock.lock();
        try {
            astCache.clear();
        } finally {
            cacheLock.unlock();
        }
    }

    /**
     * Cached tree together with the text it was parsed from; the hash in the key is not trusted alone.
     */
    private static final class CachedUnit {
        private final String source;
        private final CompilationUnit unit;

        CachedUnit(String source, CompilationUnit unit) {
            this.source = source;
            this.unit = unit;
        }
    }
}
