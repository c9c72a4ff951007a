package com.templateformatter.lint;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.templateformatter.api.error.Severity;
import com.templateformatter.ast.ParseError;
import com.templateformatter.ast.ParseResult;
import com.templateformatter.format.FormatIgnore;
import com.templateformatter.parser.TemplateParser;
import com.templateformatter.util.LoggerUtil;

/**
 * Runs a set of rules over one template.
 *
 * <p>The source is parsed once with whitespace tracking, so the returned parse result can be
 * handed straight to the autofixer. Parse errors are reported as {@value #PARSER_RULE}
 * diagnostics and suppress the remaining rules. Diagnostics on a line preceded by a
 * {@code <%# herb:disable ... %>} comment are dropped, see {@link DisableDirectives}.
 */
public class Linter {
    private static final Logger logger = LoggerUtil.getLogger(Linter.class);

    public static final String PARSER_RULE = "parser-no-errors";

    private final List<Rule> rules;

    public Linter(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public LintResult lint(Path filePath, String source) {
        ParseResult parseResult = TemplateParser.parse(source, true);
        return lint(filePath, parseResult);
    }

    public LintResult lint(Path filePath, ParseResult parseResult) {
        List<Diagnostic> diagnostics = new ArrayList<>();

        if (parseResult.hasErrors()) {
            for (ParseError error : parseResult.getErrors()) {
                diagnostics.add(new Diagnostic(PARSER_RULE, error.getMessage(), Severity.FATAL,
                        error.getLocation(), null));
            }
            return new LintResult(parseResult, diagnostics, false);
        }

        if (FormatIgnore.hasLinterIgnoreDirective(parseResult.getValue())) {
            logger.fine(() -> "Skipping " + _describe(filePath) + ": " + FormatIgnore.LINTER_IGNORE + " directive");
            return new LintResult(parseResult, diagnostics, true);
        }

        LintContext context = new LintContext(filePath, parseResult.getSource());
        for (Rule rule : rules) {
            try {
                diagnostics.addAll(rule.check(parseResult, context));
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Rule " + rule.getName() + " failed on " + _describe(filePath), e);
            }
        }

        DisableDirectives directives = DisableDirectives.collect(parseResult.getValue());
        if (!directives.isEmpty()) {
            int before = diagnostics.size();
            diagnostics.removeIf(diagnostic -> diagnostic.getLocation() != null && directives.isDisabled(
                    diagnostic.getLocation().getStart().getLine(), diagnostic.getRuleName()));
            int suppressed = before - diagnostics.size();
            logger.fine(() -> _describe(filePath) + ": " + suppressed + " diagnostics disabled by directives");
        }

        logger.fine(() -> _describe(filePath) + ": " + diagnostics.size() + " diagnostics");
        return new LintResult(parseResult, diagnostics, false);
    }

    private static String _describe(Path filePath) {
        return filePath == null ? "<input>" : filePath.toString();
    }
}
