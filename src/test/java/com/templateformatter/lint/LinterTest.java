package com.templateformatter.lint;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.templateformatter.api.error.FormatterError;
import com.templateformatter.api.error.Severity;
import com.templateformatter.ast.ParseResult;

class LinterTest {
    private static final Path FILE = Paths.get("index.html.erb");

    private final Linter linter = new Linter(RuleRegistry.withBuiltIns().createAll());

    @Test
    void testCleanTemplateHasNoDiagnostics() {
        LintResult result = linter.lint(FILE, "<div class=\"a\">\n  <br>\n</div>\n");

        assertThat(result.getDiagnostics()).isEmpty();
        assertThat(result.isIgnored()).isFalse();
        assertThat(result.hasParseErrors()).isFalse();
    }

    @Test
    void testDiagnosticsFollowRuleOrder() {
        LintResult result = linter.lint(FILE, "<P class='x'></P> \n");

        assertThat(result.getDiagnostics()).extracting(Diagnostic::getRuleName).containsExactly(
                "html-tag-name-lowercase", "html-attribute-double-quotes", "erb-no-trailing-whitespace");
        assertThat(result.countFixable()).isEqualTo(3);
    }

    @Test
    void testParseErrorsStopRules() {
        LintResult result = linter.lint(FILE, "<DIV>");

        assertThat(result.hasParseErrors()).isTrue();
        assertThat(result.getDiagnostics()).hasSize(1);
        Diagnostic diagnostic = result.getDiagnostics().get(0);
        assertThat(diagnostic.getRuleName()).isEqualTo(Linter.PARSER_RULE);
        assertThat(diagnostic.getSeverity()).isEqualTo(Severity.FATAL);
        assertThat(diagnostic.isFixable()).isFalse();
    }

    @Test
    void testIgnoreDirectiveSkipsRules() {
        LintResult result = linter.lint(FILE, "<%# herb:linter ignore %><DIV></DIV>");

        assertThat(result.isIgnored()).isTrue();
        assertThat(result.getDiagnostics()).isEmpty();
    }

    @Test
    void testDisableCommentSilencesNamedRuleOnNextLine() {
        LintResult result = linter.lint(FILE,
                "<%# herb:disable html-tag-name-lowercase, html-attribute-double-quotes %>\n"
                        + "<DIV class='x'></DIV>\n<B>x</B>\n");

        assertThat(result.getDiagnostics()).hasSize(1);
        Diagnostic diagnostic = result.getDiagnostics().get(0);
        assertThat(diagnostic.getRuleName()).isEqualTo("html-tag-name-lowercase");
        assertThat(diagnostic.getLocation().getStart().getLine()).isEqualTo(3);
    }

    @Test
    void testDisableAllSilencesEveryRuleOnNextLineOnly() {
        LintResult result = linter.lint(FILE, "<%# herb:disable all %>\n<DIV class='x'></DIV> \n<B>x</B>\n");

        assertThat(result.getDiagnostics()).extracting(Diagnostic::getRuleName)
                .containsExactly("html-tag-name-lowercase");
        assertThat(result.getDiagnostics().get(0).getLocation().getStart().getLine()).isEqualTo(3);
    }

    @Test
    void testDisableCommentForOtherRuleKeepsDiagnostics() {
        LintResult result = linter.lint(FILE, "<%# herb:disable erb-no-empty-tags %>\n<DIV></DIV>\n");

        assertThat(result.getDiagnostics()).extracting(Diagnostic::getRuleName)
                .containsExactly("html-tag-name-lowercase");
    }

    @Test
    void testFailingRuleDoesNotStopOthers() {
        Rule failing = new VisitorRule() {
            @Override
            public String getName() {
                return "failing";
            }

            @Override
            public String getDescription() {
                return "Always throws";
            }

            @Override
            public List<Diagnostic> check(ParseResult parseResult, LintContext context) {
                throw new IllegalStateException("broken rule");
            }
        };
        Linter mixed = new Linter(List.of(failing, RuleRegistry.withBuiltIns().create("html-tag-name-lowercase")));

        LintResult result = mixed.lint(FILE, "<B>x</B>");

        assertThat(result.getDiagnostics()).extracting(Diagnostic::getRuleName)
                .containsExactly("html-tag-name-lowercase");
    }

    @Test
    void testDiagnosticConvertsToFormatterError() {
        Diagnostic diagnostic = linter.lint(FILE, "<p>\n  <SPAN></SPAN>\n</p>").getDiagnostics().get(0);

        FormatterError error = diagnostic.toFormatterError();

        assertThat(error.getLine()).isEqualTo(2);
        assertThat(error.getColumn()).isEqualTo(2);
        assertThat(error.getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(error.getRuleName()).isEqualTo("html-tag-name-lowercase");
    }
}
