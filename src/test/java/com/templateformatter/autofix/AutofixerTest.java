package com.templateformatter.autofix;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Paths;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.templateformatter.ast.DocumentNode;
import com.templateformatter.ast.HtmlElementNode;
import com.templateformatter.ast.Node;
import com.templateformatter.ast.ParseResult;
import com.templateformatter.format.Formatter;
import com.templateformatter.lint.Diagnostic;
import com.templateformatter.lint.FixSafety;
import com.templateformatter.lint.LintResult;
import com.templateformatter.lint.Linter;
import com.templateformatter.lint.Rule;
import com.templateformatter.lint.RuleRegistry;
import com.templateformatter.lint.VisitorRule;
import com.templateformatter.lint.rules.ErbNoEmptyTagsRule;
import com.templateformatter.lint.rules.ErbNoExtraNewlineRule;
import com.templateformatter.lint.rules.ErbNoTrailingWhitespaceRule;
import com.templateformatter.lint.rules.HtmlNoDuplicateAttributesRule;
import com.templateformatter.lint.rules.HtmlNoSelfClosingRule;
import com.templateformatter.lint.rules.HtmlTagNameLowercaseRule;
import com.templateformatter.parser.TemplateParser;

class AutofixerTest {
    private final Autofixer autofixer = new Autofixer();

    private static LintResult lint(String source, Rule... rules) {
        return new Linter(List.of(rules)).lint(Paths.get("test.html.erb"), source);
    }

    /**
     * Test rule that reports every element and empties its body on fix.
     */
    private static class ClearBodyRule extends VisitorRule {
        @Override
        public String getName() {
            return "clear-body";
        }

        @Override
        public String getDescription() {
            return "Empties element bodies";
        }

        @Override
        public FixSafety getFixSafety() {
            return FixSafety.SAFE;
        }

        @Override
        public boolean autofix(Node node, DocumentNode root) {
            HtmlElementNode element = (HtmlElementNode) node;
            HtmlElementNode replacement = NodeCopier.element(element, element.getOpenTag(), element.getTagName(),
                    List.of(), element.getCloseTag());
            return NodeReplacer.replace(root, element, replacement);
        }
    }

    @Test
    void testLowercasesTagNames() {
        LintResult lintResult = lint("<DIV>hello</DIV>", new HtmlTagNameLowercaseRule());

        AutofixResult result = autofixer.apply(lintResult.getParseResult(), lintResult.getDiagnostics());

        assertThat(result.getSource()).isEqualTo("<div>hello</div>");
        assertThat(result.getFixed()).hasSize(1);
        assertThat(result.getUnfixed()).isEmpty();
    }

    @Test
    void testClearBodyFixThenFormat() {
        ParseResult parseResult = TemplateParser.parse("<div>hello</div>", true);
        Rule rule = new ClearBodyRule();
        Node element = parseResult.getValue().getChildren().get(0);
        Diagnostic diagnostic = new Diagnostic(rule.getName(), "clear", rule.getDefaultSeverity(),
                element.getLocation(), FixDescriptor.forNode(rule, element));

        AutofixResult result = autofixer.apply(parseResult, List.of(diagnostic));

        assertThat(result.getSource()).isEqualTo("<div></div>");
        assertThat(new Formatter().format(result.getSource())).isEqualTo("<div></div>\n");
    }

    @Test
    void testFixTargetsNodeByIdentityNotShape() {
        ParseResult parseResult = TemplateParser.parse("<p>a</p><p>a</p>", true);
        DocumentNode root = parseResult.getValue();
        Node first = root.getChildren().get(0);
        Node second = root.getChildren().get(1);
        Rule rule = new ClearBodyRule();
        Diagnostic diagnostic = new Diagnostic(rule.getName(), "clear", rule.getDefaultSeverity(),
                second.getLocation(), FixDescriptor.forNode(rule, second));

        AutofixResult result = autofixer.apply(parseResult, List.of(diagnostic));

        assertThat(result.getSource()).isEqualTo("<p>a</p><p></p>");
        assertThat(root.getChildren().get(0)).isSameAs(first);
    }

    @Test
    void testSecondFixOnSupersededNodeIsUnfixed() {
        LintResult lintResult = lint("<DIV />", new HtmlTagNameLowercaseRule(), new HtmlNoSelfClosingRule());
        assertThat(lintResult.getDiagnostics()).hasSize(2);

        AutofixResult result = autofixer.apply(lintResult.getParseResult(), lintResult.getDiagnostics());

        assertThat(result.getSource()).isEqualTo("<div />");
        assertThat(result.getFixed()).extracting(Diagnostic::getRuleName)
                .containsExactly(HtmlTagNameLowercaseRule.NAME);
        assertThat(result.getUnfixed()).extracting(Diagnostic::getRuleName)
                .containsExactly(HtmlNoSelfClosingRule.NAME);
    }

    @Test
    void testRepeatedDiagnosticDoesNotApplyTwice() {
        LintResult lintResult = lint("<DIV>x</DIV>", new HtmlTagNameLowercaseRule());
        Diagnostic diagnostic = lintResult.getDiagnostics().get(0);

        AutofixResult result = autofixer.apply(lintResult.getParseResult(), List.of(diagnostic, diagnostic));

        assertThat(result.getSource()).isEqualTo("<div>x</div>");
        assertThat(result.getFixed()).hasSize(1);
        assertThat(result.getUnfixed()).hasSize(1);
    }

    @Test
    void testReappliedOffsetFixFailsVerification() {
        String source = "a\n\n\n\nb";
        LintResult lintResult = lint(source, new ErbNoExtraNewlineRule());
        assertThat(lintResult.getDiagnostics()).hasSize(1);
        FixDescriptor fix = lintResult.getDiagnostics().get(0).getFix();
        assertThat(fix.getStart()).isEqualTo(4);
        assertThat(fix.getEnd()).isEqualTo(5);

        AutofixResult first = autofixer.apply(lintResult.getParseResult(), lintResult.getDiagnostics());
        assertThat(first.getSource()).isEqualTo("a\n\n\nb");

        AutofixResult second = autofixer.apply(TemplateParser.parse(first.getSource(), true),
                lintResult.getDiagnostics());
        assertThat(second.getSource()).isEqualTo("a\n\n\nb");
        assertThat(second.getFixed()).isEmpty();
        assertThat(second.getUnfixed()).hasSize(1);
    }

    @Test
    void testUnsafeFixesRequireOptIn() {
        LintResult lintResult = lint("a<% %>b", new ErbNoEmptyTagsRule());

        AutofixResult safeOnly = autofixer.apply(lintResult.getParseResult(), lintResult.getDiagnostics());
        assertThat(safeOnly.getSource()).isEqualTo("a<% %>b");
        assertThat(safeOnly.hasFixes()).isFalse();
        assertThat(safeOnly.getUnfixed()).hasSize(1);

        AutofixResult withUnsafe = autofixer.apply(lintResult.getParseResult(), lintResult.getDiagnostics(), true);
        assertThat(withUnsafe.getSource()).isEqualTo("ab");
        assertThat(withUnsafe.getFixed()).hasSize(1);
    }

    @Test
    void testRulesWithoutFixAreNeverAdmitted() {
        LintResult lintResult = lint("<p id=\"a\" id=\"b\"></p>", new HtmlNoDuplicateAttributesRule());

        AutofixResult result = autofixer.apply(lintResult.getParseResult(), lintResult.getDiagnostics(), true);

        assertThat(lintResult.getDiagnostics().get(0).isFixable()).isFalse();
        assertThat(Autofixer.isAdmitted(new HtmlNoDuplicateAttributesRule(), true)).isFalse();
        assertThat(result.getUnfixed()).hasSize(1);
        assertThat(result.getSource()).isEqualTo("<p id=\"a\" id=\"b\"></p>");
    }

    @Test
    void testNodeFixesRunBeforeOffsetFixes() {
        LintResult lintResult = lint("<DIV>x</DIV>  \n", new ErbNoTrailingWhitespaceRule(),
                new HtmlTagNameLowercaseRule());

        AutofixResult result = autofixer.apply(lintResult.getParseResult(), lintResult.getDiagnostics());

        assertThat(result.getSource()).isEqualTo("<div>x</div>\n");
        assertThat(result.getFixed()).extracting(Diagnostic::getRuleName)
                .containsExactly(HtmlTagNameLowercaseRule.NAME, ErbNoTrailingWhitespaceRule.NAME);
    }

    @Test
    void testOffsetFixAfterShrinkingNodeFixIsSkipped() {
        LintResult lintResult = lint("<% %>x  \n", new ErbNoEmptyTagsRule(), new ErbNoTrailingWhitespaceRule());

        AutofixResult result = autofixer.apply(lintResult.getParseResult(), lintResult.getDiagnostics(), true);

        assertThat(result.getSource()).isEqualTo("x  \n");
        assertThat(result.getUnfixed()).extracting(Diagnostic::getRuleName)
                .containsExactly(ErbNoTrailingWhitespaceRule.NAME);
    }

    @Test
    void testThrowingFixIsReportedUnfixed() {
        Rule broken = new ClearBodyRule() {
            @Override
            public boolean autofix(Node node, DocumentNode root) {
                throw new IllegalStateException("boom");
            }
        };
        ParseResult parseResult = TemplateParser.parse("<p>x</p>", true);
        Node element = parseResult.getValue().getChildren().get(0);
        Diagnostic diagnostic = new Diagnostic(broken.getName(), "broken", broken.getDefaultSeverity(),
                element.getLocation(), FixDescriptor.forNode(broken, element));

        AutofixResult result = autofixer.apply(parseResult, List.of(diagnostic));

        assertThat(result.getSource()).isEqualTo("<p>x</p>");
        assertThat(result.getUnfixed()).containsExactly(diagnostic);
    }

    @Test
    void testAllBuiltInSafeFixesTogether() {
        String source = "<DIV class='box'>\n  <BR />  \n</DIV>\n";
        LintResult lintResult = new Linter(RuleRegistry.withBuiltIns().createAll())
                .lint(Paths.get("all.html.erb"), source);

        AutofixResult result = autofixer.apply(lintResult.getParseResult(), lintResult.getDiagnostics());

        // the self-closing fix targets the <BR /> node that the lowercase fix already replaced
        assertThat(result.getSource()).isEqualTo("<div class=\"box\">\n  <br />\n</div>\n");
        assertThat(result.getUnfixed()).extracting(Diagnostic::getRuleName)
                .containsExactly(HtmlNoSelfClosingRule.NAME);
    }
}
