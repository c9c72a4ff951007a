package com.templateformatter.lint.rules;

import static com.templateformatter.lint.rules.RuleTestSupport.fix;
import static com.templateformatter.lint.rules.RuleTestSupport.lint;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.templateformatter.lint.Diagnostic;

class HtmlNoSelfClosingRuleTest {
    private final HtmlNoSelfClosingRule rule = new HtmlNoSelfClosingRule();

    @Test
    void testReportsSelfClosingElements() {
        assertThat(lint(rule, "<br /><div/><img src=\"a\">").getDiagnostics())
                .extracting(Diagnostic::getMessage)
                .containsExactly(
                        "Void element `br` should not use `/>`. Use `<br>` instead.",
                        "Element `div` should not be self-closing. Use `<div></div>`.");
    }

    @Test
    void testFixDropsSlashFromVoidElement() {
        assertThat(fix(rule, "<p><br /></p>")).isEqualTo("<p><br></p>");
        assertThat(fix(rule, "<input type=\"text\" />")).isEqualTo("<input type=\"text\">");
    }

    @Test
    void testFixAddsCloseTagToOtherElements() {
        assertThat(fix(rule, "<div class=\"x\" />")).isEqualTo("<div class=\"x\"></div>");
        assertThat(fix(rule, "<span/>")).isEqualTo("<span></span>");
    }
}
