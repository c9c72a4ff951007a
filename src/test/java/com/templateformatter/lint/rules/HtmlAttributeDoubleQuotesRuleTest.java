package com.templateformatter.lint.rules;

import static com.templateformatter.lint.rules.RuleTestSupport.fix;
import static com.templateformatter.lint.rules.RuleTestSupport.lint;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class HtmlAttributeDoubleQuotesRuleTest {
    private final HtmlAttributeDoubleQuotesRule rule = new HtmlAttributeDoubleQuotesRule();

    @Test
    void testReportsSingleQuotedValues() {
        assertThat(lint(rule, "<a href='/home' title=\"t\" data-x=y>x</a>").getDiagnostics()).hasSize(1);
    }

    @Test
    void testAllowsSingleQuotesAroundDoubleQuotes() {
        assertThat(lint(rule, "<p title='say \"hi\"'></p>").getDiagnostics()).isEmpty();
    }

    @Test
    void testFixSwapsQuotes() {
        assertThat(fix(rule, "<a href='/home' class='<%= css %>'>x</a>"))
                .isEqualTo("<a href=\"/home\" class=\"<%= css %>\">x</a>");
    }
}
