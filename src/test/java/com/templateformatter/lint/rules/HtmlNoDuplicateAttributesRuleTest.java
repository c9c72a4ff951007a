package com.templateformatter.lint.rules;

import static com.templateformatter.lint.rules.RuleTestSupport.lint;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.templateformatter.lint.Diagnostic;

class HtmlNoDuplicateAttributesRuleTest {
    private final HtmlNoDuplicateAttributesRule rule = new HtmlNoDuplicateAttributesRule();

    @Test
    void testReportsRepeatedNamesCaseInsensitively() {
        List<Diagnostic> diagnostics = lint(rule, "<div id=\"a\" ID=\"b\" class=\"c\"></div>").getDiagnostics();

        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0).getMessage()).isEqualTo("Duplicate attribute `id` on `<div>`.");
        assertThat(diagnostics.get(0).getFix()).isNull();
    }

    @Test
    void testDynamicNamesAreSkipped() {
        assertThat(lint(rule, "<div data-<%= a %>=\"1\" data-<%= a %>=\"2\"></div>").getDiagnostics()).isEmpty();
    }

    @Test
    void testEachTagIsCheckedSeparately() {
        assertThat(lint(rule, "<p id=\"a\"></p><p id=\"a\"></p>").getDiagnostics()).isEmpty();
    }
}
