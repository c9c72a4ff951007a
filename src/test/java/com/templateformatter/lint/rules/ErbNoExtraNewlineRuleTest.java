package com.templateformatter.lint.rules;

import static com.templateformatter.lint.rules.RuleTestSupport.fix;
import static com.templateformatter.lint.rules.RuleTestSupport.lint;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.templateformatter.lint.Diagnostic;

class ErbNoExtraNewlineRuleTest {
    private final ErbNoExtraNewlineRule rule = new ErbNoExtraNewlineRule();

    @Test
    void testAllowsTwoBlankLines() {
        assertThat(lint(rule, "<p></p>\n\n\n<p></p>").getDiagnostics()).isEmpty();
    }

    @Test
    void testReportsEachRunOnce() {
        List<Diagnostic> diagnostics = lint(rule, "a\n\n\n\n\nb\n\n\n\nc").getDiagnostics();

        assertThat(diagnostics).extracting(Diagnostic::getMessage).containsExactly(
                "Extra blank line detected: 4 blank lines, at most 2 allowed.",
                "Extra blank line detected: 3 blank lines, at most 2 allowed.");
        assertThat(diagnostics.get(0).getFix().getStart()).isEqualTo(4);
        assertThat(diagnostics.get(0).getFix().getEnd()).isEqualTo(6);
    }

    @Test
    void testFixKeepsTwoBlankLines() {
        assertThat(fix(rule, "a\n\n\n\n\nb")).isEqualTo("a\n\n\nb");
    }

    @Test
    void testLaterRunShiftedByEarlierFixIsLeftForNextPass() {
        String once = fix(rule, "a\n\n\n\n\nb\n\n\n\nc");

        assertThat(once).isEqualTo("a\n\n\nb\n\n\n\nc");
        assertThat(fix(rule, once)).isEqualTo("a\n\n\nb\n\n\nc");
    }
}
