package com.templateformatter.lint.rules;

import static com.templateformatter.lint.rules.RuleTestSupport.fix;
import static com.templateformatter.lint.rules.RuleTestSupport.lint;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.templateformatter.lint.FixSafety;

class ErbNoEmptyTagsRuleTest {
    private final ErbNoEmptyTagsRule rule = new ErbNoEmptyTagsRule();

    @Test
    void testReportsBlankTags() {
        assertThat(lint(rule, "<% %><%= %><%=\n%><%= x %>").getDiagnostics()).hasSize(3);
    }

    @Test
    void testFixIsUnsafe() {
        assertThat(rule.getFixSafety()).isEqualTo(FixSafety.UNSAFE);
        assertThat(fix(rule, "<p><%= %>x</p>")).isEqualTo("<p><%= %>x</p>");
        assertThat(fix(rule, "<p><%= %>x</p>", true)).isEqualTo("<p>x</p>");
    }
}
