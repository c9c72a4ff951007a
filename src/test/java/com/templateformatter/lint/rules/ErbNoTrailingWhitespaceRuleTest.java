package com.templateformatter.lint.rules;

import static com.templateformatter.lint.rules.RuleTestSupport.fix;
import static com.templateformatter.lint.rules.RuleTestSupport.lint;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ErbNoTrailingWhitespaceRuleTest {
    private final ErbNoTrailingWhitespaceRule rule = new ErbNoTrailingWhitespaceRule();

    @Test
    void testReportsTrailingSpacesAndTabs() {
        assertThat(lint(rule, "<p>a</p> \t\n<p>b</p>\r\n<p>c</p>  ").getDiagnostics()).hasSize(2);
    }

    @Test
    void testIgnoresInnerWhitespace() {
        assertThat(lint(rule, "<p> a  b </p>\n").getDiagnostics()).isEmpty();
    }

    @Test
    void testFixStripsTrailingWhitespace() {
        assertThat(fix(rule, "<p>x</p>\t\r\n")).isEqualTo("<p>x</p>\r\n");
        assertThat(fix(rule, "<div></div>   ")).isEqualTo("<div></div>");
    }

    @Test
    void testFixesAfterAnEarlierRemovalAreDeferred() {
        String source = "<div>  \n  <p>x</p>\t\r\n</div>   ";

        String once = fix(rule, source);
        assertThat(once).isEqualTo("<div>\n  <p>x</p>\t\r\n</div>   ");

        String twice = fix(rule, once);
        assertThat(twice).isEqualTo("<div>\n  <p>x</p>\r\n</div>   ");
        assertThat(fix(rule, twice)).isEqualTo("<div>\n  <p>x</p>\r\n</div>");
    }
}
