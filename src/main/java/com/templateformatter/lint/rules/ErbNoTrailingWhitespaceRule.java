package com.templateformatter.lint.rules;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.templateformatter.lint.LintContext;
import com.templateformatter.lint.SourceRule;

/**
 * Disallows spaces and tabs at the end of a line.
 */
public class ErbNoTrailingWhitespaceRule extends SourceRule {
    public static final String NAME = "erb-no-trailing-whitespace";

    private static final Pattern TRAILING_WHITESPACE = Pattern.compile("[ \t]+(?=\r?\n|\\z)");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Lines must not end with whitespace";
    }

    @Override
    protected void checkSource(String source, LintContext context) {
        Matcher matcher = TRAILING_WHITESPACE.matcher(source);
        while (matcher.find()) {
            addOffense("Trailing whitespace detected.", context, matcher.start(), matcher.end());
        }
    }

    @Override
    protected boolean matchesFix(String source, int start, int end) {
        if (start == end) {
            return false;
        }
        for (int i = start; i < end; i++) {
            if (!_isBlank(source.charAt(i))) {
                return false;
            }
        }
        if (start > 0 && _isBlank(source.charAt(start - 1))) {
            return false;
        }
        return end == source.length() || source.charAt(end) == '\n' || source.charAt(end) == '\r';
    }

    @Override
    protected String replacementFor(String slice) {
        return "";
    }

    private static boolean _isBlank(char c) {
        return c == ' ' || c == '\t';
    }
}
