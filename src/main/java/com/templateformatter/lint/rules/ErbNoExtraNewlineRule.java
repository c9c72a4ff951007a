package com.templateformatter.lint.rules;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.templateformatter.lint.LintContext;
import com.templateformatter.lint.SourceRule;

/**
 * Allows at most two consecutive blank lines. The fix deletes the newlines past the third.
 */
public class ErbNoExtraNewlineRule extends SourceRule {
    public static final String NAME = "erb-no-extra-newline";

    private static final Pattern EXTRA_NEWLINES = Pattern.compile("\n{4,}");
    private static final int KEPT_NEWLINES = 3;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "No more than two consecutive blank lines";
    }

    @Override
    protected void checkSource(String source, LintContext context) {
        Matcher matcher = EXTRA_NEWLINES.matcher(source);
        while (matcher.find()) {
            int start = matcher.start() + KEPT_NEWLINES;
            int blankLines = matcher.end() - matcher.start() - 1;
            addOffense("Extra blank line detected: " + blankLines + " blank lines, at most 2 allowed.",
                    context, start, matcher.end());
        }
    }

    @Override
    protected boolean matchesFix(String source, int start, int end) {
        if (start < KEPT_NEWLINES || start == end) {
            return false;
        }
        for (int i = start - KEPT_NEWLINES; i < end; i++) {
            if (source.charAt(i) != '\n') {
                return false;
            }
        }
        return true;
    }

    @Override
    protected String replacementFor(String slice) {
        return "";
    }
}
