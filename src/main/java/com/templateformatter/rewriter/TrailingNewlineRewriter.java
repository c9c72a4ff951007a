package com.templateformatter.rewriter;

import com.templateformatter.format.FormatContext;

/**
 * Ends non-empty output with exactly one newline.
 */
public class TrailingNewlineRewriter extends StringRewriter {
    public static final String NAME = "trailing-newline";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Ensure the output ends with exactly one newline";
    }

    @Override
    public String rewrite(String formatted, FormatContext context) {
        int end = formatted.length();
        while (end > 0 && (formatted.charAt(end - 1) == '\n' || formatted.charAt(end - 1) == '\r')) {
            end--;
        }
        return end == 0 ? "" : formatted.substring(0, end) + "\n";
    }
}
