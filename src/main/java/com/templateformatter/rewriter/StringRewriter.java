package com.templateformatter.rewriter;

import com.templateformatter.format.FormatContext;

/**
 * Transforms the formatted text.
 */
public abstract class StringRewriter {

    public abstract String getName();

    public abstract String getDescription();

    public abstract String rewrite(String formatted, FormatContext context);
}
