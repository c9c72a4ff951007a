package com.templateformatter.rewriter;

import com.templateformatter.ast.DocumentNode;
import com.templateformatter.format.FormatContext;

/**
 * Transforms the parsed tree before it is formatted.
 *
 * <p>Implementations edit the tree through {@link com.templateformatter.autofix.NodeReplacer}
 * and return the root to format, normally the one they received.
 */
public abstract class AstRewriter {

    public abstract String getName();

    public abstract String getDescription();

    public abstract DocumentNode rewrite(DocumentNode root, FormatContext context);
}
