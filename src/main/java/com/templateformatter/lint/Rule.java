package com.templateformatter.lint;

import java.util.List;

import com.templateformatter.ast.DocumentNode;
import com.templateformatter.ast.Node;
import com.templateformatter.ast.ParseResult;
import com.templateformatter.api.error.Severity;
import com.templateformatter.autofix.FixDescriptor;

/**
 * A lint rule: detects problems in a parsed template and optionally fixes them.
 *
 * <p>Tree fixes receive the offending node and the root and must edit the tree only through
 * {@link com.templateformatter.autofix.NodeReplacer}; superseded nodes are never altered.
 */
public interface Rule {
    String getName();

    String getDescription();

    Severity getDefaultSeverity();

    FixSafety getFixSafety();

    List<Diagnostic> check(ParseResult parseResult, LintContext context);

    /**
     * Fixes the problem at {@code node}. Returns {@code false} when the node is no longer
     * reachable from {@code root} or the fix does not apply.
     */
    default boolean autofix(Node node, DocumentNode root) {
        return false;
    }

    /**
     * Applies an offset fix to {@code source}, returning the new text or {@code null} when the
     * recorded slice no longer matches.
     */
    default String autofixSource(FixDescriptor fix, String source) {
        return null;
    }
}
