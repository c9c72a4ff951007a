package com.templateformatter.lint.rules;

import com.templateformatter.ast.DocumentNode;
import com.templateformatter.ast.ErbContentNode;
import com.templateformatter.ast.Node;
import com.templateformatter.autofix.NodeReplacer;
import com.templateformatter.lint.FixSafety;
import com.templateformatter.lint.VisitorRule;

/**
 * Flags ERB tags without code, such as {@code <% %>} or {@code <%= %>}. Removing them can
 * change whitespace in the rendered output, so the fix is unsafe.
 */
public class ErbNoEmptyTagsRule extends VisitorRule {
    public static final String NAME = "erb-no-empty-tags";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "ERB tags must contain code";
    }

    @Override
    public FixSafety getFixSafety() {
        return FixSafety.UNSAFE;
    }

    @Override
    public void visitErbContentNode(ErbContentNode node) {
        if (node.getContentValue().isBlank()) {
            addOffense("ERB tag should not be empty. Remove empty ERB tags.", node);
        }
    }

    @Override
    public boolean autofix(Node node, DocumentNode root) {
        if (!(node instanceof ErbContentNode) || !((ErbContentNode) node).getContentValue().isBlank()) {
            return false;
        }
        return NodeReplacer.remove(root, node);
    }
}
