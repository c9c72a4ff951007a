package com.templateformatter.lint.rules;

import java.util.Locale;

import com.templateformatter.ast.DocumentNode;
import com.templateformatter.ast.HtmlCloseTagNode;
import com.templateformatter.ast.HtmlElementNode;
import com.templateformatter.ast.HtmlOpenTagNode;
import com.templateformatter.ast.Node;
import com.templateformatter.autofix.NodeCopier;
import com.templateformatter.autofix.NodeReplacer;
import com.templateformatter.lint.FixSafety;
import com.templateformatter.lint.VisitorRule;

/**
 * Tag names must be lowercase: {@code <DIV>} becomes {@code <div>}.
 *
 * <p>The fix rebuilds the element from its name tokens upward: new tokens, new open and close
 * tags, a new element, spliced into the element's owning sequence.
 */
public class HtmlTagNameLowercaseRule extends VisitorRule {
    public static final String NAME = "html-tag-name-lowercase";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Element names must be lowercase";
    }

    @Override
    public FixSafety getFixSafety() {
        return FixSafety.SAFE;
    }

    @Override
    public void visitHtmlElementNode(HtmlElementNode node) {
        String name = node.getTagNameValue();
        String lower = name.toLowerCase(Locale.ROOT);
        HtmlCloseTagNode closeTag = node.getCloseTag();
        boolean closeMismatch = closeTag != null && !lower.equals(closeTag.getTagName().getValue());
        if (!name.equals(lower) || closeMismatch) {
            addOffense("Tag name `" + name + "` should be lowercase. Use `" + lower + "` instead.", node);
        }
        super.visitHtmlElementNode(node);
    }

    @Override
    public boolean autofix(Node node, DocumentNode root) {
        if (!(node instanceof HtmlElementNode)) {
            return false;
        }
        HtmlElementNode element = (HtmlElementNode) node;
        String lower = element.getTagNameValue().toLowerCase(Locale.ROOT);

        HtmlOpenTagNode openTag = NodeCopier.openTag(element.getOpenTag(),
                NodeCopier.token(element.getOpenTag().getTagName(), lower));
        HtmlCloseTagNode closeTag = element.getCloseTag() == null
                ? null
                : NodeCopier.closeTag(element.getCloseTag(), NodeCopier.token(element.getCloseTag().getTagName(), lower));
        HtmlElementNode replacement = NodeCopier.element(element, openTag,
                NodeCopier.token(element.getTagName(), lower), closeTag);

        return NodeReplacer.replace(root, element, replacement);
    }
}
