package com.templateformatter.lint.rules;

import java.util.List;

import com.templateformatter.ast.DocumentNode;
import com.templateformatter.ast.HtmlCloseTagNode;
import com.templateformatter.ast.HtmlElementNode;
import com.templateformatter.ast.HtmlOpenTagNode;
import com.templateformatter.ast.Node;
import com.templateformatter.ast.Token;
import com.templateformatter.ast.WhitespaceNode;
import com.templateformatter.autofix.NodeCopier;
import com.templateformatter.autofix.NodeLocator;
import com.templateformatter.autofix.NodeReplacer;
import com.templateformatter.lint.FixSafety;
import com.templateformatter.lint.VisitorRule;

/**
 * Disallows the self-closing slash. {@code <br />} becomes {@code <br>}; a non-void element
 * such as {@code <div />} gets an explicit close tag.
 */
public class HtmlNoSelfClosingRule extends VisitorRule {
    public static final String NAME = "html-no-self-closing";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Elements must not use the self-closing syntax";
    }

    @Override
    public FixSafety getFixSafety() {
        return FixSafety.SAFE;
    }

    @Override
    public void visitHtmlElementNode(HtmlElementNode node) {
        if (node.getOpenTag().isSelfClosing()) {
            String name = node.getTagNameValue();
            String message = node.isVoid()
                    ? "Void element `" + name + "` should not use `/>`. Use `<" + name + ">` instead."
                    : "Element `" + name + "` should not be self-closing. Use `<" + name + "></" + name + ">`.";
            addOffense(message, node);
        }
        super.visitHtmlElementNode(node);
    }

    @Override
    public boolean autofix(Node node, DocumentNode root) {
        if (!(node instanceof HtmlElementNode)) {
            return false;
        }
        HtmlElementNode element = (HtmlElementNode) node;
        HtmlOpenTagNode openTag = element.getOpenTag();
        if (!openTag.isSelfClosing() || !NodeLocator.isReachable(root, element)) {
            return false;
        }

        List<Node> children = openTag.getChildren();
        int end = children.size();
        while (end > 0 && children.get(end - 1) instanceof WhitespaceNode) {
            end--;
        }
        HtmlOpenTagNode newOpenTag = NodeCopier.openTag(openTag, openTag.getTagName(),
                NodeCopier.token(openTag.getTagClosing(), ">"), children.subList(0, end));

        if (element.isVoid()) {
            return NodeReplacer.replaceStructural(root, openTag, newOpenTag);
        }

        Token closing = openTag.getTagClosing();
        HtmlCloseTagNode closeTag = new HtmlCloseTagNode(NodeCopier.token(closing, "</"),
                openTag.getTagName(), NodeCopier.token(closing, ">"), List.of(),
                closing.getLocation(), closing.getRange(), List.of());
        HtmlElementNode replacement = NodeCopier.element(element, newOpenTag, element.getTagName(), closeTag);
        return NodeReplacer.replace(root, element, replacement);
    }
}
