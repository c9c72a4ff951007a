package com.templateformatter.lint.rules;

import com.templateformatter.ast.DocumentNode;
import com.templateformatter.ast.HtmlAttributeNode;
import com.templateformatter.ast.HtmlAttributeValueNode;
import com.templateformatter.ast.Node;
import com.templateformatter.ast.Token;
import com.templateformatter.autofix.NodeCopier;
import com.templateformatter.autofix.NodeReplacer;
import com.templateformatter.lint.FixSafety;
import com.templateformatter.lint.VisitorRule;
import com.templateformatter.printer.IdentityPrinter;

/**
 * Attribute values should use double quotes unless the value itself contains one.
 */
public class HtmlAttributeDoubleQuotesRule extends VisitorRule {
    public static final String NAME = "html-attribute-double-quotes";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Attribute values must be wrapped in double quotes";
    }

    @Override
    public FixSafety getFixSafety() {
        return FixSafety.SAFE;
    }

    @Override
    public void visitHtmlAttributeNode(HtmlAttributeNode node) {
        HtmlAttributeValueNode value = node.getValue();
        if (value != null && _isSingleQuoted(value) && !_containsDoubleQuote(value)) {
            String name = IdentityPrinter.printNode(node.getName());
            addOffense("Attribute `" + name + "` uses single quotes. Prefer double quotes.", value);
        }
        super.visitHtmlAttributeNode(node);
    }

    @Override
    public boolean autofix(Node node, DocumentNode root) {
        if (!(node instanceof HtmlAttributeValueNode)) {
            return false;
        }
        HtmlAttributeValueNode value = (HtmlAttributeValueNode) node;
        if (!_isSingleQuoted(value)) {
            return false;
        }
        Token openQuote = NodeCopier.token(value.getOpenQuote(), "\"");
        Token closeQuote = NodeCopier.token(value.getCloseQuote(), "\"");
        HtmlAttributeValueNode replacement = NodeCopier.attributeValue(value, openQuote, value.getChildren(),
                closeQuote);
        return NodeReplacer.replaceStructural(root, value, replacement);
    }

    private boolean _isSingleQuoted(HtmlAttributeValueNode value) {
        return value.isQuoted() && value.getOpenQuote() != null && "'".equals(value.getOpenQuote().getValue());
    }

    private boolean _containsDoubleQuote(HtmlAttributeValueNode value) {
        return IdentityPrinter.printNodes(value.getChildren()).indexOf('"') >= 0;
    }
}
