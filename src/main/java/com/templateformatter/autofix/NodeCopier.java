package com.templateformatter.autofix;

import java.util.List;

import com.templateformatter.ast.HtmlAttributeValueNode;
import com.templateformatter.ast.HtmlCloseTagNode;
import com.templateformatter.ast.HtmlElementNode;
import com.templateformatter.ast.HtmlOpenTagNode;
import com.templateformatter.ast.LiteralNode;
import com.templateformatter.ast.Node;
import com.templateformatter.ast.Token;

/**
 * Builds copies of nodes with single fields swapped. Every field that is not overridden is
 * carried over unchanged, including location, range and errors.
 */
public final class NodeCopier {

    private NodeCopier() {
    }

    public static Token token(Token token, String value) {
        return token == null ? null : token.withValue(value);
    }

    public static HtmlOpenTagNode openTag(HtmlOpenTagNode openTag, Token tagName) {
        return openTag(openTag, tagName, openTag.getTagClosing(), openTag.getChildren());
    }

    public static HtmlOpenTagNode openTag(HtmlOpenTagNode openTag, Token tagName, Token tagClosing,
                                         List<Node> children) {
        return new HtmlOpenTagNode(openTag.getTagOpening(), tagName, tagClosing, children, openTag.isVoid(),
                openTag.getLocation(), openTag.getRange(), openTag.getErrors());
    }

    public static HtmlCloseTagNode closeTag(HtmlCloseTagNode closeTag, Token tagName) {
        return new HtmlCloseTagNode(closeTag.getTagOpening(), tagName, closeTag.getTagClosing(),
                closeTag.getChildren(), closeTag.getLocation(), closeTag.getRange(), closeTag.getErrors());
    }

    public static HtmlElementNode element(HtmlElementNode element, HtmlOpenTagNode openTag, Token tagName,
                                          HtmlCloseTagNode closeTag) {
        return element(element, openTag, tagName, element.getBody(), closeTag);
    }

    public static HtmlElementNode element(HtmlElementNode element, HtmlOpenTagNode openTag, Token tagName,
                                          List<Node> body, HtmlCloseTagNode closeTag) {
        return new HtmlElementNode(openTag, tagName, body, closeTag, element.isVoid(),
                element.getLocation(), element.getRange(), element.getErrors());
    }

    public static HtmlAttributeValueNode attributeValue(HtmlAttributeValueNode value, Token openQuote,
                                                        List<Node> children, Token closeQuote) {
        return new HtmlAttributeValueNode(openQuote, children, closeQuote, openQuote != null,
                value.getLocation(), value.getRange(), value.getErrors());
    }

    /**
     * A literal occupying the span of {@code original}.
     */
    public static LiteralNode literal(Node original, String content) {
        return new LiteralNode(content, original.getLocation(), original.getRange(), List.of());
    }
}
