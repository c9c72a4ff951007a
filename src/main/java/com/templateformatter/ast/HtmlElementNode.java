package com.templateformatter.ast;

import java.util.List;

/**
 * An element: open tag, body and an optional close tag. Void and self-closing elements have an
 * empty body and no close tag.
 */
public final class HtmlElementNode extends Node implements HasBody {
    private final HtmlOpenTagNode openTag;
    private final Token tagName;
    private final List<Node> body;
    private final HtmlCloseTagNode closeTag;
    private final boolean isVoid;

    public HtmlElementNode(HtmlOpenTagNode openTag, Token tagName, List<Node> body, HtmlCloseTagNode closeTag,
                           boolean isVoid, Location location, Range range, List<ParseError> errors) {
        super(location, range, errors);
        this.openTag = openTag;
        this.tagName = tagName;
        this.body = mutableCopy(body);
        this.closeTag = closeTag;
        this.isVoid = isVoid;
    }

    public HtmlOpenTagNode getOpenTag() { return openTag; }
    public Token getTagName() { return tagName; }
    public HtmlCloseTagNode getCloseTag() { return closeTag; }
    public boolean isVoid() { return isVoid; }

    @Override
    public List<Node> getBody() { return body; }

    public String getTagNameValue() {
        return tagName.getValue();
    }

    @Override
    public NodeType getType() { return NodeType.HTML_ELEMENT; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitHtmlElementNode(this);
    }

    @Override
    public List<Node> childNodes() {
        List<Node> nodes = mutableCopy(List.of(openTag));
        nodes.addAll(body);
        addIfPresent(nodes, closeTag);
        return nodes;
    }

    @Override
    public Node withChildReplaced(Node oldChild, Node newChild) {
        if (oldChild == openTag) {
            return new HtmlElementNode(cast(newChild, HtmlOpenTagNode.class), tagName, body, closeTag, isVoid,
                    getLocation(), getRange(), getErrors());
        }
        if (closeTag != null && oldChild == closeTag) {
            return new HtmlElementNode(openTag, tagName, body, cast(newChild, HtmlCloseTagNode.class), isVoid,
                    getLocation(), getRange(), getErrors());
        }
        return null;
    }
}
