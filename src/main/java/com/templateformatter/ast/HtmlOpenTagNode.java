package com.templateformatter.ast;

import java.util.List;

public final class HtmlOpenTagNode extends Node implements HasChildren {
    private final Token tagOpening;
    private final Token tagName;
    private final Token tagClosing;
    private final List<Node> children;
    private final boolean isVoid;

    public HtmlOpenTagNode(Token tagOpening, Token tagName, Token tagClosing, List<Node> children, boolean isVoid,
                           Location location, Range range, List<ParseError> errors) {
        super(location, range, errors);
        this.tagOpening = tagOpening;
        this.tagName = tagName;
        this.tagClosing = tagClosing;
        this.children = mutableCopy(children);
        this.isVoid = isVoid;
    }

    public Token getTagOpening() { return tagOpening; }
    public Token getTagName() { return tagName; }
    public Token getTagClosing() { return tagClosing; }
    public boolean isVoid() { return isVoid; }

    @Override
    public List<Node> getChildren() { return children; }

    public boolean isSelfClosing() {
        String value = tagClosing.getValue();
        return value.startsWith("/") && value.endsWith(">");
    }

    @Override
    public NodeType getType() { return NodeType.HTML_OPEN_TAG; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitHtmlOpenTagNode(this);
    }

    @Override
    public List<Node> childNodes() {
        return mutableCopy(children);
    }
}
