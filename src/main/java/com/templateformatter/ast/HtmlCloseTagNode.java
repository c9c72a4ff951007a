package com.templateformatter.ast;

import java.util.List;

public final class HtmlCloseTagNode extends Node implements HasChildren {
    private final Token tagOpening;
    private final Token tagName;
    private final Token tagClosing;
    private final List<Node> children;

    public HtmlCloseTagNode(Token tagOpening, Token tagName, Token tagClosing, List<Node> children,
                            Location location, Range range, List<ParseError> errors) {
        super(location, range, errors);
        this.tagOpening = tagOpening;
        this.tagName = tagName;
        this.tagClosing = tagClosing;
        this.children = mutableCopy(children);
    }

    public Token getTagOpening() { return tagOpening; }
    public Token getTagName() { return tagName; }
    public Token getTagClosing() { return tagClosing; }

    @Override
    public List<Node> getChildren() { return children; }

    @Override
    public NodeType getType() { return NodeType.HTML_CLOSE_TAG; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitHtmlCloseTagNode(this);
    }

    @Override
    public List<Node> childNodes() {
        return mutableCopy(children);
    }
}
