package com.templateformatter.ast;

import java.util.List;

public final class CdataNode extends Node implements HasChildren {
    private final Token tagOpening;
    private final List<Node> children;
    private final Token tagClosing;

    public CdataNode(Token tagOpening, List<Node> children, Token tagClosing,
                     Location location, Range range, List<ParseError> errors) {
        super(location, range, errors);
        this.tagOpening = tagOpening;
        this.children = mutableCopy(children);
        this.tagClosing = tagClosing;
    }

    public Token getTagOpening() { return tagOpening; }
    public Token getTagClosing() { return tagClosing; }

    @Override
    public List<Node> getChildren() { return children; }

    @Override
    public NodeType getType() { return NodeType.CDATA; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitCdataNode(this);
    }

    @Override
    public List<Node> childNodes() {
        return mutableCopy(children);
    }
}
