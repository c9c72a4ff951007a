package com.templateformatter.ast;

import java.util.List;

public final class DocumentNode extends Node implements HasChildren {
    private final List<Node> children;

    public DocumentNode(List<Node> children, Location location, Range range, List<ParseError> errors) {
        super(location, range, errors);
        this.children = mutableCopy(children);
    }

    @Override
    public List<Node> getChildren() { return children; }

    @Override
    public NodeType getType() { return NodeType.DOCUMENT; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitDocumentNode(this);
    }

    @Override
    public List<Node> childNodes() {
        return mutableCopy(children);
    }
}
