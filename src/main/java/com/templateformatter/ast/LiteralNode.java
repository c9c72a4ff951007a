package com.templateformatter.ast;

import java.util.List;

/**
 * Raw text inside a tag, attribute, comment, doctype or CDATA section.
 */
public final class LiteralNode extends Node {
    private final String content;

    public LiteralNode(String content, Location location, Range range, List<ParseError> errors) {
        super(location, range, errors);
        this.content = content;
    }

    public String getContent() { return content; }

    @Override
    public NodeType getType() { return NodeType.LITERAL; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitLiteralNode(this);
    }

    @Override
    public List<Node> childNodes() {
        return mutableCopy(List.of());
    }
}
