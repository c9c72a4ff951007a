package com.templateformatter.ast;

import java.util.List;

/**
 * Whitespace inside a tag. Only produced when the parser tracks whitespace.
 */
public final class WhitespaceNode extends Node {
    private final Token value;

    public WhitespaceNode(Token value, Location location, Range range, List<ParseError> errors) {
        super(location, range, errors);
        this.value = value;
    }

    public Token getValue() { return value; }

    @Override
    public NodeType getType() { return NodeType.WHITESPACE; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitWhitespaceNode(this);
    }

    @Override
    public List<Node> childNodes() {
        return mutableCopy(List.of());
    }
}
