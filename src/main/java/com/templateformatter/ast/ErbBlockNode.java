package com.templateformatter.ast;

import java.util.List;

/**
 * A block opened by {@code do} (optionally with block parameters) or a {@code begin} section.
 */
public final class ErbBlockNode extends ErbNode implements HasBody {
    private final List<Node> body;
    private final ErbEndNode endNode;

    public ErbBlockNode(Token tagOpening, Token content, Token tagClosing, List<Node> body, ErbEndNode endNode,
                        Location location, Range range, List<ParseError> errors) {
        super(tagOpening, content, tagClosing, location, range, errors);
        this.body = mutableCopy(body);
        this.endNode = endNode;
    }

    @Override
    public List<Node> getBody() { return body; }

    public ErbEndNode getEndNode() { return endNode; }

    @Override
    public NodeType getType() { return NodeType.ERB_BLOCK; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitErbBlockNode(this);
    }

    @Override
    public List<Node> childNodes() {
        List<Node> nodes = mutableCopy(body);
        addIfPresent(nodes, endNode);
        return nodes;
    }

    @Override
    public Node withChildReplaced(Node oldChild, Node newChild) {
        if (endNode != null && oldChild == endNode) {
            return new ErbBlockNode(getTagOpening(), getContent(), getTagClosing(), body,
                    cast(newChild, ErbEndNode.class), getLocation(), getRange(), getErrors());
        }
        return null;
    }
}
