package com.templateformatter.ast;

import java.util.List;

/**
 * A {@code for}, {@code while} or {@code until} loop.
 */
public final class ErbLoopNode extends ErbNode implements HasBody {
    private final List<Node> body;
    private final ErbEndNode endNode;

    public ErbLoopNode(Token tagOpening, Token content, Token tagClosing, List<Node> body, ErbEndNode endNode,
                       Location location, Range range, List<ParseError> errors) {
        super(tagOpening, content, tagClosing, location, range, errors);
        this.body = mutableCopy(body);
        this.endNode = endNode;
    }

    @Override
    public List<Node> getBody() { return body; }

    public ErbEndNode getEndNode() { return endNode; }

    @Override
    public NodeType getType() { return NodeType.ERB_LOOP; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitErbLoopNode(this);
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
            return new ErbLoopNode(getTagOpening(), getContent(), getTagClosing(), body,
                    cast(newChild, ErbEndNode.class), getLocation(), getRange(), getErrors());
        }
        return null;
    }
}
