package com.templateformatter.ast;

import java.util.List;

/**
 * An {@code if}, {@code unless} or {@code elsif} branch. The {@code subsequent} branch is either
 * another {@code ErbIfNode} for {@code elsif} or an {@link ErbElseNode}. Only the outermost
 * branch carries the end marker.
 */
public final class ErbIfNode extends ErbNode implements HasBody {
    private final List<Node> statements;
    private final Node subsequent;
    private final ErbEndNode endNode;

    public ErbIfNode(Token tagOpening, Token content, Token tagClosing, List<Node> statements, Node subsequent,
                     ErbEndNode endNode, Location location, Range range, List<ParseError> errors) {
        super(tagOpening, content, tagClosing, location, range, errors);
        this.statements = mutableCopy(statements);
        this.subsequent = subsequent;
        this.endNode = endNode;
    }

    @Override
    public List<Node> getBody() { return statements; }

    public Node getSubsequent() { return subsequent; }
    public ErbEndNode getEndNode() { return endNode; }

    @Override
    public NodeType getType() { return NodeType.ERB_IF; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitErbIfNode(this);
    }

    @Override
    public List<Node> childNodes() {
        List<Node> nodes = mutableCopy(statements);
        addIfPresent(nodes, subsequent);
        addIfPresent(nodes, endNode);
        return nodes;
    }

    @Override
    public Node withChildReplaced(Node oldChild, Node newChild) {
        if (subsequent != null && oldChild == subsequent) {
            return new ErbIfNode(getTagOpening(), getContent(), getTagClosing(), statements, newChild, endNode,
                    getLocation(), getRange(), getErrors());
        }
        if (endNode != null && oldChild == endNode) {
            return new ErbIfNode(getTagOpening(), getContent(), getTagClosing(), statements, subsequent,
                    cast(newChild, ErbEndNode.class), getLocation(), getRange(), getErrors());
        }
        return null;
    }
}
