package com.templateformatter.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A case construct. {@code children} holds whatever sits between the case tag and the first
 * branch; the branch list itself is fixed and is edited by copying the case node.
 */
public final class ErbCaseNode extends ErbNode implements HasChildren {
    private final List<Node> children;
    private final List<ErbWhenNode> conditions;
    private final ErbElseNode elseClause;
    private final ErbEndNode endNode;

    public ErbCaseNode(Token tagOpening, Token content, Token tagClosing, List<Node> children,
                       List<ErbWhenNode> conditions, ErbElseNode elseClause, ErbEndNode endNode,
                       Location location, Range range, List<ParseError> errors) {
        super(tagOpening, content, tagClosing, location, range, errors);
        this.children = mutableCopy(children);
        this.conditions = List.copyOf(conditions);
        this.elseClause = elseClause;
        this.endNode = endNode;
    }

    @Override
    public List<Node> getChildren() { return children; }

    public List<ErbWhenNode> getConditions() { return conditions; }
    public ErbElseNode getElseClause() { return elseClause; }
    public ErbEndNode getEndNode() { return endNode; }

    @Override
    public NodeType getType() { return NodeType.ERB_CASE; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitErbCaseNode(this);
    }

    @Override
    public List<Node> childNodes() {
        List<Node> nodes = mutableCopy(children);
        nodes.addAll(conditions);
        addIfPresent(nodes, elseClause);
        addIfPresent(nodes, endNode);
        return nodes;
    }

    @Override
    public Node withChildReplaced(Node oldChild, Node newChild) {
        for (int i = 0; i < conditions.size(); i++) {
            if (conditions.get(i) == oldChild) {
                List<ErbWhenNode> updated = new ArrayList<>(conditions);
                updated.set(i, cast(newChild, ErbWhenNode.class));
                return new ErbCaseNode(getTagOpening(), getContent(), getTagClosing(), children, updated,
                        elseClause, endNode, getLocation(), getRange(), getErrors());
            }
        }
        if (elseClause != null && oldChild == elseClause) {
            return new ErbCaseNode(getTagOpening(), getContent(), getTagClosing(), children, conditions,
                    cast(newChild, ErbElseNode.class), endNode, getLocation(), getRange(), getErrors());
        }
        if (endNode != null && oldChild == endNode) {
            return new ErbCaseNode(getTagOpening(), getContent(), getTagClosing(), children, conditions,
                    elseClause, cast(newChild, ErbEndNode.class), getLocation(), getRange(), getErrors());
        }
        return null;
    }
}
