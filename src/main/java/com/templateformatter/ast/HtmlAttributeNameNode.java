package com.templateformatter.ast;

import java.util.List;

public final class HtmlAttributeNameNode extends Node implements HasChildren {
    private final List<Node> children;

    public HtmlAttributeNameNode(List<Node> children, Location location, Range range, List<ParseError> errors) {
        super(location, range, errors);
        this.children = mutableCopy(children);
    }

    @Override
    public List<Node> getChildren() { return children; }

    /**
     * Returns the literal text of the name, or {@code null} if it contains embedded code.
     */
    public String getStaticName() {
        StringBuilder sb = new StringBuilder();
        for (Node child : children) {
            if (!(child instanceof LiteralNode)) {
                return null;
            }
            sb.append(((LiteralNode) child).getContent());
        }
        return sb.toString();
    }

    @Override
    public NodeType getType() { return NodeType.HTML_ATTRIBUTE_NAME; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitHtmlAttributeNameNode(this);
    }

    @Override
    public List<Node> childNodes() {
        return mutableCopy(children);
    }
}
