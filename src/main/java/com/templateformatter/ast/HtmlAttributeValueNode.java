package com.templateformatter.ast;

import java.util.List;

public final class HtmlAttributeValueNode extends Node implements HasChildren {
    private final Token openQuote;
    private final List<Node> children;
    private final Token closeQuote;
    private final boolean quoted;

    public HtmlAttributeValueNode(Token openQuote, List<Node> children, Token closeQuote, boolean quoted,
                                  Location location, Range range, List<ParseError> errors) {
        super(location, range, errors);
        this.openQuote = openQuote;
        this.children = mutableCopy(children);
        this.closeQuote = closeQuote;
        this.quoted = quoted;
    }

    public Token getOpenQuote() { return openQuote; }
    public Token getCloseQuote() { return closeQuote; }
    public boolean isQuoted() { return quoted; }

    @Override
    public List<Node> getChildren() { return children; }

    /**
     * Returns the literal text of the value, or {@code null} if it contains embedded code.
     */
    public String getStaticValue() {
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
    public NodeType getType() { return NodeType.HTML_ATTRIBUTE_VALUE; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitHtmlAttributeValueNode(this);
    }

    @Override
    public List<Node> childNodes() {
        return mutableCopy(children);
    }
}
