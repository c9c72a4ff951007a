package com.templateformatter.ast;

import java.util.List;

public final class HtmlTextNode extends Node {
    private final String content;

    public HtmlTextNode(String content, Location location, Range range, List<ParseError> errors) {
        super(location, range, errors);
        this.content = content;
    }

    public String getContent() { return content; }

    @Override
    public NodeType getType() { return NodeType.HTML_TEXT; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitHtmlTextNode(this);
    }

    @Override
    public List<Node> childNodes() {
        return mutableCopy(List.of());
    }
}
