package com.templateformatter.ast;

import java.util.List;

public final class ErbEndNode extends ErbNode {

    public ErbEndNode(Token tagOpening, Token content, Token tagClosing,
                      Location location, Range range, List<ParseError> errors) {
        super(tagOpening, content, tagClosing, location, range, errors);
    }

    @Override
    public NodeType getType() { return NodeType.ERB_END; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitErbEndNode(this);
    }

    @Override
    public List<Node> childNodes() {
        return mutableCopy(List.of());
    }
}
