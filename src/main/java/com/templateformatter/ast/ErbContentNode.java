package com.templateformatter.ast;

import java.util.List;

/**
 * A single embedded tag that is not part of a control-flow construct: output, statement or
 * comment.
 */
public final class ErbContentNode extends ErbNode {

    public ErbContentNode(Token tagOpening, Token content, Token tagClosing,
                          Location location, Range range, List<ParseError> errors) {
        super(tagOpening, content, tagClosing, location, range, errors);
    }

    @Override
    public NodeType getType() { return NodeType.ERB_CONTENT; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitErbContentNode(this);
    }

    @Override
    public List<Node> childNodes() {
        return mutableCopy(List.of());
    }
}
