package com.templateformatter.ast;

import java.util.List;

public final class ErbElseNode extends ErbNode implements HasBody {
    private final List<Node> statements;

    public ErbElseNode(Token tagOpening, Token content, Token tagClosing, List<Node> statements,
                       Location location, Range range, List<ParseError> errors) {
        super(tagOpening, content, tagClosing, location, range, errors);
        this.statements = mutableCopy(statements);
    }

    @Override
    public List<Node> getBody() { return statements; }

    @Override
    public NodeType getType() { return NodeType.ERB_ELSE; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitErbElseNode(this);
    }

    @Override
    public List<Node> childNodes() {
        return mutableCopy(statements);
    }
}
