package com.templateformatter.ast;

import java.util.List;

/**
 * A {@code when} or {@code in} branch of a case construct.
 */
public final class ErbWhenNode extends ErbNode implements HasBody {
    private final List<Node> statements;

    public ErbWhenNode(Token tagOpening, Token content, Token tagClosing, List<Node> statements,
                       Location location, Range range, List<ParseError> errors) {
        super(tagOpening, content, tagClosing, location, range, errors);
        this.statements = mutableCopy(statements);
    }

    @Override
    public List<Node> getBody() { return statements; }

    @Override
    public NodeType getType() { return NodeType.ERB_WHEN; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitErbWhenNode(this);
    }

    @Override
    public List<Node> childNodes() {
        return mutableCopy(statements);
    }
}
