package com.templateformatter.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An attribute inside an open tag. The equals token keeps any whitespace around {@code =} so
 * the attribute reprints exactly; it is {@code null} for valueless attributes.
 */
public final class HtmlAttributeNode extends Node {
    private final HtmlAttributeNameNode name;
    private final Token equals;
    private final HtmlAttributeValueNode value;

    public HtmlAttributeNode(HtmlAttributeNameNode name, Token equals, HtmlAttributeValueNode value,
                             Location location, Range range, List<ParseError> errors) {
        super(location, range, errors);
        this.name = name;
        this.equals = equals;
        this.value = value;
    }

    public HtmlAttributeNameNode getName() { return name; }
    public Token getEquals() { return equals; }
    public HtmlAttributeValueNode getValue() { return value; }

    @Override
    public NodeType getType() { return NodeType.HTML_ATTRIBUTE; }

    @Override
    public void accept(Visitor visitor) {
        visitor.visitHtmlAttributeNode(this);
    }

    @Override
    public List<Node> childNodes() {
        List<Node> nodes = new ArrayList<>();
        nodes.add(name);
        addIfPresent(nodes, value);
        return nodes;
    }

    @Override
    public Node withChildReplaced(Node oldChild, Node newChild) {
        if (oldChild == name) {
            return new HtmlAttributeNode(cast(newChild, HtmlAttributeNameNode.class), equals, value,
                    getLocation(), getRange(), getErrors());
        }
        if (value != null && oldChild == value) {
            return new HtmlAttributeNode(name, equals, cast(newChild, HtmlAttributeValueNode.class),
                    getLocation(), getRange(), getErrors());
        }
        return null;
    }
}
