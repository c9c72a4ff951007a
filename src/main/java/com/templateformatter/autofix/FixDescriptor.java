package com.templateformatter.autofix;

import com.templateformatter.ast.Node;
import com.templateformatter.lint.Rule;

/**
 * How a diagnostic can be fixed: either through the offending node, edited in the tree, or
 * through a {@code [start, end)} character range of the source text.
 */
public final class FixDescriptor {
    private final Rule rule;
    private final Node node;
    private final int start;
    private final int end;

    private FixDescriptor(Rule rule, Node node, int start, int end) {
        this.rule = rule;
        this.node = node;
        this.start = start;
        this.end = end;
    }

    public static FixDescriptor forNode(Rule rule, Node node) {
        if (node == null) {
            throw new IllegalArgumentException("node must not be null");
        }
        return new FixDescriptor(rule, node, -1, -1);
    }

    public static FixDescriptor forOffsets(Rule rule, int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid offsets [" + start + ", " + end + ")");
        }
        return new FixDescriptor(rule, null, start, end);
    }

    public Rule getRule() { return rule; }
    public Node getNode() { return node; }
    public int getStart() { return start; }
    public int getEnd() { return end; }

    public boolean isNodeFix() {
        return node != null;
    }

    public boolean isOffsetFix() {
        return node == null;
    }

    @Override
    public String toString() {
        return isNodeFix()
                ? rule.getName() + " -> " + node
                : rule.getName() + " -> [" + start + ", " + end + ")";
    }
}
