package com.templateformatter.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class of every node in a template tree.
 *
 * <p>Nodes are compared by reference identity only. Scalar fields are final; the ordered
 * children and body sequences exposed through {@link HasChildren} and {@link HasBody} are the
 * only mutable state, and structural edits happen exclusively by replacing a slot in one of
 * those sequences.
 */
public abstract class Node {
    private final Location location;
    private final Range range;
    private final List<ParseError> errors;

    protected Node(Location location, Range range, List<ParseError> errors) {
        this.location = location;
        this.range = range;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public Location getLocation() { return location; }
    public Range getRange() { return range; }
    public List<ParseError> getErrors() { return errors; }

    public abstract NodeType getType();

    public abstract void accept(Visitor visitor);

    /**
     * Returns a fresh list of the direct child nodes in source order, including nodes held in
     * scalar fields.
     */
    public abstract List<Node> childNodes();

    /**
     * Returns a copy of this node with {@code oldChild} swapped for {@code newChild} in a scalar
     * field, or {@code null} when {@code oldChild} is not held by a scalar field of this node.
     */
    public Node withChildReplaced(Node oldChild, Node newChild) {
        return null;
    }

    /**
     * Collects the errors of this node and of every descendant.
     */
    public List<ParseError> recursiveErrors() {
        List<ParseError> result = new ArrayList<>(errors);
        for (Node child : childNodes()) {
            result.addAll(child.recursiveErrors());
        }
        return result;
    }

    protected static List<Node> mutableCopy(List<? extends Node> nodes) {
        return nodes == null ? new ArrayList<>() : new ArrayList<>(nodes);
    }

    protected static void addIfPresent(List<Node> nodes, Node node) {
        if (node != null) {
            nodes.add(node);
        }
    }

    @SuppressWarnings("unchecked")
    protected static <T extends Node> T cast(Node node, Class<T> type) {
        if (node != null && !type.isInstance(node)) {
            throw new IllegalArgumentException("Expected " + type.getSimpleName() + " but got "
                    + node.getClass().getSimpleName());
        }
        return (T) node;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + range;
    }
}
