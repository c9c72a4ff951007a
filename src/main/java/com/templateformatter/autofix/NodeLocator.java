package com.templateformatter.autofix;

import java.util.ArrayList;
import java.util.List;

import com.templateformatter.ast.HasBody;
import com.templateformatter.ast.HasChildren;
import com.templateformatter.ast.Node;

/**
 * Identity-based lookups in a template tree.
 *
 * <p>Every comparison uses {@code ==}: two structurally identical siblings are different
 * targets, and a node evicted by an earlier replacement is never found again.
 */
public final class NodeLocator {

    private NodeLocator() {
    }

    /**
     * Returns the first node, in depth-first order from {@code root}, whose children or body
     * sequence holds {@code target}, or {@code null} when {@code target} is unreachable.
     */
    public static Node findParent(Node root, Node target) {
        if (root == null || target == null) {
            return null;
        }
        if (arrayFor(root, target) != null) {
            return root;
        }
        for (Node child : root.childNodes()) {
            Node parent = findParent(child, target);
            if (parent != null) {
                return parent;
            }
        }
        return null;
    }

    /**
     * Returns whichever of the parent's ordered sequences holds {@code target}, or {@code null}.
     */
    public static List<Node> arrayFor(Node parent, Node target) {
        if (parent instanceof HasChildren) {
            List<Node> children = ((HasChildren) parent).getChildren();
            if (indexOf(children, target) >= 0) {
                return children;
            }
        }
        if (parent instanceof HasBody) {
            List<Node> body = ((HasBody) parent).getBody();
            if (indexOf(body, target) >= 0) {
                return body;
            }
        }
        return null;
    }

    public static int indexOf(List<? extends Node> nodes, Node target) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == target) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the chain of nodes from {@code root} down to and including {@code target}, or an
     * empty list when {@code target} is unreachable. Scalar fields are followed as well as
     * sequences.
     */
    public static List<Node> pathTo(Node root, Node target) {
        List<Node> path = new ArrayList<>();
        if (root != null && target != null && _collectPath(root, target, path)) {
            return path;
        }
        return new ArrayList<>();
    }

    public static boolean isReachable(Node root, Node target) {
        return !pathTo(root, target).isEmpty();
    }

    private static boolean _collectPath(Node node, Node target, List<Node> path) {
        path.add(node);
        if (node == target) {
            return true;
        }
        for (Node child : node.childNodes()) {
            if (_collectPath(child, target, path)) {
                return true;
            }
        }
        path.remove(path.size() - 1);
        return false;
    }
}
