package com.templateformatter.autofix;

import java.util.List;
import java.util.logging.Logger;

import com.templateformatter.ast.Node;
import com.templateformatter.util.LoggerUtil;

/**
 * Edits a template tree by splicing new nodes into their parents' ordered sequences.
 *
 * <p>Nodes are never mutated: a fix constructs replacement nodes and hands them to one of these
 * operations. A failed lookup returns {@code false} and leaves the tree untouched.
 */
public final class NodeReplacer {
    private static final Logger logger = LoggerUtil.getLogger(NodeReplacer.class);

    private NodeReplacer() {
    }

    /**
     * Overwrites the slot holding {@code oldNode} in its owning sequence.
     */
    public static boolean replace(Node root, Node oldNode, Node newNode) {
        Node parent = NodeLocator.findParent(root, oldNode);
        if (parent == null) {
            logger.fine(() -> "No parent sequence holds " + oldNode);
            return false;
        }
        List<Node> sequence = NodeLocator.arrayFor(parent, oldNode);
        int index = NodeLocator.indexOf(sequence, oldNode);
        sequence.set(index, newNode);
        return true;
    }

    /**
     * Deletes {@code node} from its owning sequence.
     */
    public static boolean remove(Node root, Node node) {
        Node parent = NodeLocator.findParent(root, node);
        if (parent == null) {
            return false;
        }
        List<Node> sequence = NodeLocator.arrayFor(parent, node);
        sequence.remove(NodeLocator.indexOf(sequence, node));
        return true;
    }

    /**
     * Replaces a node that may sit in a scalar field.
     *
     * <p>When {@code oldNode} is held by a sequence this is {@link #replace}. Otherwise every
     * ancestor between it and the nearest ancestor held by a sequence is rebuilt with the one
     * changed field swapped, and that rebuilt ancestor is spliced in.
     */
    public static boolean replaceStructural(Node root, Node oldNode, Node newNode) {
        List<Node> path = NodeLocator.pathTo(root, oldNode);
        if (path.size() < 2) {
            return false;
        }

        Node current = oldNode;
        Node replacement = newNode;
        for (int i = path.size() - 2; i >= 0; i--) {
            Node parent = path.get(i);
            if (NodeLocator.arrayFor(parent, current) != null) {
                return replace(root, current, replacement);
            }
            Node rebuilt = parent.withChildReplaced(current, replacement);
            if (rebuilt == null) {
                logger.warning("Cannot rebuild " + parent + " around " + current);
                return false;
            }
            current = parent;
            replacement = rebuilt;
        }
        logger.fine("Reached the root without finding an owning sequence for " + oldNode);
        return false;
    }
}
