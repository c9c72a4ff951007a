package com.templateformatter.ast;

import java.util.List;

/**
 * A node owning an ordered, mutable children sequence.
 */
public interface HasChildren {
    List<Node> getChildren();
}
