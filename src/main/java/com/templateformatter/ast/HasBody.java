package com.templateformatter.ast;

import java.util.List;

/**
 * A node owning an ordered, mutable body sequence.
 */
public interface HasBody {
    List<Node> getBody();
}
