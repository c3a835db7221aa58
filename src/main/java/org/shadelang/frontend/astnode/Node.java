package org.shadelang.frontend.astnode;

import org.shadelang.frontend.analysis.Visitor;

/**
 * Common interface of all syntax tree nodes.
 */
public interface Node {
    /**
     * Accepts a visitor to process this node.
     *
     * @param visitor the visitor to process this node
     */
    void accept(Visitor visitor);

    /**
     * Returns the index of the token this node was parsed from, or -1.
     */
    int getIndex();
}
