package org.shadelang.frontend.astnode;

/**
 * Marker base class for nodes that produce a value.
 */
public abstract class ExpressionNode extends AbstractNode {
    protected ExpressionNode(int tokenIndex) {
        super(tokenIndex);
    }
}
