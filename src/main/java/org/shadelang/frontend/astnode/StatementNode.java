package org.shadelang.frontend.astnode;

/**
 * Base class of the two statement forms. The expression slot is mutable so that
 * the constant folding pass can rewrite it in place.
 */
public abstract class StatementNode extends AbstractNode {
    public ExpressionNode expression;

    protected StatementNode(ExpressionNode expression, int tokenIndex) {
        super(tokenIndex);
        this.expression = expression;
    }
}
