package org.shadelang.frontend.astnode;

import org.shadelang.frontend.analysis.Visitor;

/**
 * The BinaryOperatorNode class represents a node in the abstract syntax tree (AST) that holds
 * a binary operator and its two operands.
 */
public class BinaryOperatorNode extends ExpressionNode {
    public final BinaryOperator operator;
    public ExpressionNode left;
    public ExpressionNode right;

    public BinaryOperatorNode(BinaryOperator operator, ExpressionNode left, ExpressionNode right, int tokenIndex) {
        super(tokenIndex);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
