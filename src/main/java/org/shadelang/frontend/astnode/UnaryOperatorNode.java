package org.shadelang.frontend.astnode;

import org.shadelang.frontend.analysis.Visitor;

public class UnaryOperatorNode extends ExpressionNode {
    public final UnaryOperator operator;
    public ExpressionNode operand;

    public UnaryOperatorNode(UnaryOperator operator, ExpressionNode operand, int tokenIndex) {
        super(tokenIndex);
        this.operator = operator;
        this.operand = operand;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
