package org.shadelang.frontend.astnode;

import org.shadelang.frontend.analysis.Visitor;

/**
 * {@code return expression;}
 */
public class ReturnNode extends StatementNode {
    public ReturnNode(ExpressionNode expression, int tokenIndex) {
        super(expression, tokenIndex);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
