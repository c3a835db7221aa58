package org.shadelang.frontend.astnode;

import org.shadelang.frontend.analysis.Visitor;

/**
 * {@code target = expression;}
 */
public class AssignmentNode extends StatementNode {
    public final String target;

    public AssignmentNode(String target, ExpressionNode expression, int tokenIndex) {
        super(expression, tokenIndex);
        this.target = target;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
