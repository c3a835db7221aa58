package org.shadelang.frontend.astnode;

import org.shadelang.frontend.analysis.Visitor;

import java.util.List;

/**
 * A call to a program function or to a builtin, e.g. {@code normalize(v)}.
 */
public class CallNode extends ExpressionNode {
    public final String callee;
    public final List<ExpressionNode> arguments;

    public CallNode(String callee, List<ExpressionNode> arguments, int tokenIndex) {
        super(tokenIndex);
        this.callee = callee;
        this.arguments = arguments;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
