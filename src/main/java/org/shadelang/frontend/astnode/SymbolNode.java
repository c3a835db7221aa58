package org.shadelang.frontend.astnode;

import org.shadelang.frontend.analysis.Visitor;

/**
 * A reference to a parameter or local by name.
 */
public class SymbolNode extends ExpressionNode {
    public final String name;

    public SymbolNode(String name, int tokenIndex) {
        super(tokenIndex);
        this.name = name;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
