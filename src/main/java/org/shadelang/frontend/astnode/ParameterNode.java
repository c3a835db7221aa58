package org.shadelang.frontend.astnode;

import org.shadelang.frontend.analysis.Visitor;

/**
 * A typed name: a program in/out parameter or a function parameter.
 */
public class ParameterNode extends AbstractNode {
    public final String name;
    public final TypeKind typeKind;

    public ParameterNode(String name, TypeKind typeKind, int tokenIndex) {
        super(tokenIndex);
        this.name = name;
        this.typeKind = typeKind;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
