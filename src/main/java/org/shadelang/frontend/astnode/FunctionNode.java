package org.shadelang.frontend.astnode;

import org.shadelang.frontend.analysis.Visitor;

import java.util.List;

/**
 * A named function with its parameters, declared return type and statements.
 */
public class FunctionNode extends AbstractNode {
    public final String name;
    public final List<ParameterNode> parameters;
    public final TypeKind returnType;
    public final List<StatementNode> statements;

    public FunctionNode(String name, List<ParameterNode> parameters, TypeKind returnType,
                        List<StatementNode> statements, int tokenIndex) {
        super(tokenIndex);
        this.name = name;
        this.parameters = parameters;
        this.returnType = returnType;
        this.statements = statements;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
