package org.shadelang.frontend.astnode;

import org.shadelang.frontend.analysis.Visitor;

import java.util.List;

/**
 * Root of the syntax tree: the in-parameters, out-parameters and functions of
 * one compilation unit, each in declaration order.
 */
public class ProgramNode extends AbstractNode {
    public final List<ParameterNode> inParameters;
    public final List<ParameterNode> outParameters;
    public final List<FunctionNode> functions;

    public ProgramNode(List<ParameterNode> inParameters, List<ParameterNode> outParameters,
                       List<FunctionNode> functions) {
        super(0);
        this.inParameters = inParameters;
        this.outParameters = outParameters;
        this.functions = functions;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
