package org.shadelang.frontend.analysis;

import org.shadelang.frontend.astnode.*;

/**
 * Visitor over the ShadeLang syntax tree.
 */
public interface Visitor {
    void visit(ProgramNode node);

    void visit(ParameterNode node);

    void visit(FunctionNode node);

    void visit(AssignmentNode node);

    void visit(ReturnNode node);

    void visit(BinaryOperatorNode node);

    void visit(UnaryOperatorNode node);

    void visit(CallNode node);

    void visit(LiteralNode node);

    void visit(SymbolNode node);
}
