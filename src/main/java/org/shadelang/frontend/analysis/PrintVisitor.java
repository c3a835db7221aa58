package org.shadelang.frontend.analysis;

import org.shadelang.frontend.astnode.*;

/*
 *
 * Usage:
 *
 *   PrintVisitor printVisitor = new PrintVisitor();
 *   node.accept(printVisitor);
 *   return printVisitor.getResult();
 */
public class PrintVisitor implements Visitor {

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    public String getResult() {
        return sb.toString();
    }

    @Override
    public void visit(ProgramNode node) {
        appendIndent();
        sb.append("ProgramNode:\n");
        indentLevel++;
        for (ParameterNode in : node.inParameters) {
            appendIndent();
            sb.append("in ");
            in.accept(this);
        }
        for (ParameterNode out : node.outParameters) {
            appendIndent();
            sb.append("out ");
            out.accept(this);
        }
        for (FunctionNode function : node.functions) {
            function.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(ParameterNode node) {
        // Callers print the indent and any prefix
        sb.append("ParameterNode: ").append(node.typeKind.keyword()).append(" ").append(node.name).append("\n");
    }

    @Override
    public void visit(FunctionNode node) {
        appendIndent();
        sb.append("FunctionNode: ").append(node.name)
                .append(" -> ").append(node.returnType.keyword())
                .append("  pos:").append(node.tokenIndex).append("\n");
        indentLevel++;
        for (ParameterNode parameter : node.parameters) {
            appendIndent();
            parameter.accept(this);
        }
        for (StatementNode statement : node.statements) {
            statement.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(AssignmentNode node) {
        appendIndent();
        sb.append("AssignmentNode: ").append(node.target).append("  pos:").append(node.tokenIndex).append("\n");
        indentLevel++;
        node.expression.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(ReturnNode node) {
        appendIndent();
        sb.append("ReturnNode:  pos:").append(node.tokenIndex).append("\n");
        indentLevel++;
        node.expression.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        appendIndent();
        sb.append("BinaryOperatorNode: ").append(node.operator.symbol()).append("  pos:").append(node.tokenIndex).append("\n");
        indentLevel++;
        node.left.accept(this);
        node.right.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(UnaryOperatorNode node) {
        appendIndent();
        sb.append("UnaryOperatorNode: ").append(node.operator.symbol()).append("  pos:").append(node.tokenIndex).append("\n");
        indentLevel++;
        node.operand.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(CallNode node) {
        appendIndent();
        sb.append("CallNode: ").append(node.callee).append("  pos:").append(node.tokenIndex).append("\n");
        indentLevel++;
        for (ExpressionNode argument : node.arguments) {
            argument.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(LiteralNode node) {
        appendIndent();
        sb.append("LiteralNode: ");
        switch (node.kind) {
            case DECIMAL -> sb.append((float) node.value);
            case INTEGER -> sb.append((long) node.value);
            case BOOLEAN -> sb.append(node.booleanValue());
        }
        sb.append("\n");
    }

    @Override
    public void visit(SymbolNode node) {
        appendIndent();
        sb.append("SymbolNode: ").append(node.name).append("\n");
    }
}
