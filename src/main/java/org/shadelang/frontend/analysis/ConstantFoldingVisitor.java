package org.shadelang.frontend.analysis;

import org.shadelang.frontend.astnode.*;
import org.shadelang.runtime.ErrorMessageUtil;
import org.shadelang.runtime.runtimetypes.ErrorKind;
import org.shadelang.runtime.runtimetypes.ShadeCompilerException;

import java.util.List;

/**
 * AST visitor that performs constant folding optimization.
 * This visitor evaluates constant expressions at compile time, replacing them
 * with literal results. Statement expressions, operands and call arguments are
 * rewritten in place.
 * <p>
 * Decimal arithmetic is evaluated in 32-bit float precision, the precision the
 * virtual machine computes in. Integer arithmetic is 32-bit. Operands of different
 * literal kinds are left alone.
 * <p>
 * A fold that would divide by a constant zero, or whose result does not fit its
 * type, fails the compilation with {@link ErrorKind#FOLDING}.
 */
public class ConstantFoldingVisitor implements Visitor {

    public static final String FLOAT_OVERFLOW = "Constant expression overflows float";

    private final ErrorMessageUtil errorUtil;
    private ExpressionNode result;

    public ConstantFoldingVisitor(ErrorMessageUtil errorUtil) {
        this.errorUtil = errorUtil;
    }

    /**
     * Folds every function of the program in place.
     *
     * @param program   the program to optimize
     * @param errorUtil error formatter for the program's source, may be null
     */
    public static void fold(ProgramNode program, ErrorMessageUtil errorUtil) {
        program.accept(new ConstantFoldingVisitor(errorUtil));
    }

    /**
     * Folds one expression.
     *
     * @return the folded expression, which may be the same node
     */
    public ExpressionNode foldExpression(ExpressionNode node) {
        node.accept(this);
        return result;
    }

    @Override
    public void visit(ProgramNode node) {
        for (FunctionNode function : node.functions) {
            function.accept(this);
        }
    }

    @Override
    public void visit(ParameterNode node) {
        // Nothing to fold in a declaration
    }

    @Override
    public void visit(FunctionNode node) {
        for (StatementNode statement : node.statements) {
            statement.accept(this);
        }
    }

    @Override
    public void visit(AssignmentNode node) {
        node.expression = foldExpression(node.expression);
    }

    @Override
    public void visit(ReturnNode node) {
        node.expression = foldExpression(node.expression);
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        node.left = foldExpression(node.left);
        node.right = foldExpression(node.right);

        if (node.left instanceof LiteralNode left && node.right instanceof LiteralNode right
                && left.kind == right.kind) {
            if (left.kind == LiteralKind.DECIMAL) {
                result = foldDecimal(node, (float) left.value, (float) right.value);
                return;
            }
            if (left.kind == LiteralKind.INTEGER) {
                result = foldInteger(node, (long) left.value, (long) right.value);
                return;
            }
        }
        result = node;
    }

    @Override
    public void visit(UnaryOperatorNode node) {
        node.operand = foldExpression(node.operand);

        if (node.operand instanceof LiteralNode literal) {
            if (node.operator == UnaryOperator.NEG && literal.kind == LiteralKind.DECIMAL) {
                result = LiteralNode.decimal(-(float) literal.value, node.tokenIndex);
                return;
            }
            if (node.operator == UnaryOperator.NEG && literal.kind == LiteralKind.INTEGER) {
                result = LiteralNode.integer(checkInt(node, -(long) literal.value), node.tokenIndex);
                return;
            }
            if (node.operator == UnaryOperator.NOT && literal.kind == LiteralKind.BOOLEAN) {
                result = LiteralNode.bool(!literal.booleanValue(), node.tokenIndex);
                return;
            }
        }
        result = node;
    }

    @Override
    public void visit(CallNode node) {
        List<ExpressionNode> arguments = node.arguments;
        for (int i = 0; i < arguments.size(); i++) {
            arguments.set(i, foldExpression(arguments.get(i)));
        }
        result = node;
    }

    @Override
    public void visit(LiteralNode node) {
        if (node.kind == LiteralKind.DECIMAL && !Float.isFinite((float) node.value)) {
            throw foldingError(node, FLOAT_OVERFLOW);
        }
        result = node;
    }

    @Override
    public void visit(SymbolNode node) {
        result = node;
    }

    private ExpressionNode foldDecimal(BinaryOperatorNode node, float a, float b) {
        float value;
        switch (node.operator) {
            case ADD -> value = a + b;
            case SUB -> value = a - b;
            case MUL -> value = a * b;
            case DIV -> {
                if (b == 0.0f) {
                    throw foldingError(node, "Division by zero in constant expression");
                }
                value = a / b;
            }
            default -> throw new IllegalStateException("Unexpected operator: " + node.operator);
        }
        if (!Float.isFinite(value)) {
            throw foldingError(node, FLOAT_OVERFLOW);
        }
        return LiteralNode.decimal(value, node.tokenIndex);
    }

    private ExpressionNode foldInteger(BinaryOperatorNode node, long a, long b) {
        long value;
        switch (node.operator) {
            case ADD -> value = a + b;
            case SUB -> value = a - b;
            case MUL -> value = a * b;
            case DIV -> {
                if (b == 0) {
                    throw foldingError(node, "Division by zero in constant expression");
                }
                value = a / b;
            }
            default -> throw new IllegalStateException("Unexpected operator: " + node.operator);
        }
        return LiteralNode.integer(checkInt(node, value), node.tokenIndex);
    }

    private long checkInt(ExpressionNode node, long value) {
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw foldingError(node, "Constant expression overflows int");
        }
        return value;
    }

    private ShadeCompilerException foldingError(ExpressionNode node, String message) {
        return new ShadeCompilerException(ErrorKind.FOLDING, null, node.tokenIndex, message, errorUtil);
    }
}
