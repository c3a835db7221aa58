package org.shadelang.frontend.astnode;

import org.shadelang.frontend.analysis.Visitor;

/**
 * The LiteralNode class represents a numeric or boolean constant.
 * <p>
 * Decimal literals keep their value as a double as parsed; the code generator
 * narrows it to a 32-bit float when emitting it.
 */
public class LiteralNode extends ExpressionNode {
    public final LiteralKind kind;
    public final double value;

    public LiteralNode(LiteralKind kind, double value, int tokenIndex) {
        super(tokenIndex);
        this.kind = kind;
        this.value = value;
    }

    public static LiteralNode decimal(double value, int tokenIndex) {
        return new LiteralNode(LiteralKind.DECIMAL, value, tokenIndex);
    }

    public static LiteralNode integer(long value, int tokenIndex) {
        return new LiteralNode(LiteralKind.INTEGER, value, tokenIndex);
    }

    public static LiteralNode bool(boolean value, int tokenIndex) {
        return new LiteralNode(LiteralKind.BOOLEAN, value ? 1 : 0, tokenIndex);
    }

    public boolean booleanValue() {
        return value != 0;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
