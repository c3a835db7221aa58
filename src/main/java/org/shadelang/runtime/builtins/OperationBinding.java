package org.shadelang.runtime.builtins;

import org.shadelang.frontend.astnode.TypeKind;

/**
 * What an operator resolves to for a given operand signature: either a single
 * inline opcode or a call to a native function.
 */
public final class OperationBinding {
    private final short opcode;
    private final BuiltinFunction function;
    private final TypeKind resultType;

    private OperationBinding(short opcode, BuiltinFunction function, TypeKind resultType) {
        this.opcode = opcode;
        this.function = function;
        this.resultType = resultType;
    }

    public static OperationBinding inline(short opcode, TypeKind resultType) {
        return new OperationBinding(opcode, null, resultType);
    }

    public static OperationBinding nativeCall(BuiltinFunction function) {
        return new OperationBinding((short) -1, function, function.returnType());
    }

    public boolean isInline() {
        return function == null;
    }

    /**
     * The inline opcode; only meaningful when {@link #isInline()}.
     */
    public short opcode() {
        return opcode;
    }

    /**
     * The native target; null when {@link #isInline()}.
     */
    public BuiltinFunction function() {
        return function;
    }

    public TypeKind resultType() {
        return resultType;
    }

    @Override
    public String toString() {
        return isInline() ? "inline(" + opcode + ")" : "native(" + function.handle() + ")";
    }
}
