package org.shadelang.runtime.builtins;

import org.shadelang.frontend.astnode.TypeKind;

import java.util.List;

/**
 * A native function the virtual machine can call through {@code CALL_NATIVE}.
 *
 * @param handle         stable identifier the host binds the implementation by
 * @param name           source-level name, or the operator symbol for operator overloads
 * @param parameterTypes parameter types in order
 * @param returnType     result type
 * @param implementation host implementation
 */
public record BuiltinFunction(String handle, String name, List<TypeKind> parameterTypes, TypeKind returnType,
                              NativeImplementation implementation) {

    public BuiltinFunction {
        parameterTypes = List.copyOf(parameterTypes);
    }

    public Object invoke(Object... args) {
        if (args.length != parameterTypes.size()) {
            throw new IllegalArgumentException(handle + " expects " + parameterTypes.size()
                    + " arguments, got " + args.length);
        }
        return implementation.invoke(args);
    }
}
