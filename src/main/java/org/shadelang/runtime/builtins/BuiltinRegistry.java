package org.shadelang.runtime.builtins;

import org.shadelang.backend.bytecode.Opcodes;
import org.shadelang.frontend.astnode.BinaryOperator;
import org.shadelang.frontend.astnode.TypeKind;

import java.util.*;

import static org.shadelang.frontend.astnode.TypeKind.F32;
import static org.shadelang.frontend.astnode.TypeKind.I32;
import static org.shadelang.frontend.astnode.TypeKind.VEC3;

/**
 * Maps operators and builtin names, together with their operand types, to their
 * implementation.
 * <p>
 * Operators are keyed by (operator, left type, right type); builtin functions by
 * (name, parameter types). The code generator resolves against the static types of
 * the operands, so a registry lookup replaces any name mangling of overloads.
 */
public class BuiltinRegistry {

    private record BinaryKey(BinaryOperator operator, TypeKind left, TypeKind right) {
    }

    private record FunctionKey(String name, List<TypeKind> parameterTypes) {
    }

    private final Map<BinaryKey, OperationBinding> binaryOperators = new HashMap<>();
    private final Map<FunctionKey, BuiltinFunction> functions = new HashMap<>();
    private final Set<String> functionNames = new HashSet<>();

    /**
     * Creates a registry with the inline scalar arithmetic and the vector library.
     */
    public static BuiltinRegistry createDefault() {
        BuiltinRegistry registry = new BuiltinRegistry();

        // Scalar arithmetic lowers to single instructions
        registry.registerBinary(BinaryOperator.ADD, F32, F32, OperationBinding.inline(Opcodes.ADD_F32, F32));
        registry.registerBinary(BinaryOperator.SUB, F32, F32, OperationBinding.inline(Opcodes.SUB_F32, F32));
        registry.registerBinary(BinaryOperator.MUL, F32, F32, OperationBinding.inline(Opcodes.MUL_F32, F32));
        registry.registerBinary(BinaryOperator.DIV, F32, F32, OperationBinding.inline(Opcodes.DIV_F32, F32));
        registry.registerBinary(BinaryOperator.ADD, I32, I32, OperationBinding.inline(Opcodes.ADD_I32, I32));
        registry.registerBinary(BinaryOperator.SUB, I32, I32, OperationBinding.inline(Opcodes.SUB_I32, I32));
        registry.registerBinary(BinaryOperator.MUL, I32, I32, OperationBinding.inline(Opcodes.MUL_I32, I32));
        registry.registerBinary(BinaryOperator.DIV, I32, I32, OperationBinding.inline(Opcodes.DIV_I32, I32));

        // Vector operators
        registry.registerBinary(BinaryOperator.MUL, F32, VEC3, OperationBinding.nativeCall(new BuiltinFunction(
                "vec3.mul.f32_vec3", "*", List.of(F32, VEC3), VEC3,
                args -> VectorOperators.scale((Vec3) args[1], (Float) args[0]))));
        registry.registerBinary(BinaryOperator.MUL, VEC3, F32, OperationBinding.nativeCall(new BuiltinFunction(
                "vec3.mul.vec3_f32", "*", List.of(VEC3, F32), VEC3,
                args -> VectorOperators.scale((Vec3) args[0], (Float) args[1]))));
        registry.registerBinary(BinaryOperator.ADD, VEC3, VEC3, OperationBinding.nativeCall(new BuiltinFunction(
                "vec3.add.vec3_vec3", "+", List.of(VEC3, VEC3), VEC3,
                args -> VectorOperators.add((Vec3) args[0], (Vec3) args[1]))));

        // Library functions
        registry.registerFunction(new BuiltinFunction(
                "vec3.new", "Vec3", List.of(F32, F32, F32), VEC3,
                args -> VectorOperators.construct((Float) args[0], (Float) args[1], (Float) args[2])));
        registry.registerFunction(new BuiltinFunction(
                "vec3.normalize", "normalize", List.of(VEC3), VEC3,
                args -> VectorOperators.normalize((Vec3) args[0])));
        registry.registerFunction(new BuiltinFunction(
                "vec3.dot", "dot", List.of(VEC3, VEC3), F32,
                args -> VectorOperators.dot((Vec3) args[0], (Vec3) args[1])));
        return registry;
    }

    public void registerBinary(BinaryOperator operator, TypeKind left, TypeKind right, OperationBinding binding) {
        binaryOperators.put(new BinaryKey(operator, left, right), binding);
    }

    public void registerFunction(BuiltinFunction function) {
        functions.put(new FunctionKey(function.name(), function.parameterTypes()), function);
        functionNames.add(function.name());
    }

    /**
     * Resolves a binary operator for the given operand types.
     *
     * @return the binding, or null if the operator is not defined for those types
     */
    public OperationBinding resolveBinary(BinaryOperator operator, TypeKind left, TypeKind right) {
        return binaryOperators.get(new BinaryKey(operator, left, right));
    }

    /**
     * Resolves a builtin function by name and argument types.
     *
     * @return the function, or null if no overload of that name takes those types
     */
    public BuiltinFunction resolveFunction(String name, List<TypeKind> argumentTypes) {
        return functions.get(new FunctionKey(name, List.copyOf(argumentTypes)));
    }

    /**
     * Whether any overload is registered under the name.
     */
    public boolean hasFunction(String name) {
        return functionNames.contains(name);
    }

    /**
     * All overloads registered under the name, for error messages.
     */
    public List<BuiltinFunction> overloads(String name) {
        List<BuiltinFunction> result = new ArrayList<>();
        for (BuiltinFunction function : functions.values()) {
            if (function.name().equals(name)) {
                result.add(function);
            }
        }
        result.sort(Comparator.comparing(BuiltinFunction::handle));
        return result;
    }
}
