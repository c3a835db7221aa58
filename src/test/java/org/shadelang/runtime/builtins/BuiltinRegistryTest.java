package org.shadelang.runtime.builtins;

import org.junit.jupiter.api.Test;
import org.shadelang.backend.bytecode.Opcodes;
import org.shadelang.frontend.astnode.BinaryOperator;
import org.shadelang.frontend.astnode.TypeKind;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BuiltinRegistryTest {

    private final BuiltinRegistry registry = BuiltinRegistry.createDefault();

    @Test
    public void testScalarOperatorsAreInline() {
        OperationBinding sub = registry.resolveBinary(BinaryOperator.SUB, TypeKind.F32, TypeKind.F32);

        assertTrue(sub.isInline());
        assertEquals(Opcodes.SUB_F32, sub.opcode());
        assertEquals(TypeKind.F32, sub.resultType());

        OperationBinding div = registry.resolveBinary(BinaryOperator.DIV, TypeKind.I32, TypeKind.I32);
        assertEquals(Opcodes.DIV_I32, div.opcode());
        assertEquals(TypeKind.I32, div.resultType());
    }

    @Test
    public void testVectorOperatorsAreNative() {
        OperationBinding scale = registry.resolveBinary(BinaryOperator.MUL, TypeKind.F32, TypeKind.VEC3);

        assertFalse(scale.isInline());
        assertEquals("vec3.mul.f32_vec3", scale.function().handle());
        assertEquals(TypeKind.VEC3, scale.resultType());
        assertEquals(new Vec3(2, 4, 6), scale.function().invoke(2.0f, new Vec3(1, 2, 3)));

        OperationBinding add = registry.resolveBinary(BinaryOperator.ADD, TypeKind.VEC3, TypeKind.VEC3);
        assertEquals(new Vec3(5, 7, 9), add.function().invoke(new Vec3(1, 2, 3), new Vec3(4, 5, 6)));
    }

    @Test
    public void testUndefinedOperatorSignature() {
        assertNull(registry.resolveBinary(BinaryOperator.ADD, TypeKind.VEC3, TypeKind.F32));
        assertNull(registry.resolveBinary(BinaryOperator.DIV, TypeKind.VEC3, TypeKind.VEC3));
        assertNull(registry.resolveBinary(BinaryOperator.ADD, TypeKind.F32, TypeKind.I32));
        assertNull(registry.resolveBinary(BinaryOperator.MUL, TypeKind.BOOL, TypeKind.BOOL));
    }

    @Test
    public void testFunctionsResolveByNameAndArgumentTypes() {
        BuiltinFunction dot = registry.resolveFunction("dot", List.of(TypeKind.VEC3, TypeKind.VEC3));

        assertEquals("vec3.dot", dot.handle());
        assertEquals(TypeKind.F32, dot.returnType());
        assertEquals(32.0f, dot.invoke(new Vec3(1, 2, 3), new Vec3(4, 5, 6)));

        assertNull(registry.resolveFunction("dot", List.of(TypeKind.VEC3)));
        assertTrue(registry.hasFunction("dot"));
        assertFalse(registry.hasFunction("cross"));
    }

    @Test
    public void testVectorConstructorAndNormalize() {
        BuiltinFunction construct = registry.resolveFunction("Vec3", List.of(TypeKind.F32, TypeKind.F32, TypeKind.F32));
        Vec3 v = (Vec3) construct.invoke(3.0f, 0.0f, 4.0f);

        Vec3 n = (Vec3) registry.resolveFunction("normalize", List.of(TypeKind.VEC3)).invoke(v);
        assertEquals(0.6f, n.x, 1e-6f);
        assertEquals(0.0f, n.y);
        assertEquals(0.8f, n.z, 1e-6f);
    }

    @Test
    public void testNormalizeZeroVectorGivesNaN() {
        Vec3 n = VectorOperators.normalize(new Vec3(0, 0, 0));

        assertTrue(Float.isNaN(n.x));
    }

    @Test
    public void testInvokeChecksArity() {
        BuiltinFunction dot = registry.resolveFunction("dot", List.of(TypeKind.VEC3, TypeKind.VEC3));

        assertThrows(IllegalArgumentException.class, () -> dot.invoke(new Vec3(1, 0, 0)));
    }

    @Test
    public void testOverloadsAreListedForErrors() {
        registry.registerFunction(new BuiltinFunction("vec3.dot.f32", "dot", List.of(TypeKind.F32, TypeKind.F32),
                TypeKind.F32, args -> (Float) args[0] * (Float) args[1]));

        List<BuiltinFunction> overloads = registry.overloads("dot");
        assertEquals(2, overloads.size());
        assertEquals("vec3.dot", overloads.get(0).handle());
        assertEquals(6.0f, registry.resolveFunction("dot", List.of(TypeKind.F32, TypeKind.F32)).invoke(2.0f, 3.0f));
    }
}
