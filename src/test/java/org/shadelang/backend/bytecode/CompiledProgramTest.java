package org.shadelang.backend.bytecode;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;
import org.shadelang.CompilerOptions;
import org.shadelang.scriptengine.ShadeLanguageProvider;

import java.nio.ByteOrder;

import static org.junit.jupiter.api.Assertions.*;

public class CompiledProgramTest {

    private static final String LIGHTING =
            "in vec3 normal;\n" +
            "in vec3 light;\n" +
            "out float intensity;\n" +
            "fn clampish(float x) { return x * 0.5 + 0.5; }\n" +
            "fn main() {\n" +
            "    d = dot(normalize(normal), light);\n" +
            "    intensity = clampish(d);\n" +
            "}\n";

    private static CompiledProgram compile(String code) {
        CompilerOptions options = new CompilerOptions();
        options.code = code;
        options.fileName = "lighting.shd";
        return ShadeLanguageProvider.compile(options);
    }

    @Test
    public void testGetCodeReturnsCopy() {
        CompiledProgram program = compile("fn main() { return 1.0; }");

        int[] code = program.getCode();
        code[0] = 0;
        assertEquals(InstructionWord.encode(Opcodes.CONST_F32), program.word(0));
    }

    @Test
    public void testByteOrder() {
        CompiledProgram program = compile("in float a; fn main() { return a; }");
        // LOAD_GLOBAL 0 = 0x0000000D, RET 0 = 0x0000000E

        assertArrayEquals(new byte[]{0, 0, 0, 0x0D, 0, 0, 0, 0x0E}, program.toByteArray(ByteOrder.BIG_ENDIAN));
        assertArrayEquals(new byte[]{0x0D, 0, 0, 0, 0x0E, 0, 0, 0}, program.toByteArray(ByteOrder.LITTLE_ENDIAN));
    }

    @Test
    public void testImmediateBytes() {
        CompiledProgram program = compile("fn main() { x = 1.0; return x; }");

        byte[] little = program.toByteArray(ByteOrder.LITTLE_ENDIAN);
        // RET 4 is the last word: tag 14 then immediate 4
        assertEquals(5 * 4, little.length);
        assertArrayEquals(new byte[]{0x0E, 0, 0x04, 0}, java.util.Arrays.copyOfRange(little, 16, 20));
    }

    @Test
    public void testFunctionAddressOfUnknownFunction() {
        CompiledProgram program = compile(LIGHTING);

        assertThrows(IllegalArgumentException.class, () -> program.functionAddress("missing"));
        assertNull(program.function("missing"));
    }

    @Test
    public void testEveryCallTargetsAFunctionEntry() {
        CompiledProgram program = compile(LIGHTING);

        for (Instruction instruction : InstructionDecoder.decodeAll(program.getCode())) {
            if (instruction.opcode() == Opcodes.CALL) {
                assertTrue(program.getFunctions().values().stream()
                        .anyMatch(f -> f.getAddress() == instruction.immediate()));
            }
            if (instruction.opcode() == Opcodes.CALL_NATIVE) {
                assertTrue(instruction.immediate() < program.getNativeImports().size());
            }
        }
    }

    @Test
    public void testDisassembly() {
        String listing = compile(LIGHTING).disassemble();

        assertTrue(listing.startsWith("=== Bytecode Disassembly ===\n"), listing);
        assertTrue(listing.contains("Static section: 12 bytes\n"), listing);
        assertTrue(listing.contains("Min stack size: 1036 bytes\n"), listing);
        assertTrue(listing.contains("\nclampish:\n   0: LOAD_LOCAL 0\n   1: CONST_F32 0.5\n"), listing);
        assertTrue(listing.contains("\nmain:\n"), listing);
        assertTrue(listing.contains("CALL_NATIVE 0  ; vec3.normalize"), listing);
        assertTrue(listing.contains("CALL_NATIVE 1  ; vec3.dot"), listing);
        assertTrue(listing.contains("CALL 0  ; clampish"), listing);
        assertTrue(listing.contains("STORE_GLOBAL 8\n"), listing);
    }

    @Test
    public void testMetadataJson() {
        CompiledProgram program = compile(LIGHTING);

        JSONObject json = JSON.parseObject(ProgramMetadataWriter.toJson(program, true));

        assertEquals(12, json.getIntValue("staticSectionSize"));
        assertEquals(1036, json.getIntValue("minStackSize"));
        assertEquals(program.codeLength(), json.getIntValue("codeLength"));

        JSONObject intensity = json.getJSONObject("globals").getJSONObject("intensity");
        assertEquals(8, intensity.getIntValue("offset"));
        assertTrue(intensity.getBooleanValue("static"));
        assertEquals("float", intensity.getString("type"));

        JSONObject main = json.getJSONObject("functions").getJSONObject("main");
        assertEquals(program.functionAddress("main"), main.getIntValue("address"));
        assertEquals(4, main.getIntValue("frameSize"));
        assertEquals(0, main.getJSONObject("locals").getJSONObject("d").getIntValue("offset"));
        assertFalse(main.getJSONObject("locals").getJSONObject("d").getBooleanValue("static"));

        assertEquals("vec3.normalize", json.getJSONArray("nativeImports").getString(0));
        assertEquals("vec3.dot", json.getJSONArray("nativeImports").getString(1));
    }

    @Test
    public void testCompactMetadataIsSingleLine() {
        String json = ProgramMetadataWriter.toJson(compile("in float a;"), false);

        assertFalse(json.contains("\n"));
        assertTrue(json.startsWith("{\"staticSectionSize\":4,"), json);
    }
}
