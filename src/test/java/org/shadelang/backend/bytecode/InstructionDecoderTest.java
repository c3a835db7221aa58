package org.shadelang.backend.bytecode;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InstructionDecoderTest {

    @Test
    public void testDecodeAllWalksOperandWords() {
        int[] code = {
                InstructionWord.encode(Opcodes.CONST_F32),
                InstructionWord.floatBits(2.5f),
                InstructionWord.encode(Opcodes.LOAD_LOCAL, 8),
                InstructionWord.encode(Opcodes.ADD_F32),
                InstructionWord.encode(Opcodes.RET, 12)
        };

        List<Instruction> instructions = InstructionDecoder.decodeAll(code);

        assertEquals(4, instructions.size());
        assertEquals(2.5f, instructions.get(0).floatOperand());
        assertEquals(2, instructions.get(0).length());
        assertEquals(2, instructions.get(1).pc());
        assertEquals(8, instructions.get(1).immediate());
        assertEquals("LOAD_LOCAL 8", instructions.get(1).toString());
        assertEquals("CONST_F32 2.5", instructions.get(0).toString());
        assertEquals("ADD_F32", instructions.get(2).toString());
        assertEquals(Opcodes.RET, instructions.get(3).opcode());
    }

    @Test
    public void testUnknownTagIsRejected() {
        int[] code = {InstructionWord.encode(Opcodes.VOID), 0x00050063};

        BytecodeFormatException e = assertThrows(BytecodeFormatException.class,
                () -> InstructionDecoder.decodeAll(code));
        assertEquals(1, e.getPc());
        assertTrue(e.getMessage().contains("Unknown opcode 99"));
    }

    @Test
    public void testMissingFloatOperand() {
        int[] code = {InstructionWord.encode(Opcodes.CONST_F32)};

        BytecodeFormatException e = assertThrows(BytecodeFormatException.class,
                () -> InstructionDecoder.decode(code, 0));
        assertTrue(e.getMessage().contains("CONST_F32 is missing its operand word"));
    }

    @Test
    public void testPcOutOfRange() {
        assertThrows(BytecodeFormatException.class, () -> InstructionDecoder.decode(new int[0], 0));
    }

    @Test
    public void testFloatOperandOnlyForConstants() {
        Instruction ret = InstructionDecoder.decode(new int[]{InstructionWord.encode(Opcodes.RET, 4)}, 0);

        assertThrows(IllegalStateException.class, ret::floatOperand);
    }
}
