package org.shadelang.backend.bytecode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Decodes instruction words, validating opcode tags.
 */
public final class InstructionDecoder {

    private InstructionDecoder() {
    }

    /**
     * Decodes the instruction starting at {@code pc}.
     *
     * @throws BytecodeFormatException if the tag is unknown or operand words are missing
     */
    public static Instruction decode(int[] code, int pc) {
        if (pc < 0 || pc >= code.length) {
            throw new BytecodeFormatException(pc, "No instruction");
        }
        int word = code[pc];
        int tag = InstructionWord.opcode(word);
        if (!Opcodes.isValid(tag)) {
            throw new BytecodeFormatException(pc, "Unknown opcode " + tag);
        }
        int trailing = Opcodes.trailingWords(tag);
        if (pc + trailing >= code.length) {
            throw new BytecodeFormatException(pc, Opcodes.name(tag) + " is missing its operand word");
        }
        int[] operands = Arrays.copyOfRange(code, pc + 1, pc + 1 + trailing);
        return new Instruction(pc, (short) tag, InstructionWord.immediate(word), operands);
    }

    /**
     * Decodes a whole code array from index 0.
     */
    public static List<Instruction> decodeAll(int[] code) {
        List<Instruction> instructions = new ArrayList<>();
        int pc = 0;
        while (pc < code.length) {
            Instruction instruction = decode(code, pc);
            instructions.add(instruction);
            pc += instruction.length();
        }
        return instructions;
    }
}
