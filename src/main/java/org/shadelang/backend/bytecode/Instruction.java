package org.shadelang.backend.bytecode;

/**
 * One decoded instruction: the opcode word plus its trailing operand words.
 *
 * @param pc           index of the opcode word in the code array
 * @param opcode       validated opcode tag
 * @param immediate    the 16-bit immediate
 * @param operandWords raw words that followed the opcode word
 */
public record Instruction(int pc, short opcode, int immediate, int[] operandWords) {

    /**
     * Number of words this instruction occupies.
     */
    public int length() {
        return 1 + operandWords.length;
    }

    /**
     * The float operand of a {@code CONST_F32}.
     */
    public float floatOperand() {
        if (opcode != Opcodes.CONST_F32) {
            throw new IllegalStateException(Opcodes.name(opcode) + " has no float operand");
        }
        return InstructionWord.bitsToFloat(operandWords[0]);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(Opcodes.name(opcode));
        if (Opcodes.hasImmediate(opcode)) {
            sb.append(' ').append(immediate);
        }
        if (opcode == Opcodes.CONST_F32) {
            sb.append(' ').append(floatOperand());
        }
        return sb.toString();
    }
}
