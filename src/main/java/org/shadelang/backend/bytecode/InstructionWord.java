package org.shadelang.backend.bytecode;

import org.shadelang.Configuration;

/**
 * Packing and unpacking of 32-bit instruction words.
 * <p>
 * Layout: opcode tag in bits 0-15, immediate in bits 16-31. Float operands are
 * carried as their raw IEEE-754 single-precision bit pattern.
 */
public final class InstructionWord {

    private InstructionWord() {
    }

    public static int encode(short opcode) {
        return encode(opcode, 0);
    }

    /**
     * Packs an opcode and a 16-bit immediate into one word.
     *
     * @throws IllegalArgumentException if the immediate does not fit 16 bits
     */
    public static int encode(short opcode, int immediate) {
        if (immediate < 0 || immediate > Configuration.MAX_IMMEDIATE) {
            throw new IllegalArgumentException("Immediate out of range: " + immediate);
        }
        return (opcode & 0xFFFF) | (immediate << 16);
    }

    public static int opcode(int word) {
        return word & 0xFFFF;
    }

    public static int immediate(int word) {
        return word >>> 16;
    }

    public static int floatBits(float value) {
        return Float.floatToRawIntBits(value);
    }

    public static float bitsToFloat(int word) {
        return Float.intBitsToFloat(word);
    }
}
