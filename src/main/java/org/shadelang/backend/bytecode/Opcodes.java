package org.shadelang.backend.bytecode;

/**
 * Bytecode opcodes for the ShadeLang virtual machine.
 *
 * Design: stack/accumulator machine with fixed-width 32-bit instruction words.
 * The opcode tag occupies bits 0-15 of a word and the immediate bits 16-31, so
 * every tag must fit 16 bits.
 *
 * Some opcodes are followed by raw operand words that carry no tag; consumers
 * must use {@link #trailingWords(int)} to step over them.
 *
 * Opcode Ranges:
 * - 0-3: integer arithmetic
 * - 4-7: float arithmetic
 * - 8-9: constants
 * - 10-13: memory
 * - 14-18: control
 */
public class Opcodes {
    // =================================================================
    // INTEGER ARITHMETIC (0-3)
    // =================================================================

    /** push(pop2 + pop1), 32-bit int */
    public static final short ADD_I32 = 0;

    /** push(pop2 - pop1), 32-bit int */
    public static final short SUB_I32 = 1;

    /** push(pop2 * pop1), 32-bit int */
    public static final short MUL_I32 = 2;

    /** push(pop2 / pop1), 32-bit int */
    public static final short DIV_I32 = 3;

    // =================================================================
    // FLOAT ARITHMETIC (4-7)
    // =================================================================

    /** push(pop2 + pop1), 32-bit float */
    public static final short ADD_F32 = 4;

    /** push(pop2 - pop1), 32-bit float */
    public static final short SUB_F32 = 5;

    /** push(pop2 * pop1), 32-bit float */
    public static final short MUL_F32 = 6;

    /** push(pop2 / pop1), 32-bit float */
    public static final short DIV_F32 = 7;

    // =================================================================
    // CONSTANTS (8-9)
    // =================================================================

    /** Push float constant. Followed by one raw word: the IEEE-754 single bit pattern */
    public static final short CONST_F32 = 8;

    /** Push the empty value */
    public static final short VOID = 9;

    // =================================================================
    // MEMORY (10-13) - immediate is a byte offset
    // =================================================================

    /** Pop into the current frame at offset immediate */
    public static final short STORE_LOCAL = 10;

    /** Push the 4-byte frame slot at offset immediate */
    public static final short LOAD_LOCAL = 11;

    /** Pop into the static section at offset immediate */
    public static final short STORE_GLOBAL = 12;

    /** Push the 4-byte static section slot at offset immediate */
    public static final short LOAD_GLOBAL = 13;

    // =================================================================
    // CONTROL (14-18)
    // =================================================================

    /** Return; immediate is the frame size in bytes to reclaim */
    public static final short RET = 14;

    /** Call the function whose first instruction is at index immediate */
    public static final short CALL = 15;

    /** Unconditional jump to index immediate. Reserved, never emitted */
    public static final short JMP = 16;

    /** Jump to index immediate if pop is true. Reserved, never emitted */
    public static final short JMP_IF = 17;

    /** Call native import number immediate */
    public static final short CALL_NATIVE = 18;

    public static final int OPCODE_COUNT = 19;

    private static final String[] NAMES = {
            "ADD_I32", "SUB_I32", "MUL_I32", "DIV_I32",
            "ADD_F32", "SUB_F32", "MUL_F32", "DIV_F32",
            "CONST_F32", "VOID",
            "STORE_LOCAL", "LOAD_LOCAL", "STORE_GLOBAL", "LOAD_GLOBAL",
            "RET", "CALL", "JMP", "JMP_IF", "CALL_NATIVE"
    };

    private static final boolean[] HAS_IMMEDIATE = new boolean[OPCODE_COUNT];

    static {
        for (short op : new short[]{STORE_LOCAL, LOAD_LOCAL, STORE_GLOBAL, LOAD_GLOBAL,
                RET, CALL, JMP, JMP_IF, CALL_NATIVE}) {
            HAS_IMMEDIATE[op] = true;
        }
    }

    // Prevent instantiation
    private Opcodes() {
    }

    public static boolean isValid(int tag) {
        return tag >= 0 && tag < OPCODE_COUNT;
    }

    public static String name(int tag) {
        return isValid(tag) ? NAMES[tag] : "UNKNOWN(" + tag + ")";
    }

    /**
     * Whether the opcode uses its immediate field.
     */
    public static boolean hasImmediate(int tag) {
        return isValid(tag) && HAS_IMMEDIATE[tag];
    }

    /**
     * Number of raw operand words that follow the opcode word.
     */
    public static int trailingWords(int tag) {
        return tag == CONST_F32 ? 1 : 0;
    }
}
