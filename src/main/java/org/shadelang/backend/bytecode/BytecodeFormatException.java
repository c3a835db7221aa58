package org.shadelang.backend.bytecode;

import java.io.Serial;

/**
 * Thrown when a code array does not decode: an unknown opcode tag, or an
 * instruction whose operand words run past the end of the code.
 */
public class BytecodeFormatException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final int pc;

    public BytecodeFormatException(int pc, String message) {
        super(message + " at pc " + pc);
        this.pc = pc;
    }

    public int getPc() {
        return pc;
    }
}
