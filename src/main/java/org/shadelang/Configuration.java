package org.shadelang;

/**
 * Central configuration class for the ShadeLang toolchain.
 * Contains constants that fix the bytecode layout and the runtime contract
 * shared with the virtual machine.
 */
public final class Configuration {

    public static final String version = "0.3.0";

    // One instruction cell is a 32-bit word
    public static final int WORD_SIZE_BYTES = 4;

    // Every global or local name gets one 4-byte slot, whatever its declared type
    public static final int SLOT_SIZE_BYTES = 4;

    // Working stack added on top of the static section
    public static final int WORKING_STACK_MARGIN = 1024;

    // Immediates live in the high 16 bits of an instruction word
    public static final int MAX_IMMEDIATE = 0xFFFF;

    // Prevent instantiation
    private Configuration() {
    }
}
