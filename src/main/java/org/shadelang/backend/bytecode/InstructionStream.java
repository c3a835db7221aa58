package org.shadelang.backend.bytecode;

import java.util.Arrays;

/**
 * Append-only buffer of instruction words.
 */
public class InstructionStream {
    // Typical small shader needs a few dozen words
    private int[] words = new int[64];
    private int size = 0;

    /**
     * Index the next word will be written at.
     */
    public int size() {
        return size;
    }

    public void emit(short opcode) {
        add(InstructionWord.encode(opcode));
    }

    public void emit(short opcode, int immediate) {
        add(InstructionWord.encode(opcode, immediate));
    }

    /**
     * Appends an untagged operand word.
     */
    public void emitRaw(int word) {
        add(word);
    }

    public void emitFloat(float value) {
        emit(Opcodes.CONST_F32);
        emitRaw(InstructionWord.floatBits(value));
    }

    public int get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + size);
        }
        return words[index];
    }

    /**
     * Drops every word from {@code newSize} on.
     */
    public void truncate(int newSize) {
        if (newSize < 0 || newSize > size) {
            throw new IllegalArgumentException("Cannot truncate " + size + " words to " + newSize);
        }
        size = newSize;
    }

    public int[] toArray() {
        return Arrays.copyOf(words, size);
    }

    private void add(int word) {
        if (size == words.length) {
            words = Arrays.copyOf(words, size * 2);
        }
        words[size++] = word;
    }
}
