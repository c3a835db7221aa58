package org.shadelang.backend.bytecode;

import org.shadelang.Configuration;
import org.shadelang.runtime.builtins.BuiltinFunction;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The compiled unit handed to the virtual machine: the instruction stream, the
 * global symbol table, the function table, the native import table, and the
 * storage the VM must provide.
 * <p>
 * A host drives a shader by writing in-parameters into the static section at
 * their global offsets, calling a function by its address, and reading the
 * out-parameters back.
 */
public class CompiledProgram {
    private final int[] code;
    private final Map<String, SymbolMeta> globalSymbols;
    private final Map<String, FuncMeta> functions;
    private final List<BuiltinFunction> nativeImports;
    private final int staticSectionSize;
    private final int minStackSize;

    public CompiledProgram(int[] code, Map<String, SymbolMeta> globalSymbols, Map<String, FuncMeta> functions,
                           List<BuiltinFunction> nativeImports, int staticSectionSize, int minStackSize) {
        this.code = code.clone();
        this.globalSymbols = Collections.unmodifiableMap(new LinkedHashMap<>(globalSymbols));
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.nativeImports = List.copyOf(nativeImports);
        this.staticSectionSize = staticSectionSize;
        this.minStackSize = minStackSize;
    }

    public int[] getCode() {
        return code.clone();
    }

    public int codeLength() {
        return code.length;
    }

    public int word(int index) {
        return code[index];
    }

    /**
     * Globals in static-section order.
     */
    public Map<String, SymbolMeta> getGlobalSymbols() {
        return globalSymbols;
    }

    public SymbolMeta globalSymbol(String name) {
        return globalSymbols.get(name);
    }

    /**
     * Functions in generation order.
     */
    public Map<String, FuncMeta> getFunctions() {
        return functions;
    }

    public FuncMeta function(String name) {
        return functions.get(name);
    }

    /**
     * Entry instruction index of the named function.
     *
     * @throws IllegalArgumentException if there is no such function
     */
    public int functionAddress(String name) {
        FuncMeta function = functions.get(name);
        if (function == null) {
            throw new IllegalArgumentException("No function named '" + name + "'");
        }
        return function.getAddress();
    }

    /**
     * Native functions in import-slot order; {@code CALL_NATIVE n} calls entry n.
     */
    public List<BuiltinFunction> getNativeImports() {
        return nativeImports;
    }

    public int getStaticSectionSize() {
        return staticSectionSize;
    }

    public int getMinStackSize() {
        return minStackSize;
    }

    /**
     * Serializes the instruction stream, one 4-byte word per cell.
     *
     * @param order byte order of the consuming machine
     */
    public byte[] toByteArray(ByteOrder order) {
        ByteBuffer buffer = ByteBuffer.allocate(code.length * Configuration.WORD_SIZE_BYTES).order(order);
        for (int word : code) {
            buffer.putInt(word);
        }
        return buffer.array();
    }

    public String disassemble() {
        return Disassembler.disassemble(this);
    }
}
