package org.shadelang.backend.bytecode;

import org.shadelang.frontend.astnode.TypeKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-function metadata: the entry address, the signature, and the local table.
 * The address is fixed when the function's generation starts. Locals are added
 * by the {@link SymbolAllocator} while the function is being generated.
 */
public class FuncMeta {
    private final String name;
    private final int address;
    private final List<TypeKind> parameterTypes;
    private final TypeKind returnType;
    private final Map<String, SymbolMeta> symbols = new LinkedHashMap<>();
    private int frameSize;

    public FuncMeta(String name, int address, List<TypeKind> parameterTypes, TypeKind returnType) {
        this.name = name;
        this.address = address;
        this.parameterTypes = List.copyOf(parameterTypes);
        this.returnType = returnType;
    }

    public String getName() {
        return name;
    }

    /**
     * Index of the function's first instruction.
     */
    public int getAddress() {
        return address;
    }

    public List<TypeKind> getParameterTypes() {
        return parameterTypes;
    }

    public TypeKind getReturnType() {
        return returnType;
    }

    /**
     * Local table in allocation order, parameters first.
     */
    public Map<String, SymbolMeta> getSymbols() {
        return Collections.unmodifiableMap(symbols);
    }

    /**
     * Bytes of frame storage allocated so far.
     */
    public int getFrameSize() {
        return frameSize;
    }

    public SymbolMeta lookup(String name) {
        return symbols.get(name);
    }

    SymbolMeta define(String name, TypeKind typeKind, int slotSize) {
        SymbolMeta meta = new SymbolMeta(frameSize, false, typeKind);
        symbols.put(name, meta);
        frameSize += slotSize;
        return meta;
    }

    @Override
    public String toString() {
        return "FuncMeta{name=" + name + ", address=" + address + ", frameSize=" + frameSize + ", symbols=" + symbols + "}";
    }
}
