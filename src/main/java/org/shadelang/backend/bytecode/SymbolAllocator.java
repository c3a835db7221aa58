package org.shadelang.backend.bytecode;

import org.shadelang.Configuration;
import org.shadelang.frontend.astnode.ParameterNode;
import org.shadelang.frontend.astnode.ProgramNode;
import org.shadelang.frontend.astnode.TypeKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assigns storage offsets to names.
 * <p>
 * Globals are laid out once, in declaration order, in-parameters before
 * out-parameters, one slot each starting at offset 0 of the static section.
 * Locals are laid out per function from frame offset 0, in the order they are
 * introduced. Every name takes {@link Configuration#SLOT_SIZE_BYTES} bytes
 * whatever its type.
 * <p>
 * Names are trusted to be unique within a scope; the parser checks that.
 */
public class SymbolAllocator {
    private final Map<String, SymbolMeta> globalSymbols = new LinkedHashMap<>();
    private int staticSectionSize = 0;

    public SymbolAllocator(ProgramNode program) {
        for (ParameterNode in : program.inParameters) {
            addGlobal(in.name, in.typeKind);
        }
        for (ParameterNode out : program.outParameters) {
            addGlobal(out.name, out.typeKind);
        }
    }

    private void addGlobal(String name, TypeKind typeKind) {
        globalSymbols.put(name, new SymbolMeta(staticSectionSize, true, typeKind));
        staticSectionSize += Configuration.SLOT_SIZE_BYTES;
    }

    /**
     * Looks up a global.
     *
     * @return the global's storage, or null if the name is not a global
     */
    public SymbolMeta global(String name) {
        return globalSymbols.get(name);
    }

    /**
     * Resolves a name as seen from inside a function: locals first, then globals.
     *
     * @return the storage, or null if the name is unknown
     */
    public SymbolMeta resolve(FuncMeta function, String name) {
        SymbolMeta local = function.lookup(name);
        return local != null ? local : globalSymbols.get(name);
    }

    /**
     * Gives a name the next free slot of the function's frame.
     */
    public SymbolMeta allocateLocal(FuncMeta function, String name, TypeKind typeKind) {
        return function.define(name, typeKind, Configuration.SLOT_SIZE_BYTES);
    }

    public Map<String, SymbolMeta> getGlobalSymbols() {
        return Collections.unmodifiableMap(globalSymbols);
    }

    public int getStaticSectionSize() {
        return staticSectionSize;
    }
}
