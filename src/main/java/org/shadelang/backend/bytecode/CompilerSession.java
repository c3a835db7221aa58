package org.shadelang.backend.bytecode;

import org.shadelang.frontend.astnode.ProgramNode;
import org.shadelang.runtime.builtins.BuiltinFunction;
import org.shadelang.runtime.builtins.BuiltinRegistry;

import java.util.*;

/**
 * State owned by exactly one compilation: the symbol allocator, the function
 * table, the native import table and the sequence counter that numbers imports.
 * A session is created per compile call and never shared.
 */
public class CompilerSession {
    private final BuiltinRegistry registry;
    private final SymbolAllocator allocator;
    private final Map<String, FuncMeta> functions = new LinkedHashMap<>();
    private final Map<String, Integer> nativeImportIndex = new HashMap<>();
    private final List<BuiltinFunction> nativeImports = new ArrayList<>();
    private int sequence = 0;

    public CompilerSession(ProgramNode program, BuiltinRegistry registry) {
        this.registry = registry;
        this.allocator = new SymbolAllocator(program);
    }

    public BuiltinRegistry getRegistry() {
        return registry;
    }

    public SymbolAllocator getAllocator() {
        return allocator;
    }

    /**
     * Returns the next value of the session's sequence counter.
     */
    public int nextSequence() {
        return sequence++;
    }

    public void registerFunction(FuncMeta function) {
        functions.put(function.getName(), function);
    }

    /**
     * Looks up a function whose generation has started, or null.
     */
    public FuncMeta function(String name) {
        return functions.get(name);
    }

    public Map<String, FuncMeta> getFunctions() {
        return Collections.unmodifiableMap(functions);
    }

    /**
     * Returns the import slot of a native function, adding it on first use.
     */
    public int nativeImport(BuiltinFunction function) {
        Integer index = nativeImportIndex.get(function.handle());
        if (index == null) {
            index = nextSequence();
            nativeImportIndex.put(function.handle(), index);
            nativeImports.add(function);
        }
        return index;
    }

    public List<BuiltinFunction> getNativeImports() {
        return Collections.unmodifiableList(nativeImports);
    }
}
