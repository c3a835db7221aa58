package org.shadelang.backend.bytecode;

import org.shadelang.CompilerOptions;
import org.shadelang.Configuration;
import org.shadelang.frontend.analysis.ConstantFoldingVisitor;
import org.shadelang.frontend.analysis.Visitor;
import org.shadelang.frontend.astnode.*;
import org.shadelang.runtime.ErrorMessageUtil;
import org.shadelang.runtime.builtins.BuiltinFunction;
import org.shadelang.runtime.builtins.BuiltinRegistry;
import org.shadelang.runtime.builtins.OperationBinding;
import org.shadelang.runtime.runtimetypes.ErrorKind;
import org.shadelang.runtime.runtimetypes.ShadeCompilerException;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * BytecodeCompiler traverses the syntax tree and generates VM bytecode.
 *
 * Key responsibilities:
 * - Lay out globals and, per function, locals through the {@link SymbolAllocator}
 * - Fix each function's address when its generation starts
 * - Lower expressions post-order onto the evaluation stack, operands left to right
 * - Dispatch operators and builtin calls on the static types of their operands
 * - Reject stores and returns whose value type differs from the declared type
 *
 * Calling convention: the caller pushes arguments left to right and emits
 * {@code CALL address}. The callee's parameters are its first locals, in order,
 * so argument 0 lives at frame offset 0.
 *
 * Any error aborts the compilation. Before it propagates, the instruction stream
 * is cut back to the start of the statement being lowered.
 */
public class BytecodeCompiler implements Visitor {
    private final InstructionStream code = new InstructionStream();
    private final CompilerSession session;
    private final SymbolAllocator allocator;
    private final BuiltinRegistry registry;

    // Error reporting
    private final ErrorMessageUtil errorUtil;
    private final CompilerOptions options;

    private FuncMeta currentFunction;
    private boolean hasReturn;

    // Static type of the value the last lowered expression left on the stack
    private TypeKind lastResultType;

    public BytecodeCompiler(CompilerSession session, ErrorMessageUtil errorUtil, CompilerOptions options) {
        this.session = session;
        this.allocator = session.getAllocator();
        this.registry = session.getRegistry();
        this.errorUtil = errorUtil;
        this.options = options;
    }

    /**
     * Generates code for every function of the program.
     *
     * @param program a folded, validated program
     * @return the compiled artifact
     */
    public CompiledProgram compile(ProgramNode program) {
        program.accept(this);

        int staticSectionSize = allocator.getStaticSectionSize();
        return new CompiledProgram(
                code.toArray(),
                allocator.getGlobalSymbols(),
                session.getFunctions(),
                session.getNativeImports(),
                staticSectionSize,
                staticSectionSize + Configuration.WORKING_STACK_MARGIN);
    }

    /**
     * The words emitted so far, including after a failed compile.
     */
    public InstructionStream getCode() {
        return code;
    }

    @Override
    public void visit(ProgramNode node) {
        for (FunctionNode function : node.functions) {
            function.accept(this);
        }
    }

    @Override
    public void visit(ParameterNode node) {
        // Parameters are laid out by the allocator, not lowered
    }

    @Override
    public void visit(FunctionNode node) {
        List<TypeKind> parameterTypes = new ArrayList<>();
        for (ParameterNode parameter : node.parameters) {
            parameterTypes.add(parameter.typeKind);
        }
        currentFunction = new FuncMeta(node.name, code.size(), parameterTypes, node.returnType);
        hasReturn = false;
        session.registerFunction(currentFunction);
        options.logDebug("codegen function " + node.name + " at " + currentFunction.getAddress());

        for (ParameterNode parameter : node.parameters) {
            allocator.allocateLocal(currentFunction, parameter.name, parameter.typeKind);
        }

        for (StatementNode statement : node.statements) {
            int statementStart = code.size();
            try {
                statement.accept(this);
            } catch (ShadeCompilerException e) {
                code.truncate(statementStart);
                throw e;
            }
        }

        if (!hasReturn) {
            int returnStart = code.size();
            try {
                code.emit(Opcodes.VOID);
                emitWithImmediate(Opcodes.RET, currentFunction.getFrameSize(), node.tokenIndex);
            } catch (ShadeCompilerException e) {
                code.truncate(returnStart);
                throw e;
            }
        }
        options.logDebug("  frame size " + currentFunction.getFrameSize() + ", ends at " + code.size());
    }

    @Override
    public void visit(AssignmentNode node) {
        node.expression.accept(this);

        SymbolMeta local = currentFunction.lookup(node.target);
        if (local != null) {
            checkType(local.typeKind(), node.target, node);
            emitWithImmediate(Opcodes.STORE_LOCAL, local.offset(), node.tokenIndex);
            return;
        }
        SymbolMeta global = allocator.global(node.target);
        if (global != null) {
            checkType(global.typeKind(), node.target, node);
            emitWithImmediate(Opcodes.STORE_GLOBAL, global.offset(), node.tokenIndex);
            return;
        }
        SymbolMeta fresh = allocator.allocateLocal(currentFunction, node.target, lastResultType);
        options.logDebug("  local " + node.target + " at " + fresh.offset());
        emitWithImmediate(Opcodes.STORE_LOCAL, fresh.offset(), node.tokenIndex);
    }

    @Override
    public void visit(ReturnNode node) {
        node.expression.accept(this);
        if (lastResultType != currentFunction.getReturnType()) {
            throw error(ErrorKind.TYPE_MISMATCH, currentFunction.getName(), node,
                    "Function '" + currentFunction.getName() + "' returns " + currentFunction.getReturnType().keyword()
                            + " but the expression is " + lastResultType.keyword());
        }
        emitWithImmediate(Opcodes.RET, currentFunction.getFrameSize(), node.tokenIndex);
        hasReturn = true;
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        node.left.accept(this);
        TypeKind leftType = lastResultType;
        node.right.accept(this);
        TypeKind rightType = lastResultType;

        OperationBinding binding = registry.resolveBinary(node.operator, leftType, rightType);
        if (binding == null) {
            throw error(ErrorKind.UNSUPPORTED_EXPRESSION, null, node,
                    "Operator '" + node.operator.symbol() + "' is not defined for ("
                            + leftType.keyword() + ", " + rightType.keyword() + ")");
        }
        emitBinding(binding, node);
    }

    @Override
    public void visit(UnaryOperatorNode node) {
        if (node.operator != UnaryOperator.NEG) {
            throw error(ErrorKind.UNSUPPORTED_EXPRESSION, null, node,
                    "Unsupported unary operator '" + node.operator.symbol() + "'");
        }
        // Negation is multiplication by -1.0
        node.operand.accept(this);
        TypeKind operandType = lastResultType;
        OperationBinding binding = registry.resolveBinary(BinaryOperator.MUL, operandType, TypeKind.F32);
        if (binding == null) {
            throw error(ErrorKind.UNSUPPORTED_EXPRESSION, null, node,
                    "Negation is not defined for " + operandType.keyword());
        }
        code.emitFloat(-1.0f);
        emitBinding(binding, node);
    }

    @Override
    public void visit(CallNode node) {
        FuncMeta function = session.function(node.callee);
        if (function != null) {
            List<TypeKind> argumentTypes = lowerArguments(node);
            if (!argumentTypes.equals(function.getParameterTypes())) {
                throw error(ErrorKind.ARGUMENT_MISMATCH, node.callee, node,
                        "Function '" + node.callee + "' expects " + signature(function.getParameterTypes())
                                + " but was called with " + signature(argumentTypes));
            }
            emitWithImmediate(Opcodes.CALL, function.getAddress(), node.tokenIndex);
            lastResultType = function.getReturnType();
            return;
        }

        if (registry.hasFunction(node.callee)) {
            List<TypeKind> argumentTypes = lowerArguments(node);
            BuiltinFunction builtin = registry.resolveFunction(node.callee, argumentTypes);
            if (builtin == null) {
                String candidates = registry.overloads(node.callee).stream()
                        .map(f -> signature(f.parameterTypes()))
                        .collect(Collectors.joining(", "));
                throw error(ErrorKind.ARGUMENT_MISMATCH, node.callee, node,
                        "No overload of '" + node.callee + "' takes " + signature(argumentTypes)
                                + "; candidates: " + candidates);
            }
            emitBinding(OperationBinding.nativeCall(builtin), node);
            return;
        }

        throw error(ErrorKind.UNRESOLVED_FUNCTION, node.callee, node, "Unknown function: " + node.callee);
    }

    @Override
    public void visit(LiteralNode node) {
        if (node.kind != LiteralKind.DECIMAL) {
            throw error(ErrorKind.UNSUPPORTED_EXPRESSION, null, node,
                    "Unsupported " + node.kind.name().toLowerCase() + " literal");
        }
        float value = (float) node.value;
        if (!Float.isFinite(value)) {
            throw error(ErrorKind.FOLDING, null, node, ConstantFoldingVisitor.FLOAT_OVERFLOW);
        }
        code.emitFloat(value);
        lastResultType = TypeKind.F32;
    }

    @Override
    public void visit(SymbolNode node) {
        SymbolMeta symbol = allocator.resolve(currentFunction, node.name);
        if (symbol == null) {
            throw error(ErrorKind.UNRESOLVED_SYMBOL, node.name, node, "Unknown symbol: " + node.name);
        }
        emitWithImmediate(symbol.isStatic() ? Opcodes.LOAD_GLOBAL : Opcodes.LOAD_LOCAL,
                symbol.offset(), node.tokenIndex);
        lastResultType = symbol.typeKind();
    }

    private List<TypeKind> lowerArguments(CallNode node) {
        List<TypeKind> types = new ArrayList<>();
        for (ExpressionNode argument : node.arguments) {
            argument.accept(this);
            types.add(lastResultType);
        }
        return types;
    }

    private void emitBinding(OperationBinding binding, ExpressionNode node) {
        if (binding.isInline()) {
            code.emit(binding.opcode());
        } else {
            emitWithImmediate(Opcodes.CALL_NATIVE, session.nativeImport(binding.function()), node.tokenIndex);
        }
        lastResultType = binding.resultType();
    }

    private void emitWithImmediate(short opcode, int immediate, int tokenIndex) {
        if (immediate > Configuration.MAX_IMMEDIATE) {
            throw new ShadeCompilerException(ErrorKind.OPERAND_OVERFLOW, null, tokenIndex,
                    Opcodes.name(opcode) + " operand " + immediate + " does not fit 16 bits", errorUtil);
        }
        code.emit(opcode, immediate);
    }

    // Stored values keep the type the symbol was declared or first assigned with
    private void checkType(TypeKind expected, String name, Node node) {
        if (lastResultType != expected) {
            throw error(ErrorKind.TYPE_MISMATCH, name, node,
                    "Cannot assign " + lastResultType.keyword() + " to '" + name + "' of type " + expected.keyword());
        }
    }

    private static String signature(List<TypeKind> types) {
        return types.stream().map(TypeKind::keyword).collect(Collectors.joining(", ", "(", ")"));
    }

    private ShadeCompilerException error(ErrorKind kind, String name, Node node, String message) {
        return new ShadeCompilerException(kind, name, node.getIndex(), message, errorUtil);
    }
}
