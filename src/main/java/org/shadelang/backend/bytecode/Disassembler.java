package org.shadelang.backend.bytecode;

import java.util.HashMap;
import java.util.Map;

/**
 * Renders a compiled program as a readable listing.
 */
public final class Disassembler {

    private Disassembler() {
    }

    public static String disassemble(CompiledProgram program) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Bytecode Disassembly ===\n");
        sb.append("Static section: ").append(program.getStaticSectionSize()).append(" bytes\n");
        sb.append("Min stack size: ").append(program.getMinStackSize()).append(" bytes\n");
        sb.append("Code length: ").append(program.codeLength()).append(" words\n");

        Map<Integer, String> functionsByAddress = new HashMap<>();
        for (FuncMeta function : program.getFunctions().values()) {
            functionsByAddress.put(function.getAddress(), function.getName());
        }

        int[] code = program.getCode();
        int pc = 0;
        while (pc < code.length) {
            String functionName = functionsByAddress.get(pc);
            if (functionName != null) {
                sb.append("\n").append(functionName).append(":\n");
            }
            Instruction instruction = InstructionDecoder.decode(code, pc);
            sb.append(String.format("%4d: ", pc)).append(instruction);
            switch (instruction.opcode()) {
                case Opcodes.CALL -> {
                    String target = functionsByAddress.get(instruction.immediate());
                    if (target != null) {
                        sb.append("  ; ").append(target);
                    }
                }
                case Opcodes.CALL_NATIVE -> {
                    if (instruction.immediate() < program.getNativeImports().size()) {
                        sb.append("  ; ").append(program.getNativeImports().get(instruction.immediate()).handle());
                    }
                }
                default -> {
                }
            }
            sb.append("\n");
            pc += instruction.length();
        }
        return sb.toString();
    }
}
