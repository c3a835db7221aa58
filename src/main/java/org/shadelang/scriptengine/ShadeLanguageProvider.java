package org.shadelang.scriptengine;

import org.shadelang.CompilerOptions;
import org.shadelang.backend.bytecode.BytecodeCompiler;
import org.shadelang.backend.bytecode.CompiledProgram;
import org.shadelang.backend.bytecode.CompilerSession;
import org.shadelang.frontend.analysis.ConstantFoldingVisitor;
import org.shadelang.frontend.astnode.ProgramNode;
import org.shadelang.frontend.lexer.Lexer;
import org.shadelang.frontend.lexer.LexerToken;
import org.shadelang.frontend.parser.Parser;
import org.shadelang.runtime.ErrorMessageUtil;
import org.shadelang.runtime.builtins.BuiltinRegistry;

import java.util.List;

/**
 * The ShadeLanguageProvider runs the compilation pipeline:
 * tokenize, parse, fold constants, generate code.
 * <p>
 * Every call is self-contained: it creates its own session, tables and registry,
 * so compilations share no mutable state. A failure at any stage propagates as
 * an exception and no artifact is returned.
 */
public class ShadeLanguageProvider {

    /**
     * Compiles the source text held in the options.
     *
     * @param compilerOptions compiler flags, file name and source code
     * @return the compiled program
     */
    public static CompiledProgram compile(CompilerOptions compilerOptions) {
        List<LexerToken> tokens = tokenize(compilerOptions.code);
        ErrorMessageUtil errorUtil = new ErrorMessageUtil(compilerOptions.fileName, tokens);
        ProgramNode program = parse(tokens, errorUtil);
        compilerOptions.logDebug("parsed:\n" + program);
        return compile(program, compilerOptions, errorUtil);
    }

    /**
     * Folds and compiles an already parsed program.
     *
     * @param program         the syntax tree; folded in place
     * @param compilerOptions compiler flags
     * @param errorUtil       error formatter for the program's source, may be null
     * @return the compiled program
     */
    public static CompiledProgram compile(ProgramNode program, CompilerOptions compilerOptions,
                                          ErrorMessageUtil errorUtil) {
        ConstantFoldingVisitor.fold(program, errorUtil);
        compilerOptions.logDebug("folded:\n" + program);

        CompilerSession session = new CompilerSession(program, BuiltinRegistry.createDefault());
        BytecodeCompiler compiler = new BytecodeCompiler(session, errorUtil, compilerOptions);
        CompiledProgram compiled = compiler.compile(program);
        compilerOptions.logDebug("compiled " + compiled.codeLength() + " words, "
                + compiled.getFunctions().size() + " functions");
        return compiled;
    }

    public static List<LexerToken> tokenize(String code) {
        return new Lexer(code).tokenize();
    }

    public static ProgramNode parse(CompilerOptions compilerOptions) {
        List<LexerToken> tokens = tokenize(compilerOptions.code);
        return parse(tokens, new ErrorMessageUtil(compilerOptions.fileName, tokens));
    }

    private static ProgramNode parse(List<LexerToken> tokens, ErrorMessageUtil errorUtil) {
        return new Parser(tokens, errorUtil).parse();
    }
}
