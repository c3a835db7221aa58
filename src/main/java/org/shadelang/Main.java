package org.shadelang;

import org.shadelang.backend.bytecode.CompiledProgram;
import org.shadelang.backend.bytecode.ProgramMetadataWriter;
import org.shadelang.frontend.lexer.LexerToken;
import org.shadelang.runtime.runtimetypes.ShadeCompilerException;
import org.shadelang.runtime.runtimetypes.ShadeParserException;
import org.shadelang.scriptengine.ShadeLanguageProvider;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Command-line entry point of the ShadeLang compiler.
 */
public class Main {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the compiler and returns the process exit status.
     */
    public static int run(String[] args) {
        CompilerOptions options;
        try {
            options = ArgumentParser.parseArguments(args);
        } catch (IllegalArgumentException | IOException e) {
            System.err.println(e.getMessage());
            System.err.print(ArgumentParser.usage());
            return 2;
        }
        if (options.helpRequested) {
            System.out.print(ArgumentParser.usage());
            return 0;
        }
        if (options.versionRequested) {
            System.out.println("ShadeLang " + Configuration.version);
            return 0;
        }
        if (options.code == null) {
            System.err.println("No source given");
            System.err.print(ArgumentParser.usage());
            return 2;
        }
        options.logDebug(options.toString());

        try {
            if (options.tokenizeOnly) {
                for (LexerToken token : ShadeLanguageProvider.tokenize(options.code)) {
                    System.out.println(token);
                }
                return 0;
            }
            if (options.parseOnly) {
                System.out.print(ShadeLanguageProvider.parse(options));
                return 0;
            }

            CompiledProgram program = ShadeLanguageProvider.compile(options);
            if (options.disassembleEnabled) {
                System.out.print(program.disassemble());
            }
            if (options.metadataEnabled) {
                System.out.println(ProgramMetadataWriter.toJson(program, true));
            }
            if (options.outputFileName != null) {
                Files.write(Paths.get(options.outputFileName), program.toByteArray(options.byteOrder));
                options.logDebug("wrote " + options.outputFileName);
            }
            return 0;
        } catch (ShadeParserException | ShadeCompilerException e) {
            System.err.print(e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("Cannot write " + options.outputFileName + ": " + e.getMessage());
            return 1;
        }
    }
}
