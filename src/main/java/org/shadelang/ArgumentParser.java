package org.shadelang;

import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * The ArgumentParser class parses command-line arguments and configures the
 * CompilerOptions accordingly.
 */
public class ArgumentParser {

    /**
     * Parses the command-line arguments and returns a CompilerOptions object
     * configured based on the provided arguments.
     *
     * @param args The command-line arguments to parse.
     * @return A CompilerOptions object with settings derived from the arguments.
     * @throws IllegalArgumentException on an unknown switch or a missing value
     * @throws IOException              if the source file cannot be read
     */
    public static CompilerOptions parseArguments(String[] args) throws IOException {
        CompilerOptions parsedArgs = new CompilerOptions();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-e":
                    parsedArgs.code = requireValue(args, ++i, arg);
                    if (parsedArgs.fileName == null) {
                        parsedArgs.fileName = "-e";
                    }
                    break;
                case "-o":
                    parsedArgs.outputFileName = requireValue(args, ++i, arg);
                    break;
                case "--debug":
                    parsedArgs.debugEnabled = true;
                    break;
                case "--tokenize":
                    parsedArgs.tokenizeOnly = true;
                    break;
                case "--parse":
                    parsedArgs.parseOnly = true;
                    break;
                case "--disassemble":
                    parsedArgs.disassembleEnabled = true;
                    break;
                case "--metadata":
                    parsedArgs.metadataEnabled = true;
                    break;
                case "--byte-order":
                    parsedArgs.byteOrder = parseByteOrder(requireValue(args, ++i, arg));
                    break;
                case "-v":
                case "--version":
                    parsedArgs.versionRequested = true;
                    break;
                case "-h":
                case "--help":
                    parsedArgs.helpRequested = true;
                    break;
                default:
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unrecognized switch: " + arg);
                    }
                    if (parsedArgs.code != null) {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
                    parsedArgs.fileName = arg;
                    parsedArgs.code = new String(Files.readAllBytes(Paths.get(arg)), StandardCharsets.UTF_8);
            }
        }
        return parsedArgs;
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static ByteOrder parseByteOrder(String value) {
        switch (value) {
            case "big":
                return ByteOrder.BIG_ENDIAN;
            case "little":
                return ByteOrder.LITTLE_ENDIAN;
            case "native":
                return ByteOrder.nativeOrder();
            default:
                throw new IllegalArgumentException("Byte order must be big, little or native: " + value);
        }
    }

    public static String usage() {
        return "Usage: shadelang [switches] [file]\n" +
                "  -e code              compile code from the command line\n" +
                "  -o file              write the bytecode image to file\n" +
                "  --byte-order order   big, little or native (default native)\n" +
                "  --disassemble        print the bytecode listing\n" +
                "  --metadata           print function and symbol tables as JSON\n" +
                "  --tokenize           print tokens and stop\n" +
                "  --parse              print the syntax tree and stop\n" +
                "  --debug              trace the compiler\n" +
                "  -v, --version        print the compiler version\n" +
                "  -h, --help           print this help\n";
    }
}
