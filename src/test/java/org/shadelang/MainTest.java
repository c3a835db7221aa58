package org.shadelang;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    private PrintStream originalOut;
    private PrintStream originalErr;
    private ByteArrayOutputStream outputStream;
    private ByteArrayOutputStream errorStream;

    @BeforeEach
    void setUp() {
        originalOut = System.out;
        originalErr = System.err;
        outputStream = new ByteArrayOutputStream();
        errorStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream));
        System.setErr(new PrintStream(errorStream));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    public void testDisassembleAndMetadata() {
        int status = Main.run(new String[]{"--disassemble", "--metadata", "-e",
                "in float a; out float b; fn main() { b = a * 2.0; }"});

        assertEquals(0, status);
        String output = outputStream.toString();
        assertTrue(output.contains("=== Bytecode Disassembly ==="), output);
        assertTrue(output.contains("STORE_GLOBAL 4"), output);
        assertTrue(output.matches("(?s).*\"minStackSize\":\\s*1032.*"), output);
    }

    @Test
    public void testWritesBytecodeImage(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("shader.bin");

        int status = Main.run(new String[]{"-o", out.toString(), "--byte-order", "big", "-e",
                "fn main() { return 3.5; }"});

        assertEquals(0, status);
        byte[] bytes = Files.readAllBytes(out);
        assertEquals(12, bytes.length);
        // CONST_F32, then 3.5f = 0x40600000
        assertArrayEquals(new byte[]{0, 0, 0, 8, 0x40, 0x60, 0, 0, 0, 0, 0, 14}, bytes);
    }

    @Test
    public void testTokenizeAndParse() {
        assertEquals(0, Main.run(new String[]{"--tokenize", "-e", "in float a;"}));
        assertTrue(outputStream.toString().contains("type=IDENTIFIER, text='float'"));

        assertEquals(0, Main.run(new String[]{"--parse", "-e", "fn f() { return 1.0; }"}));
        assertTrue(outputStream.toString().contains("FunctionNode: f -> float"));
    }

    @Test
    public void testCompileErrorExitsWithOne() {
        assertEquals(1, Main.run(new String[]{"-e", "fn main() { return nope; }"}));
        assertTrue(errorStream.toString().startsWith("Unknown symbol: nope at -e line 1"), errorStream.toString());
    }

    @Test
    public void testSyntaxErrorExitsWithOne() {
        assertEquals(1, Main.run(new String[]{"-e", "fn main( { }"}));
        assertTrue(errorStream.toString().contains("at -e line 1"));
    }

    @Test
    public void testUsageErrors() {
        assertEquals(2, Main.run(new String[0]));
        assertTrue(errorStream.toString().contains("No source given"));
        assertEquals(2, Main.run(new String[]{"--bogus"}));
        assertTrue(errorStream.toString().contains("Unrecognized switch: --bogus"));
    }

    @Test
    public void testHelp() {
        assertEquals(0, Main.run(new String[]{"--help"}));
        assertTrue(outputStream.toString().startsWith("Usage: shadelang"));
    }

    @Test
    public void testVersion() {
        assertEquals(0, Main.run(new String[]{"--version"}));
        assertEquals("ShadeLang " + Configuration.version, outputStream.toString().trim());
    }

    @Test
    public void testDebugTrace() {
        assertEquals(0, Main.run(new String[]{"--debug", "-e", "fn main() { x = 1.0; return x; }"}));

        String output = outputStream.toString();
        assertTrue(output.contains("codegen function main at 0"), output);
        assertTrue(output.contains("local x at 0"), output);
    }
}
