package org.shadelang;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ArgumentParserTest {

    @Test
    public void testInlineCode() throws IOException {
        CompilerOptions options = ArgumentParser.parseArguments(
                new String[]{"--disassemble", "-e", "fn f() { }", "--byte-order", "big", "-o", "out.bin"});

        assertEquals("fn f() { }", options.code);
        assertEquals("-e", options.fileName);
        assertTrue(options.disassembleEnabled);
        assertFalse(options.metadataEnabled);
        assertEquals(ByteOrder.BIG_ENDIAN, options.byteOrder);
        assertEquals("out.bin", options.outputFileName);
    }

    @Test
    public void testDefaults() throws IOException {
        CompilerOptions options = ArgumentParser.parseArguments(new String[0]);

        assertNull(options.code);
        assertEquals(ByteOrder.nativeOrder(), options.byteOrder);
        assertFalse(options.debugEnabled);
    }

    @Test
    public void testSourceFile(@TempDir Path dir) throws IOException {
        Path source = dir.resolve("shader.shd");
        Files.write(source, "in float a;\n".getBytes(StandardCharsets.UTF_8));

        CompilerOptions options = ArgumentParser.parseArguments(
                new String[]{"--metadata", "--byte-order", "little", source.toString()});

        assertEquals("in float a;\n", options.code);
        assertEquals(source.toString(), options.fileName);
        assertTrue(options.metadataEnabled);
        assertEquals(ByteOrder.LITTLE_ENDIAN, options.byteOrder);
    }

    @Test
    public void testMissingFile(@TempDir Path dir) {
        assertThrows(IOException.class,
                () -> ArgumentParser.parseArguments(new String[]{dir.resolve("none.shd").toString()}));
    }

    @Test
    public void testBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> ArgumentParser.parseArguments(new String[]{"--fast"}));
        assertThrows(IllegalArgumentException.class, () -> ArgumentParser.parseArguments(new String[]{"-o"}));
        assertThrows(IllegalArgumentException.class,
                () -> ArgumentParser.parseArguments(new String[]{"--byte-order", "middle"}));
        assertThrows(IllegalArgumentException.class,
                () -> ArgumentParser.parseArguments(new String[]{"-e", "fn f() { }", "extra.shd"}));
    }

    @Test
    public void testOptionsClone() throws IOException {
        CompilerOptions options = ArgumentParser.parseArguments(new String[]{"--debug", "-e", "in float a;"});
        CompilerOptions copy = options.clone();
        copy.debugEnabled = false;

        assertTrue(options.debugEnabled);
        assertEquals(options.code, copy.code);
        assertTrue(options.toString().contains("debugEnabled=true"));
    }
}
