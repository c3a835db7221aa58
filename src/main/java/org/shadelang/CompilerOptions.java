package org.shadelang;

import java.nio.ByteOrder;

/**
 * Per-run compiler settings, filled in by {@link ArgumentParser}.
 */
public class CompilerOptions implements Cloneable {
    public boolean debugEnabled = false;
    public boolean tokenizeOnly = false;
    public boolean parseOnly = false;
    public boolean disassembleEnabled = false;
    public boolean metadataEnabled = false;
    public boolean helpRequested = false;
    public boolean versionRequested = false;
    public String code = null;
    public String fileName = null;
    public String outputFileName = null;
    public ByteOrder byteOrder = ByteOrder.nativeOrder();

    /**
     * Prints the message when debug output is enabled.
     *
     * @param message the message to print
     */
    public void logDebug(String message) {
        if (this.debugEnabled) {
            System.out.println(message);
        }
    }

    @Override
    public CompilerOptions clone() {
        try {
            return (CompilerOptions) super.clone();
        } catch (CloneNotSupportedException e) {
            // This shouldn't happen, since we're implementing Cloneable
            throw new AssertionError();
        }
    }

    @Override
    public String toString() {
        return "CompilerOptions{\n" +
                "    debugEnabled=" + debugEnabled + ",\n" +
                "    tokenizeOnly=" + tokenizeOnly + ",\n" +
                "    parseOnly=" + parseOnly + ",\n" +
                "    disassembleEnabled=" + disassembleEnabled + ",\n" +
                "    metadataEnabled=" + metadataEnabled + ",\n" +
                "    fileName='" + fileName + "',\n" +
                "    outputFileName='" + outputFileName + "',\n" +
                "    byteOrder=" + byteOrder + "\n" +
                "}";
    }
}
