package org.shadelang.runtime.runtimetypes;

import org.shadelang.runtime.ErrorMessageUtil;

import java.io.Serial;

/**
 * ShadeCompilerException reports a failure of the folding pass or of code generation.
 * It carries the kind of failure, the offending name when there is one, and a
 * detailed message that includes the file name, line number and a snippet of code
 * when the source tokens are known.
 */
public class ShadeCompilerException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String name;
    private final int tokenIndex;

    // Detailed error message that includes additional context about the error
    private final String errorMessage;

    /**
     * Constructs a new ShadeCompilerException.
     *
     * @param kind             the kind of failure
     * @param name             the offending symbol or function name, may be null
     * @param tokenIndex       the index of the token where the error occurred, or -1
     * @param message          the detail message describing the error
     * @param errorMessageUtil the utility for formatting error messages, may be null
     */
    public ShadeCompilerException(ErrorKind kind, String name, int tokenIndex, String message,
                                  ErrorMessageUtil errorMessageUtil) {
        super(message);
        this.kind = kind;
        this.name = name;
        this.tokenIndex = tokenIndex;
        if (errorMessageUtil != null && tokenIndex >= 0) {
            this.errorMessage = errorMessageUtil.errorMessage(tokenIndex, message);
        } else {
            this.errorMessage = message + "\n";
        }
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Returns the symbol or function name the error is about, or null.
     */
    public String getName() {
        return name;
    }

    public int getTokenIndex() {
        return tokenIndex;
    }

    /**
     * Returns the detailed error message.
     *
     * @return the detailed error message
     */
    @Override
    public String getMessage() {
        return errorMessage;
    }
}
