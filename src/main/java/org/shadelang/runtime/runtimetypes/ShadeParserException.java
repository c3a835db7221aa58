package org.shadelang.runtime.runtimetypes;

import org.shadelang.runtime.ErrorMessageUtil;

import java.io.Serial;

/**
 * ShadeParserException reports a syntax error found while parsing source text.
 */
public class ShadeParserException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final int tokenIndex;
    private final String cleanMessage;

    public ShadeParserException(int tokenIndex, String message, ErrorMessageUtil errorMessageUtil) {
        super(message);
        this.tokenIndex = tokenIndex;
        this.cleanMessage = errorMessageUtil.errorMessage(tokenIndex, message);
    }

    public int getTokenIndex() {
        return tokenIndex;
    }

    @Override
    public String getMessage() {
        return cleanMessage;
    }

    /**
     * Returns just the message without the exception class name.
     */
    @Override
    public String toString() {
        return cleanMessage;
    }
}
