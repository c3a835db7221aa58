package org.shadelang.runtime;

import org.shadelang.frontend.lexer.LexerToken;
import org.shadelang.frontend.lexer.LexerTokenType;
import org.shadelang.frontend.parser.TokenUtils;

import java.util.List;

/**
 * Utility class for generating error messages with context from a list of tokens.
 */
public class ErrorMessageUtil {
    private final String fileName;
    private final List<LexerToken> tokens;

    /**
     * Constructs an ErrorMessageUtil with the specified file name and list of tokens.
     *
     * @param fileName the name of the file
     * @param tokens   the list of tokens
     */
    public ErrorMessageUtil(String fileName, List<LexerToken> tokens) {
        this.fileName = fileName;
        this.tokens = tokens;
    }

    /**
     * Quotes the specified string for inclusion in an error message.
     * Escapes special characters such as newlines, tabs, and backslashes.
     */
    private static String errorMessageQuote(String str) {
        StringBuilder escaped = new StringBuilder();
        for (char c : str.toCharArray()) {
            switch (c) {
                case '\n':
                    escaped.append("\\n");
                    break;
                case '\t':
                    escaped.append("\\t");
                    break;
                case '\\':
                    escaped.append("\\\\");
                    break;
                case '\"':
                    escaped.append("\\\"");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return "\"" + escaped + "\"";
    }

    /**
     * Generates an error message with context from the token list.
     *
     * @param index   the index of the token where the error occurred
     * @param message the error message
     * @return the formatted error message with context
     */
    public String errorMessage(int index, String message) {
        int line = getLineNumber(index);
        String nearString = TokenUtils.toText(tokens, index - 4, index + 2);
        return message + " at " + fileName + " line " + line + ", near " + errorMessageQuote(nearString) + "\n";
    }

    /**
     * Counts newlines in the tokens before the specified index.
     *
     * @param index the index of the token
     * @return the 1-based line number
     */
    public int getLineNumber(int index) {
        int line = 1;
        int end = Math.min(index, tokens.size());
        for (int i = 0; i < end; i++) {
            LexerToken tok = tokens.get(i);
            if (tok.type == LexerTokenType.EOF) {
                break;
            }
            if (tok.type == LexerTokenType.NEWLINE) {
                line++;
            } else if (tok.type == LexerTokenType.COMMENT) {
                line += (int) tok.text.chars().filter(c -> c == '\n').count();
            }
        }
        return line;
    }
}
