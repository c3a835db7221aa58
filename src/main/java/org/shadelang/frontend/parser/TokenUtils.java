package org.shadelang.frontend.parser;

import org.shadelang.frontend.lexer.LexerToken;
import org.shadelang.frontend.lexer.LexerTokenType;

import java.util.List;

/**
 * The TokenUtils class provides utility methods for peeking at and consuming
 * lexer tokens during parsing.
 */
public class TokenUtils {

    /**
     * Converts a range of tokens into a single string of text, excluding EOF tokens.
     *
     * @param tokens    The list of LexerToken objects to process.
     * @param codeStart The starting index in the list of tokens.
     * @param codeEnd   The ending index in the list of tokens.
     * @return A string representing the concatenated text of the specified token range.
     */
    public static String toText(List<LexerToken> tokens, int codeStart, int codeEnd) {
        StringBuilder sb = new StringBuilder();
        codeStart = Math.max(codeStart, 0);
        codeEnd = Math.min(codeEnd, tokens.size() - 1);
        for (int i = codeStart; i <= codeEnd; i++) {
            LexerToken tok = tokens.get(i);
            if (tok.type != LexerTokenType.EOF) {
                sb.append(tok.text);
            }
        }
        return sb.toString();
    }

    /**
     * Advances past whitespace, newlines and comments and returns the next significant
     * token without consuming it.
     *
     * @param parser The parser containing the token list and current token index.
     * @return The next significant token, or an EOF token if the end of the list is reached.
     */
    public static LexerToken peek(Parser parser) {
        parser.tokenIndex = skipWhitespace(parser.tokenIndex, parser.tokens);
        if (parser.tokenIndex >= parser.tokens.size()) {
            return new LexerToken(LexerTokenType.EOF, "");
        }
        return parser.tokens.get(parser.tokenIndex);
    }

    /**
     * Consumes the next significant token.
     */
    public static LexerToken consume(Parser parser) {
        LexerToken token = peek(parser);
        if (token.type != LexerTokenType.EOF) {
            parser.tokenIndex++;
        }
        return token;
    }

    /**
     * Consumes the next significant token, which must have the given type and text.
     *
     * @throws org.shadelang.runtime.runtimetypes.ShadeParserException if it does not
     */
    public static LexerToken consume(Parser parser, LexerTokenType type, String text) {
        LexerToken token = peek(parser);
        if (token.type != type || !token.text.equals(text)) {
            throw parser.syntaxError("Expected '" + text + "' but found '" + describe(token) + "'");
        }
        parser.tokenIndex++;
        return token;
    }

    /**
     * Consumes the next significant token, which must have the given type.
     */
    public static LexerToken consume(Parser parser, LexerTokenType type) {
        LexerToken token = peek(parser);
        if (token.type != type) {
            throw parser.syntaxError("Expected " + type.name().toLowerCase() + " but found '" + describe(token) + "'");
        }
        parser.tokenIndex++;
        return token;
    }

    static String describe(LexerToken token) {
        return token.type == LexerTokenType.EOF ? "end of file" : token.text;
    }

    private static int skipWhitespace(int tokenIndex, List<LexerToken> tokens) {
        while (tokenIndex < tokens.size()) {
            LexerTokenType type = tokens.get(tokenIndex).type;
            if (type != LexerTokenType.WHITESPACE && type != LexerTokenType.NEWLINE
                    && type != LexerTokenType.COMMENT) {
                break;
            }
            tokenIndex++;
        }
        return tokenIndex;
    }
}
