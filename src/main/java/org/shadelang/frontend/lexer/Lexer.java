package org.shadelang.frontend.lexer;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer class converts ShadeLang source text into a sequence of tokens.
 * <p>
 * Whitespace, newlines and comments are returned as tokens of their own; the
 * parser skips them, but {@link org.shadelang.runtime.ErrorMessageUtil} uses them
 * to compute line numbers and to quote the source near an error.
 * <p>
 * Numbers are consumed whole, including a fractional part and an exponent, so that
 * {@code 1.5e3} is a single NUMBER token.
 */
public class Lexer {
    // End of File character constant
    public static final String EOF = Character.toString((char) -1);
    // Array to mark operator characters
    public static boolean[] isOperator;

    // Static block to initialize the isOperator array
    static {
        isOperator = new boolean[128];
        for (char c : "!%&()*+,-./:;<=>?[]^{|}~".toCharArray()) {
            isOperator[c] = true;
        }
    }

    // Input characters to be tokenized
    public String input;
    // Current position in the input
    public int position;
    // Length of the input
    public int length;

    public Lexer(String input) {
        this.input = input;
        this.length = this.input.length();
        this.position = 0;
    }

    private static boolean isIdentifierStart(int codePoint) {
        return codePoint == '_' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_START);
    }

    private static boolean isIdentifierPart(int codePoint) {
        return codePoint == '_' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_CONTINUE);
    }

    private static boolean isAsciiWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private int getCurrentCodePoint() {
        if (position >= length) {
            return -1;
        }
        char c1 = input.charAt(position);
        if (Character.isHighSurrogate(c1) && position + 1 < length) {
            char c2 = input.charAt(position + 1);
            if (Character.isLowSurrogate(c2)) {
                return Character.toCodePoint(c1, c2);
            }
        }
        return c1;
    }

    private void advanceCodePoint(int codePoint) {
        position += Character.charCount(codePoint);
    }

    private char peek(int offset) {
        int index = position + offset;
        return index < length ? input.charAt(index) : '\0';
    }

    // Method to tokenize the input string into a list of tokens
    public List<LexerToken> tokenize() {
        List<LexerToken> tokens = new ArrayList<>();
        LexerToken token;

        while ((token = nextToken()) != null) {
            tokens.add(token);
        }
        tokens.add(new LexerToken(LexerTokenType.EOF, EOF));
        tokens.add(new LexerToken(LexerTokenType.EOF, EOF));

        this.input = null;  // Throw away input to spare memory
        return tokens;
    }

    public LexerToken nextToken() {
        if (position >= length) {
            return null;
        }

        char current = input.charAt(position);
        int currentCp = getCurrentCodePoint();

        if (current == '\n') {
            position++;
            return new LexerToken(LexerTokenType.NEWLINE, "\n");
        } else if (isAsciiWhitespace(current)) {
            return consumeWhitespace();
        } else if (current == '/' && (peek(1) == '/' || peek(1) == '*')) {
            return consumeComment();
        } else if (isDigit(current) || (current == '.' && isDigit(peek(1)))) {
            return consumeNumber();
        } else if (isIdentifierStart(currentCp)) {
            return consumeIdentifier();
        } else if (current < 128 && isOperator[current]) {
            return consumeOperator();
        } else {
            int start = position;
            advanceCodePoint(currentCp);
            return new LexerToken(LexerTokenType.STRING, input.substring(start, position));
        }
    }

    public LexerToken consumeWhitespace() {
        int start = position;
        while (position < length && isAsciiWhitespace(input.charAt(position))) {
            position++;
        }
        return new LexerToken(LexerTokenType.WHITESPACE, input.substring(start, position));
    }

    public LexerToken consumeComment() {
        int start = position;
        if (peek(1) == '/') {
            while (position < length && input.charAt(position) != '\n') {
                position++;
            }
        } else {
            int end = input.indexOf("*/", position + 2);
            // An unterminated block comment runs to the end of the input
            position = end < 0 ? length : end + 2;
        }
        return new LexerToken(LexerTokenType.COMMENT, input.substring(start, position));
    }

    public LexerToken consumeNumber() {
        int start = position;
        while (position < length && isDigit(input.charAt(position))) {
            position++;
        }
        if (peek(0) == '.' && isDigit(peek(1))) {
            position++;
            while (position < length && isDigit(input.charAt(position))) {
                position++;
            }
        } else if (peek(0) == '.' && (!isIdentifierStart(peek(1)) || exponentPrefix(1) > 0)) {
            // "1." and "1.e5" are still decimal literals
            position++;
        }
        int prefix = exponentPrefix(0);
        if (prefix > 0) {
            position += prefix;
            while (position < length && isDigit(input.charAt(position))) {
                position++;
            }
        }
        return new LexerToken(LexerTokenType.NUMBER, input.substring(start, position));
    }

    // Length of "e", "e+" or "e-" at the offset when a digit follows it, else 0
    private int exponentPrefix(int offset) {
        char e = peek(offset);
        if (e != 'e' && e != 'E') {
            return 0;
        }
        int size = (peek(offset + 1) == '+' || peek(offset + 1) == '-') ? 2 : 1;
        return isDigit(peek(offset + size)) ? size : 0;
    }

    public LexerToken consumeIdentifier() {
        int start = position;
        int cp = getCurrentCodePoint();
        advanceCodePoint(cp);

        while (position < length) {
            int curCp = getCurrentCodePoint();
            if (isIdentifierPart(curCp)) {
                advanceCodePoint(curCp);
            } else {
                break;
            }
        }
        // Build token text using substring to preserve surrogate pairs correctly
        return new LexerToken(LexerTokenType.IDENTIFIER, input.substring(start, position));
    }

    public LexerToken consumeOperator() {
        char current = input.charAt(position);
        if (current == '-' && peek(1) == '>') {
            position += 2;
            return new LexerToken(LexerTokenType.OPERATOR, "->");
        }
        position++;
        return new LexerToken(LexerTokenType.OPERATOR, String.valueOf(current));
    }
}
