package org.shadelang.frontend.lexer;

/**
 * The LexerToken class represents a lexical token of ShadeLang source text.
 * A token is a basic unit of meaningful data, such as a keyword, identifier,
 * operator or numeric literal.
 *
 * <p>This class encapsulates the type and text of a token. Whitespace, newlines
 * and comments are kept as tokens so that the token list can be turned back into
 * source text when formatting error messages.</p>
 */
public class LexerToken {
    /**
     * The type of the token, represented by an instance of the LexerTokenType enum.
     */
    public LexerTokenType type;

    /**
     * The text of the token, exactly as it appears in the source.
     */
    public String text;

    /**
     * Constructs a new LexerToken with the specified type and text.
     *
     * @param type the type of the token
     * @param text the text of the token
     */
    public LexerToken(LexerTokenType type, String text) {
        this.type = type;
        this.text = text;
    }

    /**
     * Returns a string representation of the token.
     *
     * @return a string representation of the token
     */
    @Override
    public String toString() {
        return "LexerToken{" + "type=" + type + ", text='" + text + '\'' + '}';
    }
}
