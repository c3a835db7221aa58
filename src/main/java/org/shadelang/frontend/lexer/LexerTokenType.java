package org.shadelang.frontend.lexer;

/**
 * Categories of tokens produced by the {@link Lexer}.
 */
public enum LexerTokenType {
    WHITESPACE,
    NEWLINE,
    COMMENT,
    IDENTIFIER,
    NUMBER,
    OPERATOR,
    STRING,
    EOF
}
