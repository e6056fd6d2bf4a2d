package org.messagewrangler.compiler.model;

/**
 * Token categories produced by the {@link org.messagewrangler.compiler.frontend.lexer.Lexer}.
 * Keywords are lexed as {@link #IDENTIFIER} and recognized by the parser by their text.
 */
public enum TokenType {
    IDENTIFIER,
    NUMBER,
    STRING,

    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    LT,
    GT,
    COMMA,
    SEMICOLON,
    COLON,
    DOUBLE_COLON,
    DOT,
    EQUALS,
    PIPE,
    /** Any other printable character; only legal inside default value expressions. */
    SYMBOL,

    DOC_COMMENT,
    LOCAL_COMMENT,
    BLOCK_COMMENT,

    END_OF_FILE;

    public boolean isComment() {
        return this == DOC_COMMENT || this == LOCAL_COMMENT || this == BLOCK_COMMENT;
    }
}
