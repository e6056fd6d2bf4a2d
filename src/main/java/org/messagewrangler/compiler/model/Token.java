package org.messagewrangler.compiler.model;

/**
 * A lexical token with its source position.
 *
 * @param type     The token category.
 * @param text     The exact source text (comments: the comment body without its markers).
 * @param value    The literal value for numbers ({@link Long} or {@link Double}) and strings (unquoted), else null.
 * @param line     The 1-based line.
 * @param column   The 1-based column of the first character.
 * @param fileName The source file name.
 */
public record Token(TokenType type, String text, Object value, int line, int column, String fileName) {

    /**
     * Returns the column just after the last character of this token on its line.
     */
    public int endColumn() {
        return column + text.length();
    }

    public boolean isIdentifier(String keyword) {
        return type == TokenType.IDENTIFIER && keyword.equals(text);
    }
}
