package org.messagewrangler.compiler.frontend.lexer;

import org.messagewrangler.compiler.diagnostics.DiagnosticsEngine;
import org.messagewrangler.compiler.model.Token;
import org.messagewrangler.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns schema source text into a flat token list.
 * <p>
 * Comments are kept as tokens ({@link TokenType#DOC_COMMENT}, {@link TokenType#LOCAL_COMMENT},
 * {@link TokenType#BLOCK_COMMENT}) so the parser can attach them to declarations.
 * Lexing stops at the first malformed token; the error is reported to the diagnostics engine
 * and the returned list ends with {@link TokenType#END_OF_FILE} regardless.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int startLine = 1;
    private int startColumn = 1;
    private boolean failed = false;

    public Lexer(String source, DiagnosticsEngine diagnostics, String fileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.fileName = fileName;
    }

    /**
     * Scans the whole source.
     * @return The tokens, terminated by an END_OF_FILE token.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd() && !failed) {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, current - lineStart + 1, fileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '{' -> addToken(TokenType.LBRACE);
            case '}' -> addToken(TokenType.RBRACE);
            case '[' -> addToken(TokenType.LBRACKET);
            case ']' -> addToken(TokenType.RBRACKET);
            case '<' -> addToken(TokenType.LT);
            case '>' -> addToken(TokenType.GT);
            case ',' -> addToken(TokenType.COMMA);
            case ';' -> addToken(TokenType.SEMICOLON);
            case '=' -> addToken(TokenType.EQUALS);
            case '|' -> addToken(TokenType.PIPE);
            case '.' -> addToken(TokenType.DOT);
            case ':' -> addToken(match(':') ? TokenType.DOUBLE_COLON : TokenType.COLON);
            case '/' -> slash();
            case '"' -> string();
            case ' ', '\t', '\r', '\f' -> {
                // whitespace
            }
            case '\n' -> newLine();
            default -> {
                if (isDigit(c) || (c == '-' && isDigit(peek()))) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else if (!Character.isISOControl(c)) {
                    addToken(TokenType.SYMBOL);
                } else {
                    error("Unexpected character code " + (int) c + ".");
                }
            }
        }
    }

    private void slash() {
        if (match('/')) {
            boolean doc = match('/');
            while (peek() != '\n' && !isAtEnd()) advance();
            int bodyStart = start + (doc ? 3 : 2);
            String body = source.substring(bodyStart, current).trim();
            addToken(doc ? TokenType.DOC_COMMENT : TokenType.LOCAL_COMMENT, body, null);
        } else if (match('*')) {
            blockComment();
        } else {
            addToken(TokenType.SYMBOL);
        }
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                String raw = source.substring(start + 2, current - 2);
                addToken(TokenType.BLOCK_COMMENT, cleanBlockComment(raw), null);
                return;
            }
            if (advance() == '\n') {
                newLine();
            }
        }
        error("Unterminated block comment.");
    }

    private static String cleanBlockComment(String raw) {
        List<String> lines = new ArrayList<>();
        for (String l : raw.split("\n", -1)) {
            String t = l.trim();
            if (t.startsWith("*")) {
                t = t.substring(1).trim();
            }
            lines.add(t);
        }
        while (!lines.isEmpty() && lines.get(0).isEmpty()) lines.remove(0);
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) lines.remove(lines.size() - 1);
        return String.join("\n", lines);
    }

    private void string() {
        StringBuilder value = new StringBuilder();
        while (peek() != '"' && !isAtEnd()) {
            char c = advance();
            if (c == '\n') {
                error("Unterminated string literal.");
                return;
            }
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    default -> value.append(escaped);
                }
            } else {
                value.append(c);
            }
        }
        if (isAtEnd()) {
            error("Unterminated string literal.");
            return;
        }
        advance(); // closing quote
        addToken(TokenType.STRING, source.substring(start, current), value.toString());
    }

    private void number() {
        if (source.charAt(start) == '0' && (peek() == 'x' || peek() == 'X') && isHexDigit(peekNext())) {
            advance();
            while (isHexDigit(peek())) advance();
            String text = source.substring(start, current);
            try {
                addToken(TokenType.NUMBER, text, Long.parseUnsignedLong(text.substring(2), 16));
            } catch (NumberFormatException e) {
                error("Numeric literal out of range: " + text);
            }
            return;
        }
        while (isDigit(peek())) advance();
        boolean fractional = false;
        if (peek() == '.' && isDigit(peekNext())) {
            fractional = true;
            advance();
            while (isDigit(peek())) advance();
        }
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '-' || peekNext() == '+') && isDigit(peekAt(2))))) {
            fractional = true;
            advance();
            if (peek() == '-' || peek() == '+') advance();
            while (isDigit(peek())) advance();
        }
        String text = source.substring(start, current);
        try {
            Object value = fractional ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
            addToken(TokenType.NUMBER, text, value);
        } catch (NumberFormatException e) {
            error("Numeric literal out of range: " + text);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private void error(String message) {
        diagnostics.reportError(message, fileName, startLine);
        failed = true;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        int index = current + offset;
        return index >= source.length() ? '\0' : source.charAt(index);
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        addToken(type, source.substring(start, current), null);
    }

    private void addToken(TokenType type, String text, Object value) {
        tokens.add(new Token(type, text, value, startLine, startColumn, fileName));
    }
}
