package org.messagewrangler.compiler.frontend.lexer;

import org.messagewrangler.compiler.diagnostics.DiagnosticsEngine;
import org.messagewrangler.compiler.diagnostics.ErrorKind;
import org.messagewrangler.compiler.model.Token;
import org.messagewrangler.compiler.model.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class LexerTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private List<Token> scan(String source) {
        return new Lexer(source, diagnostics, "test.def").scanTokens();
    }

    @Test
    void scansQualifiedNameAndPunctuation() {
        List<Token> tokens = scan("a::b.c : Map<K, V>[] = x | y;");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.DOUBLE_COLON, TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER,
                TokenType.COLON, TokenType.IDENTIFIER, TokenType.LT, TokenType.IDENTIFIER, TokenType.COMMA,
                TokenType.IDENTIFIER, TokenType.GT, TokenType.LBRACKET, TokenType.RBRACKET, TokenType.EQUALS,
                TokenType.IDENTIFIER, TokenType.PIPE, TokenType.IDENTIFIER, TokenType.SEMICOLON, TokenType.END_OF_FILE);
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void distinguishesTheThreeCommentStyles() {
        List<Token> tokens = scan("/// doc text\n// local text\n/* block\n * text */\n");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.DOC_COMMENT, TokenType.LOCAL_COMMENT, TokenType.BLOCK_COMMENT, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).text()).isEqualTo("doc text");
        assertThat(tokens.get(1).text()).isEqualTo("local text");
        assertThat(tokens.get(2).text()).isEqualTo("block\ntext");
    }

    @Test
    void parsesNumericLiterals() {
        List<Token> tokens = scan("42 -7 0x1F 2.5 4294967296");

        assertThat(tokens).extracting(Token::value)
                .containsExactly(42L, -7L, 31L, 2.5, 4294967296L, null);
    }

    @Test
    void hexLiteralsCoverTheFullSixtyFourBits() {
        List<Token> tokens = scan("0xFFFFFFFFFFFFFFFF 0x8000000000000000 0x7FFFFFFFFFFFFFFF");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::value)
                .containsExactly(-1L, Long.MIN_VALUE, Long.MAX_VALUE, null);
    }

    @Test
    void hexLiteralWiderThanSixtyFourBitsIsASyntaxError() {
        scan("0x1FFFFFFFFFFFFFFFF");

        assertThat(diagnostics.errorsOfKind(ErrorKind.SYNTAX)).hasSize(1);
        assertThat(diagnostics.summary()).contains("Numeric literal out of range: 0x1FFFFFFFFFFFFFFFF");
    }

    @Test
    void keepsQuotedTextAndUnescapesValue() {
        List<Token> tokens = scan("\"say \\\"hi\\\"\"");

        Token string = tokens.get(0);
        assertThat(string.type()).isEqualTo(TokenType.STRING);
        assertThat(string.text()).isEqualTo("\"say \\\"hi\\\"\"");
        assertThat(string.value()).isEqualTo("say \"hi\"");
    }

    @Test
    void tracksLinesAndColumns() {
        List<Token> tokens = scan("message A {\n  id: int\n}");

        Token id = tokens.get(3);
        assertThat(id.text()).isEqualTo("id");
        assertThat(id.line()).isEqualTo(2);
        assertThat(id.column()).isEqualTo(3);
        assertThat(id.fileName()).isEqualTo("test.def");
    }

    @Test
    void unterminatedStringIsASyntaxError() {
        List<Token> tokens = scan("import \"open.def\nmessage A {}");

        assertThat(diagnostics.errorsOfKind(ErrorKind.SYNTAX)).hasSize(1);
        assertThat(diagnostics.summary()).contains("Unterminated string literal");
        assertThat(tokens.get(tokens.size() - 1).type()).isEqualTo(TokenType.END_OF_FILE);
    }

    @Test
    void unterminatedBlockCommentIsASyntaxError() {
        scan("/* never closed");

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.summary()).contains("Unterminated block comment");
    }
}
