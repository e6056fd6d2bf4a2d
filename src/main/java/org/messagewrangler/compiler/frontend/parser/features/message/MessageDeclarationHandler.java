package org.messagewrangler.compiler.frontend.parser.features.message;

import org.messagewrangler.compiler.frontend.parser.IDeclarationHandler;
import org.messagewrangler.compiler.frontend.parser.ParsingContext;
import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.frontend.parser.ast.TypeNode;
import org.messagewrangler.compiler.model.Token;
import org.messagewrangler.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code message Name [: Parent] { field* }}.
 *
 * <p>Field syntax: {@code modifier* name : type [= default] [;]}. The default expression is kept as
 * raw text; it runs up to a semicolon, a closing brace, a comment or the end of the line.
 */
public class MessageDeclarationHandler implements IDeclarationHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();

        Token name = context.consume(TokenType.IDENTIFIER, "Expected a message name.");
        if (name == null) return null;

        String parent = null;
        if (context.match(TokenType.COLON)) {
            parent = context.qualifiedName("Expected a parent message name after ':'.");
            if (parent == null) return null;
        }

        Token open = context.consume(TokenType.LBRACE, "Expected '{' after message name.");
        if (open == null) return null;

        List<FieldNode> fields = new ArrayList<>();
        while (!context.check(TokenType.RBRACE) && !context.isAtEnd()) {
            FieldNode field = field(context);
            if (field == null) return null;
            fields.add(field);
        }
        if (context.consume(TokenType.RBRACE, "Expected '}' to close message '" + name.text() + "'.") == null) {
            return null;
        }
        return new MessageNode(name, parent, fields, context.comments(keyword, open));
    }

    private FieldNode field(ParsingContext context) {
        Token first = context.peek();
        List<String> modifiers = new ArrayList<>();
        while (context.check(TokenType.IDENTIFIER) && context.checkNext(TokenType.IDENTIFIER)) {
            modifiers.add(context.advance().text());
        }

        Token name = context.consume(TokenType.IDENTIFIER, "Expected a field name.");
        if (name == null) return null;
        if (context.consume(TokenType.COLON, "Expected ':' after field name '" + name.text() + "'.") == null) {
            return null;
        }

        TypeNode type = context.typeDefinition();
        if (type == null) return null;

        String defaultValue = null;
        if (context.match(TokenType.EQUALS)) {
            defaultValue = defaultExpression(context);
            if (defaultValue == null) return null;
        }
        context.match(TokenType.SEMICOLON);

        return new FieldNode(name, List.copyOf(modifiers), type, defaultValue, context.comments(first, context.previous()));
    }

    private String defaultExpression(ParsingContext context) {
        Token equals = context.previous();
        StringBuilder text = new StringBuilder();
        Token last = equals;
        while (!context.isAtEnd()
                && !context.check(TokenType.SEMICOLON)
                && !context.check(TokenType.RBRACE)
                && context.peek().line() == last.line()) {
            Token t = context.advance();
            if (text.length() > 0 && t.column() > last.endColumn()) {
                text.append(' ');
            }
            text.append(t.text());
            last = t;
        }
        if (text.length() == 0) {
            context.error(context.peek(), "Expected a default value after '='.");
            return null;
        }
        return text.toString();
    }
}
