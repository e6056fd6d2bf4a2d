package org.messagewrangler.compiler.frontend.parser;

import org.messagewrangler.compiler.diagnostics.DiagnosticsEngine;
import org.messagewrangler.compiler.frontend.parser.ast.ArrayTypeNode;
import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.frontend.parser.ast.BasicTypeNode;
import org.messagewrangler.compiler.frontend.parser.ast.Comments;
import org.messagewrangler.compiler.frontend.parser.ast.CompoundTypeNode;
import org.messagewrangler.compiler.frontend.parser.ast.InlineEnumTypeNode;
import org.messagewrangler.compiler.frontend.parser.ast.InlineOptionsTypeNode;
import org.messagewrangler.compiler.frontend.parser.ast.MapTypeNode;
import org.messagewrangler.compiler.frontend.parser.ast.RefTypeNode;
import org.messagewrangler.compiler.frontend.parser.ast.SchemaFileNode;
import org.messagewrangler.compiler.frontend.parser.ast.TypeNode;
import org.messagewrangler.compiler.frontend.parser.features.enumdef.EnumValueNode;
import org.messagewrangler.compiler.frontend.parser.features.importdecl.ImportNode;
import org.messagewrangler.compiler.model.Token;
import org.messagewrangler.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recursive-descent parser for schema files.
 * <p>
 * Keyword-introduced declarations are dispatched through the {@link DeclarationHandlerRegistry};
 * type expressions, value lists and qualified names are parsed here and offered to handlers through
 * {@link ParsingContext}. Comment tokens are removed from the stream up front and indexed by the
 * significant token they precede (leading) or follow on the same line (trailing).
 * <p>
 * Parsing stops at the first syntax error. The returned tree is then incomplete and must not be used.
 */
public class Parser implements ParsingContext {

    private final List<Token> tokens = new ArrayList<>();
    private final Map<Token, List<Token>> leadingComments = new HashMap<>();
    private final Map<Token, List<Token>> trailingComments = new HashMap<>();
    private final DiagnosticsEngine diagnostics;
    private final DeclarationHandlerRegistry registry;
    private int current = 0;
    private boolean failed = false;

    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this(tokens, diagnostics, DeclarationHandlerRegistry.initialize());
    }

    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, DeclarationHandlerRegistry registry) {
        this.diagnostics = diagnostics;
        this.registry = registry;
        indexTokens(tokens);
    }

    private void indexTokens(List<Token> input) {
        List<Token> pending = new ArrayList<>();
        Token lastSignificant = null;
        for (Token token : input) {
            if (token.type().isComment()) {
                if (lastSignificant != null && token.line() == lastSignificant.line() && pending.isEmpty()) {
                    trailingComments.computeIfAbsent(lastSignificant, k -> new ArrayList<>()).add(token);
                } else {
                    pending.add(token);
                }
                continue;
            }
            if (!pending.isEmpty()) {
                leadingComments.put(token, pending);
                pending = new ArrayList<>();
            }
            tokens.add(token);
            lastSignificant = token;
        }
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END_OF_FILE) {
            Token last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
            tokens.add(new Token(TokenType.END_OF_FILE, "", null,
                    last != null ? last.line() : 1, 1, last != null ? last.fileName() : ""));
        }
    }

    /**
     * Parses the whole token stream.
     * @return The parse tree; incomplete if a syntax error was reported.
     */
    public SchemaFileNode parse() {
        String fileName = tokens.get(0).fileName();
        List<ImportNode> imports = new ArrayList<>();
        List<AstNode> items = new ArrayList<>();
        while (!isAtEnd() && !failed) {
            AstNode node = declaration();
            if (node instanceof ImportNode importNode) {
                if (!items.isEmpty()) {
                    diagnostics.reportWarning("Import of '" + importNode.pathValue()
                            + "' appears after declarations.", importNode.getSourceFileName(), importNode.getSourceLine());
                }
                imports.add(importNode);
            } else if (node != null) {
                items.add(node);
            }
        }
        return new SchemaFileNode(fileName, imports, items);
    }

    /**
     * Returns whether a syntax error stopped this parser.
     */
    public boolean hasFailed() {
        return failed;
    }

    @Override
    public AstNode declaration() {
        Token start = peek();
        if (start.type() == TokenType.IDENTIFIER) {
            Optional<IDeclarationHandler> handler = registry.get(start.text());
            if (handler.isPresent()) {
                AstNode node = handler.get().parse(this);
                if (node == null && !failed) {
                    error(start, "Malformed '" + start.text() + "' declaration.");
                }
                return node;
            }
        }
        error(start, "Expected a declaration (import, namespace, message, enum, open_enum, options or compound).");
        return null;
    }

    @Override
    public String qualifiedName(String errorMessage) {
        Token first = consume(TokenType.IDENTIFIER, errorMessage);
        if (first == null) return null;
        StringBuilder name = new StringBuilder(first.text());
        while ((check(TokenType.DOUBLE_COLON) || check(TokenType.DOT)) && checkNext(TokenType.IDENTIFIER)) {
            name.append(advance().text());
            name.append(advance().text());
        }
        return name.toString();
    }

    @Override
    public TypeNode typeDefinition() {
        TypeNode base = singleType();
        if (base == null) return null;
        if (match(TokenType.LBRACKET)) {
            if (consume(TokenType.RBRACKET, "Expected ']' to close the array type.") == null) return null;
            if (base instanceof MapTypeNode) {
                error(previous(), "Arrays of maps are not supported.");
                return null;
            }
            if (check(TokenType.LBRACKET)) {
                error(peek(), "Nested array types are not supported.");
                return null;
            }
            return new ArrayTypeNode(base);
        }
        return base;
    }

    private TypeNode singleType() {
        Token t = peek();
        if (t.isIdentifier("enum") || t.isIdentifier("open_enum")) {
            advance();
            boolean open = t.isIdentifier("open_enum");
            if (check(TokenType.LBRACE)) {
                List<EnumValueNode> values = valueList();
                return values == null ? null : new InlineEnumTypeNode(open, values);
            }
            if (open) {
                error(peek(), "Expected '{' after open_enum in a field type.");
                return null;
            }
            String name = qualifiedName("Expected an enum name or '{' after enum.");
            return name == null ? null : new RefTypeNode(name, RefTypeNode.Expected.ENUM);
        }
        if (t.isIdentifier("options")) {
            advance();
            if (check(TokenType.LBRACE)) {
                List<EnumValueNode> values = valueList();
                return values == null ? null : new InlineOptionsTypeNode(values);
            }
            String name = qualifiedName("Expected an options name or '{' after options.");
            return name == null ? null : new RefTypeNode(name, RefTypeNode.Expected.OPTIONS);
        }
        if (t.isIdentifier("Map") && checkNext(TokenType.LT)) {
            return mapType();
        }
        if (t.type() == TokenType.IDENTIFIER) {
            String name = qualifiedName("Expected a type name.");
            if (name == null) return null;
            if (check(TokenType.LBRACE)) {
                List<String> components = componentList();
                return components == null ? null : new CompoundTypeNode(name, components);
            }
            return BasicTypeNode.isBasic(name) ? new BasicTypeNode(name) : new RefTypeNode(name, RefTypeNode.Expected.ANY);
        }
        error(t, "Expected a type.");
        return null;
    }

    private TypeNode mapType() {
        advance(); // Map
        advance(); // <
        Token keyStart = peek();
        TypeNode key = singleType();
        if (key == null) return null;
        if (!(key instanceof BasicTypeNode) && !(key instanceof RefTypeNode)) {
            error(keyStart, "Map keys must be a basic or named type.");
            return null;
        }
        if (consume(TokenType.COMMA, "Expected ',' between map key and value types.") == null) return null;
        TypeNode value = typeDefinition();
        if (value == null) return null;
        if (consume(TokenType.GT, "Expected '>' to close the map type.") == null) return null;
        return new MapTypeNode(key, value);
    }

    @Override
    public List<EnumValueNode> valueList() {
        if (consume(TokenType.LBRACE, "Expected '{' to open the value list.") == null) return null;
        List<EnumValueNode> values = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !isAtEnd()) {
            Token name = consume(TokenType.IDENTIFIER, "Expected a value name.");
            if (name == null) return null;
            Long value = null;
            if (match(TokenType.EQUALS)) {
                Token number = consume(TokenType.NUMBER, "Expected an integer after '='.");
                if (number == null) return null;
                if (!(number.value() instanceof Long)) {
                    error(number, "Enum and options values must be integers.");
                    return null;
                }
                value = (Long) number.value();
            }
            if (!match(TokenType.COMMA)) {
                match(TokenType.SEMICOLON);
            }
            values.add(new EnumValueNode(name, value, comments(name, previous())));
        }
        if (consume(TokenType.RBRACE, "Expected '}' to close the value list.") == null) return null;
        return values;
    }

    @Override
    public List<String> componentList() {
        if (consume(TokenType.LBRACE, "Expected '{' to open the component list.") == null) return null;
        List<String> components = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !isAtEnd()) {
            Token name = consume(TokenType.IDENTIFIER, "Expected a component name.");
            if (name == null) return null;
            components.add(name.text());
            if (!check(TokenType.RBRACE) && consume(TokenType.COMMA, "Expected ',' between components.") == null) {
                return null;
            }
        }
        if (consume(TokenType.RBRACE, "Expected '}' to close the component list.") == null) return null;
        return components;
    }

    @Override
    public Comments comments(Token first, Token last) {
        return Comments.of(leadingComments.getOrDefault(first, List.of()),
                trailingComments.getOrDefault(last, List.of()));
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.END_OF_FILE;
        return peek().type() == type;
    }

    @Override
    public boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    @Override
    public Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        error(peek(), errorMessage);
        return null;
    }

    @Override
    public void error(Token at, String message) {
        if (failed) return;
        String found = at.type() == TokenType.END_OF_FILE ? "end of file" : "'" + at.text() + "'";
        diagnostics.reportError(message + " Found " + found + ".", at.fileName(), at.line());
        failed = true;
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }
}
