package org.messagewrangler.compiler.frontend.parser;

import org.messagewrangler.compiler.diagnostics.DiagnosticsEngine;
import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.frontend.parser.ast.Comments;
import org.messagewrangler.compiler.frontend.parser.ast.TypeNode;
import org.messagewrangler.compiler.frontend.parser.features.enumdef.EnumValueNode;
import org.messagewrangler.compiler.model.Token;
import org.messagewrangler.compiler.model.TokenType;

import java.util.List;

/**
 * Provides declaration handlers with access to the token stream.
 * This interface decouples handlers from the concrete {@link Parser} implementation.
 * <p>
 * Methods that parse a construct return {@code null} after reporting a syntax error;
 * handlers propagate the {@code null} and the parser stops.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks if the token after the current one is of the given type.
     */
    boolean checkNext(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * If not, it reports a syntax error naming the offending token.
     * @param type The expected token type.
     * @param errorMessage The error message to report if the token type does not match.
     * @return The consumed token, or null if the type did not match.
     */
    Token consume(TokenType type, String errorMessage);

    /**
     * Reports a syntax error at the given token and stops the parse.
     */
    void error(Token at, String message);

    /**
     * Parses one declaration (namespace, message, enum, options, compound or import).
     * @return The node, or null after a syntax error.
     */
    AstNode declaration();

    /**
     * Parses a {@code ::}- or {@code .}-separated name.
     * @return The name exactly as written, or null after a syntax error.
     */
    String qualifiedName(String errorMessage);

    /**
     * Parses a field type expression, including array and map forms.
     */
    TypeNode typeDefinition();

    /**
     * Parses a braced enum or options value list.
     */
    List<EnumValueNode> valueList();

    /**
     * Parses a braced list of compound component names.
     */
    List<String> componentList();

    /**
     * Collects the comments attached to a declaration spanning {@code first} to {@code last}.
     */
    Comments comments(Token first, Token last);

    /**
     * Gets the diagnostics engine for reporting errors and warnings.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();
}
