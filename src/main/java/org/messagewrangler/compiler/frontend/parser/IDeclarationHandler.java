package org.messagewrangler.compiler.frontend.parser;

import org.messagewrangler.compiler.frontend.parser.ast.AstNode;

/**
 * Handler interface for the keyword-introduced declarations of a schema file.
 * Handlers consume the declaration's tokens, starting at the keyword, and produce a parse tree node.
 */
public interface IDeclarationHandler {

    /**
     * Parses the declaration from the token stream.
     *
     * @param context The parsing context providing access to the token stream.
     * @return The parse tree node, or {@code null} after a syntax error.
     */
    AstNode parse(ParsingContext context);
}
