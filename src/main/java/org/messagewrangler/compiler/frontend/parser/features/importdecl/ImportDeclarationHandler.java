package org.messagewrangler.compiler.frontend.parser.features.importdecl;

import org.messagewrangler.compiler.frontend.parser.IDeclarationHandler;
import org.messagewrangler.compiler.frontend.parser.ParsingContext;
import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.model.Token;
import org.messagewrangler.compiler.model.TokenType;

/**
 * Parses the {@code import} declaration.
 *
 * <p>Syntax: {@code import "path" [as Alias]}
 *
 * <p>This handler only produces an {@link ImportNode}. Loading the imported file is done by the
 * {@link org.messagewrangler.compiler.frontend.module.DependencyScanner}.
 */
public class ImportDeclarationHandler implements IDeclarationHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        context.advance(); // consume import

        Token pathToken = context.consume(TokenType.STRING, "Expected a file path in quotes after import.");
        if (pathToken == null) return null;

        Token aliasToken = null;
        if (context.peek().isIdentifier("as") && context.peek().line() == pathToken.line()) {
            context.advance(); // consume as
            aliasToken = context.consume(TokenType.IDENTIFIER, "Expected an alias name after 'as'.");
            if (aliasToken == null) return null;
        }
        context.match(TokenType.SEMICOLON);

        return new ImportNode(pathToken, aliasToken);
    }
}
