package org.messagewrangler.compiler.frontend.parser.features.namespace;

import org.messagewrangler.compiler.frontend.parser.IDeclarationHandler;
import org.messagewrangler.compiler.frontend.parser.ParsingContext;
import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.frontend.parser.features.importdecl.ImportNode;
import org.messagewrangler.compiler.model.Token;
import org.messagewrangler.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code namespace Name { item* }}. Items are parsed recursively through
 * {@link ParsingContext#declaration()}, so namespaces nest to any depth.
 */
public class NamespaceDeclarationHandler implements IDeclarationHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();

        Token name = context.consume(TokenType.IDENTIFIER, "Expected a namespace name.");
        if (name == null) return null;
        Token open = context.consume(TokenType.LBRACE, "Expected '{' after namespace name.");
        if (open == null) return null;

        List<AstNode> items = new ArrayList<>();
        while (!context.check(TokenType.RBRACE) && !context.isAtEnd()) {
            Token itemStart = context.peek();
            AstNode item = context.declaration();
            if (item == null) return null;
            if (item instanceof ImportNode) {
                context.error(itemStart, "Imports are only allowed at file level.");
                return null;
            }
            items.add(item);
        }
        if (context.consume(TokenType.RBRACE, "Expected '}' to close namespace '" + name.text() + "'.") == null) {
            return null;
        }
        return new NamespaceNode(name, items, context.comments(keyword, open));
    }
}
