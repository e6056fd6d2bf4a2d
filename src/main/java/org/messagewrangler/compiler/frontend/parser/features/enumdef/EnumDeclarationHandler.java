package org.messagewrangler.compiler.frontend.parser.features.enumdef;

import org.messagewrangler.compiler.frontend.parser.IDeclarationHandler;
import org.messagewrangler.compiler.frontend.parser.ParsingContext;
import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.model.Token;
import org.messagewrangler.compiler.model.TokenType;

import java.util.List;

/**
 * Parses {@code enum Name [: Parent] { ... }} and {@code open_enum Name [: Parent] { ... }}.
 */
public class EnumDeclarationHandler implements IDeclarationHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        boolean open = keyword.isIdentifier("open_enum");

        Token name = context.consume(TokenType.IDENTIFIER, "Expected an enum name after '" + keyword.text() + "'.");
        if (name == null) return null;

        String parent = null;
        if (context.match(TokenType.COLON)) {
            parent = context.qualifiedName("Expected a parent enum name after ':'.");
            if (parent == null) return null;
        }

        Token brace = context.peek();
        List<EnumValueNode> values = context.valueList();
        if (values == null) return null;
        return new EnumNode(name, open, parent, values, context.comments(keyword, brace));
    }
}
