package org.messagewrangler.compiler.frontend.parser.features.options;

import org.messagewrangler.compiler.frontend.parser.IDeclarationHandler;
import org.messagewrangler.compiler.frontend.parser.ParsingContext;
import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.frontend.parser.features.enumdef.EnumValueNode;
import org.messagewrangler.compiler.model.Token;
import org.messagewrangler.compiler.model.TokenType;

import java.util.List;

/**
 * Parses a standalone {@code options Name { flag [= N], ... }} declaration.
 */
public class OptionsDeclarationHandler implements IDeclarationHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();

        Token name = context.consume(TokenType.IDENTIFIER, "Expected an options name.");
        if (name == null) return null;

        Token brace = context.peek();
        List<EnumValueNode> values = context.valueList();
        if (values == null) return null;
        return new OptionsNode(name, values, context.comments(keyword, brace));
    }
}
