package org.messagewrangler.compiler.frontend.parser.features.compound;

import org.messagewrangler.compiler.frontend.parser.IDeclarationHandler;
import org.messagewrangler.compiler.frontend.parser.ParsingContext;
import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.model.Token;
import org.messagewrangler.compiler.model.TokenType;

import java.util.List;

/**
 * Parses a named compound declaration introduced by a basic type: {@code float Vec3 { x, y, z }}.
 */
public class CompoundDeclarationHandler implements IDeclarationHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token baseType = context.advance();

        Token name = context.consume(TokenType.IDENTIFIER, "Expected a compound name after '" + baseType.text() + "'.");
        if (name == null) return null;

        Token brace = context.peek();
        List<String> components = context.componentList();
        if (components == null) return null;
        return new CompoundDefNode(name, baseType.text(), components, context.comments(baseType, brace));
    }
}
