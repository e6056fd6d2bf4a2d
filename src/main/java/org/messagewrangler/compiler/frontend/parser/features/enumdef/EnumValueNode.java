package org.messagewrangler.compiler.frontend.parser.features.enumdef;

import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.frontend.parser.ast.Comments;
import org.messagewrangler.compiler.frontend.parser.ast.SourceLocatable;
import org.messagewrangler.compiler.model.Token;

/**
 * One entry of an enum or options body.
 *
 * @param name     The value name token.
 * @param value    The explicit numeric value, or {@code null} when omitted.
 * @param comments The attached comments.
 */
public record EnumValueNode(Token name, Long value, Comments comments) implements AstNode, SourceLocatable {

    @Override
    public String getSourceFileName() {
        return name.fileName();
    }

    @Override
    public int getSourceLine() {
        return name.line();
    }
}
