package org.messagewrangler.compiler.frontend.parser.features.message;

import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.frontend.parser.ast.Comments;
import org.messagewrangler.compiler.frontend.parser.ast.SourceLocatable;
import org.messagewrangler.compiler.model.Token;

import java.util.List;

/**
 * Parse tree node for {@code message Name [: Parent] { field* }}.
 *
 * @param name     The message name token.
 * @param parent   The parent message name as written, or {@code null}.
 * @param fields   The fields in declaration order.
 * @param comments The attached comments.
 */
public record MessageNode(Token name, String parent, List<FieldNode> fields, Comments comments)
        implements AstNode, SourceLocatable {

    @Override
    public String getSourceFileName() {
        return name.fileName();
    }

    @Override
    public int getSourceLine() {
        return name.line();
    }
}
