package org.messagewrangler.compiler.frontend.parser.features.compound;

import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.frontend.parser.ast.Comments;
import org.messagewrangler.compiler.frontend.parser.ast.SourceLocatable;
import org.messagewrangler.compiler.model.Token;

import java.util.List;

/**
 * Parse tree node for a named compound: {@code float Vec3 { x, y, z }}.
 */
public record CompoundDefNode(Token name, String baseType, List<String> components, Comments comments)
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
