package org.messagewrangler.compiler.frontend.parser.features.options;

import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.frontend.parser.ast.Comments;
import org.messagewrangler.compiler.frontend.parser.ast.SourceLocatable;
import org.messagewrangler.compiler.frontend.parser.features.enumdef.EnumValueNode;
import org.messagewrangler.compiler.model.Token;

import java.util.List;

/**
 * Parse tree node for a standalone {@code options Name { flag [= N], ... }} declaration.
 */
public record OptionsNode(Token name, List<EnumValueNode> values, Comments comments)
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
