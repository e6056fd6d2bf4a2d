package org.messagewrangler.compiler.frontend.parser.features.enumdef;

import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.frontend.parser.ast.Comments;
import org.messagewrangler.compiler.frontend.parser.ast.SourceLocatable;
import org.messagewrangler.compiler.model.Token;

import java.util.List;

/**
 * Parse tree node for {@code enum|open_enum Name [: Parent] { value, ... }}.
 */
public record EnumNode(Token name, boolean open, String parent, List<EnumValueNode> values, Comments comments)
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
