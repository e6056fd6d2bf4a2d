package org.messagewrangler.compiler.frontend.parser.features.namespace;

import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.frontend.parser.ast.Comments;
import org.messagewrangler.compiler.frontend.parser.ast.SourceLocatable;
import org.messagewrangler.compiler.model.Token;

import java.util.List;

/**
 * Parse tree node for {@code namespace Name { item* }}.
 */
public record NamespaceNode(Token name, List<AstNode> items, Comments comments) implements AstNode, SourceLocatable {

    @Override
    public String getSourceFileName() {
        return name.fileName();
    }

    @Override
    public int getSourceLine() {
        return name.line();
    }
}
