package org.messagewrangler.compiler.frontend.parser.features.message;

import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.frontend.parser.ast.Comments;
import org.messagewrangler.compiler.frontend.parser.ast.SourceLocatable;
import org.messagewrangler.compiler.frontend.parser.ast.TypeNode;
import org.messagewrangler.compiler.model.Token;

import java.util.List;

/**
 * Parse tree node for {@code modifier* name : type [= default] [;]}.
 *
 * @param name         The field name token.
 * @param modifiers    The modifier words in source order.
 * @param type         The type expression.
 * @param defaultValue The raw default expression text, or {@code null}.
 * @param comments     The attached comments.
 */
public record FieldNode(Token name, List<String> modifiers, TypeNode type, String defaultValue, Comments comments)
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
