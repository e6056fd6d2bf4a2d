package org.messagewrangler.compiler.frontend.parser.features.importdecl;

import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.frontend.parser.ast.SourceLocatable;
import org.messagewrangler.compiler.model.Token;

/**
 * Parse tree node for the {@code import} declaration.
 *
 * <p>Syntax: {@code import "path" [as Alias]}
 *
 * @param path  The string literal token containing the file path.
 * @param alias The identifier token for the local alias name, or {@code null} for a plain import.
 */
public record ImportNode(Token path, Token alias) implements AstNode, SourceLocatable {

    /**
     * Returns the unquoted import path.
     */
    public String pathValue() {
        return (String) path.value();
    }

    public String aliasName() {
        return alias != null ? alias.text() : null;
    }

    @Override
    public String getSourceFileName() {
        return path.fileName();
    }

    @Override
    public int getSourceLine() {
        return path.line();
    }
}
