package org.messagewrangler.compiler.frontend.parser.ast;

import org.messagewrangler.compiler.frontend.parser.features.importdecl.ImportNode;

import java.util.List;

/**
 * Root of the parse tree of one schema file.
 *
 * @param fileName The source file name.
 * @param imports  The import declarations, in source order.
 * @param items    The top-level declarations (namespaces, messages, enums, options, compounds).
 */
public record SchemaFileNode(String fileName, List<ImportNode> imports, List<AstNode> items) implements AstNode {
}
