package org.messagewrangler.compiler.frontend.module;

import org.messagewrangler.compiler.frontend.early.ImportDecl;
import org.messagewrangler.compiler.frontend.parser.ast.SchemaFileNode;

import java.util.List;

/**
 * Per-file result of the dependency scan.
 *
 * @param id         The canonical identity of this file.
 * @param sourcePath The file path used in diagnostics.
 * @param tree       The parse tree (the file is parsed exactly once per compilation).
 * @param imports    The import declarations with their resolved identities.
 */
public record ModuleDescriptor(
        ModuleId id,
        String sourcePath,
        SchemaFileNode tree,
        List<ImportDecl> imports
) {
}
