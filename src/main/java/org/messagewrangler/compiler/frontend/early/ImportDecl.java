package org.messagewrangler.compiler.frontend.early;

import org.messagewrangler.compiler.frontend.module.ModuleId;

/**
 * A raw import.
 *
 * @param path   The path as written in the source.
 * @param alias  The local alias, or {@code null}.
 * @param target The canonical identity of the imported file, or {@code null} if it was never resolved.
 * @param line   The line of the import declaration.
 */
public record ImportDecl(String path, String alias, ModuleId target, int line) {

    /**
     * Returns the key under which the imported model is attached: the alias if given, else the path.
     */
    public String key() {
        return alias != null ? alias : path;
    }

    public boolean isAliased() {
        return alias != null;
    }
}
