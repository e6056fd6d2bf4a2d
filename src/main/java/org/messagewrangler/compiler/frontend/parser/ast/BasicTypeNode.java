package org.messagewrangler.compiler.frontend.parser.ast;

import java.util.Set;

/**
 * One of the built-in types {@code string}, {@code int}, {@code float}, {@code bool}, {@code byte}.
 *
 * @param name The type keyword.
 */
public record BasicTypeNode(String name) implements TypeNode {

    public static final Set<String> NAMES = Set.of("string", "int", "float", "bool", "byte");

    public static boolean isBasic(String name) {
        return NAMES.contains(name);
    }
}
