package org.messagewrangler.compiler.frontend.parser.ast;

/**
 * A reference to a named type, bare or qualified with {@code ::} or a legacy {@code .}.
 *
 * @param name     The name as written.
 * @param expected The entity kind required by the syntax ({@code enum X} demands an enum).
 */
public record RefTypeNode(String name, Expected expected) implements TypeNode {

    public enum Expected {
        ANY,
        ENUM,
        OPTIONS
    }
}
