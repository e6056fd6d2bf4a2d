package org.messagewrangler.compiler.frontend.parser.ast;

/**
 * {@code Map<K, V>}; the key is a basic or named type.
 */
public record MapTypeNode(TypeNode key, TypeNode value) implements TypeNode {
}
