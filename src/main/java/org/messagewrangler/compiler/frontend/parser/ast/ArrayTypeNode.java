package org.messagewrangler.compiler.frontend.parser.ast;

/**
 * {@code T[]}. The element is never itself an array or a map.
 */
public record ArrayTypeNode(TypeNode element) implements TypeNode {
}
