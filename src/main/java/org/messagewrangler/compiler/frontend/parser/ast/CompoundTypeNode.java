package org.messagewrangler.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A fixed-component aggregate in field position: {@code float { x, y, z }}.
 *
 * @param baseType   The base type name (usually a basic type).
 * @param components The component names, in declaration order.
 */
public record CompoundTypeNode(String baseType, List<String> components) implements TypeNode {
}
