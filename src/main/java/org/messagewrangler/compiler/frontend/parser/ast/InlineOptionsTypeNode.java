package org.messagewrangler.compiler.frontend.parser.ast;

import org.messagewrangler.compiler.frontend.parser.features.enumdef.EnumValueNode;

import java.util.List;

/**
 * An options body declared directly in field position: {@code options { READ, WRITE }}.
 */
public record InlineOptionsTypeNode(List<EnumValueNode> values) implements TypeNode {
}
