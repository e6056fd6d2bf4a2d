package org.messagewrangler.compiler.frontend.parser.ast;

import org.messagewrangler.compiler.frontend.parser.features.enumdef.EnumValueNode;

import java.util.List;

/**
 * An enum body declared directly in field position: {@code enum { A, B = 4 }}.
 */
public record InlineEnumTypeNode(boolean open, List<EnumValueNode> values) implements TypeNode {
}
