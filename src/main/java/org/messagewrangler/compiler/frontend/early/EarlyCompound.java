package org.messagewrangler.compiler.frontend.early;

import org.messagewrangler.compiler.model.SourceRef;

import java.util.List;

/**
 * A raw named compound declaration ({@code float Vec3 { x, y, z }}).
 */
public record EarlyCompound(String name, String baseType, List<String> components,
                            String doc, String comment, SourceRef source) {
}
