package org.messagewrangler.compiler.frontend.parser.ast;

/**
 * Marker interface for all nodes of the concrete parse tree.
 */
public interface AstNode {
}
