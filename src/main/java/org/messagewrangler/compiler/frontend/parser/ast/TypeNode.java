package org.messagewrangler.compiler.frontend.parser.ast;

/**
 * A type expression in field position. Implemented by one record per syntactic form.
 */
public interface TypeNode extends AstNode {
}
