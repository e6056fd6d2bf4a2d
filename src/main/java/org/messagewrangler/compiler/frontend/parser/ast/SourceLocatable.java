package org.messagewrangler.compiler.frontend.parser.ast;

/**
 * Capability interface for parse tree nodes that originate from a specific source position.
 * Used by the early model builder to annotate raw entities with provenance.
 */
public interface SourceLocatable {

    /**
     * Returns the file path of the source file this node originated from.
     *
     * @return The source file path, never null for nodes implementing this interface.
     */
    String getSourceFileName();

    /**
     * Returns the 1-based line of the declaring token.
     */
    int getSourceLine();
}
