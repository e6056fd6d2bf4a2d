package org.messagewrangler.compiler.api;

import org.messagewrangler.compiler.model.SourceRef;

/**
 * A named entity registered in a model's symbol table.
 */
public interface ModelEntity {

    String name();

    String qfn();

    SourceRef source();
}
