package org.messagewrangler.compiler.frontend.transform;

import org.messagewrangler.compiler.frontend.early.EarlyModel;

/**
 * A single-file pass of the early transform pipeline.
 * <p>
 * A pass takes exclusive ownership of the model for the duration of {@link #apply(EarlyModel)} and
 * hands back the same (mutated) instance. Passes are idempotent.
 */
public interface IEarlyTransform {

    /**
     * Transforms the model.
     *
     * @param model The model, satisfying the postconditions of every earlier pass.
     * @return The transformed model.
     */
    EarlyModel apply(EarlyModel model);

    /**
     * Returns the pass name used in log output.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
