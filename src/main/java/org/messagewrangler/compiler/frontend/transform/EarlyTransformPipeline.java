package org.messagewrangler.compiler.frontend.transform;

import org.messagewrangler.compiler.diagnostics.DiagnosticsEngine;
import org.messagewrangler.compiler.frontend.early.EarlyModel;
import org.messagewrangler.compiler.frontend.module.CompilationContext;
import org.messagewrangler.compiler.frontend.module.ModuleId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * Runs the early transform passes in their fixed order.
 * <p>
 * Single-file order: AddFileLevelNamespace, AttachImportedModels, CanonicalizeColons, QfnReference,
 * PromoteInlineEnums. For a whole compilation, {@link #runInDependencyOrder(Collection)} first applies
 * {@link DependencySort} and then runs the passes file by file, registering each finished model in the
 * {@link CompilationContext} before any importer of it is processed.
 */
public class EarlyTransformPipeline {

    private static final Logger log = LoggerFactory.getLogger(EarlyTransformPipeline.class);

    private final List<IEarlyTransform> passes;
    private final CompilationContext context;
    private final DiagnosticsEngine diagnostics;

    public EarlyTransformPipeline(List<IEarlyTransform> passes, CompilationContext context, DiagnosticsEngine diagnostics) {
        this.passes = List.copyOf(passes);
        this.context = context;
        this.diagnostics = diagnostics;
    }

    /**
     * Creates the standard pipeline bound to one compilation.
     */
    public static EarlyTransformPipeline standard(CompilationContext context, DiagnosticsEngine diagnostics) {
        return new EarlyTransformPipeline(List.of(
                new AddFileLevelNamespace(),
                new AttachImportedModels(context),
                new CanonicalizeColons(),
                new QfnReference(),
                new PromoteInlineEnums()
        ), context, diagnostics);
    }

    public List<IEarlyTransform> passes() {
        return passes;
    }

    /**
     * Runs every pass over one model.
     */
    public EarlyModel run(EarlyModel model) {
        EarlyModel current = model;
        for (IEarlyTransform pass : passes) {
            log.debug("{}: running {}", current.file(), pass.name());
            current = pass.apply(current);
        }
        return current;
    }

    /**
     * Sorts the models of a compilation and runs every pass over each of them, dependencies first.
     *
     * @return The models in dependency order, or an empty list if the import graph has a cycle.
     */
    public List<EarlyModel> runInDependencyOrder(Collection<EarlyModel> models) {
        int errorsBefore = diagnostics.errorCount();
        List<EarlyModel> ordered = new DependencySort(diagnostics).sort(models);
        if (diagnostics.errorCount() > errorsBefore) {
            return List.of();
        }
        for (EarlyModel model : ordered) {
            EarlyModel finished = run(model);
            ModuleId id = finished.id() != null ? finished.id() : ModuleId.of(Path.of(finished.file()));
            context.registerEarlyModel(id, finished);
        }
        return ordered;
    }
}
