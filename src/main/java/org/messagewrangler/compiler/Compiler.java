package org.messagewrangler.compiler;

import org.messagewrangler.compiler.api.Model;
import org.messagewrangler.compiler.diagnostics.DiagnosticsEngine;
import org.messagewrangler.compiler.frontend.early.EarlyModel;
import org.messagewrangler.compiler.frontend.early.EarlyModelBuilder;
import org.messagewrangler.compiler.frontend.io.SourceLoader;
import org.messagewrangler.compiler.frontend.module.CompilationContext;
import org.messagewrangler.compiler.frontend.module.DependencyScanner;
import org.messagewrangler.compiler.frontend.module.ModuleDescriptor;
import org.messagewrangler.compiler.frontend.module.ModuleId;
import org.messagewrangler.compiler.frontend.transform.EarlyTransformPipeline;
import org.messagewrangler.compiler.semantics.ModelBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a schema file and everything it imports into a resolved {@link Model}.
 *
 * <p>Phases: dependency scanning and parsing, early model building, the transform passes in
 * dependency order, and model building. Each phase reports into one {@link DiagnosticsEngine};
 * if a phase leaves errors behind, compilation stops with a {@link CompilationException}.</p>
 */
public class Compiler {

    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    private final CompilerOptions options;

    public Compiler() {
        this(CompilerOptions.defaults());
    }

    public Compiler(CompilerOptions options) {
        this.options = options;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * Compiles a schema file from disk.
     *
     * @throws CompilationException If any error was reported.
     */
    public Model compile(Path rootFile) {
        return compile(rootFile, new DiagnosticsEngine());
    }

    /**
     * Compiles a schema file from disk, reporting into the given engine so that callers see warnings too.
     *
     * @throws CompilationException If any error was reported.
     */
    public Model compile(Path rootFile, DiagnosticsEngine diagnostics) {
        CompilationContext context = new CompilationContext();
        ModuleId rootId = scanner(diagnostics).scan(rootFile, context);
        return finish(rootId, rootFile.toString(), context, diagnostics);
    }

    /**
     * Compiles in-memory source. Imports resolve relative to the directory of {@code sourcePath}.
     *
     * @param content    The root file's source text.
     * @param sourcePath The (possibly virtual) path used for diagnostics and the file-level namespace.
     * @throws CompilationException If any error was reported.
     */
    public Model compileSource(String content, String sourcePath) {
        return compileSource(content, sourcePath, new DiagnosticsEngine());
    }

    public Model compileSource(String content, String sourcePath, DiagnosticsEngine diagnostics) {
        CompilationContext context = new CompilationContext();
        ModuleId rootId = scanner(diagnostics).scan(content, sourcePath, context);
        return finish(rootId, sourcePath, context, diagnostics);
    }

    /**
     * Compiles a schema bundled on the classpath. Its imports resolve against the configured search paths.
     *
     * @throws IOException          If the resource cannot be read.
     * @throws CompilationException If any error was reported.
     */
    public Model compileResource(String resourcePath) throws IOException {
        SourceLoader.LoadResult loaded = SourceLoader.loadClasspath(resourcePath);
        return compileSource(loaded.content(), loaded.logicalName());
    }

    private DependencyScanner scanner(DiagnosticsEngine diagnostics) {
        return new DependencyScanner(diagnostics, options.importSearchPaths(), options.fileExtension());
    }

    private Model finish(ModuleId rootId, String rootName, CompilationContext context, DiagnosticsEngine diagnostics) {
        failIfErrors("Scanning", rootName, diagnostics);

        EarlyModelBuilder earlyBuilder = new EarlyModelBuilder(diagnostics);
        List<EarlyModel> earlyModels = new ArrayList<>();
        for (ModuleDescriptor descriptor : context.descriptors().values()) {
            earlyModels.add(earlyBuilder.build(descriptor));
        }
        failIfErrors("Parsing", rootName, diagnostics);

        List<EarlyModel> ordered = EarlyTransformPipeline.standard(context, diagnostics).runInDependencyOrder(earlyModels);
        failIfErrors("Import resolution", rootName, diagnostics);

        ModelBuilder modelBuilder = new ModelBuilder(diagnostics);
        for (EarlyModel early : ordered) {
            context.registerModel(early.id(), modelBuilder.build(early, context));
        }
        failIfErrors("Model building", rootName, diagnostics);
        if (options.warningsAsErrors() && diagnostics.hasWarnings()) {
            throw new CompilationException("Compilation of " + rootName
                    + " produced warnings, which are treated as errors:\n" + diagnostics.summary(), diagnostics);
        }

        Model model = context.model(rootId)
                .orElseThrow(() -> new IllegalStateException("No model was built for root file " + rootId));
        log.info("Compiled {}: {} files, {} messages, {} enums",
                rootName, ordered.size(), model.messages().size(), model.enums().size());
        return model;
    }

    private static void failIfErrors(String phase, String rootName, DiagnosticsEngine diagnostics) {
        if (diagnostics.hasErrors()) {
            throw new CompilationException(phase + " of " + rootName + " failed with "
                    + diagnostics.errorCount() + " error(s):\n" + diagnostics.summary(), diagnostics);
        }
    }
}
