package org.messagewrangler.compiler.frontend.transform;

import org.messagewrangler.compiler.frontend.early.EarlyModel;
import org.messagewrangler.compiler.frontend.early.ImportDecl;
import org.messagewrangler.compiler.frontend.module.CompilationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Binds each import of a file to the finished early model of the imported file, taken from the
 * per-compilation registry. Aliased imports are attached under the alias, plain imports under the path.
 * <p>
 * Imports whose file could not be found were already reported by the dependency scanner and are skipped.
 */
public class AttachImportedModels implements IEarlyTransform {

    private static final Logger log = LoggerFactory.getLogger(AttachImportedModels.class);

    private final CompilationContext context;

    public AttachImportedModels(CompilationContext context) {
        this.context = context;
    }

    @Override
    public EarlyModel apply(EarlyModel model) {
        for (ImportDecl decl : model.imports()) {
            if (decl.target() == null) {
                continue;
            }
            Optional<EarlyModel> imported = context.earlyModel(decl.target());
            if (imported.isPresent()) {
                model.importedModels().put(decl.key(), imported.get());
            } else {
                log.debug("{}: import '{}' has no finished model", model.file(), decl.path());
            }
        }
        return model;
    }
}
