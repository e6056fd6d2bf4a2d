package org.messagewrangler.compiler.frontend.transform;

import org.messagewrangler.compiler.frontend.early.EarlyModel;
import org.messagewrangler.compiler.frontend.early.EarlyNamespace;
import org.messagewrangler.compiler.model.SourceRef;

import java.util.List;

/**
 * Gives every file a single root scope named after the file.
 * <p>
 * A model whose only top-level item is a namespace already named after the file is marked as
 * file level and left as is. Otherwise a namespace with the file's name is synthesized and every
 * top-level message, enum, options set, compound and namespace is moved into it.
 */
public class AddFileLevelNamespace implements IEarlyTransform {

    @Override
    public EarlyModel apply(EarlyModel model) {
        if (model.fileLevelNamespace().isPresent() && !model.hasTopLevelItems()) {
            return model;
        }
        List<EarlyNamespace> roots = model.roots();
        if (roots.size() == 1 && !model.hasTopLevelItems()
                && roots.get(0).name().equals(model.fileNamespaceName())) {
            roots.get(0).setFileLevel(true);
            return model;
        }

        EarlyNamespace fileNs = model.addNamespace(model.fileNamespaceName(), EarlyNamespace.NO_PARENT,
                "", "", new SourceRef(model.file(), 0));
        fileNs.setFileLevel(true);
        for (EarlyNamespace root : roots) {
            model.reparent(root.index(), fileNs.index());
        }
        fileNs.messages().addAll(model.messages());
        fileNs.enums().addAll(model.enums());
        fileNs.options().addAll(model.options());
        fileNs.compounds().addAll(model.compounds());
        model.messages().clear();
        model.enums().clear();
        model.options().clear();
        model.compounds().clear();
        return model;
    }
}
