package org.messagewrangler.compiler.frontend.module;

import org.messagewrangler.compiler.api.Model;
import org.messagewrangler.compiler.frontend.early.EarlyModel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The per-compilation registry, keyed by canonical file identity.
 * <p>
 * Holds every scanned file, every finished early model and every finished resolved model.
 * It is created by the compiler for one root file and passed explicitly to each phase that needs it;
 * an entry is only added once the file's phase has completed, so readers never see partial state.
 */
public class CompilationContext {

    private final Map<ModuleId, ModuleDescriptor> descriptors = new LinkedHashMap<>();
    private final Map<ModuleId, EarlyModel> earlyModels = new LinkedHashMap<>();
    private final Map<ModuleId, Model> models = new LinkedHashMap<>();
    private ModuleId rootId;

    public void setRoot(ModuleId rootId) {
        this.rootId = rootId;
    }

    public ModuleId root() {
        return rootId;
    }

    // === Scanned files ===

    public boolean isScanned(ModuleId id) {
        return descriptors.containsKey(id);
    }

    public void registerDescriptor(ModuleDescriptor descriptor) {
        descriptors.put(descriptor.id(), descriptor);
    }

    public Optional<ModuleDescriptor> descriptor(ModuleId id) {
        return Optional.ofNullable(descriptors.get(id));
    }

    /**
     * Returns the scanned files in discovery order.
     */
    public Map<ModuleId, ModuleDescriptor> descriptors() {
        return Collections.unmodifiableMap(descriptors);
    }

    // === Finished early models ===

    public void registerEarlyModel(ModuleId id, EarlyModel model) {
        earlyModels.put(id, model);
    }

    public Optional<EarlyModel> earlyModel(ModuleId id) {
        return Optional.ofNullable(earlyModels.get(id));
    }

    public Map<ModuleId, EarlyModel> earlyModels() {
        return Collections.unmodifiableMap(earlyModels);
    }

    // === Finished resolved models ===

    public void registerModel(ModuleId id, Model model) {
        models.put(id, model);
    }

    public Optional<Model> model(ModuleId id) {
        return Optional.ofNullable(models.get(id));
    }
}
