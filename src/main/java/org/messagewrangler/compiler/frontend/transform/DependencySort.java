package org.messagewrangler.compiler.frontend.transform;

import org.messagewrangler.compiler.diagnostics.DiagnosticsEngine;
import org.messagewrangler.compiler.diagnostics.ErrorKind;
import org.messagewrangler.compiler.frontend.early.EarlyModel;
import org.messagewrangler.compiler.frontend.early.ImportDecl;
import org.messagewrangler.compiler.frontend.module.ModuleId;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Orders a set of files so that every file comes after the files it imports.
 *
 * <p>Depth-first topological sort over import edges. Files are keyed by canonical absolute path;
 * an import without a resolved identity is resolved against the importing file's directory.
 * A file re-entered while it is still on the DFS stack closes a cycle, which is reported as a
 * circular import naming every file on the cycle. Imports of files outside the set are ignored.</p>
 */
public class DependencySort {

    private final DiagnosticsEngine diagnostics;

    public DependencySort(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Sorts the given models, dependencies first.
     *
     * @param models The models of one compilation.
     * @return The models in dependency order; on a cycle, the order with the back edge ignored.
     */
    public List<EarlyModel> sort(Collection<EarlyModel> models) {
        Map<ModuleId, EarlyModel> byId = new LinkedHashMap<>();
        for (EarlyModel model : models) {
            byId.put(idOf(model), model);
        }

        List<EarlyModel> sorted = new ArrayList<>();
        Set<ModuleId> done = new HashSet<>();
        List<ModuleId> stack = new ArrayList<>();
        for (ModuleId id : byId.keySet()) {
            visit(id, byId, done, stack, sorted);
        }
        return sorted;
    }

    private void visit(ModuleId id, Map<ModuleId, EarlyModel> byId, Set<ModuleId> done,
                       List<ModuleId> stack, List<EarlyModel> sorted) {
        if (done.contains(id)) {
            return;
        }
        EarlyModel model = byId.get(id);
        stack.add(id);
        for (ImportDecl decl : model.imports()) {
            ModuleId target = targetOf(model, decl);
            if (!byId.containsKey(target)) {
                continue;
            }
            int onStack = stack.indexOf(target);
            if (onStack >= 0) {
                reportCycle(stack.subList(onStack, stack.size()), target, byId, model, decl);
                continue;
            }
            visit(target, byId, done, stack, sorted);
        }
        stack.remove(stack.size() - 1);
        done.add(id);
        sorted.add(model);
    }

    private void reportCycle(List<ModuleId> cycle, ModuleId reentered, Map<ModuleId, EarlyModel> byId,
                             EarlyModel importer, ImportDecl decl) {
        String chain = cycle.stream()
                .map(id -> byId.get(id).file())
                .collect(Collectors.joining(" -> "));
        diagnostics.reportError(ErrorKind.CIRCULAR_IMPORT,
                "Circular import: " + chain + " -> " + byId.get(reentered).file(),
                importer.file(), decl.line());
    }

    private static ModuleId idOf(EarlyModel model) {
        return model.id() != null ? model.id() : ModuleId.of(Path.of(model.file()));
    }

    private static ModuleId targetOf(EarlyModel model, ImportDecl decl) {
        if (decl.target() != null) {
            return decl.target();
        }
        Path dir = Path.of(model.file()).toAbsolutePath().getParent();
        Path resolved = dir != null ? dir.resolve(decl.path()) : Path.of(decl.path());
        return ModuleId.of(resolved.normalize());
    }
}
