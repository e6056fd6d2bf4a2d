package org.messagewrangler.compiler.frontend.early;

import org.messagewrangler.compiler.frontend.module.ModuleId;
import org.messagewrangler.compiler.model.SourceRef;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The raw model of one source file.
 * <p>
 * Namespaces live in an arena owned by the model and refer to each other by index.
 * Items declared outside any namespace are held in the model's own top-level lists until
 * {@code AddFileLevelNamespace} moves them into the file-level namespace.
 * <p>
 * A model is owned by one pass at a time; passes mutate it in place.
 */
public class EarlyModel {

    private final String file;
    private final String fileNamespace;
    private final ModuleId id;
    private final List<EarlyNamespace> arena = new ArrayList<>();
    private final List<Integer> roots = new ArrayList<>();
    private final List<EarlyMessage> messages = new ArrayList<>();
    private final List<EarlyEnum> enums = new ArrayList<>();
    private final List<EarlyEnum> options = new ArrayList<>();
    private final List<EarlyCompound> compounds = new ArrayList<>();
    private final List<ImportDecl> imports = new ArrayList<>();
    private final Map<String, EarlyModel> importedModels = new LinkedHashMap<>();

    /**
     * @param file          The source file name used in diagnostics.
     * @param fileNamespace The name of the file-level namespace (the file stem).
     * @param id            The canonical identity of the file, or {@code null} for in-memory sources.
     */
    public EarlyModel(String file, String fileNamespace, ModuleId id) {
        this.file = file;
        this.fileNamespace = fileNamespace;
        this.id = id;
    }

    public String file() {
        return file;
    }

    public String fileNamespaceName() {
        return fileNamespace;
    }

    public ModuleId id() {
        return id;
    }

    // === Namespace arena ===

    /**
     * Allocates a namespace in the arena and links it under {@code parentIndex}
     * (or as a root when {@code parentIndex} is {@link EarlyNamespace#NO_PARENT}).
     */
    public EarlyNamespace addNamespace(String name, int parentIndex, String doc, String comment, SourceRef source) {
        EarlyNamespace ns = new EarlyNamespace(arena.size(), name, parentIndex, doc, comment, source);
        arena.add(ns);
        if (parentIndex == EarlyNamespace.NO_PARENT) {
            roots.add(ns.index());
        } else {
            arena.get(parentIndex).children().add(ns.index());
        }
        return ns;
    }

    /**
     * Moves a root namespace under another namespace.
     */
    public void reparent(int index, int newParentIndex) {
        EarlyNamespace ns = arena.get(index);
        if (ns.hasParent()) {
            arena.get(ns.parentIndex()).children().remove(Integer.valueOf(index));
        } else {
            roots.remove(Integer.valueOf(index));
        }
        ns.setParentIndex(newParentIndex);
        arena.get(newParentIndex).children().add(index);
    }

    public EarlyNamespace namespace(int index) {
        return arena.get(index);
    }

    public Optional<EarlyNamespace> parentOf(EarlyNamespace ns) {
        return ns.hasParent() ? Optional.of(arena.get(ns.parentIndex())) : Optional.empty();
    }

    public List<EarlyNamespace> childrenOf(EarlyNamespace ns) {
        List<EarlyNamespace> result = new ArrayList<>(ns.children().size());
        for (int child : ns.children()) {
            result.add(arena.get(child));
        }
        return result;
    }

    /**
     * Returns the indices of namespaces without a parent, in declaration order.
     */
    public List<Integer> rootIndices() {
        return Collections.unmodifiableList(roots);
    }

    public List<EarlyNamespace> roots() {
        List<EarlyNamespace> result = new ArrayList<>(roots.size());
        for (int root : roots) {
            result.add(arena.get(root));
        }
        return result;
    }

    /**
     * Returns every namespace reachable from the roots, depth-first in declaration order.
     */
    public List<EarlyNamespace> namespacesDepthFirst() {
        List<EarlyNamespace> result = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(roots.get(i));
        }
        while (!stack.isEmpty()) {
            EarlyNamespace ns = arena.get(stack.pop());
            result.add(ns);
            List<Integer> children = ns.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * Returns the chain of namespaces from the root down to {@code ns}, inclusive.
     */
    public List<EarlyNamespace> ancestry(EarlyNamespace ns) {
        List<EarlyNamespace> chain = new ArrayList<>();
        EarlyNamespace cursor = ns;
        while (cursor != null) {
            chain.add(0, cursor);
            cursor = cursor.hasParent() ? arena.get(cursor.parentIndex()) : null;
        }
        return chain;
    }

    /**
     * Returns the file-level namespace if the model has been wrapped by {@code AddFileLevelNamespace}.
     */
    public Optional<EarlyNamespace> fileLevelNamespace() {
        if (roots.size() == 1 && arena.get(roots.get(0)).isFileLevel()) {
            return Optional.of(arena.get(roots.get(0)));
        }
        return Optional.empty();
    }

    // === Top-level items (before AddFileLevelNamespace) ===

    public List<EarlyMessage> messages() {
        return messages;
    }

    public List<EarlyEnum> enums() {
        return enums;
    }

    public List<EarlyEnum> options() {
        return options;
    }

    public List<EarlyCompound> compounds() {
        return compounds;
    }

    public boolean hasTopLevelItems() {
        return !messages.isEmpty() || !enums.isEmpty() || !options.isEmpty() || !compounds.isEmpty();
    }

    // === Imports ===

    public List<ImportDecl> imports() {
        return imports;
    }

    /**
     * Returns the attached imported models keyed by alias (aliased imports) or path.
     */
    public Map<String, EarlyModel> importedModels() {
        return importedModels;
    }

    /**
     * Returns every namespace-held and top-level message, in depth-first namespace order.
     */
    public List<EarlyMessage> allMessages() {
        List<EarlyMessage> result = new ArrayList<>(messages);
        for (EarlyNamespace ns : namespacesDepthFirst()) {
            result.addAll(ns.messages());
        }
        return result;
    }

    /**
     * Returns every namespace-held and top-level enum and options declaration.
     */
    public List<EarlyEnum> allEnums() {
        List<EarlyEnum> result = new ArrayList<>(enums);
        result.addAll(options);
        for (EarlyNamespace ns : namespacesDepthFirst()) {
            result.addAll(ns.enums());
            result.addAll(ns.options());
        }
        return result;
    }

    @Override
    public String toString() {
        return "EarlyModel[" + file + "]";
    }
}
