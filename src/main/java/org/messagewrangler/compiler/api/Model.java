package org.messagewrangler.compiler.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The resolved, immutable model of one schema file and its imports.
 * <p>
 * Every type occurrence in the model is either a primitive, a compound, or a {@link TypeRef} that
 * resolves through {@link #resolve(TypeRef)}. The symbol table covers this file and every file it
 * imports, directly or transitively.
 */
public final class Model {

    private final String file;
    private final List<ModelNamespace> namespaces;
    private final Map<String, Model> imports;
    private final Map<String, String> aliases;
    private final Map<String, ModelEntity> symbols;

    /**
     * @param file       The source file.
     * @param namespaces The namespaces declared by this file (normally the single file-level namespace).
     * @param imports    The imported models keyed by alias (aliased imports) or path.
     * @param aliases    Import alias to the imported file-level namespace QFN.
     * @param symbols    QFN to entity, for this file and all imported files.
     */
    public Model(String file, List<ModelNamespace> namespaces, Map<String, Model> imports,
                 Map<String, String> aliases, Map<String, ModelEntity> symbols) {
        this.file = file;
        this.namespaces = List.copyOf(namespaces);
        this.imports = Collections.unmodifiableMap(new LinkedHashMap<>(imports));
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        this.symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
    }

    public String file() {
        return file;
    }

    public List<ModelNamespace> namespaces() {
        return namespaces;
    }

    public Map<String, Model> imports() {
        return imports;
    }

    public Map<String, String> aliases() {
        return aliases;
    }

    public Map<String, ModelEntity> symbols() {
        return symbols;
    }

    public Optional<ModelEntity> resolve(TypeRef ref) {
        return Optional.ofNullable(symbols.get(ref.qfn()));
    }

    public Optional<ModelEntity> lookup(String qfn) {
        return Optional.ofNullable(symbols.get(qfn));
    }

    public Optional<ModelMessage> message(String qfn) {
        ModelEntity entity = symbols.get(qfn);
        return entity instanceof ModelMessage m ? Optional.of(m) : Optional.empty();
    }

    public Optional<ModelEnum> enumeration(String qfn) {
        ModelEntity entity = symbols.get(qfn);
        return entity instanceof ModelEnum e ? Optional.of(e) : Optional.empty();
    }

    /**
     * Returns the namespaces of this file, depth-first.
     */
    public List<ModelNamespace> allNamespaces() {
        List<ModelNamespace> result = new ArrayList<>();
        for (ModelNamespace ns : namespaces) {
            collect(ns, result);
        }
        return result;
    }

    private static void collect(ModelNamespace ns, List<ModelNamespace> out) {
        out.add(ns);
        for (ModelNamespace child : ns.namespaces()) {
            collect(child, out);
        }
    }

    /**
     * Returns the messages declared in this file, depth-first by namespace.
     */
    public List<ModelMessage> messages() {
        List<ModelMessage> result = new ArrayList<>();
        for (ModelNamespace ns : allNamespaces()) {
            result.addAll(ns.messages());
        }
        return result;
    }

    /**
     * Returns the enums and options sets declared in this file, depth-first by namespace.
     */
    public List<ModelEnum> enums() {
        List<ModelEnum> result = new ArrayList<>();
        for (ModelNamespace ns : allNamespaces()) {
            result.addAll(ns.enums());
        }
        return result;
    }

    @Override
    public String toString() {
        return "Model[" + file + "]";
    }
}
