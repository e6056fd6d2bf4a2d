package org.messagewrangler.compiler.frontend.transform;

import org.messagewrangler.compiler.frontend.early.EarlyCompound;
import org.messagewrangler.compiler.frontend.early.EarlyEnum;
import org.messagewrangler.compiler.frontend.early.EarlyField;
import org.messagewrangler.compiler.frontend.early.EarlyMessage;
import org.messagewrangler.compiler.frontend.early.EarlyModel;
import org.messagewrangler.compiler.frontend.early.EarlyNamespace;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-namespace symbol tables of one file, mapping the unqualified names declared directly in a
 * namespace to their QFNs.
 * <p>
 * Fields with an inline enum or options body register the name their promoted enum will get
 * ({@code Message_field}), so references to it resolve before promotion.
 */
public final class NamespaceSymbolTable {

    private final Map<Integer, Map<String, String>> scopes = new HashMap<>();
    private final Set<String> qfns = new LinkedHashSet<>();
    private final String rootQfn;

    private NamespaceSymbolTable(String rootQfn) {
        this.rootQfn = rootQfn;
    }

    /**
     * Builds the tables of a model whose namespaces already carry QFNs.
     */
    public static NamespaceSymbolTable build(EarlyModel model) {
        EarlyNamespace root = model.fileLevelNamespace()
                .orElseThrow(() -> new IllegalStateException("No file-level namespace in " + model.file()));
        NamespaceSymbolTable table = new NamespaceSymbolTable(root.qfn());
        for (EarlyNamespace ns : model.namespacesDepthFirst()) {
            Map<String, String> scope = table.scopes.computeIfAbsent(ns.index(), k -> new HashMap<>());
            for (EarlyMessage message : ns.messages()) {
                table.define(scope, ns, message.name());
            }
            for (EarlyEnum earlyEnum : ns.enums()) {
                table.define(scope, ns, earlyEnum.name());
            }
            for (EarlyEnum options : ns.options()) {
                table.define(scope, ns, options.name());
            }
            for (EarlyCompound compound : ns.compounds()) {
                table.define(scope, ns, compound.name());
            }
            for (EarlyMessage message : ns.messages()) {
                for (EarlyField field : message.fields()) {
                    if (field.type().containsInline()) {
                        table.define(scope, ns, PromoteInlineEnums.promotedName(message, field));
                    }
                }
            }
        }
        return table;
    }

    private void define(Map<String, String> scope, EarlyNamespace ns, String name) {
        String qfn = ns.qfn() + "::" + name;
        scope.putIfAbsent(name, qfn);
        qfns.add(qfn);
    }

    /**
     * Looks up a name declared directly in the given namespace.
     */
    public Optional<String> lookup(EarlyNamespace ns, String name) {
        Map<String, String> scope = scopes.get(ns.index());
        return scope == null ? Optional.empty() : Optional.ofNullable(scope.get(name));
    }

    public boolean containsQfn(String qfn) {
        return qfns.contains(qfn);
    }

    /**
     * Returns the QFN of the file-level namespace.
     */
    public String rootQfn() {
        return rootQfn;
    }

    public Set<String> qfns() {
        return qfns;
    }
}
