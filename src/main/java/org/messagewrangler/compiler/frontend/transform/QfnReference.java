package org.messagewrangler.compiler.frontend.transform;

import org.messagewrangler.compiler.frontend.early.EarlyEnum;
import org.messagewrangler.compiler.frontend.early.EarlyField;
import org.messagewrangler.compiler.frontend.early.EarlyMessage;
import org.messagewrangler.compiler.frontend.early.EarlyModel;
import org.messagewrangler.compiler.frontend.early.EarlyNamespace;
import org.messagewrangler.compiler.frontend.early.ImportDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assigns a QFN to every namespace and rewrites every type and parent reference to the QFN it denotes.
 *
 * <p>An unqualified name is looked up in the enclosing namespace, then in each outer namespace up to the
 * file level; the innermost declaration wins and siblings never see each other's members. If the file
 * does not declare it, the file-level namespaces of the file's own plain (non-aliased) imports are
 * searched in import order; what those files import in turn is not visible. Aliased imports are only reachable as {@code Alias::Name}, which resolves to the imported
 * file's own QFN.</p>
 *
 * <p>A qualified name is accepted as an existing QFN, then tried relative to each enclosing namespace,
 * then through an import alias, then against plain imports. {@code Message::field} also finds the enum
 * promoted from that field's inline body. Names that resolve nowhere are left as written for the
 * Model Builder to report.</p>
 */
public class QfnReference implements IEarlyTransform {

    private static final Logger log = LoggerFactory.getLogger(QfnReference.class);
    private static final String SEP = "::";

    @Override
    public EarlyModel apply(EarlyModel model) {
        EarlyNamespace fileNs = model.fileLevelNamespace()
                .orElseThrow(() -> new IllegalStateException(
                        "QfnReference requires a single file-level namespace in " + model.file()));
        assignQfns(model, fileNs);

        Resolver resolver = new Resolver(model);
        int rewritten = 0;
        for (EarlyNamespace ns : model.namespacesDepthFirst()) {
            List<EarlyNamespace> scopeChain = model.ancestry(ns);
            Collections.reverse(scopeChain);
            for (EarlyMessage message : ns.messages()) {
                if (message.parentRaw() != null) {
                    String resolved = resolver.resolve(message.parentRaw(), scopeChain);
                    if (!resolved.equals(message.parentRaw())) rewritten++;
                    message.setParentRaw(resolved);
                }
                for (EarlyField field : message.fields()) {
                    var before = field.type();
                    field.setType(before.mapNames(name -> resolver.resolve(name, scopeChain), false));
                    if (field.type() != before) rewritten++;
                }
            }
            for (EarlyEnum earlyEnum : ns.enums()) {
                if (earlyEnum.parentRaw() != null) {
                    String resolved = resolver.resolve(earlyEnum.parentRaw(), scopeChain);
                    if (!resolved.equals(earlyEnum.parentRaw())) rewritten++;
                    earlyEnum.setParentRaw(resolved);
                }
            }
        }
        log.debug("{}: rewrote {} references to QFNs", model.file(), rewritten);
        return model;
    }

    private static void assignQfns(EarlyModel model, EarlyNamespace fileNs) {
        fileNs.setQfn(fileNs.name());
        for (EarlyNamespace ns : model.namespacesDepthFirst()) {
            if (ns != fileNs) {
                EarlyNamespace parent = model.parentOf(ns).orElseThrow();
                ns.setQfn(parent.qfn() + SEP + ns.name());
            }
        }
    }

    /**
     * Resolution state for one file: its own tables plus the tables of its imports.
     */
    private static final class Resolver {

        private final NamespaceSymbolTable local;
        private final Map<String, NamespaceSymbolTable> aliased = new LinkedHashMap<>();
        private final List<NamespaceSymbolTable> plain = new ArrayList<>();
        private final List<EarlyNamespace> plainRoots = new ArrayList<>();

        Resolver(EarlyModel model) {
            this.local = NamespaceSymbolTable.build(model);
            Map<EarlyModel, NamespaceSymbolTable> cache = new IdentityHashMap<>();
            for (ImportDecl decl : model.imports()) {
                EarlyModel imported = model.importedModels().get(decl.key());
                if (imported == null || imported.fileLevelNamespace().isEmpty()) {
                    continue;
                }
                NamespaceSymbolTable table = cache.computeIfAbsent(imported, NamespaceSymbolTable::build);
                if (decl.isAliased()) {
                    aliased.put(decl.alias(), table);
                } else if (!plain.contains(table)) {
                    // Only the imported file's own declarations; its imports stay invisible here.
                    plain.add(table);
                    plainRoots.add(imported.fileLevelNamespace().orElseThrow());
                }
            }
        }

        /**
         * @param name       The reference as written (after colon canonicalization).
         * @param scopeChain The enclosing namespaces, innermost first.
         */
        String resolve(String name, List<EarlyNamespace> scopeChain) {
            Optional<String> resolved = name.contains(SEP)
                    ? resolveQualified(name, scopeChain)
                    : resolveUnqualified(name, scopeChain);
            if (resolved.isEmpty() && name.contains(SEP)) {
                String member = inlineMemberName(name);
                resolved = member.contains(SEP)
                        ? resolveQualified(member, scopeChain)
                        : resolveUnqualified(member, scopeChain);
            }
            return resolved.orElse(name);
        }

        private Optional<String> resolveUnqualified(String name, List<EarlyNamespace> scopeChain) {
            for (EarlyNamespace ns : scopeChain) {
                Optional<String> hit = local.lookup(ns, name);
                if (hit.isPresent() && hit.get().startsWith(ns.qfn() + SEP)) {
                    return hit;
                }
            }
            for (int i = 0; i < plain.size(); i++) {
                Optional<String> hit = plain.get(i).lookup(plainRoots.get(i), name);
                if (hit.isPresent()) {
                    return hit;
                }
            }
            return Optional.empty();
        }

        private Optional<String> resolveQualified(String name, List<EarlyNamespace> scopeChain) {
            if (local.containsQfn(name)) {
                return Optional.of(name);
            }
            for (EarlyNamespace ns : scopeChain) {
                String candidate = ns.qfn() + SEP + name;
                if (local.containsQfn(candidate)) {
                    return Optional.of(candidate);
                }
            }
            int sep = name.indexOf(SEP);
            NamespaceSymbolTable aliasTable = sep > 0 ? aliased.get(name.substring(0, sep)) : null;
            if (aliasTable != null) {
                String candidate = aliasTable.rootQfn() + SEP + name.substring(sep + SEP.length());
                if (aliasTable.containsQfn(candidate)) {
                    return Optional.of(candidate);
                }
            }
            for (NamespaceSymbolTable table : plain) {
                if (table.containsQfn(name)) {
                    return Optional.of(name);
                }
                String candidate = table.rootQfn() + SEP + name;
                if (table.containsQfn(candidate)) {
                    return Optional.of(candidate);
                }
            }
            return Optional.empty();
        }

        /**
         * Maps {@code Outer::Message::field} to {@code Outer::Message_field}.
         */
        private static String inlineMemberName(String name) {
            int last = name.lastIndexOf(SEP);
            return name.substring(0, last) + "_" + name.substring(last + SEP.length());
        }
    }
}
