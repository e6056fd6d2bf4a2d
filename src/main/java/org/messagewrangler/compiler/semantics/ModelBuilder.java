package org.messagewrangler.compiler.semantics;

import org.messagewrangler.compiler.api.DefaultValue;
import org.messagewrangler.compiler.api.FieldType;
import org.messagewrangler.compiler.api.Model;
import org.messagewrangler.compiler.api.ModelCompound;
import org.messagewrangler.compiler.api.ModelEntity;
import org.messagewrangler.compiler.api.ModelEnum;
import org.messagewrangler.compiler.api.ModelField;
import org.messagewrangler.compiler.api.ModelMessage;
import org.messagewrangler.compiler.api.ModelNamespace;
import org.messagewrangler.compiler.api.TypeRef;
import org.messagewrangler.compiler.diagnostics.DiagnosticsEngine;
import org.messagewrangler.compiler.diagnostics.ErrorKind;
import org.messagewrangler.compiler.frontend.early.EarlyCompound;
import org.messagewrangler.compiler.frontend.early.EarlyEnum;
import org.messagewrangler.compiler.frontend.early.EarlyField;
import org.messagewrangler.compiler.frontend.early.EarlyMessage;
import org.messagewrangler.compiler.frontend.early.EarlyModel;
import org.messagewrangler.compiler.frontend.early.EarlyNamespace;
import org.messagewrangler.compiler.frontend.early.ImportDecl;
import org.messagewrangler.compiler.frontend.early.RawType;
import org.messagewrangler.compiler.frontend.module.CompilationContext;
import org.messagewrangler.compiler.model.SourceRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a fully transformed {@link EarlyModel} into the immutable {@link Model}.
 *
 * <p>The builder binds every QFN reference to a declared entity, merges enum inheritance, computes
 * enum bit widths and reduces field defaults. It never stops at the first problem: duplicate
 * definitions, unresolved references, inheritance cycles and invalid defaults are all reported to the
 * {@link DiagnosticsEngine}, and the offending part is left out of the returned model. Callers must
 * check the engine before using the result.</p>
 *
 * <p>Imported files must already be built; their models supply the symbols this file may refer to.</p>
 */
public class ModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(ModelBuilder.class);

    private final DiagnosticsEngine diagnostics;

    public ModelBuilder(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Builds a model, taking the models of its imports from the compilation context.
     */
    public Model build(EarlyModel early, CompilationContext context) {
        Map<String, Model> imports = new LinkedHashMap<>();
        for (ImportDecl decl : early.imports()) {
            if (decl.target() != null) {
                context.model(decl.target()).ifPresent(m -> imports.put(decl.key(), m));
            }
        }
        return build(early, imports);
    }

    /**
     * Builds a model.
     *
     * @param early   The early model after all transform passes.
     * @param imports The already built models of the file's imports, keyed by alias or path.
     * @return The model; incomplete if errors were reported.
     */
    public Model build(EarlyModel early, Map<String, Model> imports) {
        EarlyNamespace fileNs = early.fileLevelNamespace()
                .orElseThrow(() -> new IllegalStateException("Early model of " + early.file()
                        + " has not been through the transform passes"));
        return new Unit(early, imports).build(fileNs);
    }

    /**
     * Build state of one file.
     */
    private final class Unit {

        private final EarlyModel early;
        private final Map<String, Model> imports;
        private final Map<String, ModelEntity> importedSymbols = new LinkedHashMap<>();
        /** Entities declared by the direct imports themselves; the only imported ones a reference may bind to. */
        private final Map<String, ModelEntity> visibleSymbols = new LinkedHashMap<>();

        private final Map<String, EarlyMessage> messages = new LinkedHashMap<>();
        private final Map<String, EarlyEnum> enums = new LinkedHashMap<>();
        private final Map<String, EarlyCompound> compounds = new LinkedHashMap<>();

        private Map<String, ModelEnum> mergedEnums = Map.of();
        private final Map<String, ModelMessage> builtMessages = new LinkedHashMap<>();
        private final Map<String, ModelCompound> builtCompounds = new LinkedHashMap<>();

        Unit(EarlyModel early, Map<String, Model> imports) {
            this.early = early;
            this.imports = imports;
            for (Model imported : imports.values()) {
                imported.symbols().forEach(importedSymbols::putIfAbsent);
                for (ModelNamespace root : imported.namespaces()) {
                    String prefix = root.qfn() + "::";
                    imported.symbols().forEach((qfn, entity) -> {
                        if (qfn.startsWith(prefix)) {
                            visibleSymbols.putIfAbsent(qfn, entity);
                        }
                    });
                }
            }
        }

        Model build(EarlyNamespace fileNs) {
            checkNamespaceUniqueness();
            collectLocalEntities();

            Set<String> localSymbols = new HashSet<>();
            localSymbols.addAll(messages.keySet());
            localSymbols.addAll(enums.keySet());
            localSymbols.addAll(compounds.keySet());
            mergedEnums = new EnumMerger(diagnostics, enums, visibleSymbols, localSymbols).mergeAll();

            for (Map.Entry<String, EarlyCompound> entry : compounds.entrySet()) {
                EarlyCompound c = entry.getValue();
                builtCompounds.put(entry.getKey(), new ModelCompound(c.name(), entry.getKey(), c.baseType(),
                        c.components(), nullToEmpty(c.doc()), nullToEmpty(c.comment()), c.source()));
            }
            for (Map.Entry<String, EarlyMessage> entry : messages.entrySet()) {
                builtMessages.put(entry.getKey(), buildMessage(entry.getKey(), entry.getValue()));
            }
            checkMessageCycles();

            Map<String, ModelEntity> symbols = new LinkedHashMap<>();
            symbols.putAll(builtMessages);
            symbols.putAll(mergedEnums);
            symbols.putAll(builtCompounds);
            importedSymbols.forEach(symbols::putIfAbsent);

            Map<String, String> aliases = new LinkedHashMap<>();
            for (ImportDecl decl : early.imports()) {
                Model imported = imports.get(decl.key());
                if (decl.isAliased() && imported != null && !imported.namespaces().isEmpty()) {
                    aliases.put(decl.alias(), imported.namespaces().get(0).qfn());
                }
            }

            Model model = new Model(early.file(), List.of(namespace(fileNs)), imports, aliases, symbols);
            log.debug("Built model for {}: {} messages, {} enums, {} symbols",
                    early.file(), builtMessages.size(), mergedEnums.size(), symbols.size());
            return model;
        }

        // === Declarations ===

        private void collectLocalEntities() {
            for (EarlyNamespace ns : early.namespacesDepthFirst()) {
                Map<String, SourceRef> declared = new HashMap<>();
                for (EarlyMessage m : ns.messages()) {
                    if (declare(ns, declared, m.name(), m.source())) {
                        messages.put(qualify(ns, m.name()), m);
                    }
                }
                List<EarlyEnum> allEnums = new ArrayList<>(ns.enums());
                allEnums.addAll(ns.options());
                for (EarlyEnum e : allEnums) {
                    if (declare(ns, declared, e.name(), e.source())) {
                        enums.put(qualify(ns, e.name()), e);
                    }
                }
                for (EarlyCompound c : ns.compounds()) {
                    if (declare(ns, declared, c.name(), c.source())) {
                        compounds.put(qualify(ns, c.name()), c);
                    }
                }
            }
        }

        private boolean declare(EarlyNamespace ns, Map<String, SourceRef> declared, String name, SourceRef source) {
            SourceRef first = declared.putIfAbsent(name, source);
            if (first == null) {
                return true;
            }
            diagnostics.reportError(ErrorKind.DUPLICATE_DEFINITION,
                    "Duplicate definition of '" + name + "' in namespace '" + ns.qfn()
                            + "' (first defined at " + first + ").",
                    source.file(), source.line());
            return false;
        }

        private void checkNamespaceUniqueness() {
            List<Set<Model>> reachable = new ArrayList<>();
            for (Model direct : imports.values()) {
                reachable.add(transitive(direct));
            }

            Map<String, Model> owners = new LinkedHashMap<>();
            Set<String> reported = new HashSet<>();
            for (ImportDecl decl : early.imports()) {
                Model direct = imports.get(decl.key());
                if (direct == null) continue;
                for (Model m : transitive(direct)) {
                    for (ModelNamespace ns : m.allNamespaces()) {
                        Model owner = owners.putIfAbsent(ns.qfn(), m);
                        if (owner != null && owner != m && !reachedTogether(owner, m, reachable)
                                && reported.add(ns.qfn())) {
                            diagnostics.reportError(ErrorKind.DUPLICATE_DEFINITION,
                                    "Namespace '" + ns.qfn() + "' is declared in both " + owner.file()
                                            + " and " + m.file() + ".",
                                    early.file(), decl.line());
                        }
                    }
                }
            }

            Set<String> local = new HashSet<>();
            for (EarlyNamespace ns : early.namespacesDepthFirst()) {
                Model owner = owners.get(ns.qfn());
                if (owner != null) {
                    diagnostics.reportError(ErrorKind.DUPLICATE_DEFINITION,
                            "Namespace '" + ns.qfn() + "' is already declared in " + owner.file() + ".",
                            early.file(), lineOf(ns.source()));
                } else if (!local.add(ns.qfn())) {
                    diagnostics.reportError(ErrorKind.DUPLICATE_DEFINITION,
                            "Namespace '" + ns.qfn() + "' is declared more than once.",
                            early.file(), lineOf(ns.source()));
                }
            }
        }

        private Set<Model> transitive(Model root) {
            Set<Model> seen = Collections.newSetFromMap(new IdentityHashMap<>());
            List<Model> stack = new ArrayList<>(List.of(root));
            while (!stack.isEmpty()) {
                Model m = stack.remove(stack.size() - 1);
                if (seen.add(m)) {
                    stack.addAll(m.imports().values());
                }
            }
            return seen;
        }

        private boolean reachedTogether(Model a, Model b, List<Set<Model>> reachable) {
            for (Set<Model> set : reachable) {
                if (set.contains(a) && set.contains(b)) {
                    return true;
                }
            }
            return false;
        }

        // === Messages ===

        private ModelMessage buildMessage(String qfn, EarlyMessage message) {
            TypeRef parent = null;
            if (message.parentRaw() != null) {
                parent = resolveMessageParent(qfn, message);
            }
            List<ModelField> fields = new ArrayList<>();
            Set<String> fieldNames = new HashSet<>();
            for (EarlyField field : message.fields()) {
                if (!fieldNames.add(field.name())) {
                    diagnostics.reportError(ErrorKind.DUPLICATE_DEFINITION,
                            "Field '" + field.name() + "' is declared more than once in message '" + qfn + "'.",
                            field.source().file(), field.source().line());
                    continue;
                }
                String where = qfn + "." + field.name();
                FieldType type = fieldType(field.type(), where, field.source());
                if (type == null) {
                    continue;
                }
                DefaultValue defaultValue = null;
                if (field.defaultRaw() != null && !field.defaultRaw().isBlank()) {
                    defaultValue = reduceDefault(field, type, where);
                }
                fields.add(new ModelField(field.name(), type, field.modifiers(), defaultValue,
                        nullToEmpty(field.doc()), nullToEmpty(field.comment()), field.source()));
            }
            return new ModelMessage(message.name(), qfn, parent, fields,
                    nullToEmpty(message.doc()), nullToEmpty(message.comment()), message.source());
        }

        private TypeRef resolveMessageParent(String qfn, EarlyMessage message) {
            String parentQfn = message.parentRaw();
            if (messages.containsKey(parentQfn) || visibleSymbols.get(parentQfn) instanceof ModelMessage) {
                return new TypeRef(parentQfn, TypeRef.Kind.MESSAGE);
            }
            boolean exists = enums.containsKey(parentQfn) || compounds.containsKey(parentQfn)
                    || visibleSymbols.containsKey(parentQfn);
            diagnostics.reportError(ErrorKind.UNRESOLVED_REFERENCE, exists
                            ? "Message '" + qfn + "' cannot extend '" + parentQfn + "': it is not a message."
                            : "Message '" + qfn + "' extends unknown message '" + parentQfn + "'.",
                    message.source().file(), message.source().line());
            return null;
        }

        private void checkMessageCycles() {
            Map<String, String> parents = new HashMap<>();
            for (ModelEntity entity : importedSymbols.values()) {
                if (entity instanceof ModelMessage m && m.parent() != null) {
                    parents.put(m.qfn(), m.parent().qfn());
                }
            }
            builtMessages.forEach((qfn, m) -> {
                if (m.parent() != null) {
                    parents.put(qfn, m.parent().qfn());
                }
            });

            Set<Set<String>> reported = new HashSet<>();
            for (Map.Entry<String, ModelMessage> entry : builtMessages.entrySet()) {
                List<String> path = new ArrayList<>();
                String cursor = entry.getKey();
                while (cursor != null) {
                    int seenAt = path.indexOf(cursor);
                    if (seenAt >= 0) {
                        List<String> cycle = new ArrayList<>(path.subList(seenAt, path.size()));
                        if (reported.add(new TreeSet<>(cycle))) {
                            cycle.add(cursor);
                            ModelMessage at = builtMessages.getOrDefault(cursor, entry.getValue());
                            diagnostics.reportError(ErrorKind.CIRCULAR_INHERITANCE,
                                    "Circular message inheritance: " + String.join(" -> ", cycle),
                                    at.source().file(), at.source().line());
                        }
                        break;
                    }
                    path.add(cursor);
                    cursor = parents.get(cursor);
                }
            }
        }

        // === Types and defaults ===

        private FieldType fieldType(RawType raw, String where, SourceRef source) {
            if (raw instanceof RawType.Primitive primitive) {
                return new FieldType.PrimitiveType(FieldType.Primitive.fromKeyword(primitive.name())
                        .orElseThrow(() -> new IllegalStateException("Unknown basic type " + primitive.name())));
            }
            if (raw instanceof RawType.Reference ref) {
                return reference(ref, where, source);
            }
            if (raw instanceof RawType.Compound compound) {
                return new FieldType.CompoundType(compound.baseType(), compound.components());
            }
            if (raw instanceof RawType.Array array) {
                FieldType element = fieldType(array.element(), where, source);
                return element == null ? null : new FieldType.ArrayType(element);
            }
            if (raw instanceof RawType.MapOf map) {
                FieldType key = fieldType(map.key(), where, source);
                FieldType value = fieldType(map.value(), where, source);
                return key == null || value == null ? null : new FieldType.MapType(key, value);
            }
            throw new IllegalStateException("Field " + where + " still has an inline type " + raw
                    + "; PromoteInlineEnums must run before the model is built");
        }

        private FieldType reference(RawType.Reference ref, String where, SourceRef source) {
            String qfn = ref.name();
            FieldType type = null;
            String actual = null;
            if (messages.containsKey(qfn) || visibleSymbols.get(qfn) instanceof ModelMessage) {
                type = new FieldType.MessageRef(new TypeRef(qfn, TypeRef.Kind.MESSAGE));
                actual = "a message";
            } else if (enums.containsKey(qfn) || visibleSymbols.get(qfn) instanceof ModelEnum) {
                boolean options = enums.containsKey(qfn)
                        ? enums.get(qfn).isOptions()
                        : ((ModelEnum) visibleSymbols.get(qfn)).options();
                type = options
                        ? new FieldType.OptionsRef(new TypeRef(qfn, TypeRef.Kind.OPTIONS))
                        : new FieldType.EnumRef(new TypeRef(qfn, TypeRef.Kind.ENUM));
                actual = options ? "an options set" : "an enum";
            } else if (compounds.containsKey(qfn)) {
                EarlyCompound c = compounds.get(qfn);
                type = new FieldType.CompoundType(c.baseType(), c.components());
                actual = "a compound";
            } else if (visibleSymbols.get(qfn) instanceof ModelCompound c) {
                type = new FieldType.CompoundType(c.baseType(), c.components());
                actual = "a compound";
            }

            if (type == null) {
                diagnostics.reportError(ErrorKind.UNRESOLVED_REFERENCE,
                        "Field '" + where + "' references unknown type '" + qfn + "'.",
                        source.file(), source.line());
                return null;
            }
            boolean kindMatches = switch (ref.kind()) {
                case ANY -> true;
                case ENUM -> type instanceof FieldType.EnumRef;
                case OPTIONS -> type instanceof FieldType.OptionsRef;
            };
            if (!kindMatches) {
                String expected = ref.kind() == RawType.RefKind.ENUM ? "an enum" : "an options set";
                diagnostics.reportError(ErrorKind.UNRESOLVED_REFERENCE,
                        "Field '" + where + "' expects " + expected + " but '" + qfn + "' is " + actual + ".",
                        source.file(), source.line());
                return null;
            }
            return type;
        }

        private DefaultValue reduceDefault(EarlyField field, FieldType type, String where) {
            DefaultValueReducer reducer = new DefaultValueReducer(this::enumByQfn);
            try {
                return reducer.reduce(field.defaultRaw(), type);
            } catch (IllegalArgumentException e) {
                diagnostics.reportError(ErrorKind.INVALID_DEFAULT_VALUE,
                        "Invalid default for field '" + where + "': " + e.getMessage() + ".",
                        field.source().file(), field.source().line());
                return null;
            }
        }

        private Optional<ModelEnum> enumByQfn(String qfn) {
            ModelEnum local = mergedEnums.get(qfn);
            if (local != null) {
                return Optional.of(local);
            }
            return visibleSymbols.get(qfn) instanceof ModelEnum e ? Optional.of(e) : Optional.empty();
        }

        // === Namespaces ===

        private ModelNamespace namespace(EarlyNamespace ns) {
            List<ModelNamespace> children = new ArrayList<>();
            for (EarlyNamespace child : early.childrenOf(ns)) {
                children.add(namespace(child));
            }
            List<ModelMessage> nsMessages = new ArrayList<>();
            for (EarlyMessage m : ns.messages()) {
                ModelMessage built = builtMessages.get(qualify(ns, m.name()));
                if (built != null && !nsMessages.contains(built)) {
                    nsMessages.add(built);
                }
            }
            List<ModelEnum> nsEnums = new ArrayList<>();
            List<EarlyEnum> declared = new ArrayList<>(ns.enums());
            declared.addAll(ns.options());
            for (EarlyEnum e : declared) {
                ModelEnum built = mergedEnums.get(qualify(ns, e.name()));
                if (built != null && !nsEnums.contains(built)) {
                    nsEnums.add(built);
                }
            }
            List<ModelCompound> nsCompounds = new ArrayList<>();
            for (EarlyCompound c : ns.compounds()) {
                ModelCompound built = builtCompounds.get(qualify(ns, c.name()));
                if (built != null && !nsCompounds.contains(built)) {
                    nsCompounds.add(built);
                }
            }
            return new ModelNamespace(ns.name(), ns.qfn(), children, nsMessages, nsEnums, nsCompounds,
                    nullToEmpty(ns.doc()), nullToEmpty(ns.comment()), ns.source());
        }
    }

    private static String qualify(EarlyNamespace ns, String name) {
        return ns.qfn() + "::" + name;
    }

    private static int lineOf(SourceRef source) {
        return source != null ? source.line() : 0;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
