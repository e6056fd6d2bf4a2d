package org.messagewrangler.compiler.frontend.early;

import org.messagewrangler.compiler.diagnostics.DiagnosticsEngine;
import org.messagewrangler.compiler.frontend.module.ModuleDescriptor;
import org.messagewrangler.compiler.frontend.module.ModuleId;
import org.messagewrangler.compiler.frontend.parser.ast.ArrayTypeNode;
import org.messagewrangler.compiler.frontend.parser.ast.AstNode;
import org.messagewrangler.compiler.frontend.parser.ast.BasicTypeNode;
import org.messagewrangler.compiler.frontend.parser.ast.CompoundTypeNode;
import org.messagewrangler.compiler.frontend.parser.ast.InlineEnumTypeNode;
import org.messagewrangler.compiler.frontend.parser.ast.InlineOptionsTypeNode;
import org.messagewrangler.compiler.frontend.parser.ast.MapTypeNode;
import org.messagewrangler.compiler.frontend.parser.ast.RefTypeNode;
import org.messagewrangler.compiler.frontend.parser.ast.SchemaFileNode;
import org.messagewrangler.compiler.frontend.parser.ast.TypeNode;
import org.messagewrangler.compiler.frontend.parser.features.compound.CompoundDefNode;
import org.messagewrangler.compiler.frontend.parser.features.enumdef.EnumNode;
import org.messagewrangler.compiler.frontend.parser.features.enumdef.EnumValueNode;
import org.messagewrangler.compiler.frontend.parser.features.importdecl.ImportNode;
import org.messagewrangler.compiler.frontend.parser.features.message.FieldNode;
import org.messagewrangler.compiler.frontend.parser.features.message.MessageNode;
import org.messagewrangler.compiler.frontend.parser.features.namespace.NamespaceNode;
import org.messagewrangler.compiler.frontend.parser.features.options.OptionsNode;
import org.messagewrangler.compiler.model.SourceRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Walks a parse tree once and produces the raw {@link EarlyModel} of the file.
 * <p>
 * No names are resolved here: type names, parent names and default expressions are copied verbatim,
 * and inline enum and options bodies stay attached to their fields. The only computation is value
 * numbering: an omitted enum value is the previous value plus one (0 for the first), an omitted
 * options value is the next power of two above the previous value (1 for the first).
 */
public class EarlyModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(EarlyModelBuilder.class);
    private static final Set<String> KNOWN_MODIFIERS = Set.of("optional", "repeated", "required");

    private final DiagnosticsEngine diagnostics;

    public EarlyModelBuilder(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Builds the early model of a scanned module, carrying the resolved import identities.
     */
    public EarlyModel build(ModuleDescriptor descriptor) {
        EarlyModel model = new EarlyModel(descriptor.sourcePath(),
                fileNamespaceFor(descriptor.sourcePath()), descriptor.id());
        model.imports().addAll(descriptor.imports());
        populate(model, descriptor.tree());
        return model;
    }

    /**
     * Builds the early model of a parse tree.
     *
     * @param tree          The parse tree.
     * @param fileNamespace The name of the file-level namespace.
     * @param sourceFile    The source file name recorded as provenance.
     * @return The raw model, with imports unresolved.
     */
    public EarlyModel build(SchemaFileNode tree, String fileNamespace, String sourceFile) {
        EarlyModel model = new EarlyModel(sourceFile, fileNamespace, null);
        for (ImportNode importNode : tree.imports()) {
            model.imports().add(new ImportDecl(importNode.pathValue(), importNode.aliasName(), null,
                    importNode.getSourceLine()));
        }
        populate(model, tree);
        return model;
    }

    /**
     * Derives the file-level namespace name from a path: the file name without extension,
     * with characters that cannot appear in a name replaced by {@code _}.
     */
    public static String fileNamespaceFor(String sourceFile) {
        Path fileName = Path.of(sourceFile).getFileName();
        String stem = fileName != null ? fileName.toString() : sourceFile;
        int dot = stem.lastIndexOf('.');
        if (dot > 0) {
            stem = stem.substring(0, dot);
        }
        String sanitized = stem.replaceAll("[^A-Za-z0-9_]", "_");
        if (sanitized.isEmpty() || Character.isDigit(sanitized.charAt(0))) {
            sanitized = "_" + sanitized;
        }
        return sanitized;
    }

    private void populate(EarlyModel model, SchemaFileNode tree) {
        for (AstNode item : tree.items()) {
            addItem(model, item, null, "");
        }
        log.debug("Built early model for {}: {} namespaces, {} messages, {} enums",
                model.file(), model.namespacesDepthFirst().size(), model.allMessages().size(), model.allEnums().size());
    }

    private void addItem(EarlyModel model, AstNode item, EarlyNamespace parent, String namespacePath) {
        if (item instanceof NamespaceNode node) {
            EarlyNamespace ns = model.addNamespace(node.name().text(),
                    parent != null ? parent.index() : EarlyNamespace.NO_PARENT,
                    node.comments().doc(), node.comments().comment(), source(node.getSourceFileName(), node.getSourceLine()));
            String path = namespacePath.isEmpty() ? ns.name() : namespacePath + "::" + ns.name();
            for (AstNode child : node.items()) {
                addItem(model, child, ns, path);
            }
        } else if (item instanceof MessageNode node) {
            EarlyMessage message = buildMessage(node, namespacePath);
            if (parent != null) {
                parent.messages().add(message);
            } else {
                model.messages().add(message);
            }
        } else if (item instanceof EnumNode node) {
            EarlyEnum earlyEnum = new EarlyEnum(node.name().text(), EarlyEnum.Kind.ENUM, node.open(),
                    values(node.values(), false), node.parent(), node.comments().doc(), node.comments().comment(),
                    source(node.getSourceFileName(), node.getSourceLine()));
            if (parent != null) {
                parent.enums().add(earlyEnum);
            } else {
                model.enums().add(earlyEnum);
            }
        } else if (item instanceof OptionsNode node) {
            EarlyEnum options = new EarlyEnum(node.name().text(), EarlyEnum.Kind.OPTIONS, false,
                    values(node.values(), true), null, node.comments().doc(), node.comments().comment(),
                    source(node.getSourceFileName(), node.getSourceLine()));
            if (parent != null) {
                parent.options().add(options);
            } else {
                model.options().add(options);
            }
        } else if (item instanceof CompoundDefNode node) {
            EarlyCompound compound = new EarlyCompound(node.name().text(), node.baseType(), List.copyOf(node.components()),
                    node.comments().doc(), node.comments().comment(), source(node.getSourceFileName(), node.getSourceLine()));
            if (parent != null) {
                parent.compounds().add(compound);
            } else {
                model.compounds().add(compound);
            }
        } else {
            throw new IllegalStateException("Unexpected parse tree node: " + item.getClass().getSimpleName());
        }
    }

    private EarlyMessage buildMessage(MessageNode node, String namespacePath) {
        EarlyMessage message = new EarlyMessage(node.name().text(), node.parent(), node.comments().doc(),
                node.comments().comment(), source(node.getSourceFileName(), node.getSourceLine()));
        for (FieldNode fieldNode : node.fields()) {
            for (String modifier : fieldNode.modifiers()) {
                if (!KNOWN_MODIFIERS.contains(modifier)) {
                    diagnostics.reportWarning("Unknown modifier '" + modifier + "' on field '"
                                    + node.name().text() + "." + fieldNode.name().text() + "'.",
                            fieldNode.getSourceFileName(), fieldNode.getSourceLine());
                }
            }
            message.fields().add(new EarlyField(fieldNode.name().text(), rawType(fieldNode.type()),
                    fieldNode.modifiers(), fieldNode.defaultValue(), fieldNode.comments().doc(),
                    fieldNode.comments().comment(), source(fieldNode.getSourceFileName(), fieldNode.getSourceLine()),
                    namespacePath));
        }
        return message;
    }

    private RawType rawType(TypeNode type) {
        if (type instanceof BasicTypeNode basic) {
            return new RawType.Primitive(basic.name());
        }
        if (type instanceof RefTypeNode ref) {
            RawType.RefKind kind = switch (ref.expected()) {
                case ENUM -> RawType.RefKind.ENUM;
                case OPTIONS -> RawType.RefKind.OPTIONS;
                case ANY -> RawType.RefKind.ANY;
            };
            return new RawType.Reference(ref.name(), kind);
        }
        if (type instanceof ArrayTypeNode array) {
            return new RawType.Array(rawType(array.element()));
        }
        if (type instanceof MapTypeNode map) {
            return new RawType.MapOf(rawType(map.key()), rawType(map.value()));
        }
        if (type instanceof InlineEnumTypeNode inline) {
            return new RawType.InlineEnum(inline.open(), values(inline.values(), false));
        }
        if (type instanceof InlineOptionsTypeNode inline) {
            return new RawType.InlineOptions(values(inline.values(), true));
        }
        if (type instanceof CompoundTypeNode compound) {
            return new RawType.Compound(compound.baseType(), List.copyOf(compound.components()));
        }
        throw new IllegalStateException("Unexpected type node: " + type.getClass().getSimpleName());
    }

    /**
     * Assigns numeric values to a value list.
     *
     * @param nodes   The parsed values.
     * @param options Whether the list belongs to an options set (power-of-two numbering).
     */
    static List<EarlyEnumValue> values(List<EnumValueNode> nodes, boolean options) {
        List<EarlyEnumValue> values = new ArrayList<>(nodes.size());
        Long previous = null;
        for (EnumValueNode node : nodes) {
            long value;
            if (node.value() != null) {
                value = node.value();
            } else if (options) {
                value = nextFlag(previous);
            } else {
                value = previous == null ? 0 : previous + 1;
            }
            values.add(new EarlyEnumValue(node.name().text(), value, node.value() != null,
                    node.comments().doc(), node.comments().comment(),
                    new SourceRef(node.getSourceFileName(), node.getSourceLine())));
            previous = value;
        }
        return values;
    }

    private static long nextFlag(Long previous) {
        if (previous == null || previous <= 0) {
            return 1;
        }
        return Long.highestOneBit(previous) << 1;
    }

    private static SourceRef source(String file, int line) {
        return new SourceRef(file, line);
    }
}
