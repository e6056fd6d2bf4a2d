package org.messagewrangler.compiler.backend.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.messagewrangler.compiler.api.DefaultValue;
import org.messagewrangler.compiler.api.FieldType;
import org.messagewrangler.compiler.api.Model;
import org.messagewrangler.compiler.api.ModelCompound;
import org.messagewrangler.compiler.api.ModelEnum;
import org.messagewrangler.compiler.api.ModelEnumValue;
import org.messagewrangler.compiler.api.ModelField;
import org.messagewrangler.compiler.api.ModelMessage;
import org.messagewrangler.compiler.api.ModelNamespace;
import org.messagewrangler.compiler.model.SourceRef;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Serializes a resolved {@link Model} to JSON for external code generators.
 * <p>
 * The document holds the file, the alias map, the paths of the imported files and the file's own
 * namespace tree. Type references are written as QFNs; imported entities are not repeated.
 */
public class ModelJsonWriter {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public String toJson(Model model) {
        return gson.toJson(toJsonTree(model));
    }

    /**
     * Writes the model to {@code <outputDir>/<stem>.model.json}, creating the directory if needed.
     *
     * @return The written file.
     */
    public Path write(Model model, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(stem(model.file()) + ".model.json");
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            gson.toJson(toJsonTree(model), writer);
        }
        return target;
    }

    public JsonObject toJsonTree(Model model) {
        JsonObject root = new JsonObject();
        root.addProperty("file", model.file());
        JsonObject aliases = new JsonObject();
        model.aliases().forEach(aliases::addProperty);
        root.add("aliases", aliases);
        JsonObject imports = new JsonObject();
        for (Map.Entry<String, Model> entry : model.imports().entrySet()) {
            imports.addProperty(entry.getKey(), entry.getValue().file());
        }
        root.add("imports", imports);
        JsonArray namespaces = new JsonArray();
        for (ModelNamespace ns : model.namespaces()) {
            namespaces.add(namespace(ns));
        }
        root.add("namespaces", namespaces);
        return root;
    }

    private JsonObject namespace(ModelNamespace ns) {
        JsonObject json = new JsonObject();
        json.addProperty("name", ns.name());
        json.addProperty("qfn", ns.qfn());
        addComments(json, ns.doc(), ns.comment());
        JsonArray messages = new JsonArray();
        for (ModelMessage message : ns.messages()) {
            messages.add(message(message));
        }
        json.add("messages", messages);
        JsonArray enums = new JsonArray();
        for (ModelEnum e : ns.enums()) {
            enums.add(enumeration(e));
        }
        json.add("enums", enums);
        JsonArray compounds = new JsonArray();
        for (ModelCompound compound : ns.compounds()) {
            JsonObject c = new JsonObject();
            c.addProperty("name", compound.name());
            c.addProperty("qfn", compound.qfn());
            c.addProperty("baseType", compound.baseType());
            c.add("components", strings(compound.components()));
            addSource(c, compound.source());
            compounds.add(c);
        }
        json.add("compounds", compounds);
        JsonArray children = new JsonArray();
        for (ModelNamespace child : ns.namespaces()) {
            children.add(namespace(child));
        }
        json.add("namespaces", children);
        return json;
    }

    private JsonObject message(ModelMessage message) {
        JsonObject json = new JsonObject();
        json.addProperty("name", message.name());
        json.addProperty("qfn", message.qfn());
        message.parentRef().ifPresent(p -> json.addProperty("parent", p.qfn()));
        addComments(json, message.doc(), message.comment());
        addSource(json, message.source());
        JsonArray fields = new JsonArray();
        for (ModelField field : message.fields()) {
            JsonObject f = new JsonObject();
            f.addProperty("name", field.name());
            f.add("type", type(field.type()));
            if (!field.modifiers().isEmpty()) {
                f.add("modifiers", strings(field.modifiers()));
            }
            f.addProperty("optional", field.optional());
            field.defaultValueOpt().ifPresent(d -> f.add("default", defaultValue(d)));
            addComments(f, field.doc(), field.comment());
            addSource(f, field.source());
            fields.add(f);
        }
        json.add("fields", fields);
        return json;
    }

    private JsonObject enumeration(ModelEnum e) {
        JsonObject json = new JsonObject();
        json.addProperty("name", e.name());
        json.addProperty("qfn", e.qfn());
        json.addProperty("kind", e.options() ? "options" : "enum");
        json.addProperty("open", e.open());
        json.addProperty("bitWidth", e.bitWidth());
        e.parentRef().ifPresent(p -> json.addProperty("parent", p.qfn()));
        if (e.promotedFrom() != null) {
            json.addProperty("promotedFrom", e.promotedFrom());
        }
        addComments(json, e.doc(), e.comment());
        addSource(json, e.source());
        JsonArray values = new JsonArray();
        for (ModelEnumValue v : e.values()) {
            JsonObject value = new JsonObject();
            value.addProperty("name", v.name());
            value.addProperty("value", v.value());
            if (v.isInherited()) {
                value.addProperty("inheritedFrom", v.inheritedFrom());
            }
            addComments(value, v.doc(), v.comment());
            values.add(value);
        }
        json.add("values", values);
        return json;
    }

    private JsonObject type(FieldType type) {
        JsonObject json = new JsonObject();
        json.addProperty("tag", type.tag());
        if (type instanceof FieldType.EnumRef ref) {
            json.addProperty("ref", ref.ref().qfn());
        } else if (type instanceof FieldType.OptionsRef ref) {
            json.addProperty("ref", ref.ref().qfn());
        } else if (type instanceof FieldType.MessageRef ref) {
            json.addProperty("ref", ref.ref().qfn());
        } else if (type instanceof FieldType.CompoundType compound) {
            json.addProperty("baseType", compound.baseType());
            json.add("components", strings(compound.components()));
        } else if (type instanceof FieldType.ArrayType array) {
            json.add("element", type(array.element()));
        } else if (type instanceof FieldType.MapType map) {
            json.add("key", type(map.key()));
            json.add("value", type(map.value()));
        }
        return json;
    }

    private JsonObject defaultValue(DefaultValue value) {
        JsonObject json = new JsonObject();
        json.addProperty("text", value.text());
        if (value instanceof DefaultValue.StringValue s) {
            json.addProperty("value", s.value());
        } else if (value instanceof DefaultValue.IntValue i) {
            json.addProperty("value", i.value());
        } else if (value instanceof DefaultValue.FloatValue f) {
            json.addProperty("value", f.value());
        } else if (value instanceof DefaultValue.BoolValue b) {
            json.addProperty("value", b.value());
        } else if (value instanceof DefaultValue.EnumValue e) {
            json.addProperty("value", e.value());
        } else if (value instanceof DefaultValue.FlagsValue f) {
            json.addProperty("value", f.value());
        }
        return json;
    }

    private static JsonArray strings(List<String> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        return array;
    }

    private static void addComments(JsonObject json, String doc, String comment) {
        if (doc != null && !doc.isEmpty()) {
            json.addProperty("doc", doc);
        }
        if (comment != null && !comment.isEmpty()) {
            json.addProperty("comment", comment);
        }
    }

    private static void addSource(JsonObject json, SourceRef source) {
        if (source != null) {
            json.addProperty("line", source.line());
        }
    }

    private static String stem(String file) {
        Path fileName = Path.of(file).getFileName();
        String name = fileName != null ? fileName.toString() : file;
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
