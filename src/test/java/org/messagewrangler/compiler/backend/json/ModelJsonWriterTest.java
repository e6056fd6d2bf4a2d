package org.messagewrangler.compiler.backend.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.messagewrangler.compiler.Compiler;
import org.messagewrangler.compiler.api.Model;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class ModelJsonWriterTest {

    private final ModelJsonWriter writer = new ModelJsonWriter();
    private Model model;

    @BeforeEach
    void setUp() {
        model = new Compiler().compileSource("""
                enum Base { A = 1 }
                /// Colors.
                enum Color : Base { B = 2 }
                message Pixel {
                    color: Color = B
                    optional alpha: byte = 255
                    tags: Map<string, Pixel[]>
                    state: options { On, Blink }
                }
                float Vec { x, y }
                """, "pixels.def");
    }

    private static JsonObject fileNamespace(JsonObject root) {
        return root.getAsJsonArray("namespaces").get(0).getAsJsonObject();
    }

    @Test
    void writesFileAndNamespace() {
        JsonObject root = writer.toJsonTree(model);

        assertThat(root.get("file").getAsString()).isEqualTo("pixels.def");
        assertThat(root.getAsJsonObject("aliases").size()).isZero();
        assertThat(root.getAsJsonObject("imports").size()).isZero();
        JsonObject ns = fileNamespace(root);
        assertThat(ns.get("qfn").getAsString()).isEqualTo("pixels");
        assertThat(ns.getAsJsonArray("messages")).hasSize(1);
        assertThat(ns.getAsJsonArray("enums")).hasSize(3);
        assertThat(ns.getAsJsonArray("compounds").get(0).getAsJsonObject().get("baseType").getAsString())
                .isEqualTo("float");
        assertThat(ns.getAsJsonArray("namespaces")).isEmpty();
    }

    @Test
    void writesEnumsWithInheritedValues() {
        JsonArray enums = fileNamespace(writer.toJsonTree(model)).getAsJsonArray("enums");
        JsonObject color = enums.get(1).getAsJsonObject();

        assertThat(color.get("qfn").getAsString()).isEqualTo("pixels::Color");
        assertThat(color.get("kind").getAsString()).isEqualTo("enum");
        assertThat(color.get("parent").getAsString()).isEqualTo("pixels::Base");
        assertThat(color.get("bitWidth").getAsInt()).isEqualTo(8);
        assertThat(color.get("doc").getAsString()).isEqualTo("Colors.");
        JsonObject inherited = color.getAsJsonArray("values").get(0).getAsJsonObject();
        assertThat(inherited.get("name").getAsString()).isEqualTo("A");
        assertThat(inherited.get("inheritedFrom").getAsString()).isEqualTo("pixels::Base");
        assertThat(color.getAsJsonArray("values").get(1).getAsJsonObject().has("inheritedFrom")).isFalse();

        JsonObject state = enums.get(2).getAsJsonObject();
        assertThat(state.get("kind").getAsString()).isEqualTo("options");
        assertThat(state.get("promotedFrom").getAsString()).isEqualTo("Pixel.state");
    }

    @Test
    void writesFieldTypesAndDefaults() {
        JsonArray fields = fileNamespace(writer.toJsonTree(model)).getAsJsonArray("messages")
                .get(0).getAsJsonObject().getAsJsonArray("fields");

        JsonObject color = fields.get(0).getAsJsonObject();
        assertThat(color.getAsJsonObject("type").get("tag").getAsString()).isEqualTo("enum");
        assertThat(color.getAsJsonObject("type").get("ref").getAsString()).isEqualTo("pixels::Color");
        assertThat(color.getAsJsonObject("default").get("text").getAsString()).isEqualTo("B");
        assertThat(color.getAsJsonObject("default").get("value").getAsLong()).isEqualTo(2);
        assertThat(color.get("optional").getAsBoolean()).isFalse();

        JsonObject alpha = fields.get(1).getAsJsonObject();
        assertThat(alpha.get("optional").getAsBoolean()).isTrue();
        assertThat(alpha.getAsJsonArray("modifiers").get(0).getAsString()).isEqualTo("optional");

        JsonObject tags = fields.get(2).getAsJsonObject().getAsJsonObject("type");
        assertThat(tags.get("tag").getAsString()).isEqualTo("map");
        assertThat(tags.getAsJsonObject("key").get("tag").getAsString()).isEqualTo("string");
        JsonObject value = tags.getAsJsonObject("value");
        assertThat(value.get("tag").getAsString()).isEqualTo("array");
        assertThat(value.getAsJsonObject("element").get("ref").getAsString()).isEqualTo("pixels::Pixel");
    }

    @Test
    void writesPrettyPrintedFile(@TempDir Path dir) throws IOException {
        Path written = writer.write(model, dir.resolve("out"));

        assertThat(written).isEqualTo(dir.resolve("out").resolve("pixels.model.json"));
        String json = Files.readString(written);
        assertThat(json).contains("\n  \"file\": \"pixels.def\"");
        assertThat(JsonParser.parseString(json)).isEqualTo(writer.toJsonTree(model));
        assertThat(writer.toJson(model)).isEqualTo(json);
    }
}
