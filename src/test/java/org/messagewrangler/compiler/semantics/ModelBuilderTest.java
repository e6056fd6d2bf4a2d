package org.messagewrangler.compiler.semantics;

import org.messagewrangler.compiler.api.DefaultValue;
import org.messagewrangler.compiler.api.FieldType;
import org.messagewrangler.compiler.api.Model;
import org.messagewrangler.compiler.api.ModelEnum;
import org.messagewrangler.compiler.api.ModelEnumValue;
import org.messagewrangler.compiler.api.ModelField;
import org.messagewrangler.compiler.api.ModelMessage;
import org.messagewrangler.compiler.api.ModelNamespace;
import org.messagewrangler.compiler.api.TypeRef;
import org.messagewrangler.compiler.diagnostics.Diagnostic;
import org.messagewrangler.compiler.diagnostics.DiagnosticsEngine;
import org.messagewrangler.compiler.diagnostics.ErrorKind;
import org.messagewrangler.compiler.frontend.early.EarlyModel;
import org.messagewrangler.compiler.frontend.early.EarlyModelBuilder;
import org.messagewrangler.compiler.frontend.lexer.Lexer;
import org.messagewrangler.compiler.frontend.module.CompilationContext;
import org.messagewrangler.compiler.frontend.parser.Parser;
import org.messagewrangler.compiler.frontend.transform.AddFileLevelNamespace;
import org.messagewrangler.compiler.frontend.transform.EarlyTransformPipeline;
import org.messagewrangler.compiler.frontend.transform.QfnReference;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class ModelBuilderTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private EarlyModel early(String source) {
        Parser parser = new Parser(new Lexer(source, diagnostics, "test.def").scanTokens(), diagnostics);
        EarlyModel early = new EarlyModelBuilder(diagnostics).build(parser.parse(), "test", "test.def");
        assertThat(diagnostics.hasErrors()).as("parse errors: %s", diagnostics.summary()).isFalse();
        return early;
    }

    private Model build(String source) {
        EarlyModel model = early(source);
        EarlyTransformPipeline.standard(new CompilationContext(), diagnostics).run(model);
        return new ModelBuilder(diagnostics).build(model, Map.of());
    }

    private static ModelEnum enumeration(Model model, String qfn) {
        return model.enumeration(qfn).orElseThrow();
    }

    private static ModelMessage message(Model model, String qfn) {
        return model.message(qfn).orElseThrow();
    }

    private static ModelField field(Model model, String messageQfn, String name) {
        return message(model, messageQfn).field(name).orElseThrow();
    }

    private Diagnostic onlyError(ErrorKind kind) {
        assertThat(diagnostics.errors()).as(diagnostics.summary()).hasSize(1);
        assertThat(diagnostics.errors().get(0).kind()).isEqualTo(kind);
        return diagnostics.errors().get(0);
    }

    @Nested
    class EnumInheritance {

        @Test
        void mergesParentValuesFirst() {
            Model model = build("""
                    enum A { X = 1 }
                    enum B : A { Y = 2 }
                    enum C : B { Z = 3 }
                    """);

            ModelEnum c = enumeration(model, "test::C");
            assertThat(c.values()).extracting(ModelEnumValue::name).containsExactly("X", "Y", "Z");
            assertThat(c.values()).extracting(ModelEnumValue::value).containsExactly(1L, 2L, 3L);
            assertThat(c.values()).extracting(ModelEnumValue::inheritedFrom).containsExactly("test::A", "test::B", null);
            assertThat(c.parentRef()).contains(new TypeRef("test::B", TypeRef.Kind.ENUM));
            assertThat(diagnostics.getDiagnostics()).isEmpty();
        }

        @Test
        void resolvesParentsDeclaredLater() {
            Model model = build("""
                    enum C : B { Z = 3 }
                    enum B : A { Y = 2 }
                    enum A { X = 1 }
                    """);

            assertThat(enumeration(model, "test::C").values()).extracting(ModelEnumValue::name)
                    .containsExactly("X", "Y", "Z");
            assertThat(model.enums()).extracting(ModelEnum::name).containsExactly("C", "B", "A");
        }

        @Test
        void rejectsRedeclaredInheritedValue() {
            Model model = build("""
                    enum A { X = 1 }
                    enum B : A { X = 2, Y }
                    """);

            Diagnostic error = onlyError(ErrorKind.DUPLICATE_ENUM_VALUE);
            assertThat(error.message()).isEqualTo("Enum 'test::B' redeclares value 'X' inherited from 'test::A'.");
            assertThat(error.line()).isEqualTo(2);
            assertThat(enumeration(model, "test::B").values()).extracting(ModelEnumValue::value)
                    .containsExactly(1L, 3L);
        }

        @Test
        void rejectsValueDeclaredTwice() {
            build("enum E { A, A }");

            assertThat(onlyError(ErrorKind.DUPLICATE_ENUM_VALUE).message())
                    .isEqualTo("Enum 'test::E' declares value 'A' more than once.");
        }

        @Test
        void warnsOnReusedNumber() {
            build("enum E { A = 1, B = 1 }");

            assertThat(diagnostics.hasErrors()).isFalse();
            assertThat(diagnostics.summary()).contains("value 'B' reuses number 1 of 'A'");
        }

        @Test
        void reportsCycleOnce() {
            Model model = build("""
                    enum A : B { X }
                    enum B : A { Y }
                    """);

            assertThat(onlyError(ErrorKind.CIRCULAR_INHERITANCE).message())
                    .isEqualTo("Circular enum inheritance: test::A -> test::B -> test::A");
            assertThat(enumeration(model, "test::B").parentRef()).isEmpty();
        }

        @Test
        void rejectsParentThatIsNotAnEnum() {
            build("""
                    message M {}
                    options O { R }
                    enum E : M { X }
                    enum F : O { X }
                    enum G : Nope { X }
                    """);

            assertThat(diagnostics.errorsOfKind(ErrorKind.UNRESOLVED_REFERENCE)).extracting(Diagnostic::message)
                    .containsExactly(
                            "Enum 'test::E' cannot extend 'test::M': it is not an enum.",
                            "Enum 'test::F' cannot extend 'test::O': it is not an enum.",
                            "Enum 'test::G' extends unknown enum 'Nope'.");
        }
    }

    @Nested
    class BitWidths {

        @Test
        void picksSmallestWidth() {
            Model model = build("""
                    enum Small { A = 0, B = 255 }
                    enum Medium { A = 256 }
                    enum Negative { A = -1 }
                    enum Wide { A = 4294967296 }
                    open_enum Open { A }
                    """);

            assertThat(enumeration(model, "test::Small").bitWidth()).isEqualTo(8);
            assertThat(enumeration(model, "test::Medium").bitWidth()).isEqualTo(16);
            assertThat(enumeration(model, "test::Negative").bitWidth()).isEqualTo(8);
            assertThat(enumeration(model, "test::Wide").bitWidth()).isEqualTo(64);
            assertThat(enumeration(model, "test::Open").bitWidth()).isEqualTo(32);
            assertThat(enumeration(model, "test::Open").open()).isTrue();
        }

        @Test
        void countsInheritedValues() {
            Model model = build("""
                    enum Base { Big = 70000 }
                    enum Child : Base { Small = 1 }
                    """);

            assertThat(enumeration(model, "test::Child").bitWidth()).isEqualTo(32);
        }
    }

    @Nested
    class Messages {

        @Test
        void bindsFieldTypes() {
            Model model = build("""
                    float Vec { x, y }
                    enum E { A }
                    options O { R, W }
                    message Ref {}
                    message M {
                        a: Vec
                        b: E
                        c: O
                        d: Ref[]
                        e: Map<string, Ref>
                        f: int
                        g: byte { hi, lo }
                    }
                    """);

            TypeRef ref = new TypeRef("test::Ref", TypeRef.Kind.MESSAGE);
            assertThat(message(model, "test::M").fields()).extracting(ModelField::type).containsExactly(
                    new FieldType.CompoundType("float", List.of("x", "y")),
                    new FieldType.EnumRef(new TypeRef("test::E", TypeRef.Kind.ENUM)),
                    new FieldType.OptionsRef(new TypeRef("test::O", TypeRef.Kind.OPTIONS)),
                    new FieldType.ArrayType(new FieldType.MessageRef(ref)),
                    new FieldType.MapType(new FieldType.PrimitiveType(FieldType.Primitive.STRING),
                            new FieldType.MessageRef(ref)),
                    new FieldType.PrimitiveType(FieldType.Primitive.INT),
                    new FieldType.CompoundType("byte", List.of("hi", "lo")));
            assertThat(field(model, "test::M", "d").typeRef()).contains(ref);
            assertThat(diagnostics.getDiagnostics()).isEmpty();
        }

        @Test
        void resolvesParentMessage() {
            Model model = build("""
                    namespace N { message Base {} }
                    message Child : N::Base {}
                    """);

            assertThat(message(model, "test::Child").parentRef())
                    .contains(new TypeRef("test::N::Base", TypeRef.Kind.MESSAGE));
        }

        @Test
        void reportsUnknownFieldType() {
            Model model = build("message M { x: Nope\n y: int }");

            Diagnostic error = onlyError(ErrorKind.UNRESOLVED_REFERENCE);
            assertThat(error.message()).isEqualTo("Field 'test::M.x' references unknown type 'Nope'.");
            assertThat(error.fileName()).isEqualTo("test.def");
            assertThat(message(model, "test::M").fields()).extracting(ModelField::name).containsExactly("y");
        }

        @Test
        void reportsKindMismatch() {
            build("""
                    message Other {}
                    enum E { A }
                    message M {
                        x: enum Other
                        y: options E
                    }
                    """);

            assertThat(diagnostics.errorsOfKind(ErrorKind.UNRESOLVED_REFERENCE)).extracting(Diagnostic::message)
                    .containsExactly(
                            "Field 'test::M.x' expects an enum but 'test::Other' is a message.",
                            "Field 'test::M.y' expects an options set but 'test::E' is an enum.");
        }

        @Test
        void reportsBadParents() {
            build("""
                    enum E { X }
                    message A : E {}
                    message B : Nope {}
                    """);

            assertThat(diagnostics.errorsOfKind(ErrorKind.UNRESOLVED_REFERENCE)).extracting(Diagnostic::message)
                    .containsExactly(
                            "Message 'test::A' cannot extend 'test::E': it is not a message.",
                            "Message 'test::B' extends unknown message 'Nope'.");
        }

        @Test
        void reportsInheritanceCycleOnce() {
            build("""
                    message A : B {}
                    message B : A {}
                    message S : S {}
                    """);

            assertThat(diagnostics.errorsOfKind(ErrorKind.CIRCULAR_INHERITANCE)).extracting(Diagnostic::message)
                    .containsExactly(
                            "Circular message inheritance: test::A -> test::B -> test::A",
                            "Circular message inheritance: test::S -> test::S");
        }

        @Test
        void reportsDuplicateField() {
            build("message M {\n a: int\n a: string\n}");

            Diagnostic error = onlyError(ErrorKind.DUPLICATE_DEFINITION);
            assertThat(error.message()).isEqualTo("Field 'a' is declared more than once in message 'test::M'.");
            assertThat(error.line()).isEqualTo(3);
        }
    }

    @Nested
    class Duplicates {

        @Test
        void keepsFirstDefinition() {
            Model model = build("""
                    message A {}
                    message A { x: int }
                    """);

            Diagnostic error = onlyError(ErrorKind.DUPLICATE_DEFINITION);
            assertThat(error.message())
                    .isEqualTo("Duplicate definition of 'A' in namespace 'test' (first defined at test.def:1).");
            assertThat(error.line()).isEqualTo(2);
            assertThat(model.messages()).hasSize(1);
            assertThat(message(model, "test::A").fields()).isEmpty();
        }

        @Test
        void detectsClashAcrossEntityKinds() {
            build("message A {}\nenum A { X }");

            assertThat(onlyError(ErrorKind.DUPLICATE_DEFINITION).message()).contains("'A'");
        }

        @Test
        void allowsSameNameInDifferentNamespaces() {
            Model model = build("namespace N { message A {} }\nmessage A {}");

            assertThat(diagnostics.hasErrors()).isFalse();
            assertThat(model.lookup("test::A")).isPresent();
            assertThat(model.lookup("test::N::A")).isPresent();
        }

        @Test
        void rejectsNamespaceDeclaredTwice() {
            build("namespace N { message A {} }\nnamespace N { message B {} }");

            assertThat(diagnostics.errorsOfKind(ErrorKind.DUPLICATE_DEFINITION)).extracting(Diagnostic::message)
                    .contains("Namespace 'test::N' is declared more than once.");
        }
    }

    @Nested
    class Defaults {

        private Model model;

        private Model defaults(String fields) {
            model = build("""
                    enum Color { Red = 1, Green, Blue }
                    open_enum Code { Ok = 0 }
                    options Perm { Read, Write, Exec }
                    message Other {}
                    message M {
                    %s
                    }
                    """.formatted(fields));
            return model;
        }

        private DefaultValue defaultOf(String name) {
            return field(model, "test::M", name).defaultValue();
        }

        @Test
        void reducesEveryKind() {
            defaults("""
                    s: string = "hello"
                    i: int = -12
                    f: float = 2.5
                    b: bool = false
                    y: byte = 255
                    c1: Color = Green
                    c2: Color = Color::Blue
                    c3: Color = Color.Red
                    c4: Color = 3
                    o: Code = 42
                    p: Perm = Read | Exec
                    m: Other = none
                    """);

            assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
            assertThat(defaultOf("s")).isEqualTo(new DefaultValue.StringValue("hello"));
            assertThat(defaultOf("i")).isEqualTo(new DefaultValue.IntValue(-12));
            assertThat(defaultOf("f")).isEqualTo(new DefaultValue.FloatValue(2.5));
            assertThat(defaultOf("b")).isEqualTo(new DefaultValue.BoolValue(false));
            assertThat(defaultOf("y")).isEqualTo(new DefaultValue.IntValue(255));
            assertThat(defaultOf("c1")).isEqualTo(new DefaultValue.EnumValue("Green", 2));
            assertThat(defaultOf("c2")).isEqualTo(new DefaultValue.EnumValue("Blue", 3));
            assertThat(defaultOf("c3")).isEqualTo(new DefaultValue.EnumValue("Red", 1));
            assertThat(defaultOf("c4")).isEqualTo(new DefaultValue.EnumValue("Blue", 3));
            assertThat(defaultOf("o")).isEqualTo(new DefaultValue.IntValue(42));
            assertThat(defaultOf("p")).isEqualTo(new DefaultValue.FlagsValue(List.of("Read", "Exec"), 5));
            assertThat(defaultOf("m")).isEqualTo(new DefaultValue.RawValue("none"));
        }

        @Test
        void reportsInvalidDefaults() {
            defaults("""
                    s: string = hello
                    y: byte = 300
                    c: Color = Purple
                    n: Color = 9
                    b: bool = yes
                    ok: int = 7
                    """);

            assertThat(diagnostics.errorsOfKind(ErrorKind.INVALID_DEFAULT_VALUE)).extracting(Diagnostic::message)
                    .containsExactly(
                            "Invalid default for field 'test::M.s': 'hello' is not a quoted string.",
                            "Invalid default for field 'test::M.y': 300 is out of range for byte.",
                            "Invalid default for field 'test::M.c': 'Purple' is not a value of 'test::Color'.",
                            "Invalid default for field 'test::M.n': 9 is not a value of enum 'test::Color'.",
                            "Invalid default for field 'test::M.b': 'yes' is not true or false.");
            assertThat(field(model, "test::M", "s").defaultValueOpt()).isEmpty();
            assertThat(defaultOf("ok")).isEqualTo(new DefaultValue.IntValue(7));
        }
    }

    @Test
    void buildsNamespaceTreeAndSymbols() {
        Model model = build("""
                /// Outer scope.
                namespace Outer {
                    namespace Inner { enum Level { Low } }
                    message Item {}
                }
                """);

        ModelNamespace fileNs = model.namespaces().get(0);
        assertThat(fileNs.qfn()).isEqualTo("test");
        ModelNamespace outer = fileNs.namespaces().get(0);
        assertThat(outer.doc()).isEqualTo("Outer scope.");
        assertThat(outer.namespaces()).extracting(ModelNamespace::qfn).containsExactly("test::Outer::Inner");
        assertThat(model.allNamespaces()).extracting(ModelNamespace::qfn)
                .containsExactly("test", "test::Outer", "test::Outer::Inner");
        assertThat(model.symbols()).containsOnlyKeys("test::Outer::Item", "test::Outer::Inner::Level");
        assertThat(model.file()).isEqualTo("test.def");
    }

    @Test
    void requiresTransformedModel() {
        EarlyModel raw = early("message M {}");

        assertThatThrownBy(() -> new ModelBuilder(diagnostics).build(raw, Map.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("test.def");
    }

    @Test
    void rejectsInlineTypesLeftBehind() {
        EarlyModel model = early("message M { x: enum { A, B } }");
        new AddFileLevelNamespace().apply(model);
        new QfnReference().apply(model);

        assertThatThrownBy(() -> new ModelBuilder(diagnostics).build(model, Map.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("still has an inline type");
    }
}
