package org.messagewrangler.compiler.semantics;

import org.messagewrangler.compiler.api.DefaultValue;
import org.messagewrangler.compiler.api.FieldType;
import org.messagewrangler.compiler.api.ModelEnum;
import org.messagewrangler.compiler.api.ModelEnumValue;
import org.messagewrangler.compiler.api.TypeRef;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class DefaultValueReducerTest {

    private static final ModelEnum MODE = new ModelEnum("Mode", "app::Mode", false, false, 8,
            List.of(value("Off", 0), value("On", 1)), null, "", "", null, null);
    private static final ModelEnum ACCESS = new ModelEnum("Access", "app::Access", true, false, 8,
            List.of(value("Read", 1), value("Write", 2), value("Admin", 8)), null, "", "", null, null);

    private final DefaultValueReducer reducer = new DefaultValueReducer(
            qfn -> Optional.ofNullable(Map.of(MODE.qfn(), MODE, ACCESS.qfn(), ACCESS).get(qfn)));

    private static ModelEnumValue value(String name, long value) {
        return new ModelEnumValue(name, value, "", "", null, null);
    }

    private static FieldType primitive(FieldType.Primitive primitive) {
        return new FieldType.PrimitiveType(primitive);
    }

    @Test
    void reducesPrimitives() {
        assertThat(reducer.reduce(" \"a \\\"b\\\"\" ", primitive(FieldType.Primitive.STRING)))
                .isEqualTo(new DefaultValue.StringValue("a \"b\""));
        assertThat(reducer.reduce("0x1F", primitive(FieldType.Primitive.INT))).isEqualTo(new DefaultValue.IntValue(31));
        assertThat(reducer.reduce("0", primitive(FieldType.Primitive.BYTE))).isEqualTo(new DefaultValue.IntValue(0));
        assertThat(reducer.reduce("1e3", primitive(FieldType.Primitive.FLOAT)))
                .isEqualTo(new DefaultValue.FloatValue(1000.0));
        assertThat(reducer.reduce("true", primitive(FieldType.Primitive.BOOL))).isEqualTo(new DefaultValue.BoolValue(true));
    }

    @Test
    void rejectsMalformedPrimitives() {
        assertThatThrownBy(() -> reducer.reduce("\"", primitive(FieldType.Primitive.STRING)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("'\"' is not a quoted string");
        assertThatThrownBy(() -> reducer.reduce("ten", primitive(FieldType.Primitive.INT)))
                .hasMessage("'ten' is not an integer");
        assertThatThrownBy(() -> reducer.reduce("-1", primitive(FieldType.Primitive.BYTE)))
                .hasMessage("-1 is out of range for byte");
        assertThatThrownBy(() -> reducer.reduce("fast", primitive(FieldType.Primitive.FLOAT)))
                .hasMessage("'fast' is not a number");
        assertThatThrownBy(() -> reducer.reduce("1", primitive(FieldType.Primitive.BOOL)))
                .hasMessage("'1' is not true or false");
    }

    @Test
    void reducesEnumByNameOrNumber() {
        FieldType type = new FieldType.EnumRef(new TypeRef("app::Mode", TypeRef.Kind.ENUM));

        assertThat(reducer.reduce("On", type)).isEqualTo(new DefaultValue.EnumValue("On", 1));
        assertThat(reducer.reduce("app::Mode::Off", type)).isEqualTo(new DefaultValue.EnumValue("Off", 0));
        assertThat(reducer.reduce("1", type)).isEqualTo(new DefaultValue.EnumValue("On", 1));
        assertThatThrownBy(() -> reducer.reduce("Dim", type)).hasMessage("'Dim' is not a value of 'app::Mode'");
    }

    @Test
    void combinesFlags() {
        FieldType type = new FieldType.OptionsRef(new TypeRef("app::Access", TypeRef.Kind.OPTIONS));

        DefaultValue value = reducer.reduce("Read|Access::Write | 8", type);

        assertThat(value).isEqualTo(new DefaultValue.FlagsValue(List.of("Read", "Write", "8"), 11));
        assertThat(value.text()).isEqualTo("Read | Write | 8");
        assertThatThrownBy(() -> reducer.reduce("Read || Write", type)).hasMessage("empty flag in 'Read || Write'");
    }

    @Test
    void failsForUnresolvedEnum() {
        FieldType type = new FieldType.EnumRef(new TypeRef("app::Missing", TypeRef.Kind.ENUM));

        assertThatThrownBy(() -> reducer.reduce("A", type)).hasMessage("enum 'app::Missing' is not resolved");
    }

    @Test
    void keepsOtherDefaultsAsWritten() {
        FieldType type = new FieldType.ArrayType(primitive(FieldType.Primitive.INT));

        assertThat(reducer.reduce(" [1, 2] ", type)).isEqualTo(new DefaultValue.RawValue("[1, 2]"));
    }
}
