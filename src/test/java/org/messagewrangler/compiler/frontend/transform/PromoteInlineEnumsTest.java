package org.messagewrangler.compiler.frontend.transform;

import org.messagewrangler.compiler.diagnostics.DiagnosticsEngine;
import org.messagewrangler.compiler.frontend.early.EarlyEnum;
import org.messagewrangler.compiler.frontend.early.EarlyEnumValue;
import org.messagewrangler.compiler.frontend.early.EarlyMessage;
import org.messagewrangler.compiler.frontend.early.EarlyModel;
import org.messagewrangler.compiler.frontend.early.EarlyModelBuilder;
import org.messagewrangler.compiler.frontend.early.EarlyNamespace;
import org.messagewrangler.compiler.frontend.early.RawType;
import org.messagewrangler.compiler.frontend.lexer.Lexer;
import org.messagewrangler.compiler.frontend.module.CompilationContext;
import org.messagewrangler.compiler.frontend.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class PromoteInlineEnumsTest {

    private EarlyModel model;
    private EarlyNamespace n;

    @BeforeEach
    void setUp() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        String source = """
                namespace N {
                    message M {
                        /// Power state.
                        state: enum { On, Off }
                        flags: options { A, B }[]
                        byName: Map<string, open_enum { X = 3 }>
                        plain: int
                    }
                }
                """;
        Parser parser = new Parser(new Lexer(source, diagnostics, "promo.def").scanTokens(), diagnostics);
        model = new EarlyModelBuilder(diagnostics).build(parser.parse(), "promo", "promo.def");
        EarlyTransformPipeline.standard(new CompilationContext(), diagnostics).run(model);
        n = model.childrenOf(model.fileLevelNamespace().orElseThrow()).get(0);
    }

    private EarlyEnum promoted(String name) {
        return n.enums().stream().filter(e -> e.name().equals(name)).findFirst().orElseThrow();
    }

    @Test
    void rewritesFieldsToReferences() {
        EarlyMessage m = n.messages().get(0);

        assertThat(m.fields().get(0).type())
                .isEqualTo(new RawType.Reference("promo::N::M_state", RawType.RefKind.ENUM));
        assertThat(m.fields().get(1).type())
                .isEqualTo(new RawType.Array(new RawType.Reference("promo::N::M_flags", RawType.RefKind.OPTIONS)));
        assertThat(m.fields().get(2).type()).isEqualTo(new RawType.MapOf(new RawType.Primitive("string"),
                new RawType.Reference("promo::N::M_byName", RawType.RefKind.ENUM)));
        assertThat(m.fields().get(3).type()).isEqualTo(new RawType.Primitive("int"));
    }

    @Test
    void addsPromotedEnumsToEnclosingNamespace() {
        assertThat(n.enums()).extracting(EarlyEnum::name).containsExactly("M_state", "M_flags", "M_byName");

        EarlyEnum state = promoted("M_state");
        assertThat(state.kind()).isEqualTo(EarlyEnum.Kind.ENUM);
        assertThat(state.isPromoted()).isTrue();
        assertThat(state.promotedFrom()).isEqualTo("M.state");
        assertThat(state.doc()).isEqualTo("Power state.");
        assertThat(state.values()).extracting(EarlyEnumValue::name).containsExactly("On", "Off");

        assertThat(promoted("M_flags").kind()).isEqualTo(EarlyEnum.Kind.OPTIONS);
        assertThat(promoted("M_flags").values()).extracting(EarlyEnumValue::value).containsExactly(1L, 2L);
        assertThat(promoted("M_byName").isOpen()).isTrue();
        assertThat(promoted("M_byName").values()).extracting(EarlyEnumValue::value).containsExactly(3L);
    }

    @Test
    void leavesNoInlineBodies() {
        assertThat(model.allMessages()).flatExtracting(EarlyMessage::fields)
                .noneMatch(f -> f.type().containsInline());
    }

    @Test
    void isIdempotent() {
        new PromoteInlineEnums().apply(model);

        assertThat(n.enums()).hasSize(3);
        assertThat(n.messages().get(0).fields().get(0).type())
                .isEqualTo(new RawType.Reference("promo::N::M_state", RawType.RefKind.ENUM));
    }
}
