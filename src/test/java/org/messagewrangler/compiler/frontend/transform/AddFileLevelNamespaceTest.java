package org.messagewrangler.compiler.frontend.transform;

import org.messagewrangler.compiler.diagnostics.DiagnosticsEngine;
import org.messagewrangler.compiler.frontend.early.EarlyEnum;
import org.messagewrangler.compiler.frontend.early.EarlyMessage;
import org.messagewrangler.compiler.frontend.early.EarlyModel;
import org.messagewrangler.compiler.frontend.early.EarlyModelBuilder;
import org.messagewrangler.compiler.frontend.early.EarlyNamespace;
import org.messagewrangler.compiler.frontend.lexer.Lexer;
import org.messagewrangler.compiler.frontend.parser.Parser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class AddFileLevelNamespaceTest {

    private final AddFileLevelNamespace pass = new AddFileLevelNamespace();

    private static EarlyModel early(String source, String file) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Parser parser = new Parser(new Lexer(source, diagnostics, file).scanTokens(), diagnostics);
        return new EarlyModelBuilder(diagnostics)
                .build(parser.parse(), EarlyModelBuilder.fileNamespaceFor(file), file);
    }

    @Test
    void wrapsTopLevelItemsAndNamespaces() {
        EarlyModel model = early("""
                message A {}
                namespace N { message B {} }
                enum E { X }
                options O { Y }
                float Pos { x, y }
                """, "orders.def");

        pass.apply(model);

        EarlyNamespace fileNs = model.fileLevelNamespace().orElseThrow();
        assertThat(fileNs.name()).isEqualTo("orders");
        assertThat(model.roots()).containsExactly(fileNs);
        assertThat(fileNs.messages()).extracting(EarlyMessage::name).containsExactly("A");
        assertThat(fileNs.enums()).extracting(EarlyEnum::name).containsExactly("E");
        assertThat(fileNs.options()).extracting(EarlyEnum::name).containsExactly("O");
        assertThat(fileNs.compounds()).hasSize(1);
        assertThat(model.childrenOf(fileNs)).extracting(EarlyNamespace::name).containsExactly("N");
        assertThat(model.hasTopLevelItems()).isFalse();
    }

    @Test
    void reusesNamespaceNamedAfterFile() {
        EarlyModel model = early("namespace orders { message A {} }", "orders.def");

        pass.apply(model);

        assertThat(model.roots()).hasSize(1);
        EarlyNamespace fileNs = model.fileLevelNamespace().orElseThrow();
        assertThat(fileNs.messages()).extracting(EarlyMessage::name).containsExactly("A");
        assertThat(model.childrenOf(fileNs)).isEmpty();
    }

    @Test
    void wrapsNamespaceWithOtherName() {
        EarlyModel model = early("namespace billing { message A {} }", "orders.def");

        pass.apply(model);

        EarlyNamespace fileNs = model.fileLevelNamespace().orElseThrow();
        assertThat(fileNs.name()).isEqualTo("orders");
        assertThat(model.childrenOf(fileNs)).extracting(EarlyNamespace::name).containsExactly("billing");
    }

    @Test
    void wrapsEmptyFile() {
        EarlyModel model = early("", "empty.def");

        pass.apply(model);

        assertThat(model.fileLevelNamespace()).isPresent();
        assertThat(model.fileLevelNamespace().get().isEmpty()).isTrue();
    }

    @Test
    void isIdempotent() {
        EarlyModel model = early("message A {}\nnamespace N {}", "orders.def");

        pass.apply(model);
        EarlyNamespace first = model.fileLevelNamespace().orElseThrow();
        pass.apply(model);

        assertThat(model.roots()).containsExactly(first);
        assertThat(model.namespacesDepthFirst()).hasSize(2);
        assertThat(first.messages()).hasSize(1);
    }
}
