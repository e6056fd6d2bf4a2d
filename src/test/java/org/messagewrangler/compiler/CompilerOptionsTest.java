package org.messagewrangler.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class CompilerOptionsTest {

    @Test
    void readsCompilerBlock() {
        Config config = ConfigFactory.parseResources("test-config.conf");

        CompilerOptions options = CompilerOptions.fromConfig(config);

        assertThat(options.fileExtension()).isEqualTo(".schema");
        assertThat(options.importSearchPaths()).containsExactly(Path.of("shared"), Path.of("vendor/defs"));
        assertThat(options.warningsAsErrors()).isTrue();
    }

    @Test
    void referenceConfigMatchesDefaults() {
        CompilerOptions options = CompilerOptions.fromConfig(ConfigFactory.defaultReference());

        assertThat(options).isEqualTo(CompilerOptions.defaults());
    }

    @Test
    void fallsBackForMissingKeys() {
        assertThat(CompilerOptions.fromConfig(ConfigFactory.empty())).isEqualTo(CompilerOptions.defaults());

        CompilerOptions partial = CompilerOptions.fromConfig(
                ConfigFactory.parseString("compiler.warnings-as-errors = true"));
        assertThat(partial.fileExtension()).isEqualTo(CompilerOptions.DEFAULT_FILE_EXTENSION);
        assertThat(partial.importSearchPaths()).isEmpty();
        assertThat(partial.warningsAsErrors()).isTrue();
    }

    @Test
    void prependsSearchPaths() {
        CompilerOptions options = new CompilerOptions(".def", List.of(Path.of("b")), false)
                .withLeadingSearchPaths(List.of(Path.of("a")));

        assertThat(options.importSearchPaths()).containsExactly(Path.of("a"), Path.of("b"));
    }
}
