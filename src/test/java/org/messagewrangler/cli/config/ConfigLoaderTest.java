package org.messagewrangler.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.net.URISyntaxException;
import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader}: the file cascade and the precedence of
 * system properties over the configuration file and {@code reference.conf}.
 */
@Tag("unit")
class ConfigLoaderTest {

    private final List<String> messages = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("compiler.file-extension");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should merge the file over reference defaults")
    void loadFromFile_shouldMergeFileOverDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals(".schema", config.getString("compiler.file-extension"));
        assertTrue(config.getBoolean("compiler.warnings-as-errors"));
        assertEquals("PLAIN", config.getString("logging.format"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("compiler.file-extension", ".proto");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals(".proto", config.getString("compiler.file-extension"));
        assertTrue(config.getBoolean("compiler.warnings-as-errors"));
    }

    @Test
    @DisplayName("loadDefaults should return the reference configuration")
    void loadDefaults_shouldReturnReferenceConfig() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals(".def", config.getString("compiler.file-extension"));
        assertFalse(config.getBoolean("compiler.warnings-as-errors"));
        assertTrue(config.getStringList("compiler.import-search-paths").isEmpty());
    }

    @Test
    @DisplayName("resolve should use an explicit file and report it")
    void resolve_shouldUseExplicitFile() {
        File file = testResource("test-config.conf");

        Config config = ConfigLoader.resolve(file, (level, message) -> messages.add(level + ": " + message));

        assertEquals(".schema", config.getString("compiler.file-extension"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO: Using configuration file specified via --config"));
    }

    @Test
    @DisplayName("resolve should reject a missing explicit file")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist/messagewrangler.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> messages.add(message)));

        assertTrue(e.getMessage().startsWith("Configuration file not found: "));
        assertTrue(messages.isEmpty());
    }

    @Test
    @DisplayName("resolve should fall back to defaults and warn when no file is found")
    void resolve_shouldFallBackToDefaults() {
        Config config = ConfigLoader.resolve(null, (level, message) -> messages.add(level + ": " + message));

        assertEquals(".def", config.getString("compiler.file-extension"));
        assertEquals(List.of("WARN: No 'config/messagewrangler.conf' found. Using default configuration from classpath."),
                messages);
    }

    @Test
    @DisplayName("A compiler setting of the wrong type should fail validation")
    void loadFromFile_shouldRejectMistypedCompilerSetting(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("bad.conf");
        Files.writeString(file, "compiler.import-search-paths = \"lib\"\n");

        assertThrows(ConfigException.ValidationFailed.class, () -> ConfigLoader.loadFromFile(file.toFile()));
    }

    private File testResource(final String name) {
        final URL url = getClass().getClassLoader().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
