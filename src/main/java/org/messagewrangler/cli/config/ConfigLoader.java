package org.messagewrangler.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the compiler and logging configuration for the CLI.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dcompiler.warnings-as-errors=true})</li>
 *   <li>Environment variables</li>
 *   <li>One configuration file, found by {@link #resolve(File, ConfigMessageHandler)}</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * The {@code compiler} block of the result is checked against {@code reference.conf}, so a
 * mistyped value fails here rather than in the middle of a compilation.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "messagewrangler.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is being located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * A place a configuration file may come from.
     *
     * @param file      The candidate file.
     * @param origin    How it was specified, for messages.
     * @param mandatory Whether a missing file is an error rather than a reason to try the next candidate.
     */
    private record Candidate(File file, String origin, boolean mandatory) {
    }

    /**
     * Picks the first configuration file of the cascade and loads it:
     * the {@code --config} option, then {@code -Dconfig.file}, then {@code config/messagewrangler.conf}
     * in the working directory. Without any of them only {@code reference.conf} is used.
     *
     * @param explicitConfigFile file from {@code --config}, or {@code null}.
     * @param handler            receives which file was chosen.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or has a value of the wrong type.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        for (Candidate candidate : candidates(explicitConfigFile)) {
            File file = candidate.file().getAbsoluteFile();
            if (file.exists()) {
                handler.log(MessageLevel.INFO, "Using configuration file " + candidate.origin() + ": " + file);
                return loadFromFile(file);
            }
            if (candidate.mandatory()) {
                throw new IllegalArgumentException(candidate.origin().equals("specified via --config")
                        ? "Configuration file not found: " + file
                        : "Configuration file " + candidate.origin() + " not found: " + file);
            }
        }
        handler.log(MessageLevel.WARN,
                "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME + "' found. Using default configuration from classpath.");
        return loadDefaults();
    }

    private static List<Candidate> candidates(File explicitConfigFile) {
        List<Candidate> candidates = new ArrayList<>();
        if (explicitConfigFile != null) {
            candidates.add(new Candidate(explicitConfigFile, "specified via --config", true));
            return candidates;
        }
        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            candidates.add(new Candidate(new File(systemConfigPath), "specified via -Dconfig.file", true));
            return candidates;
        }
        candidates.add(new Candidate(new File(CONFIG_DIR, CONFIG_FILE_NAME), "found in current directory", false));
        return candidates;
    }

    static Config loadFromFile(final File configFile) {
        return layered(ConfigFactory.parseFile(configFile));
    }

    static Config loadDefaults() {
        return layered(ConfigFactory.empty());
    }

    private static Config layered(Config fileLayer) {
        Config config = ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileLayer)
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
        config.checkValid(ConfigFactory.defaultReference(), "compiler");
        return config;
    }
}
