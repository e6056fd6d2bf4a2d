package org.messagewrangler.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.messagewrangler.cli.commands.CompileCommand;
import org.messagewrangler.cli.config.ConfigLoader;
import org.messagewrangler.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Entry point of the {@code messagewrangler} command.
 * <p>
 * Global options are parsed here; the configuration is resolved lazily the first time a subcommand
 * asks for it, so {@code --help} and {@code --version} work without a readable configuration file.
 */
@Command(
    name = "messagewrangler",
    mixinStandardHelpOptions = true,
    versionProvider = CommandLineInterface.ManifestVersionProvider.class,
    description = "MessageWrangler - schema compiler for message definition files",
    subcommands = {
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code for configuration or I/O failures. */
    public static final int EXIT_FAILURE = 2;

    static final String BASE_LOGGER = "org.messagewrangler";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/messagewrangler.conf)"
    )
    private File configFile;

    @Option(
        names = {"-v", "--verbose"},
        description = "Log compiler phases at DEBUG level"
    )
    private boolean verbose;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Creates the command line with all subcommands, as used by {@link #main(String[])} and by tests.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("messagewrangler");
        return commandLine;
    }

    /**
     * Returns the resolved configuration, loading it and applying its logging block on first use.
     *
     * @throws IllegalArgumentException            If an explicitly given configuration file does not exist.
     * @throws com.typesafe.config.ConfigException If the configuration cannot be parsed or is invalid.
     */
    public Config getConfig() {
        if (config == null) {
            Config loaded = loadConfig();
            applyLogging(loaded);
            config = loaded;
        }
        return config;
    }

    private Config loadConfig() {
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        return ConfigLoader.resolve(configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.debug(message);
                case WARN -> logger.info(message);
            }
        });
    }

    private void applyLogging(Config loaded) {
        if (loaded.hasPath("logging.format")) {
            final String appender = "PLAIN".equalsIgnoreCase(loaded.getString("logging.format")) ? "STDOUT_PLAIN" : "STDOUT";
            if (!appender.equals(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY, "STDOUT_PLAIN"))) {
                System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, appender);
                LoggingConfigurator.reload();
            }
        }
        LoggingConfigurator.configure(loaded);
        if (verbose) {
            LoggingConfigurator.setLevel(BASE_LOGGER, "DEBUG");
        }
    }

    /**
     * Reads the version from the jar manifest; {@code dev} when running from classes.
     */
    public static final class ManifestVersionProvider implements IVersionProvider {

        @Override
        public String[] getVersion() {
            String version = CommandLineInterface.class.getPackage().getImplementationVersion();
            return new String[] {"MessageWrangler " + (version != null ? version : "dev")};
        }
    }
}
