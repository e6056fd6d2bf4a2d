package org.messagewrangler.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback.
 * <pre>
 * logging {
 *   format = "PLAIN"            # or "COLOR"
 *   levels { "org.messagewrangler.compiler" = DEBUG }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    /** System property read by {@code logback.xml} to pick the console appender. */
    public static final String FORMAT_PROPERTY = "messagewrangler.logging.format";

    private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    /**
     * Sets the level of every logger listed under {@code logging.levels}.
     * Unknown level names fall back to DEBUG, as Logback does.
     */
    public static void configure(Config config) {
        if (!config.hasPath("logging.levels")) {
            return;
        }
        for (Map.Entry<String, Object> entry : config.getConfig("logging.levels").root().unwrapped().entrySet()) {
            setLevel(entry.getKey().replace("\"", ""), String.valueOf(entry.getValue()));
        }
    }

    /**
     * Sets one logger's level by name.
     */
    public static void setLevel(String loggerName, String levelName) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            log.warn("Logging backend is not Logback; ignoring level for {}", loggerName);
            return;
        }
        context.getLogger(loggerName).setLevel(Level.toLevel(levelName));
    }

    /**
     * Re-reads {@code logback.xml} so a changed {@link #FORMAT_PROPERTY} takes effect.
     */
    public static void reload() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
