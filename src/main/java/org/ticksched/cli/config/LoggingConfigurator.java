package org.ticksched.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the {@code logging} configuration section to Logback.
 * <pre>
 * logging {
 *   default-level = INFO
 *   levels { "org.ticksched.runtime" = DEBUG }
 * }
 * </pre>
 * Unknown level names fall back to DEBUG, following {@link Level#toLevel(String)}.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * Configures Logback levels. Does nothing if SLF4J is bound to another backend.
     *
     * @param config the root configuration
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }

        if (config.hasPath("logging.default-level")) {
            Level level = Level.toLevel(config.getString("logging.default-level"));
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }

        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getConfig("logging.levels").root().entrySet()) {
                String loggerName = entry.getKey();
                Level level = Level.toLevel(String.valueOf(entry.getValue().unwrapped()));
                context.getLogger(loggerName).setLevel(level);
            }
        }
    }
}
