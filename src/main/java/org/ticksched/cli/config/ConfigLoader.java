package org.ticksched.cli.config;

import java.io.File;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Builds the {@code ticksched} settings tree for the CLI.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dticksched.loop.ticks-per-second=20})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * {@code reference.conf} is merged unresolved, so its substitutions see the overrides.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "ticksched.conf";

    private ConfigLoader() {
    }

    /** Severity of a {@link ConfigMessageHandler} message. */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Callback for reporting which configuration source was picked. Logging is not
     * configured yet at that point, so the CLI decides how to print it.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Picks the configuration file for this run, first match wins:
     * {@code --config}, then {@code -Dconfig.file}, then {@code config/ticksched.conf}
     * relative to the working directory. Without any of them only the built-in
     * defaults are used.
     *
     * @param explicitConfigFile file given with {@code --config}, or {@code null}
     * @param handler            told which source was chosen
     * @return the resolved configuration
     * @throws IllegalArgumentException            if a file named on the command line does not exist
     * @throws com.typesafe.config.ConfigException if the file cannot be parsed or resolved
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            return loadNamedFile(explicitConfigFile, "--config", handler);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            return loadNamedFile(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file", handler);
        }

        final File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.exists()) {
            handler.log(MessageLevel.INFO, "Loading ticksched settings from " + workingDirFile.getAbsolutePath());
            return loadFromFile(workingDirFile);
        }

        handler.log(MessageLevel.WARN, String.format(
                "%s/%s not found, running with built-in defaults", CONFIG_DIR, CONFIG_FILE_NAME));
        return loadDefaults();
    }

    private static Config loadNamedFile(final File file, final String source, final ConfigMessageHandler handler) {
        if (!file.exists()) {
            throw new IllegalArgumentException(String.format(
                    "Configuration file not found (%s): %s", source, file.getAbsolutePath()));
        }
        handler.log(MessageLevel.INFO, String.format(
                "Loading ticksched settings from %s (%s)", file.getAbsolutePath(), source));
        return loadFromFile(file);
    }

    /**
     * Loads a file between the override layers and {@code reference.conf}.
     */
    static Config loadFromFile(final File configFile) {
        return withOverrides(ConfigFactory.parseFile(configFile));
    }

    /**
     * Loads {@code reference.conf} with system property and environment overrides only.
     */
    static Config loadDefaults() {
        return withOverrides(ConfigFactory.empty());
    }

    private static Config withOverrides(final Config fileLayer) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileLayer)
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
