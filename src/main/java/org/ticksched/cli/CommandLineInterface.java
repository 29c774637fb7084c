package org.ticksched.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ticksched.cli.commands.SoakCommand;
import org.ticksched.cli.config.ConfigLoader;
import org.ticksched.cli.config.LoggingConfigurator;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

@Command(
    name = "ticksched",
    mixinStandardHelpOptions = true,
    version = "ticksched 1.0",
    description = "ticksched - deferred callback scheduling for tick-based simulation loops",
    subcommands = {
        SoakCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/ticksched.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand: show usage
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Tests use this to get the same setup as the entry point.
     *
     * @return a configured CommandLine instance
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("ticksched");
        commandLine.setExecutionExceptionHandler(CommandLineInterface::handleExecutionException);
        return commandLine;
    }

    /**
     * Reports configuration failures as a single error line with exit code 1; anything
     * else keeps picocli's default handling.
     */
    private static int handleExecutionException(final Exception ex, final CommandLine commandLine,
                                                final ParseResult parseResult) throws Exception {
        if (ex instanceof CommandLine.InitializationException) {
            commandLine.getErr().println("Error: " + ex.getMessage());
            commandLine.getErr().flush();
            return 1;
        }
        throw ex;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            throw new CommandLine.InitializationException(e.getMessage(), e);
        } catch (ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            throw new CommandLine.InitializationException(
                    "Failed to load or parse configuration: " + e.getMessage(), e);
        }

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    /**
     * Returns the resolved configuration, loading it on first access.
     *
     * @return the root configuration
     * @throws CommandLine.InitializationException if the configuration file is missing or invalid
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
