package org.minimips.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.minimips.cli.commands.CheckCommand;
import org.minimips.cli.commands.RunCommand;
import org.minimips.config.ConfigLoader;
import org.minimips.config.LoggingConfigurator;
import org.minimips.config.MinimipsSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "minimips",
    mixinStandardHelpOptions = true,
    version = "minimips 1.0",
    description = "Loads and runs programs for the minimips teaching machine.",
    subcommands = {
        RunCommand.class,
        CheckCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code of a program that halted normally. */
    public static final int EXIT_OK = 0;
    /** Exit code of a program that stopped with a run-time error. */
    public static final int EXIT_RUNTIME_ERROR = 1;
    /** Exit code of a source that could not be loaded, or invalid configuration. */
    public static final int EXIT_LOAD_ERROR = 2;

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: minimips.conf)"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private MinimipsSettings settings;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("minimips");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use, applies its logging section and returns the
     * machine settings.
     *
     * @return The settings.
     * @throws CommandLine.ParameterException if the configuration cannot be loaded, which
     *         picocli reports with exit code {@value #EXIT_LOAD_ERROR}.
     */
    public MinimipsSettings getSettings() {
        if (settings == null) {
            try {
                final Config config = ConfigLoader.load(configFile);
                LoggingConfigurator.configure(config);
                settings = MinimipsSettings.from(config);
            } catch (ConfigException | IllegalArgumentException e) {
                LOG.error("Failed to load or parse configuration: {}", e.getMessage());
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Invalid configuration: " + e.getMessage(), e);
            }
        }
        return settings;
    }
}
