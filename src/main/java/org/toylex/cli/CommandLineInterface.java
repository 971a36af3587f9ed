package org.toylex.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.toylex.cli.commands.AnalyzeCommand;
import org.toylex.cli.commands.TokensCommand;
import org.toylex.config.ConfigLoader;
import org.toylex.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "toylex",
    mixinStandardHelpOptions = true,
    version = "toylex 1.0",
    description = "Lexical analyzer producing a symbol table and program internal form",
    subcommands = {
        AnalyzeCommand.class,
        TokensCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the command line with all subcommands registered.
     * @return A ready-to-execute command line.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("toylex");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Returns the application configuration, loading it and applying the logging settings on first use.
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if the configuration file given with --config is missing or malformed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        if (configFile != null && !configFile.isFile()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
        }
        try {
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e);
        }
        LoggingConfigurator.configure(config);
        LOG.debug("Configuration loaded.");
        return config;
    }
}
