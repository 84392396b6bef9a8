package org.zerox.cli;

import com.typesafe.config.Config;
import org.zerox.cli.commands.CheckCommand;
import org.zerox.cli.commands.TokensCommand;
import org.zerox.config.ConfigLoader;
import org.zerox.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "zeroxc",
    mixinStandardHelpOptions = true,
    version = "0x compiler 0.1.0",
    description = "Checks 0x sources and prints their diagnostics or tokens.",
    subcommands = {
        CheckCommand.class,
        TokensCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a HOCON configuration file overriding the built-in defaults."
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * @return A command line for the {@code zeroxc} root command with all subcommands.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("zeroxc");
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the file given with {@code --config} does not exist.
     */
    public Config getConfig() {
        return getConfig(null);
    }

    /**
     * Loads the configuration on first use, preferring a file given to a subcommand over the
     * root {@code --config} option.
     * @param overrideFile A configuration file from the subcommand, or {@code null}.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the configuration file does not exist.
     */
    public Config getConfig(final File overrideFile) {
        if (overrideFile != null) {
            configFile = overrideFile;
            config = null;
        }
        if (config == null) {
            config = ConfigLoader.load(configFile != null ? configFile.toPath() : null);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
