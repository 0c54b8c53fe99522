package org.braceform.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.braceform.cli.commands.FormatCommand;
import org.braceform.cli.commands.InspectCommand;
import org.braceform.cli.config.ConfigLoader;
import org.braceform.engine.passes.PassOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "braceform",
    mixinStandardHelpOptions = true,
    version = "braceform 1.0",
    description = "Virtualizes implicit braces and semicolons and normalizes conditional branches",
    subcommands = {
        FormatCommand.class,
        InspectCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String APPENDER_PROPERTY = "braceform.log.appender";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/braceform.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand given.
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
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("braceform");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.debug(message);
                case WARN -> logger.warn(message);
            }
        });

        if (config.hasPath("braceform.logging.format")) {
            final String format = config.getString("braceform.logging.format");
            final String appender = "PLAIN".equalsIgnoreCase(format) ? "STDERR_PLAIN" : "STDERR";
            if (!appender.equals(System.getProperty(APPENDER_PROPERTY, "STDERR_PLAIN"))) {
                System.setProperty(APPENDER_PROPERTY, appender);
                reconfigureLogback();
            }
        }
        initialized = true;
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Loads the configuration on first use.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException if an explicitly named config file does not exist.
     * @throws ConfigException          if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * @return The pass options of the resolved configuration.
     * @throws ConfigException if an option has the wrong type.
     */
    public PassOptions getPassOptions() {
        return PassOptions.fromConfig(getConfig());
    }
}
