package org.stackmac.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.stackmac.api.StackMachineException;
import org.stackmac.cli.commands.CompileCommand;
import org.stackmac.cli.commands.DisassembleCommand;
import org.stackmac.cli.commands.RunCommand;
import org.stackmac.cli.config.LoggingConfigurator;
import org.stackmac.toolchain.Toolchain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.net.URL;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "stackmac",
    mixinStandardHelpOptions = true,
    version = "stackmac 1.0.0",
    description = "Stack machine toolchain: assembler, virtual machine and disassembler.",
    subcommands = {
        CompileCommand.class,
        RunCommand.class,
        DisassembleCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    static final String CONFIG_FILE_NAME = "stackmac.conf";
    private static final String SHOW_BANNER_PATH = "stackmac.cli.show-banner";
    private static final String LOGGING_FORMAT_PATH = "logging.format";

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: ./" + CONFIG_FILE_NAME + " if present)"
    )
    private File configFile;

    @Option(
        names = "-D",
        mapFallbackValue = "",
        description = "Override a configuration value, e.g. -Dstackmac.runtime.trace-stack-limit=5"
    )
    private Map<String, String> overrides;

    @Option(names = "--no-banner", description = "Do not print the start-up banner.")
    private boolean noBanner;

    @Spec
    private CommandSpec spec;

    private Config config;
    private Toolchain toolchain;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand given: show usage.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Creates the command line with the error handling of the tool: toolchain errors print their
     * formatted message and exit with 1, usage errors exit with 2.
     *
     * @return The configured command line.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("stackmac");
        commandLine.setExecutionExceptionHandler(CommandLineInterface::handleExecutionException);
        return commandLine;
    }

    private static int handleExecutionException(Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        final PrintWriter err = commandLine.getErr();
        if (e instanceof StackMachineException sme) {
            LOG.debug("Command failed with {}", sme.getErrorCode(), sme);
            err.println("Error: " + sme.getFormattedMessage());
        } else if (e instanceof com.typesafe.config.ConfigException) {
            LOG.error("Failed to load or parse configuration: {}", e.getMessage());
            err.println("Configuration error: " + e.getMessage());
        } else {
            LOG.error("Unexpected failure", e);
            err.println("Unexpected error: " + e);
        }
        err.flush();
        return 1;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        this.config = loadConfig();

        // Logging setup
        if (config.hasPath(LOGGING_FORMAT_PATH)) {
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY,
                    LoggingConfigurator.appenderFor(config.getString(LOGGING_FORMAT_PATH)));
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        if (shouldShowBanner()) {
            showBanner();
        }

        initialized = true;
    }

    /**
     * Load order: system properties, then -D overrides, then environment, then the configuration
     * file, then class path defaults.
     */
    private Config loadConfig() {
        final Config overrideConfig = overrides == null || overrides.isEmpty()
                ? ConfigFactory.empty()
                : ConfigFactory.parseMap(overrides, "command line -D overrides");

        final File file = resolveConfigFile();
        final Config fileConfig = file != null ? ConfigFactory.parseFile(file) : ConfigFactory.empty();

        return ConfigFactory.systemProperties()
                .withFallback(overrideConfig)
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }

    private File resolveConfigFile() {
        // 1) --config
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
            }
            LOG.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            return this.configFile;
        }
        // 2) -Dconfig.file
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via -Dconfig.file was not found: " + systemConfigFile);
            }
            LOG.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
            return systemConfigFile;
        }
        // 3) ./stackmac.conf
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            LOG.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return cwdConfigFile;
        }
        // 4) class path defaults only
        LOG.debug("No '{}' found, using default configuration from class path.", CONFIG_FILE_NAME);
        return null;
    }

    private boolean shouldShowBanner() {
        if (noBanner || System.console() == null) {
            return false;
        }
        if (config.hasPath(SHOW_BANNER_PATH) && !config.getBoolean(SHOW_BANNER_PATH)) {
            return false;
        }
        // Banner only goes with plain text logging
        final String logFormat = config.hasPath(LOGGING_FORMAT_PATH) ? config.getString(LOGGING_FORMAT_PATH) : "PLAIN";
        return "PLAIN".equalsIgnoreCase(logFormat);
    }

    private void reconfigureLogback() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            spec.commandLine().getErr().println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    private void showBanner() {
        spec.commandLine().getOut().println("\n" +
                "  ┌──────────────────────────────────┐\n" +
                "  │  STACK MAC  v1.0.0               │\n" +
                "  │  ┌───┐                           │\n" +
                "  │  │ █ │  Stack-Based VM           │\n" +
                "  │  ├───┤  12 Base Opcodes          │\n" +
                "  │  │ █ │  Extension Support        │\n" +
                "  │  └───┘                           │\n" +
                "  │  compile | run | disassemble     │\n" +
                "  └──────────────────────────────────┘\n");
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * @return The toolchain built from the configuration, created on first use.
     */
    public Toolchain getToolchain() {
        if (toolchain == null) {
            toolchain = Toolchain.fromConfig(getConfig());
        }
        return toolchain;
    }
}
