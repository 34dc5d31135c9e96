package ai.docsite.plaintext.cli;

import ai.docsite.plaintext.config.Config;
import ai.docsite.plaintext.config.ConfigLoader;
import ai.docsite.plaintext.config.SystemEnvironmentReader;
import ai.docsite.plaintext.convert.BundleConverter;
import ai.docsite.plaintext.convert.ConversionException;
import ai.docsite.plaintext.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and bundle converter.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    static final int EXIT_UNEXPECTED = 1;

    private final ConfigLoader configLoader;
    private final BundleConverter bundleConverter;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new BundleConverter());
    }

    CliApplication(ConfigLoader configLoader, BundleConverter bundleConverter) {
        this.configLoader = configLoader;
        this.bundleConverter = bundleConverter;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.debug());
        LOGGER.info("Converting {} (columns={}, noWrap={}, noRefs={})",
                config.bundle(), config.columns(), config.noWrap(), config.noRefs());

        try {
            bundleConverter.convert(config);
            return 0;
        } catch (ConversionException ex) {
            LOGGER.error("Conversion failed: {}", ex.getMessage(), ex);
            return ex.kind().exitCode();
        } catch (RuntimeException ex) {
            LOGGER.error("Unexpected failure", ex);
            return EXIT_UNEXPECTED;
        }
    }
}
