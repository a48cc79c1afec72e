package com.makernote;

import ch.qos.logback.classic.Level;
import com.makernote.cli.DescribeCommand;
import com.makernote.cli.ListCommand;
import com.makernote.cli.MakernoteTypeConverter;
import com.makernote.cli.TagsCommand;
import com.makernote.core.config.CatalogConfig;
import com.makernote.core.config.ConfigLoader;
import com.makernote.core.descriptor.MakernoteType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.Spec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Main CLI entry point for the makernote tools.
 *
 * <p>Lists the supported manufacturer makernote layouts, prints their tag catalogs and
 * describes decoded tag dumps.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code list} - List enabled vendors</li>
 *   <li>{@code tags} - Print a vendor's tag catalog</li>
 *   <li>{@code describe} - Describe a tag dump read from JSON or YAML</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -c, --config} - Configuration file (default: makernote.yaml)</li>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # List vendors
 * makernote list
 *
 * # Show the Olympus equipment catalog with hex ids
 * makernote tags olympus-equipment --hex
 *
 * # Describe a dump as JSON
 * makernote -v describe kodak kodak-dump.yaml --format json
 * }</pre>
 */
@Command(
    name = "makernote",
    mixinStandardHelpOptions = true,
    version = "makernote 1.0.0-SNAPSHOT",
    description = "Manufacturer makernote tag catalogs and value descriptions",
    subcommands = {
        ListCommand.class,
        TagsCommand.class,
        DescribeCommand.class
    }
)
public class MakernoteCli implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MakernoteCli.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: makernote.yaml)")
    private Path configPath;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * Loads the configuration named by {@code --config}, or {@code makernote.yaml} from the
     * working directory when present.
     *
     * @return loaded configuration or defaults if unavailable
     */
    public CatalogConfig loadConfig() {
        if (configPath == null) {
            Path defaultPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);
            if (!Files.exists(defaultPath)) {
                log.debug("No {} in working directory, using defaults", ConfigLoader.DEFAULT_FILE_NAME);
                return CatalogConfig.defaults();
            }
            return ConfigLoader.load(defaultPath);
        }
        log.debug("Using configuration file: {}", configPath.toAbsolutePath());
        return ConfigLoader.load(configPath);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        }
    }

    private int executionStrategy(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Creates a fully configured command line around a new root command.
     *
     * @return command line ready to {@code execute}
     */
    public static CommandLine createCommandLine() {
        MakernoteCli cli = new MakernoteCli();
        return new CommandLine(cli)
            .registerConverter(MakernoteType.class, new MakernoteTypeConverter())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
