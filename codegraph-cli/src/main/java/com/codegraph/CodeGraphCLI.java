package com.codegraph;

import ch.qos.logback.classic.Level;
import com.codegraph.cli.AnalyzeCommand;
import com.codegraph.cli.DebtCommand;
import com.codegraph.cli.DepsCommand;
import com.codegraph.cli.IssuesCommand;
import com.codegraph.cli.ListCommand;
import com.codegraph.cli.ReportCommand;
import com.codegraph.cli.SearchCommand;
import com.codegraph.cli.SummaryCommand;
import com.codegraph.cli.TraceCommand;
import com.codegraph.cli.UpdateCommand;
import com.codegraph.core.config.ConfigLoader;
import com.codegraph.core.config.EngineConfig;
import com.codegraph.core.engine.CodeGraphEngine;
import com.codegraph.core.store.impl.JsonFileGraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Main CLI entry point for CodeGraph.
 *
 * <p>CodeGraph analyses source trees into a code knowledge graph kept in a JSON store and
 * answers structural and quality queries over it.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyse a source tree</li>
 *   <li>{@code update} - Re-analyse changed files</li>
 *   <li>{@code trace}, {@code deps}, {@code search}, {@code summary} - Graph queries</li>
 *   <li>{@code issues}, {@code debt} - Quality issues and technical debt</li>
 *   <li>{@code report} - Markdown and Mermaid reports</li>
 *   <li>{@code list} - Stored projects, languages, generators or renderers</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * codegraph analyze ./src --project shop
 * codegraph search --project shop order service
 * codegraph report --project shop --output docs/codegraph
 * }</pre>
 */
@Command(
    name = "codegraph",
    mixinStandardHelpOptions = true,
    version = "CodeGraph 1.0.0-SNAPSHOT",
    description = "Cross-language code knowledge graph",
    subcommands = {
        AnalyzeCommand.class,
        UpdateCommand.class,
        TraceCommand.class,
        DepsCommand.class,
        SearchCommand.class,
        SummaryCommand.class,
        IssuesCommand.class,
        DebtCommand.class,
        ReportCommand.class,
        ListCommand.class
    }
)
public class CodeGraphCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodeGraphCLI.class);

    @Option(names = "--store", description = "Store directory (default: storage.directory of the configuration)")
    private Path storeDirectory;

    @Option(names = "--config", description = "Configuration file (default: ${DEFAULT-VALUE})")
    private Path configFile = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    private CodeGraphEngine engine;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("CodeGraph - Cross-language code knowledge graph");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'codegraph --help' to see available commands");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Returns the engine over the configured store, creating it on first use.
     */
    public CodeGraphEngine engine() {
        if (engine == null) {
            EngineConfig config = ConfigLoader.load(configFile);
            if (storeDirectory != null) {
                config = config.withStorage(new EngineConfig.StorageConfig(storeDirectory.toString()));
            }
            log.debug("Opening store at {}", config.storage().path().toAbsolutePath());
            engine = new CodeGraphEngine(config, new JsonFileGraphStore(config.storage().path()));
        }
        return engine;
    }

    /**
     * Builds the command line with logging configured before any command runs.
     */
    public static CommandLine commandLine() {
        CodeGraphCLI cli = new CodeGraphCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
