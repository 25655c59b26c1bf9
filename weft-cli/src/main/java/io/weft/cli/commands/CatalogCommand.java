package io.weft.cli.commands;

import io.weft.cli.LoggingSetup;
import io.weft.cli.ui.AnsiStyles;
import io.weft.core.ToolChainCoordinator;
import io.weft.core.WeftConfig;
import io.weft.core.WeftEnvironment;
import io.weft.core.WeftFactory;
import io.weft.core.execution.stub.SimulatedToolExecutor;
import io.weft.core.plan.ExecutionPlan;
import io.weft.core.plan.PlanCreationException;
import io.weft.serialization.JacksonCacheKeyStrategy;
import io.weft.serialization.ToolCatalog;
import io.weft.serialization.WeftSerializer;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.Callable;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/// Base class for commands that work on a tool catalog.
///
/// Loads the catalog, wires a simulated environment, registers the catalog's
/// tools and creates the plan before handing over to {@link #execute}. Cached
/// outputs are keyed by {@link JacksonCacheKeyStrategy}, so catalog inputs that
/// differ only in key order share a cache entry.
///
/// ### Configuration
/// Engine settings start from the defaults of {@link WeftConfig}, or from the
/// `weft.*` keys of the file given with `--config`. Command line options are
/// applied on top.
///
/// ### Exit codes
/// - `0` the command completed and every execution succeeded
/// - `1` an execution failed
/// - `2` the catalog or config could not be read, or no plan could be created
///
/// @implNote Subclasses must be annotated with `@Command`. Output goes to the
/// command line's configured writers so callers can capture it.
public abstract class CatalogCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID = 2;

    @Spec CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<catalog>", description = "JSON tool catalog file")
    Path catalogPath;

    @Option(
            names = "--seed",
            defaultValue = "42",
            description = "Seed of the simulated executor (default: ${DEFAULT-VALUE})")
    long seed;

    @Option(names = "--builtins", description = "Also register the built-in smart_* tools")
    boolean builtins;

    @Option(
            names = {"-c", "--config"},
            paramLabel = "<file>",
            description = "Properties file with weft.* engine settings")
    Path configPath;

    @Option(names = "--json", description = "Print JSON instead of the text report")
    boolean json;

    @Option(names = "--no-color", description = "Disable ANSI colors")
    boolean noColor;

    @Option(
            names = {"-v", "--verbose"},
            description = "Show execution progress and engine logs")
    boolean verbose;

    protected PrintWriter out;
    protected PrintWriter err;
    protected AnsiStyles styles;

    @Override
    public final Integer call() {
        LoggingSetup.configure(verbose);
        out = spec.commandLine().getOut();
        err = spec.commandLine().getErr();
        styles = AnsiStyles.of(!noColor && !json);

        ToolCatalog catalog;
        try {
            catalog = WeftSerializer.readCatalog(Files.readString(catalogPath));
        } catch (IOException | IllegalArgumentException e) {
            err.println(styles.error("Cannot load catalog " + catalogPath + ": " + e.getMessage()));
            return EXIT_INVALID;
        }

        WeftConfig config;
        try {
            config = loadConfig();
        } catch (IOException | IllegalArgumentException e) {
            err.println(styles.error("Cannot load config " + configPath + ": " + e.getMessage()));
            return EXIT_INVALID;
        }
        if (builtins) {
            config.setRegisterBuiltInTools(true);
        }
        configure(config);

        try (WeftEnvironment environment =
                WeftFactory.createEnvironment(
                        config,
                        registry -> new SimulatedToolExecutor(registry, seed),
                        new JacksonCacheKeyStrategy())) {
            ToolChainCoordinator coordinator = environment.getCoordinator();
            catalog.tools().forEach(coordinator::registerTool);

            ExecutionPlan plan;
            try {
                plan =
                        coordinator.createPlan(
                                catalog.name(),
                                catalog.description(),
                                catalog.requests(),
                                catalog.constraints());
            } catch (PlanCreationException e) {
                err.println(styles.error("Cannot plan " + catalog.name() + ": " + e.getMessage()));
                return EXIT_INVALID;
            }
            return execute(coordinator, plan);
        } finally {
            out.flush();
            err.flush();
        }
    }

    private WeftConfig loadConfig() throws IOException {
        if (configPath == null) {
            return new WeftConfig();
        }
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(configPath)) {
            properties.load(reader);
        }
        return WeftConfig.fromProperties(properties);
    }

    /// Applies command-specific options to the configuration before the
    /// environment is created.
    ///
    /// @param config configuration with the file settings and common options applied, not null
    protected void configure(WeftConfig config) {}

    /// Runs the command against a freshly planned catalog.
    ///
    /// @param coordinator coordinator holding the catalog's tools, not null
    /// @param plan plan created from the catalog's requests, not null
    /// @return process exit code
    protected abstract int execute(ToolChainCoordinator coordinator, ExecutionPlan plan);
}
