package io.weft.cli.commands;

import java.io.PrintWriter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/// Top-level `weft` command.
///
/// Without a subcommand it prints the banner and usage.
///
/// ### Subcommands
/// - `run` executes the tool chain described by a catalog
/// - `plan` prints the execution plan built from a catalog
/// - `suggest` prints ranked optimization suggestions for a catalog
@Command(
        name = "weft",
        mixinStandardHelpOptions = true,
        version = "weft 0.1.0",
        description = "Plans, runs and tunes tool chains described by JSON catalogs.",
        subcommands = {
            RunCommand.class,
            PlanCommand.class,
            SuggestCommand.class,
            CommandLine.HelpCommand.class
        })
public class WeftCommand implements Runnable {

    static final String[] BANNER = {
        "",
        " __      __ ___  ___  _____",
        " \\ \\    / /| __|| __||_   _|",
        "  \\ \\/\\/ / | _| | _|   | |",
        "   \\_/\\_/  |___||_|    |_|",
        "",
        " Tool chain planner and runner",
        ""
    };

    @Spec CommandSpec spec;

    @Override
    public void run() {
        PrintWriter out = spec.commandLine().getOut();
        for (String line : BANNER) {
            out.println(line);
        }
        spec.commandLine().usage(out);
    }
}
