package io.weft.cli;

import io.weft.cli.commands.WeftCommand;
import picocli.CommandLine;

/// Launcher for the `weft` command line.
public final class WeftMain {

    private WeftMain() {}

    public static void main(String[] args) {
        System.exit(new CommandLine(new WeftCommand()).execute(args));
    }
}
