package io.weft.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/// Applies the bundled `logging.properties` to java.util.logging.
///
/// Engine logs stay at `WARNING` unless verbose output is requested, in which
/// case the `io.weft` loggers and the root handlers drop to `FINE`.
public final class LoggingSetup {

    static final String CONFIG_RESOURCE = "/logging.properties";

    // Held so the configured level is not lost when the logger is collected.
    private static final Logger WEFT_LOGGER = Logger.getLogger("io.weft");

    private LoggingSetup() {}

    /// Reloads the logging configuration.
    ///
    /// @apiNote **Side effects**: resets the global {@link LogManager}
    ///
    /// @param verbose whether engine logs at `FINE` should be shown
    /// @throws UncheckedIOException if the bundled configuration cannot be read
    public static void configure(boolean verbose) {
        try (InputStream in = LoggingSetup.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + CONFIG_RESOURCE, e);
        }

        if (verbose) {
            WEFT_LOGGER.setLevel(Level.FINE);
            for (Handler handler : Logger.getLogger("").getHandlers()) {
                handler.setLevel(Level.FINE);
            }
        }
    }

    static Level weftLevel() {
        return WEFT_LOGGER.getLevel();
    }
}
