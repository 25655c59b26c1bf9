package io.weft.cli.ui;

import java.time.Duration;
import java.util.Locale;

/// Number and duration formatting for the text reports.
///
/// Uses {@link Locale#ROOT} so reports look the same on every machine.
public final class Formats {

    private Formats() {}

    /// Formats a duration as milliseconds below one second, seconds otherwise.
    ///
    /// `Duration.ofMillis(250)` gives `250ms`, `Duration.ofMillis(1500)` gives `1.50s`.
    ///
    /// @param duration the duration, may be null
    /// @return formatted duration, `-` for null
    public static String duration(Duration duration) {
        if (duration == null) {
            return "-";
        }
        long millis = duration.toMillis();
        if (millis < 1000) {
            return millis + "ms";
        }
        return String.format(Locale.ROOT, "%.2fs", millis / 1000.0);
    }

    public static String millis(double millis) {
        return duration(Duration.ofMillis(Math.round(millis)));
    }

    /// Formats a USD amount with four decimals, e.g. `$0.0250`.
    public static String cost(double usd) {
        return String.format(Locale.ROOT, "$%.4f", usd);
    }

    public static String decimal(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    /// Formats a value already expressed in percent, e.g. `12.5%`.
    public static String percent(double percent) {
        return String.format(Locale.ROOT, "%.1f%%", percent);
    }

    /// Formats a fraction in `[0, 1]` as a percentage, e.g. `0.9` gives `90.0%`.
    public static String fraction(double fraction) {
        return percent(fraction * 100);
    }
}
