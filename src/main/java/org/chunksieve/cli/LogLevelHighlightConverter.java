package org.chunksieve.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter coloring console output by log level.
 *
 * <p>Colors:
 * <ul>
 *   <li>ERROR - Red</li>
 *   <li>WARN - Yellow</li>
 *   <li>INFO - Blue</li>
 *   <li>DEBUG/TRACE - Gray, so raw engine lines recede behind search progress</li>
 * </ul>
 * Coloring is disabled when the {@code NO_COLOR} environment variable is set.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String ANSI_RESET = "\u001B[0m";
    static final String ANSI_RED = "\u001B[31m";
    static final String ANSI_YELLOW = "\u001B[33m";
    static final String ANSI_BLUE = "\u001B[34m";
    static final String ANSI_GRAY = "\u001B[90m";

    private final boolean enabled;

    public LogLevelHighlightConverter() {
        this(System.getenv("NO_COLOR") == null);
    }

    LogLevelHighlightConverter(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    protected String transform(ILoggingEvent event, String in) {
        if (!enabled) {
            return in;
        }
        String color = switch (event.getLevel().toInt()) {
            case Level.ERROR_INT -> ANSI_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.INFO_INT -> ANSI_BLUE;
            default -> ANSI_GRAY;
        };
        return color + in + ANSI_RESET;
    }
}
