package org.tuscan.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter that colours the level of console log lines.
 * <p>
 * Registered as {@code %highlightLevel} in {@code logback.xml}. Scan progress is logged at
 * INFO, so INFO stays uncoloured and only problems and diagnostics stand out:
 * <ul>
 *   <li>ERROR - Bold red</li>
 *   <li>WARN - Yellow</li>
 *   <li>DEBUG/TRACE - Grey</li>
 * </ul>
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD_RED = "\u001B[1;31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_GREY = "\u001B[90m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        return switch (event.getLevel().toInt()) {
            case Level.ERROR_INT -> ANSI_BOLD_RED + in + ANSI_RESET;
            case Level.WARN_INT -> ANSI_YELLOW + in + ANSI_RESET;
            case Level.DEBUG_INT, Level.TRACE_INT -> ANSI_GREY + in + ANSI_RESET;
            default -> in;
        };
    }
}
