package org.braceform.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colors the level in console output: errors red, warnings yellow, info cyan, debug and
 * trace dimmed.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String RESET = "\u001B[0m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String color = colorOf(event.getLevel());
        return color == null ? in : color + in + RESET;
    }

    static String colorOf(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> "\u001B[31m";
            case Level.WARN_INT -> "\u001B[33m";
            case Level.INFO_INT -> "\u001B[36m";
            case Level.DEBUG_INT, Level.TRACE_INT -> "\u001B[2m";
            default -> null;
        };
    }
}
