package org.ticksched.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colors the level column of console output so that failed callbacks stand out:
 * ERROR red, WARN yellow, INFO blue. DEBUG and TRACE stay plain.
 * <p>
 * Registered as {@code levelColor} in {@code logback.xml}.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String RESET = "\u001B[0m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String color = colorFor(event.getLevel());
        return color == null ? in : color + in + RESET;
    }

    private static String colorFor(Level level) {
        if (level.isGreaterOrEqual(Level.ERROR)) {
            return "\u001B[31m";
        }
        if (level.isGreaterOrEqual(Level.WARN)) {
            return "\u001B[33m";
        }
        if (level.isGreaterOrEqual(Level.INFO)) {
            return "\u001B[34m";
        }
        return null;
    }
}
