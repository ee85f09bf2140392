package com.tyron.nanodata.testFramework;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Test-only logging setup.
 *
 * Controls java.util.logging output via system property:
 * - nanodata.test.logLevel=INFO|FINE|FINER|FINEST|WARNING|SEVERE
 * <p>
 * Only loggers under {@code com.tyron.nanodata} are raised to that level; everything else
 * stays at INFO so JDK internals do not flood FINE runs.
 */
public final class TestLogging {

    public static final String LEVEL_PROPERTY = "nanodata.test.logLevel";

    private static final String PROJECT_LOGGER = "com.tyron.nanodata";

    private static volatile boolean configured;

    // strong reference; LogManager only keeps loggers weakly
    private static Logger projectLogger;

    private TestLogging() {
    }

    public static synchronized void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty(LEVEL_PROPERTY, "INFO"));
        Formatter formatter = new CompactFormatter();

        Logger root = Logger.getLogger("");
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
            if (h instanceof ConsoleHandler) {
                h.setFormatter(formatter);
            }
        }
        projectLogger = Logger.getLogger(PROJECT_LOGGER);
        projectLogger.setLevel(level);

        root.log(Level.INFO, "test logging configured level=" + level.getName());
    }

    private static final class CompactFormatter extends Formatter {

        private static final DateTimeFormatter TS = DateTimeFormatter
                .ofPattern("HH:mm:ss.SSS")
                .withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(128);
            out.append(TS.format(Instant.ofEpochMilli(record.getMillis()))).append(' ')
                    .append(String.format("%-7s", record.getLevel().getName())).append(' ')
                    .append(simpleName(record.getLoggerName())).append(" - ")
                    .append(formatMessage(record))
                    .append('\n');

            Throwable t = record.getThrown();
            if (t != null) {
                StringWriter sw = new StringWriter();
                t.printStackTrace(new PrintWriter(sw));
                out.append(sw);
            }
            return out.toString();
        }

        private static String simpleName(String loggerName) {
            if (loggerName == null || loggerName.isBlank()) return "root";
            String simple = loggerName.substring(loggerName.lastIndexOf('.') + 1);
            int dollar = simple.indexOf('$');
            return dollar >= 0 ? simple.substring(0, dollar) : simple;
        }
    }

    static Level parseLevel(String raw) {
        if (raw == null) return Level.INFO;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return Level.INFO;
        }
    }
}
