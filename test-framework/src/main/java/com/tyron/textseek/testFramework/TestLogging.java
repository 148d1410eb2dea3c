package com.tyron.textseek.testFramework;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Test-only logging setup for the seek engine.
 *
 * System properties:
 * - textseek.test.logLevel=INFO|FINE|... level of the console output, INFO by default
 * - textseek.test.seekTrace=true turns on the engine's per-call FINE trace
 *   ({@code op=select kind=WORD ...}) under {@value #ENGINE_LOGGER}
 */
public final class TestLogging {

    public static final String LOG_LEVEL_PROP = "textseek.test.logLevel";
    public static final String SEEK_TRACE_PROP = "textseek.test.seekTrace";

    /** Parent logger of every engine class. */
    public static final String ENGINE_LOGGER = "com.tyron.textseek";

    private static volatile boolean configured;

    private TestLogging() {
    }

    public static void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty(LOG_LEVEL_PROP));
        boolean seekTrace = Boolean.getBoolean(SEEK_TRACE_PROP);
        Level consoleLevel = seekTrace && level.intValue() > Level.FINE.intValue() ? Level.FINE : level;

        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(consoleLevel);
            if (h instanceof ConsoleHandler) {
                h.setFormatter(new SeekTraceFormatter());
            }
        }
        if (seekTrace) {
            Logger.getLogger(ENGINE_LOGGER).setLevel(Level.FINE);
        }

        root.log(Level.FINE, "testLogging configured level=" + level.getName() + " seekTrace=" + seekTrace);
    }

    /**
     * Runs {@code action} with the FINE trace of {@code owner} enabled and returns the messages it logged.
     * The logger's previous level is restored afterwards.
     */
    public static List<String> captureTrace(Class<?> owner, Runnable action) {
        Logger logger = Logger.getLogger(owner.getName());
        Level previous = logger.getLevel();
        List<String> messages = Collections.synchronizedList(new ArrayList<>());
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                if (record.getLevel().intValue() <= Level.FINE.intValue()) {
                    messages.add(record.getMessage());
                }
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        handler.setLevel(Level.ALL);

        logger.setLevel(Level.FINE);
        logger.addHandler(handler);
        try {
            action.run();
        } finally {
            logger.removeHandler(handler);
            logger.setLevel(previous);
        }
        return List.copyOf(messages);
    }

    static Level parseLevel(String raw) {
        if (raw == null || raw.isBlank()) return Level.INFO;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            System.err.println("Unknown " + LOG_LEVEL_PROP + "=" + raw + ", using INFO");
            return Level.INFO;
        }
    }

    /**
     * One line per record: {@code LEVEL   Class - message}. Engine messages are already
     * {@code key=value} pairs, so no timestamp or source method is added.
     */
    static final class SeekTraceFormatter extends Formatter {

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(96)
                    .append(String.format(Locale.ROOT, "%-7s", record.getLevel().getName())).append(' ')
                    .append(simpleName(record.getLoggerName())).append(" - ")
                    .append(formatMessage(record))
                    .append('\n');

            Throwable t = record.getThrown();
            if (t != null) {
                out.append("  ").append(t).append('\n');
                for (StackTraceElement element : t.getStackTrace()) {
                    out.append("    at ").append(element).append('\n');
                }
            }
            return out.toString();
        }

        private static String simpleName(String loggerName) {
            if (loggerName == null || loggerName.isEmpty()) return "root";
            if (!loggerName.startsWith(ENGINE_LOGGER)) return loggerName;
            return loggerName.substring(loggerName.lastIndexOf('.') + 1);
        }
    }
}
