package com.github.anirbanmu.classcal.log;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Structured event log. Each call becomes one {@code key=value} line on stdout, written by a
 * background {@link LogDrain} so callers never block on the terminal.
 *
 * <p>The threshold comes from {@code -Dclasscal.log.level=DEBUG|INFO|WARNING|ERROR}; without it
 * the {@code classcal} {@link System.Logger} decides.
 */
public final class Log {
    private static final Logger logger = System.getLogger("classcal");
    private static final Level THRESHOLD = threshold(System.getProperty("classcal.log.level"));
    private static final LogDrain DRAIN = new LogDrain(new FileOutputStream(FileDescriptor.out), "classcal-log-drain");

    static {
        DRAIN.start();
    }

    private Log() {}

    public static void info(String evt, Object... kv) {
        log(Level.INFO, evt, kv, null);
    }

    public static void warn(String evt, Object... kv) {
        log(Level.WARNING, evt, kv, null);
    }

    public static void error(String evt, Throwable t, Object... kv) {
        log(Level.ERROR, evt, kv, t);
    }

    public static void error(String evt, Object... kv) {
        log(Level.ERROR, evt, kv, null);
    }

    public static void debug(String evt, Object... kv) {
        log(Level.DEBUG, evt, kv, null);
    }

    // waits for queued lines to reach stdout; call before System.exit
    public static void flush() {
        DRAIN.awaitEmpty(1000);
    }

    static boolean enabled(Level level) {
        if (THRESHOLD != null) {
            return level.getSeverity() >= THRESHOLD.getSeverity();
        }
        return logger.isLoggable(level);
    }

    private static void log(Level level, String evt, Object[] kv, Throwable t) {
        if (enabled(level)) {
            DRAIN.offer(format(level, evt, kv, t));
        }
    }

    static Level threshold(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        try {
            return Level.valueOf(name.strip().toUpperCase());
        } catch (IllegalArgumentException e) {
            System.err.println("classcal: unknown log level '" + name + "', using logger defaults");
            return null;
        }
    }

    static String format(Level level, String evt, Object[] kv, Throwable t) {
        StringBuilder sb = new StringBuilder(160);
        sb.append(Instant.now().truncatedTo(ChronoUnit.MILLIS)).append(' ').append(level.getName());

        if (evt != null) {
            field(sb, "evt", evt);
        }
        for (int i = 0; kv != null && i < kv.length; i += 2) {
            Object value = i + 1 < kv.length ? kv[i + 1] : null;
            field(sb, String.valueOf(kv[i]), String.valueOf(value));
        }

        if (t != null) {
            field(sb, "err", t.getClass().getSimpleName());
            field(sb, "msg", t.getMessage());
            StackTraceElement[] trace = t.getStackTrace();
            if (trace.length > 0) {
                field(sb, "loc", trace[0].toString());
            }
            Throwable cause = t.getCause();
            if (cause != null && cause != t) {
                field(sb, "cause", cause.getClass().getSimpleName() + ": " + cause.getMessage());
            }
        }
        return sb.toString();
    }

    private static void field(StringBuilder sb, String key, String value) {
        sb.append(' ').append(key).append('=').append(escape(value));
    }

    static String escape(String s) {
        if (s == null) {
            return "null";
        }
        if (s.isEmpty()) {
            return "\"\"";
        }
        if (s.chars().noneMatch(Log::needsQuoting)) {
            return s;
        }

        StringBuilder sb = new StringBuilder(s.length() + 8).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private static boolean needsQuoting(int c) {
        return c <= ' ' || c == '=' || c == '"';
    }
}
