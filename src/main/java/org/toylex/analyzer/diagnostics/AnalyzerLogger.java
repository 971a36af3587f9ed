package org.toylex.analyzer.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzer-internal logging with an integer verbosity on top of SLF4J.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE
 * <p>
 * The verbosity gates messages before they reach SLF4J, so the configured Logback level of this
 * logger still applies on top of it. Callers that change the verbosity for one analysis restore
 * the previous value with {@link #setLevel(int)} when done.
 */
public final class AnalyzerLogger {

    public static final int ERROR = 0;
    public static final int WARN  = 1;
    public static final int INFO  = 2;
    public static final int DEBUG = 3;
    public static final int TRACE = 4;

    private static final Logger logger = LoggerFactory.getLogger(AnalyzerLogger.class);

    private static volatile int level = INFO;

    private AnalyzerLogger() {}

    /**
     * Sets the verbosity, clamped to {@link #ERROR}..{@link #TRACE}.
     * @param newLevel The new verbosity.
     * @return The previous verbosity.
     */
    public static int setLevel(int newLevel) {
        int previous = level;
        level = Math.max(ERROR, Math.min(TRACE, newLevel));
        return previous;
    }

    public static int getLevel() {
        return level;
    }

    /**
     * Logs a phase summary.
     * @param msg The message to log.
     */
    public static void debug(String msg) {
        if (level >= DEBUG) logger.debug(msg);
    }

    /**
     * Logs per-lexeme detail. Arguments are formatted by SLF4J only when the message is emitted.
     * @param format An SLF4J message format.
     * @param args The format arguments.
     */
    public static void trace(String format, Object... args) {
        if (level >= TRACE) logger.trace(format, args);
    }
}
