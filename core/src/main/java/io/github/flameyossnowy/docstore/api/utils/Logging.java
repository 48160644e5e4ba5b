package io.github.flameyossnowy.docstore.api.utils;

import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLogger;

import java.util.function.Supplier;
import java.util.logging.Level;

/**
 * Static logging facade of the core module.
 * <p>
 * Messages go to SLF4J under the {@code io.github.flameyossnowy.docstore} logger when a
 * binding is present, and to {@code java.util.logging} otherwise. Errors and warnings are
 * always written; {@link #info} needs {@link #ENABLED} and {@link #deepInfo} needs {@link #DEEP}.
 * Both switches start from the system properties {@code docstore.logging} and
 * {@code docstore.logging.deep}.
 */
@ApiStatus.Internal
public final class Logging {
    public static final String LOGGER_NAME = "io.github.flameyossnowy.docstore";

    public static boolean ENABLED = Boolean.getBoolean("docstore.logging");
    public static boolean DEEP = Boolean.getBoolean("docstore.logging.deep");

    private static final Sink SINK = detectSink();

    private Logging() {
    }

    private static Sink detectSink() {
        try {
            Logger logger = LoggerFactory.getLogger(LOGGER_NAME);
            if (!(logger instanceof NOPLogger)) return new Slf4jSink(logger);
        } catch (NoClassDefFoundError ignored) {
            // slf4j-api is not on the classpath
        }
        return new JulSink(java.util.logging.Logger.getLogger(LOGGER_NAME));
    }

    public static void error(String message) {
        SINK.log(Level.SEVERE, message, null);
    }

    public static void error(String message, Throwable throwable) {
        SINK.log(Level.SEVERE, message, throwable);
    }

    public static void warn(String message) {
        SINK.log(Level.WARNING, message, null);
    }

    /**
     * Logs lifecycle information if {@link #ENABLED} is set.
     */
    public static void info(String message) {
        if (ENABLED) SINK.log(Level.INFO, message, null);
    }

    /**
     * Logs per-operation tracing if {@link #DEEP} is set. The message is only built when it is written.
     */
    public static void deepInfo(@NotNull Supplier<String> message) {
        if (DEEP) SINK.log(Level.INFO, message.get(), null);
    }

    private interface Sink {
        void log(Level level, String message, Throwable throwable);
    }

    private record Slf4jSink(Logger logger) implements Sink {
        @Override
        public void log(Level level, String message, Throwable throwable) {
            if (level == Level.SEVERE) logger.error(message, throwable);
            else if (level == Level.WARNING) logger.warn(message, throwable);
            else logger.info(message, throwable);
        }
    }

    private record JulSink(java.util.logging.Logger logger) implements Sink {
        @Override
        public void log(Level level, String message, Throwable throwable) {
            if (throwable == null) logger.log(level, message);
            else logger.log(level, message, throwable);
        }
    }
}
