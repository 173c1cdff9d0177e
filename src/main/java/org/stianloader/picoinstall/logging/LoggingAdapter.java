package org.stianloader.picoinstall.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Logging facade used throughout picoinstall.
 *
 * <p>picoinstall is meant to be embedded in tooling that may or may not ship SLF4J. If
 * {@code org.slf4j.LoggerFactory} can be found on the classpath it is used as the log sink,
 * otherwise messages are routed to {@link java.util.logging.Logger}. Hosts can install their own
 * sink through {@link #setDefaultLogger(LoggingAdapter)}.
 *
 * <p>Messages use SLF4J placeholders ("{}"). Surplus arguments are appended to the message,
 * leftover placeholders are kept verbatim. If the last argument is a {@link Throwable}
 * its stacktrace is logged as well.
 */
public abstract class LoggingAdapter {

    @NotNull
    static LoggingAdapter currentInstance;

    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        currentInstance = instance;
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.currentInstance;
    }

    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.currentInstance = Objects.requireNonNull(instance, "instance may not be null");
    }

    public abstract void debug(Class<?> clazz, String message, Object... args);
    public abstract void error(Class<?> clazz, String message, Object... args);
    public abstract void info(Class<?> clazz, String message, Object... args);
    public abstract void warn(Class<?> clazz, String message, Object... args);
}
