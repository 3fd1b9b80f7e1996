package org.stianloader.jarresolver.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * The sink every jarresolver component writes its diagnostics to.
 *
 * <p>SLF4J is an optional dependency of jarresolver. If it is present on the classpath the
 * {@link #getDefaultLogger() default logger} forwards to it, otherwise it writes to
 * {@link java.util.logging.Logger java.util.logging}. Components accept their own instance through
 * their constructors, which is how callers (or tests) can capture the messages emitted by
 * a single resolution without touching global state.
 *
 * <p>Messages use SLF4J-style "{}" placeholders. Arguments without a placeholder are appended to the
 * message, a trailing {@link Throwable} has its stacktrace logged.
 */
public abstract class LoggingAdapter {

    @NotNull
    private static LoggingAdapter defaultLogger;

    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        LoggingAdapter.defaultLogger = instance;
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.defaultLogger;
    }

    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.defaultLogger = Objects.requireNonNull(instance, "instance may not be null");
    }

    public abstract void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args);
    public abstract void error(@NotNull Class<?> clazz, @NotNull String message, Object... args);
    public abstract void info(@NotNull Class<?> clazz, @NotNull String message, Object... args);
    public abstract void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args);
}
