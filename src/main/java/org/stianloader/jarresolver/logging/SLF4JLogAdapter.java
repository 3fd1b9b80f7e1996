package org.stianloader.jarresolver.logging;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards to the SLF4J logger named after the class that emits a message.
 * Loggers are looked up once per class, messages below the enabled level are dropped before reaching SLF4J.
 */
class SLF4JLogAdapter extends LoggingAdapter {

    @NotNull
    private final Map<@NotNull Class<?>, @NotNull Logger> loggers = new ConcurrentHashMap<>();

    @Override
    public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        Logger logger = this.getLogger(clazz);
        if (logger.isDebugEnabled()) {
            logger.debug(message, args);
        }
    }

    @Override
    public void error(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        this.getLogger(clazz).error(message, args);
    }

    @NotNull
    Logger getLogger(@NotNull Class<?> clazz) {
        return this.loggers.computeIfAbsent(clazz, LoggerFactory::getLogger);
    }

    @Override
    public void info(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        Logger logger = this.getLogger(clazz);
        if (logger.isInfoEnabled()) {
            logger.info(message, args);
        }
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        Logger logger = this.getLogger(clazz);
        if (logger.isWarnEnabled()) {
            logger.warn(message, args);
        }
    }
}
