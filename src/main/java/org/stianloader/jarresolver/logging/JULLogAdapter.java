package org.stianloader.jarresolver.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.jetbrains.annotations.NotNull;

class JULLogAdapter extends LoggingAdapter {

    @NotNull
    static String format(@NotNull String message, Object... args) {
        StringBuilder builder = new StringBuilder();
        int head = 0;
        for (int i = 0; i < args.length; i++) {
            int placeholder = message.indexOf("{}", head);
            if (placeholder != -1) {
                builder.append(message, head, placeholder).append(Objects.toString(args[i]));
                head = placeholder + 2;
            } else if (i == args.length - 1 && args[i] instanceof Throwable) {
                StringWriter trace = new StringWriter();
                ((Throwable) args[i]).printStackTrace(new PrintWriter(trace));
                builder.append(message, head, message.length()).append('\n').append(trace);
                head = message.length();
            } else {
                builder.append(message, head, message.length()).append(' ').append(Objects.toString(args[i]));
                head = message.length();
            }
        }
        builder.append(message, head, message.length());
        return builder.toString();
    }

    private void log(@NotNull Level level, @NotNull Class<?> clazz, @NotNull String message, Object... args) {
        Logger logger = Logger.getLogger(clazz.getName());
        if (logger.isLoggable(level)) {
            logger.log(level, JULLogAdapter.format(message, args));
        }
    }

    @Override
    public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        this.log(Level.FINE, clazz, message, args);
    }

    @Override
    public void error(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        this.log(Level.SEVERE, clazz, message, args);
    }

    @Override
    public void info(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        this.log(Level.INFO, clazz, message, args);
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        this.log(Level.WARNING, clazz, message, args);
    }
}
