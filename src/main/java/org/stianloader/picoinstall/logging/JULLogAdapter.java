package org.stianloader.picoinstall.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

class JULLogAdapter extends LoggingAdapter {

    @NotNull
    @Contract(pure = true)
    static String format(@NotNull String message, Object... args) {
        StringBuilder builder = new StringBuilder();
        int head = 0;
        int consumed = 0;
        while (consumed < args.length) {
            int placeholder = message.indexOf("{}", head);
            if (placeholder == -1) {
                break;
            }
            builder.append(message, head, placeholder).append(Objects.toString(args[consumed++]));
            head = placeholder + 2;
        }
        builder.append(message, head, message.length());

        for (; consumed < args.length; consumed++) {
            Object arg = args[consumed];
            if (consumed == args.length - 1 && arg instanceof Throwable) {
                StringWriter sw = new StringWriter();
                ((Throwable) arg).printStackTrace(new PrintWriter(sw));
                builder.append('\n').append(sw);
            } else {
                builder.append(' ').append(Objects.toString(arg));
            }
        }
        return builder.toString();
    }

    private static void log(Class<?> clazz, Level level, String message, Object... args) {
        Logger logger = Logger.getLogger(clazz.getName());
        if (logger.isLoggable(level)) {
            logger.log(level, JULLogAdapter.format(message, args));
        }
    }

    @Override
    public void debug(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.FINE, message, args);
    }

    @Override
    public void error(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.SEVERE, message, args);
    }

    @Override
    public void info(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.INFO, message, args);
    }

    @Override
    public void warn(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.WARNING, message, args);
    }
}
