package com.williamcallahan.media_list_sync.util;

import org.slf4j.Logger;

/**
 * Shared logging helpers that attach an optional throwable after SLF4J placeholders.
 */
public final class LoggingUtils {

    private LoggingUtils() {
    }

    public static void error(Logger log, Throwable throwable, String message, Object... args) {
        if (log == null) {
            return;
        }
        if (throwable == null) {
            log.error(message, args);
        } else {
            log.error(message, appendThrowable(args, throwable));
        }
    }

    public static void warn(Logger log, Throwable throwable, String message, Object... args) {
        if (log == null) {
            return;
        }
        if (throwable == null) {
            log.warn(message, args);
        } else {
            log.warn(message, appendThrowable(args, throwable));
        }
    }

    /**
     * Message of the innermost cause, falling back to the class name when a throwable carries no message.
     */
    public static String rootMessage(Throwable throwable) {
        if (throwable == null) {
            return null;
        }
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current && current.getMessage() == null) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }

    private static Object[] appendThrowable(Object[] args, Throwable throwable) {
        Object[] withThrowable = new Object[args.length + 1];
        System.arraycopy(args, 0, withThrowable, 0, args.length);
        withThrowable[args.length] = throwable;
        return withThrowable;
    }
}
