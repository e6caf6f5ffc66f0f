/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog.logger;

/**
 * Per-thread reference to a {@link Logger}, for code that can not have a
 * logger passed to it.
 * <p>
 * The reference does not own the logger. Whoever created the logger installs
 * it on each thread that should use it, and must {@link #clear()} those
 * threads (or stop them) before destroying it. Nothing is installed unless the
 * application does so itself; until then the logging methods here do nothing.
 * <p>
 * The origin of each line is the name of the method that called in here.
 */
public final class LogContext
{
    private static final ThreadLocal<Logger> current = new ThreadLocal<Logger>();

    private LogContext()
    {
    }

    public static void install(final Logger logger)
    {
        if (logger == null)
        {
            throw new IllegalArgumentException("logger must not be null, use clear()");
        }

        current.set(logger);
    }

    /**
     * @return the logger installed on this thread, or <code>null</code>
     */
    public static Logger current()
    {
        return current.get();
    }

    public static void clear()
    {
        current.remove();
    }

    public static void log(final LogLevel level, final String format, final Object... args)
    {
        final Logger logger = enabledLogger(level);
        if (logger != null)
        {
            logger.log(level, callerName(), format, args);
        }
    }

    public static void trace(final String format, final Object... args)
    {
        final Logger logger = enabledLogger(LogLevel.TRACE);
        if (logger != null)
        {
            logger.log(LogLevel.TRACE, callerName(), format, args);
        }
    }

    public static void debug(final String format, final Object... args)
    {
        final Logger logger = enabledLogger(LogLevel.DEBUG);
        if (logger != null)
        {
            logger.log(LogLevel.DEBUG, callerName(), format, args);
        }
    }

    public static void info(final String format, final Object... args)
    {
        final Logger logger = enabledLogger(LogLevel.INFO);
        if (logger != null)
        {
            logger.log(LogLevel.INFO, callerName(), format, args);
        }
    }

    public static void warn(final String format, final Object... args)
    {
        final Logger logger = enabledLogger(LogLevel.WARN);
        if (logger != null)
        {
            logger.log(LogLevel.WARN, callerName(), format, args);
        }
    }

    public static void error(final String format, final Object... args)
    {
        final Logger logger = enabledLogger(LogLevel.ERROR);
        if (logger != null)
        {
            logger.log(LogLevel.ERROR, callerName(), format, args);
        }
    }

    public static void fatal(final String format, final Object... args)
    {
        final Logger logger = enabledLogger(LogLevel.FATAL);
        if (logger != null)
        {
            logger.log(LogLevel.FATAL, callerName(), format, args);
        }
    }

    /**
     * @return the installed logger if it accepts the level, otherwise
     *         <code>null</code>
     */
    private static Logger enabledLogger(final LogLevel level)
    {
        LogLevel.checkValid(level);

        final Logger logger = current.get();
        if (logger == null || !logger.isEnabled(level))
        {
            return null;
        }

        return logger;
    }

    /*
     * Must be called directly from the public entry points: frame 0 is
     * getStackTrace, 1 is this method, 2 the entry point and 3 its caller.
     */
    private static String callerName()
    {
        final StackTraceElement[] stack = Thread.currentThread().getStackTrace();

        if (stack.length > 3)
        {
            return stack[3].getMethodName();
        }

        return null;
    }
}
