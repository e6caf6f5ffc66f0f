/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog.logger;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.IllegalFormatException;
import java.util.LinkedList;
import java.util.List;
import java.util.Locale;

import com.edwardthomson.fanlog.targets.LogTarget;

/**
 * Owns a set of {@link LogTarget}s and a minimum {@link LogLevel}, and writes
 * every line at or above that level to each of its targets.
 * <p>
 * Targets are notified most-recently-added first. Each target receives a line
 * as one {@link LogTarget#writev(java.nio.ByteBuffer[])} call.
 * <p>
 * Logging from several threads at once is fine. Adding targets, changing the
 * level and destroying the logger are not synchronized with logging and must
 * happen while no other thread uses the logger.
 */
public class Logger
{
    private final static org.apache.log4j.Logger diagnostics = org.apache.log4j.Logger.getLogger(Logger.class);

    public static final LogLevel DEFAULT_LEVEL = LogLevel.WARN;

    /**
     * Date (as in the C locale <code>%x</code>), time and milliseconds.
     */
    public static final String TIMESTAMP_PATTERN = "MM/dd/yy HH:mm:ss.SSS";

    private static final DateTimeFormatter TIMESTAMP_FORMATTER =
        DateTimeFormatter.ofPattern(TIMESTAMP_PATTERN, Locale.ROOT);

    private static final String UNKNOWN_ORIGIN = "(unknown)";

    private final LinkedList<LogTarget> targets = new LinkedList<LogTarget>();
    private final Clock clock;

    private LogLevel level = DEFAULT_LEVEL;
    private boolean destroyed = false;

    public Logger()
    {
        this(Clock.systemDefaultZone());
    }

    /**
     * @param clock
     *        the source of timestamps; its zone decides the local date and time
     *        printed
     */
    public Logger(final Clock clock)
    {
        if (clock == null)
        {
            throw new IllegalArgumentException("clock must not be null");
        }

        this.clock = clock;
    }

    /**
     * Adds a target, which will be notified before all targets added earlier.
     * The logger owns the target from now on and destroys it in
     * {@link #destroy()}.
     */
    public void addTarget(final LogTarget target)
    {
        if (target == null)
        {
            throw new IllegalArgumentException("target must not be null");
        }
        if (destroyed)
        {
            throw new IllegalStateException("Logger has been destroyed");
        }

        targets.addFirst(target);
    }

    /**
     * @return the targets in the order they are notified
     */
    public List<LogTarget> getTargets()
    {
        return Collections.unmodifiableList(targets);
    }

    public void setLevel(final LogLevel level)
    {
        this.level = LogLevel.checkValid(level);
    }

    public LogLevel getLevel()
    {
        return level;
    }

    public boolean isEnabled(final LogLevel level)
    {
        return LogLevel.checkValid(level).getValue() >= this.level.getValue();
    }

    /**
     * Destroys every target, then forgets them. Destroying a logger twice does
     * nothing the second time.
     */
    public void destroy()
    {
        for (LogTarget target : targets)
        {
            try
            {
                target.destroy();
            }
            catch (RuntimeException e)
            {
                diagnostics.warn("Error destroying log target " + target, e);
            }
        }

        targets.clear();
        destroyed = true;
    }

    public boolean isDestroyed()
    {
        return destroyed;
    }

    /**
     * Formats a message and writes it to every target, unless the level is
     * below this logger's level.
     * <p>
     * A message that can not be formatted, or a time that can not be
     * rendered, drops the line without telling the caller.
     * 
     * @param level
     *        any level from {@link LogLevel#TRACE} to {@link LogLevel#FATAL}
     * @param origin
     *        where the line comes from, usually a method or component name
     * @param format
     *        a {@link java.util.Formatter} format string
     * @throws IllegalArgumentException
     *         if level is <code>null</code> or {@link LogLevel#INVALID}
     */
    public void log(final LogLevel level, final String origin, final String format, final Object... args)
    {
        if (!isEnabled(level))
        {
            return;
        }

        final String message;
        try
        {
            message = format != null ? String.format(Locale.ROOT, format, args) : "null";
        }
        catch (IllegalFormatException e)
        {
            diagnostics.debug("Dropping log line from " + origin + ", could not format '" + format + "'", e);
            return;
        }

        final String timestamp;
        try
        {
            timestamp = TIMESTAMP_FORMATTER.format(LocalDateTime.now(clock));
        }
        catch (DateTimeException e)
        {
            diagnostics.debug("Dropping log line from " + origin + ", could not format the time", e);
            return;
        }

        final LogRecord record = new LogRecord(level, timestamp, origin != null ? origin : UNKNOWN_ORIGIN, message);

        for (LogTarget target : targets)
        {
            try
            {
                target.writev(record.toSegments(target.getColorizer()));
            }
            catch (RuntimeException e)
            {
                diagnostics.warn("Error writing to log target " + target, e);
            }
        }
    }

    public void trace(final String origin, final String format, final Object... args)
    {
        log(LogLevel.TRACE, origin, format, args);
    }

    public void debug(final String origin, final String format, final Object... args)
    {
        log(LogLevel.DEBUG, origin, format, args);
    }

    public void info(final String origin, final String format, final Object... args)
    {
        log(LogLevel.INFO, origin, format, args);
    }

    public void warn(final String origin, final String format, final Object... args)
    {
        log(LogLevel.WARN, origin, format, args);
    }

    public void error(final String origin, final String format, final Object... args)
    {
        log(LogLevel.ERROR, origin, format, args);
    }

    public void fatal(final String origin, final String format, final Object... args)
    {
        log(LogLevel.FATAL, origin, format, args);
    }

    @Override
    public String toString()
    {
        return "Logger [level=" + level + ", targets=" + targets + "]";
    }
}
