/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog.logger;

/**
 * Severity of a log line, totally ordered by {@link #getValue()}.
 * <p>
 * {@link #INVALID} is only ever produced by {@link #parse(String)} so that
 * configuration code can reject bad input. It is not a loggable level.
 */
public enum LogLevel
{
    INVALID(-1, "INVALID"),
    TRACE(0, "TRACE"),
    DEBUG(1, "DEBUG"),
    INFO(2, "INFO"),
    WARN(3, "WARN"),
    ERROR(4, "ERROR"),
    FATAL(5, "FATAL ERROR");

    private final int value;
    private final String displayName;

    private LogLevel(int value, String displayName)
    {
        this.value = value;
        this.displayName = displayName;
    }

    public int getValue()
    {
        return value;
    }

    /**
     * @return the canonical uppercase name, as accepted by
     *         {@link #parse(String)}
     */
    public String getName()
    {
        return name();
    }

    /**
     * @return the text rendered in a log line for this level (
     *         <code>FATAL ERROR</code> for {@link #FATAL})
     */
    public String getDisplayName()
    {
        return displayName;
    }

    public boolean isValid()
    {
        return this != INVALID;
    }

    /**
     * Parses a level name case-insensitively. Only <code>TRACE</code>,
     * <code>DEBUG</code>, <code>INFO</code>, <code>WARN</code> and
     * <code>ERROR</code> are accepted; <code>FATAL</code> cannot be selected
     * as a threshold from configuration.
     * 
     * @return the level, or {@link #INVALID} if the string is
     *         <code>null</code> or not recognized
     */
    public static LogLevel parse(final String name)
    {
        if (name == null)
        {
            return INVALID;
        }

        if (name.equalsIgnoreCase("TRACE"))
        {
            return TRACE;
        }
        else if (name.equalsIgnoreCase("DEBUG"))
        {
            return DEBUG;
        }
        else if (name.equalsIgnoreCase("INFO"))
        {
            return INFO;
        }
        else if (name.equalsIgnoreCase("WARN"))
        {
            return WARN;
        }
        else if (name.equalsIgnoreCase("ERROR"))
        {
            return ERROR;
        }

        return INVALID;
    }

    /**
     * Throws if the level can not be used for logging or as a threshold.
     */
    static LogLevel checkValid(final LogLevel level)
    {
        if (level == null || !level.isValid())
        {
            throw new IllegalArgumentException("Log level must be between TRACE and FATAL, was " + level);
        }

        return level;
    }
}
