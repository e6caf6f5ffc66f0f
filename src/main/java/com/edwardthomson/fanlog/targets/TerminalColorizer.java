/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog.targets;

import com.edwardthomson.fanlog.logger.LogLevel;

/**
 * ANSI SGR colors for interactive terminals.
 */
public class TerminalColorizer
    implements Colorizer
{
    public static final TerminalColorizer INSTANCE = new TerminalColorizer();

    public static final String RESET = ansi("0");

    private static final String TRACE_COLOR = ansi("30;2");
    private static final String DEBUG_COLOR = ansi("37;2");
    private static final String INFO_COLOR = ansi("92");
    private static final String WARN_COLOR = ansi("33");
    private static final String ERROR_COLOR = ansi("31;1");
    private static final String FATAL_COLOR = ansi("30;103;1");

    private TerminalColorizer()
    {
    }

    private static String ansi(final String parameters)
    {
        return "\033[" + parameters + "m";
    }

    @Override
    public String begin(final LogLevel level)
    {
        switch (level)
        {
            case TRACE:
                return TRACE_COLOR;
            case DEBUG:
                return DEBUG_COLOR;
            case INFO:
                return INFO_COLOR;
            case WARN:
                return WARN_COLOR;
            case ERROR:
                return ERROR_COLOR;
            case FATAL:
                return FATAL_COLOR;
            default:
                throw new IllegalArgumentException("No color for log level " + level);
        }
    }

    @Override
    public String end(final LogLevel level)
    {
        return RESET;
    }
}
