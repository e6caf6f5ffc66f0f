/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog;

import java.nio.file.Path;

import com.edwardthomson.fanlog.logger.LogLevel;
import com.edwardthomson.fanlog.logger.Logger;

/**
 * Settings used by {@link LoggerSetup} to build a logger.
 */
public class Options
{
    public static final String DEFAULT_ORIGIN = "fanlog";

    /**
     * Lines below this level are not written.
     */
    private LogLevel logLevel = Logger.DEFAULT_LEVEL;

    /**
     * If set, lines are also written to this file, which is truncated first.
     */
    private Path logFile = null;

    /**
     * If true, lines are also sent to an external tracing tool when one is
     * available.
     */
    private boolean debugMarker = false;

    /**
     * If true, fanlog's own diagnostics are shown down to DEBUG.
     */
    private boolean diagnosticsDebug = false;

    /**
     * Origin label for the lines written by the command-line tool.
     */
    private String origin = DEFAULT_ORIGIN;

    /**
     * Level of the lines written by the command-line tool.
     */
    private LogLevel messageLevel = LogLevel.INFO;

    public Options()
    {
    }

    public LogLevel getLogLevel()
    {
        return logLevel;
    }

    public void setLogLevel(LogLevel logLevel)
    {
        if (logLevel == null || !logLevel.isValid())
        {
            throw new IllegalArgumentException("Invalid log level " + logLevel);
        }

        this.logLevel = logLevel;
    }

    public Path getLogFile()
    {
        return logFile;
    }

    public void setLogFile(Path logFile)
    {
        this.logFile = logFile;
    }

    public boolean isDebugMarker()
    {
        return debugMarker;
    }

    public void setDebugMarker(boolean debugMarker)
    {
        this.debugMarker = debugMarker;
    }

    public boolean isDiagnosticsDebug()
    {
        return diagnosticsDebug;
    }

    public void setDiagnosticsDebug(boolean diagnosticsDebug)
    {
        this.diagnosticsDebug = diagnosticsDebug;
    }

    public String getOrigin()
    {
        return origin;
    }

    public void setOrigin(String origin)
    {
        this.origin = origin;
    }

    public LogLevel getMessageLevel()
    {
        return messageLevel;
    }

    public void setMessageLevel(LogLevel messageLevel)
    {
        if (messageLevel == null || !messageLevel.isValid())
        {
            throw new IllegalArgumentException("Invalid log level " + messageLevel);
        }

        this.messageLevel = messageLevel;
    }
}
