/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog;

import org.apache.log4j.Logger;

import com.edwardthomson.fanlog.targets.DebugMarkerTarget;
import com.edwardthomson.fanlog.targets.LogTarget;
import com.edwardthomson.fanlog.targets.LogTargets;
import com.edwardthomson.fanlog.targets.StreamTarget;

/**
 * Builds a {@link com.edwardthomson.fanlog.logger.Logger} from {@link Options}.
 * <p>
 * Standard error is always a target (a null target if it can not be opened).
 * The log file and the debug marker are added when configured; if either can
 * not be created the logger goes on without it.
 */
public class LoggerSetup
{
    private final static Logger logger = Logger.getLogger(LoggerSetup.class);

    private LoggerSetup()
    {
    }

    public static com.edwardthomson.fanlog.logger.Logger createLogger(final Options options)
    {
        final com.edwardthomson.fanlog.logger.Logger ret = new com.edwardthomson.fanlog.logger.Logger();
        ret.setLevel(options.getLogLevel());

        LogTarget standardError = LogTargets.standardError();
        if (standardError == null)
        {
            logger.warn("Could not open standard error, log lines will only go to the configured targets");
            standardError = LogTargets.nullTarget();
        }
        ret.addTarget(standardError);

        if (options.getLogFile() != null)
        {
            final StreamTarget file = LogTargets.file(options.getLogFile());

            if (file != null)
            {
                ret.addTarget(file);
            }
            else
            {
                logger.warn("Not logging to " + options.getLogFile());
            }
        }

        if (options.isDebugMarker())
        {
            final DebugMarkerTarget marker = LogTargets.debugMarker();

            if (marker != null)
            {
                ret.addTarget(marker);
            }
            else
            {
                logger.warn("No tracing tool available for debug markers");
            }
        }

        logger.debug("Created " + ret);

        return ret;
    }
}
