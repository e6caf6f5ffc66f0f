/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog.targets;

import com.edwardthomson.fanlog.logger.LogLevel;

/**
 * Supplies the text printed around the level name of a log line.
 */
public interface Colorizer
{
    String begin(LogLevel level);

    /**
     * @return the text printed after the level name, or <code>null</code> for
     *         none
     */
    String end(LogLevel level);
}
