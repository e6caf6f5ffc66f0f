/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog;

import java.io.Closeable;
import java.io.IOException;

import org.apache.log4j.Logger;

public class IOUtils
{
    private final static Logger logger = Logger.getLogger(IOUtils.class);

    /**
     * Closes the given resource, logging (and otherwise ignoring) any error.
     */
    public static void close(final Closeable closeable)
    {
        if (closeable == null)
        {
            return;
        }

        try
        {
            closeable.close();
        }
        catch (IOException e)
        {
            logger.debug("Error closing " + closeable, e);
        }
    }
}
