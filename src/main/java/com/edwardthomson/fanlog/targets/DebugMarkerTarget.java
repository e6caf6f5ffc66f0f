/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog.targets;

import com.edwardthomson.fanlog.UTF8Utils;

/**
 * Sends each log line to an external tracing tool as a string marker.
 */
public class DebugMarkerTarget
    extends ScalarLogTarget
{
    private StringMarker marker;

    public DebugMarkerTarget(final StringMarker marker)
    {
        if (marker == null)
        {
            throw new IllegalArgumentException("marker must not be null");
        }

        this.marker = marker;
    }

    @Override
    public void write(final byte[] bytes, final int offset, final int length)
    {
        final StringMarker current = marker;
        if (current != null)
        {
            current.mark(UTF8Utils.decode(bytes, offset, length));
        }
    }

    @Override
    public void destroy()
    {
        marker = null;
    }

    @Override
    public String toString()
    {
        return "DebugMarkerTarget [" + marker + "]";
    }
}
