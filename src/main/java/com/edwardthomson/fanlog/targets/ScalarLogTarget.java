/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog.targets;

import java.nio.ByteBuffer;

/**
 * Base class for targets that can only write one contiguous buffer at a time.
 * {@link #writev(ByteBuffer[])} copies all segments into a single array and
 * makes exactly one {@link #write(byte[], int, int)} call with it.
 */
public abstract class ScalarLogTarget
    implements LogTarget
{
    @Override
    public final void writev(final ByteBuffer[] segments)
    {
        int total = 0;
        for (ByteBuffer segment : segments)
        {
            total += segment.remaining();
        }

        final byte[] buffer = new byte[total];
        int offset = 0;
        for (ByteBuffer segment : segments)
        {
            final int length = segment.remaining();
            segment.get(buffer, offset, length);
            offset += length;
        }

        write(buffer, 0, total);
    }

    @Override
    public Colorizer getColorizer()
    {
        return null;
    }

    @Override
    public String toString()
    {
        return getClass().getSimpleName();
    }
}
