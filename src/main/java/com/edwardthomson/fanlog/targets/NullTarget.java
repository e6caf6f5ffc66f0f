/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog.targets;

import java.nio.ByteBuffer;

/**
 * Discards everything. The single instance may be added to any number of
 * loggers since destroying it does nothing.
 */
public final class NullTarget
    implements LogTarget
{
    public static final NullTarget INSTANCE = new NullTarget();

    private NullTarget()
    {
    }

    @Override
    public void write(final byte[] bytes, final int offset, final int length)
    {
    }

    @Override
    public void writev(final ByteBuffer[] segments)
    {
    }

    @Override
    public void destroy()
    {
    }

    @Override
    public Colorizer getColorizer()
    {
        return null;
    }

    @Override
    public String toString()
    {
        return "NullTarget";
    }
}
