/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog.targets;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

import org.apache.log4j.Logger;

import com.edwardthomson.fanlog.IOUtils;

/**
 * Writes to a file or to the process's standard error.
 * <p>
 * {@link #write(byte[], int, int)} goes through a buffer;
 * {@link #writev(ByteBuffer[])} flushes that buffer and then makes a single
 * gathering write on the underlying {@link FileChannel}, so that one log line
 * lands in the file in one piece even when several threads log to the same
 * target.
 * <p>
 * Use {@link LogTargets} to open one.
 */
public class StreamTarget
    implements LogTarget
{
    private final static Logger logger = Logger.getLogger(StreamTarget.class);

    private final String name;
    private final FileOutputStream stream;
    private final BufferedOutputStream buffered;
    private final FileChannel channel;
    private final Colorizer colorizer;
    private final boolean closeOnDestroy;

    private final Object writeLock = new Object();

    /**
     * @param name
     *        describes the sink in diagnostics (a path or "stderr")
     * @param stream
     *        the stream to write to, closed by {@link #destroy()}
     * @param colorizer
     *        the colorizer for an interactive terminal, or <code>null</code>
     */
    public StreamTarget(final String name, final FileOutputStream stream, final Colorizer colorizer)
    {
        this(name, stream, colorizer, true);
    }

    /**
     * @param closeOnDestroy
     *        <code>false</code> to only flush in {@link #destroy()}, for streams
     *        on a descriptor the target does not own (standard error)
     */
    public StreamTarget(final String name, final FileOutputStream stream, final Colorizer colorizer,
        final boolean closeOnDestroy)
    {
        this.name = name;
        this.stream = stream;
        this.buffered = new BufferedOutputStream(stream);
        this.channel = stream.getChannel();
        this.colorizer = colorizer;
        this.closeOnDestroy = closeOnDestroy;
    }

    @Override
    public void write(final byte[] bytes, final int offset, final int length)
    {
        try
        {
            buffered.write(bytes, offset, length);
        }
        catch (IOException e)
        {
            logger.debug("Error writing to " + name, e);
        }
    }

    @Override
    public void writev(final ByteBuffer[] segments)
    {
        synchronized (writeLock)
        {
            try
            {
                buffered.flush();

                // A gathering write to a file is complete in one call; the loop
                // only matters for pipes that accept less than a full line
                while (hasRemaining(segments))
                {
                    channel.write(segments);
                }
            }
            catch (IOException e)
            {
                logger.debug("Error writing to " + name, e);
            }
        }
    }

    private static boolean hasRemaining(final ByteBuffer[] segments)
    {
        for (ByteBuffer segment : segments)
        {
            if (segment.hasRemaining())
            {
                return true;
            }
        }

        return false;
    }

    @Override
    public void destroy()
    {
        try
        {
            buffered.flush();
        }
        catch (IOException e)
        {
            logger.debug("Error flushing " + name, e);
        }

        if (closeOnDestroy)
        {
            IOUtils.close(stream);
        }
    }

    @Override
    public Colorizer getColorizer()
    {
        return colorizer;
    }

    public String getName()
    {
        return name;
    }

    @Override
    public String toString()
    {
        return "StreamTarget [" + name + "]";
    }
}
