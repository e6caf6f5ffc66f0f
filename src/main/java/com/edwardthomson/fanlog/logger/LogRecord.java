/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog.logger;

import java.nio.ByteBuffer;

import com.edwardthomson.fanlog.UTF8Utils;
import com.edwardthomson.fanlog.targets.Colorizer;

/**
 * One formatted log line, kept as the encoded pieces that make up
 * <code>[ &lt;timestamp&gt; &lt;origin&gt; &lt;begin&gt;&lt;LEVEL&gt;&lt;end&gt; ] &lt;message&gt;\n</code>.
 * <p>
 * Everything but the color texts is shared between targets; each target gets
 * its own set of segments from {@link #toSegments(Colorizer)}.
 */
public class LogRecord
{
    public static final int SEGMENT_COUNT = 11;

    private static final byte[] OPEN = UTF8Utils.encode("[ ");
    private static final byte[] SPACE = UTF8Utils.encode(" ");
    private static final byte[] CLOSE = UTF8Utils.encode(" ] ");
    private static final byte[] NEWLINE = UTF8Utils.encode("\n");

    private final LogLevel level;
    private final byte[] timestamp;
    private final byte[] origin;
    private final byte[] levelName;
    private final byte[] message;

    public LogRecord(final LogLevel level, final String timestamp, final String origin, final String message)
    {
        this.level = LogLevel.checkValid(level);
        this.timestamp = UTF8Utils.encode(timestamp);
        this.origin = UTF8Utils.encode(origin);
        this.levelName = UTF8Utils.encode(level.getDisplayName());
        this.message = UTF8Utils.encode(message);
    }

    public LogLevel getLevel()
    {
        return level;
    }

    /**
     * @param colorizer
     *        the target's colorizer, or <code>null</code> for plain text
     * @return {@value #SEGMENT_COUNT} fresh buffers, in line order
     */
    public ByteBuffer[] toSegments(final Colorizer colorizer)
    {
        byte[] begin = UTF8Utils.EMPTY;
        byte[] end = UTF8Utils.EMPTY;

        if (colorizer != null)
        {
            begin = UTF8Utils.encode(colorizer.begin(level));
            end = UTF8Utils.encode(colorizer.end(level));
        }

        return new ByteBuffer[]
        {
            ByteBuffer.wrap(OPEN),
            ByteBuffer.wrap(timestamp),
            ByteBuffer.wrap(SPACE),
            ByteBuffer.wrap(origin),
            ByteBuffer.wrap(SPACE),
            ByteBuffer.wrap(begin),
            ByteBuffer.wrap(levelName),
            ByteBuffer.wrap(end),
            ByteBuffer.wrap(CLOSE),
            ByteBuffer.wrap(message),
            ByteBuffer.wrap(NEWLINE),
        };
    }

    /**
     * @return the whole line as it would be written to a target with the given
     *         colorizer
     */
    public String toString(final Colorizer colorizer)
    {
        final StringBuilder sb = new StringBuilder();

        for (ByteBuffer segment : toSegments(colorizer))
        {
            sb.append(UTF8Utils.decode(segment.array()));
        }

        return sb.toString();
    }

    @Override
    public String toString()
    {
        return toString(null);
    }
}
