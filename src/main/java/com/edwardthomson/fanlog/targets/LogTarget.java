/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog.targets;

import java.nio.ByteBuffer;

/**
 * An output sink for log lines.
 * <p>
 * A target is owned by exactly one {@link com.edwardthomson.fanlog.logger.Logger},
 * which calls {@link #destroy()} once when the logger itself is destroyed.
 * {@link NullTarget#INSTANCE} is the only target that may be shared.
 * <p>
 * Implementations must never throw from {@link #write(byte[], int, int)} or
 * {@link #writev(ByteBuffer[])} because of a failure in the underlying sink;
 * such failures are the target's own business.
 */
public interface LogTarget
{
    /**
     * Writes a contiguous run of bytes.
     */
    void write(byte[] bytes, int offset, int length);

    /**
     * Writes all remaining bytes of every segment, in order, as one logical
     * write. Targets without a native gathering primitive should extend
     * {@link ScalarLogTarget}.
     */
    void writev(ByteBuffer[] segments);

    /**
     * Releases everything the target holds. Called at most once by the owning
     * logger.
     */
    void destroy();

    /**
     * @return the colorizer used to decorate the level name for this target,
     *         or <code>null</code> if this target does not colorize
     */
    Colorizer getColorizer();
}
