/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog.targets;

/**
 * Entry point into an external tracing tool that can record free-form text
 * markers in its capture (for example a graphics API debugger).
 * <p>
 * Implementations are discovered with {@link java.util.ServiceLoader}; register
 * one in <code>META-INF/services/com.edwardthomson.fanlog.targets.StringMarker</code>.
 */
public interface StringMarker
{
    /**
     * @return <code>false</code> if the tracing tool is not attached to this
     *         process, in which case no markers will be sent
     */
    boolean isAvailable();

    void mark(String text);
}
