/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog.targets;

import java.util.ArrayList;
import java.util.List;

/**
 * A string marker that keeps what it was sent. Registered as a service for the
 * tests, so {@link LogTargets#debugMarker()} finds it.
 */
public class RecordingStringMarker
    implements StringMarker
{
    private final boolean available;
    private final List<String> marks = new ArrayList<String>();

    public RecordingStringMarker()
    {
        this(true);
    }

    public RecordingStringMarker(final boolean available)
    {
        this.available = available;
    }

    @Override
    public boolean isAvailable()
    {
        return available;
    }

    @Override
    public void mark(final String text)
    {
        marks.add(text);
    }

    public List<String> getMarks()
    {
        return marks;
    }
}
