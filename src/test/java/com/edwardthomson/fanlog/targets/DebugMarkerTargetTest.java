/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog.targets;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.edwardthomson.fanlog.logger.Logger;

/**
 * Tests for {@link DebugMarkerTarget} and the {@link ScalarLogTarget} adapter
 * it relies on.
 */
class DebugMarkerTargetTest
{
    @Test
    void eachLineIsOneMarker()
    {
        RecordingStringMarker marker = new RecordingStringMarker();
        Logger logger = new Logger(Clock.fixed(Instant.parse("2024-03-05T07:08:09.012Z"), ZoneOffset.UTC));
        logger.addTarget(new DebugMarkerTarget(marker));

        logger.error("render", "frame %d late", 12);
        logger.warn("render", "vsync off");

        assertEquals(Arrays.asList(
            "[ 03/05/24 07:08:09.012 render ERROR ] frame 12 late\n",
            "[ 03/05/24 07:08:09.012 render WARN ] vsync off\n"),
            marker.getMarks());
    }

    @Test
    void destroyReleasesTheMarker()
    {
        RecordingStringMarker marker = new RecordingStringMarker();
        DebugMarkerTarget target = new DebugMarkerTarget(marker);

        target.destroy();
        byte[] text = "late".getBytes(StandardCharsets.UTF_8);
        target.write(text, 0, text.length);

        assertTrue(marker.getMarks().isEmpty());
    }

    @Test
    void vectoredWriteBecomesOneScalarWrite()
    {
        final StringBuilder written = new StringBuilder();
        final int[] calls = { 0 };

        ScalarLogTarget target = new ScalarLogTarget()
        {
            @Override
            public void write(byte[] bytes, int offset, int length)
            {
                calls[0]++;
                written.append(new String(bytes, offset, length, StandardCharsets.UTF_8));
            }

            @Override
            public void destroy()
            {
            }
        };

        ByteBuffer partlyRead = ByteBuffer.wrap("xxabc".getBytes(StandardCharsets.UTF_8));
        partlyRead.position(2);

        target.writev(new ByteBuffer[]
        {
            partlyRead,
            ByteBuffer.wrap(new byte[0]),
            ByteBuffer.wrap("déf".getBytes(StandardCharsets.UTF_8)),
        });

        assertEquals(1, calls[0]);
        assertEquals("abcdéf", written.toString());
        assertNull(target.getColorizer());
    }

    @Test
    void rejectsNullMarker()
    {
        assertThrows(IllegalArgumentException.class, () -> new DebugMarkerTarget(null));
    }
}
