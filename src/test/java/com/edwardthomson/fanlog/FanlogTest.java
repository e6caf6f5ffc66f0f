/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.edwardthomson.fanlog.GetOptions.OptionException;
import com.edwardthomson.fanlog.logger.LogLevel;

/**
 * Tests for the {@link Fanlog} command line.
 */
class FanlogTest
{
    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private Fanlog fanlog(String input, String... args)
    {
        InputStream in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
        return new Fanlog(args, in, new PrintStream(err, true));
    }

    @Test
    void parsesOptions()
        throws Exception
    {
        Fanlog fanlog = fanlog("", "-l", "debug", "--at", "error", "-o", "x.log", "--origin", "build", "--debug-marker", "disk", "full");
        fanlog.parseOptions();

        Options options = fanlog.getOptions();
        assertEquals(LogLevel.DEBUG, options.getLogLevel());
        assertEquals(LogLevel.ERROR, options.getMessageLevel());
        assertEquals("x.log", options.getLogFile().toString());
        assertEquals("build", options.getOrigin());
        assertTrue(options.isDebugMarker());
        assertEquals(Arrays.asList("disk", "full"), fanlog.getMessage());
    }

    @Test
    void defaultsMatchTheLogger()
        throws Exception
    {
        Fanlog fanlog = fanlog("");
        fanlog.parseOptions();

        assertEquals(LogLevel.WARN, fanlog.getOptions().getLogLevel());
        assertEquals(LogLevel.INFO, fanlog.getOptions().getMessageLevel());
        assertEquals(Options.DEFAULT_ORIGIN, fanlog.getOptions().getOrigin());
        assertNull(fanlog.getOptions().getLogFile());
        assertFalse(fanlog.getOptions().isDebugMarker());
        assertFalse(fanlog.getOptions().isDiagnosticsDebug());
    }

    @Test
    void debugFlagIsKeptInTheOptions()
        throws Exception
    {
        Fanlog fanlog = fanlog("", "-d", "message");
        fanlog.parseOptions();

        assertTrue(fanlog.getOptions().isDiagnosticsDebug());
        assertEquals(Arrays.asList("message"), fanlog.getMessage());
    }

    @Test
    void rejectsInvalidLevels()
    {
        assertThrows(OptionException.class, () -> fanlog("", "--log-level", "loud").parseOptions());
        assertThrows(OptionException.class, () -> fanlog("", "--at", "fatal").parseOptions());
    }

    @Test
    void badOptionsPrintUsageAndFail()
    {
        assertEquals(1, fanlog("", "--log-level", "verbose").run());

        String output = new String(err.toByteArray(), StandardCharsets.UTF_8);
        assertTrue(output.contains("Invalid level 'verbose'"), output);
        assertTrue(output.contains("Usage: Fanlog"), output);
    }

    @Test
    void logsArgumentsAsOneLine()
        throws Exception
    {
        Path file = tempDir.resolve("args.log");

        int status = fanlog("", "-o", file.toString(), "--at", "error", "--origin", "ci", "build", "failed").run();

        assertEquals(0, status);
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).matches("^\\[ .* ci ERROR \\] build failed$"), lines.get(0));
    }

    @Test
    void logsEachInputLineWhenNoArgumentsAreGiven()
        throws Exception
    {
        Path file = tempDir.resolve("stdin.log");

        int status = fanlog("first\nsecond 100%\n", "-l", "info", "-o", file.toString()).run();

        assertEquals(0, status);
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).endsWith(" fanlog INFO ] first"), lines.get(0));
        assertTrue(lines.get(1).endsWith(" fanlog INFO ] second 100%"), lines.get(1));
    }

    @Test
    void linesBelowTheLevelAreNotWritten()
        throws Exception
    {
        Path file = tempDir.resolve("quiet.log");

        assertEquals(0, fanlog("", "-o", file.toString(), "--at", "info", "ignored").run());

        assertEquals(0, Files.size(file));
    }
}
