/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog.logger;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.edwardthomson.fanlog.targets.RecordingTarget;

/**
 * Tests for {@link LogContext}.
 */
class LogContextTest
{
    @AfterEach
    void clearContext()
    {
        LogContext.clear();
    }

    @Test
    void doesNothingWithoutAnInstalledLogger()
    {
        assertNull(LogContext.current());

        LogContext.error("nobody listens");
    }

    @Test
    void usesTheCallingMethodAsOrigin()
    {
        Logger logger = new Logger();
        RecordingTarget target = new RecordingTarget("t");
        logger.addTarget(target);
        LogContext.install(logger);

        LogContext.warn("%d files left", 3);

        assertEquals("usesTheCallingMethodAsOrigin", target.getOnlyWrite().get(3));
        assertEquals("3 files left", target.getOnlyWrite().get(9));
    }

    @Test
    void genericLogUsesTheCallingMethodAsOrigin()
    {
        Logger logger = new Logger();
        RecordingTarget target = new RecordingTarget("t");
        logger.addTarget(target);
        LogContext.install(logger);

        LogContext.log(LogLevel.ERROR, "boom");

        assertEquals("genericLogUsesTheCallingMethodAsOrigin", target.getOnlyWrite().get(3));
    }

    @Test
    void respectsTheLoggerLevel()
    {
        Logger logger = new Logger();
        RecordingTarget target = new RecordingTarget("t");
        logger.addTarget(target);
        LogContext.install(logger);

        LogContext.trace("t");
        LogContext.debug("d");
        LogContext.info("i");

        assertTrue(target.getWrites().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> LogContext.log(LogLevel.INVALID, "x"));
    }

    @Test
    void referenceIsPerThreadAndDoesNotOwnTheLogger()
        throws Exception
    {
        Logger logger = new Logger();
        RecordingTarget target = new RecordingTarget("t");
        logger.addTarget(target);
        LogContext.install(logger);

        final AtomicReference<Logger> seen = new AtomicReference<Logger>(logger);
        Thread other = new Thread(new Runnable()
        {
            @Override
            public void run()
            {
                seen.set(LogContext.current());
                LogContext.error("from another thread");
            }
        });
        other.start();
        other.join();

        assertNull(seen.get());
        assertTrue(target.getWrites().isEmpty());

        LogContext.clear();
        assertNull(LogContext.current());
        assertFalse(logger.isDestroyed());
        assertEquals(0, target.getDestroyCount());
    }

    @Test
    void installRejectsNull()
    {
        assertThrows(IllegalArgumentException.class, () -> LogContext.install(null));
    }
}
