/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog.targets;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

import org.apache.log4j.Logger;

/**
 * Factories for the standard targets.
 * <p>
 * Apart from {@link #nullTarget()}, every factory returns <code>null</code>
 * when the target can not be created. Callers are expected to fall back to
 * another target, or to do without.
 */
public class LogTargets
{
    private final static Logger logger = Logger.getLogger(LogTargets.class);

    /**
     * Names the file standard error is open on; on Linux a link to
     * <code>/dev/pts/N</code> or <code>/dev/ttyN</code> when it is a terminal.
     */
    static final Path STANDARD_ERROR_LINK = Paths.get("/proc/self/fd/2");

    private LogTargets()
    {
    }

    public static LogTarget nullTarget()
    {
        return NullTarget.INSTANCE;
    }

    /**
     * Opens a file for writing, creating it or truncating it. A file is never
     * treated as a terminal, so no colors are written to it.
     * 
     * @return the target or <code>null</code> if the file could not be opened
     */
    public static StreamTarget file(final Path path)
    {
        if (path == null)
        {
            return null;
        }

        try
        {
            return new StreamTarget(path.toString(), new FileOutputStream(path.toFile()), null);
        }
        catch (IOException e)
        {
            logger.warn("Could not open log file " + path, e);
            return null;
        }
        catch (SecurityException e)
        {
            logger.warn("Not allowed to open log file " + path, e);
            return null;
        }
    }

    /**
     * Writes to the process's standard error through file descriptor 2 itself,
     * so lines share its file position with everything else written there.
     * Destroying the target flushes it but leaves standard error open. Colors
     * are enabled when standard error is a terminal.
     * 
     * @return the target or <code>null</code> if standard error is not
     *         available
     */
    public static StreamTarget standardError()
    {
        return standardError(isTerminal(STANDARD_ERROR_LINK));
    }

    static StreamTarget standardError(final boolean terminal)
    {
        if (!FileDescriptor.err.valid())
        {
            logger.warn("Standard error is not open");
            return null;
        }

        final FileOutputStream stream = new FileOutputStream(FileDescriptor.err);
        return new StreamTarget("stderr", stream, terminal ? TerminalColorizer.INSTANCE : null, false);
    }

    /**
     * @param descriptorLink
     *        a <code>/proc/self/fd</code> entry
     * @return <code>true</code> if the descriptor is open on a terminal device;
     *         <code>false</code> if it is not, or if that can not be told
     */
    static boolean isTerminal(final Path descriptorLink)
    {
        final String device;
        try
        {
            device = Files.readSymbolicLink(descriptorLink).toString();
        }
        catch (IOException e)
        {
            logger.debug("Could not resolve " + descriptorLink + ", assuming no terminal", e);
            return false;
        }
        catch (UnsupportedOperationException e)
        {
            logger.debug("Can not resolve " + descriptorLink + " on this platform, assuming no terminal", e);
            return false;
        }
        catch (SecurityException e)
        {
            logger.debug("Not allowed to resolve " + descriptorLink + ", assuming no terminal", e);
            return false;
        }

        return device.startsWith("/dev/pts/") || device.startsWith("/dev/tty");
    }

    /**
     * Looks up a {@link StringMarker} with {@link ServiceLoader} and uses the
     * first one that is available.
     * 
     * @return the target or <code>null</code> if no tracing tool is available
     */
    public static DebugMarkerTarget debugMarker()
    {
        try
        {
            final Iterator<StringMarker> markers = ServiceLoader.load(StringMarker.class).iterator();

            while (markers.hasNext())
            {
                final DebugMarkerTarget target = debugMarker(markers.next());

                if (target != null)
                {
                    return target;
                }
            }
        }
        catch (ServiceConfigurationError e)
        {
            logger.warn("Could not load string marker", e);
            return null;
        }

        logger.debug("No string marker available");
        return null;
    }

    /**
     * @return a target sending to the given marker or <code>null</code> if the
     *         marker is <code>null</code> or not available
     */
    public static DebugMarkerTarget debugMarker(final StringMarker marker)
    {
        if (marker == null || !marker.isAvailable())
        {
            return null;
        }

        return new DebugMarkerTarget(marker);
    }
}
