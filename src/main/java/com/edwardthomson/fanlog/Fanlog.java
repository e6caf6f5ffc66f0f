/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.List;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import com.edwardthomson.fanlog.GetOptions.Option;
import com.edwardthomson.fanlog.GetOptions.OptionException;
import com.edwardthomson.fanlog.logger.LogLevel;

/**
 * Command-line front end: writes its arguments (or each line of standard
 * input) as log lines through a logger built from the command-line options.
 */
public class Fanlog
{
    private final static Logger logger = Logger.getLogger(Fanlog.class);

    public static void main(String[] args)
    {
        configureDiagnostics();
        System.exit(new Fanlog(args, System.in, System.err).run());
    }

    private final String[] args;
    private final InputStream input;
    private final PrintStream err;

    private Options options;
    private List<String> message;

    public Fanlog(final String[] args, final InputStream input, final PrintStream err)
    {
        this.args = args;
        this.input = input;
        this.err = err;
    }

    private void usage()
    {
        err.println("Usage: Fanlog [-l|--log-level level] [-a|--at level] [-o|--log-file path]");
        err.println("         [--origin label] [--debug-marker] [-d|--debug] [message ...]");
        err.println("Levels: trace, debug, info, warn, error");
    }

    /**
     * @return the process exit code
     */
    public int run()
    {
        try
        {
            parseOptions();
        }
        catch (OptionException e)
        {
            err.println(e.getMessage());
            usage();
            return 1;
        }

        if (options.isDiagnosticsDebug())
        {
            Logger.getRootLogger().setLevel(Level.DEBUG);
            logger.debug("Diagnostics level set to " + Level.DEBUG);
        }

        final com.edwardthomson.fanlog.logger.Logger log = LoggerSetup.createLogger(options);

        try
        {
            if (message.size() > 0)
            {
                log.log(options.getMessageLevel(), options.getOrigin(), "%s", String.join(" ", message));
            }
            else
            {
                final BufferedReader reader = new BufferedReader(new InputStreamReader(input, UTF8Utils.UTF8_CHARSET));

                String line;
                while ((line = reader.readLine()) != null)
                {
                    log.log(options.getMessageLevel(), options.getOrigin(), "%s", line);
                }
            }
        }
        catch (IOException e)
        {
            logger.error("Could not read standard input", e);
            return 1;
        }
        finally
        {
            log.destroy();
        }

        return 0;
    }

    /**
     * Configures log4j for fanlog's own diagnostics: console at WARN.
     */
    private static void configureDiagnostics()
    {
        BasicConfigurator.configure(new ConsoleAppender(new PatternLayout("%d{ISO8601} %-5p [%t] %c{1} - %m%n"),
            ConsoleAppender.SYSTEM_ERR));
        Logger.getRootLogger().setLevel(Level.WARN);
    }

    /**
     * Parses the command line into {@link #getOptions()} and
     * {@link #getMessage()}.
     */
    void parseOptions()
        throws OptionException
    {
        final GetOptions getOptions = new GetOptions(
            new Option("log-level", 'l', true, com.edwardthomson.fanlog.logger.Logger.DEFAULT_LEVEL.getName()),
            new Option("at", 'a', true, "info"),
            new Option("log-file", 'o', true, null),
            new Option("origin", (char) 0, true, Options.DEFAULT_ORIGIN),
            new Option("debug-marker", (char) 0),
            new Option("debug", 'd'));

        getOptions.parse(args);

        final Options ret = new Options();

        ret.setLogLevel(parseLevel(getOptions, "log-level"));
        ret.setMessageLevel(parseLevel(getOptions, "at"));

        if (getOptions.getArgument("log-file") != null)
        {
            try
            {
                ret.setLogFile(Paths.get(getOptions.getArgument("log-file")));
            }
            catch (InvalidPathException e)
            {
                throw new OptionException("Invalid log file '" + getOptions.getArgument("log-file") + "'");
            }
        }

        ret.setOrigin(getOptions.getArgument("origin"));
        ret.setDebugMarker(getOptions.isSet("debug-marker"));

        ret.setDiagnosticsDebug(getOptions.isSet("debug"));

        options = ret;
        message = getOptions.getFreeArguments();
    }

    private static LogLevel parseLevel(final GetOptions getOptions, final String option)
        throws OptionException
    {
        final LogLevel level = LogLevel.parse(getOptions.getArgument(option));

        if (!level.isValid())
        {
            throw new OptionException("Invalid level '" + getOptions.getArgument(option) + "' for --" + option);
        }

        return level;
    }

    public Options getOptions()
    {
        return options;
    }

    public List<String> getMessage()
    {
        return message;
    }
}
