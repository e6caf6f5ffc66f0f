/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal command-line parser: <code>--name value</code>, <code>-n value</code>,
 * <code>-nvalue</code>, flags, and <code>--</code> to end option parsing. The
 * last value given for an option wins.
 */
public class GetOptions
{
    private final Map<String, String> values = new HashMap<String, String>();
    private final List<String> freeArguments = new ArrayList<String>();

    private final Map<Character, Option> byShortName = new HashMap<Character, Option>();
    private final Map<String, Option> byLongName = new HashMap<String, Option>();

    public GetOptions(final Option... options)
    {
        for (Option option : options)
        {
            byLongName.put(option.longName, option);

            if (option.shortName != 0)
            {
                byShortName.put(option.shortName, option);
            }
        }
    }

    public void parse(final String[] args)
        throws OptionException
    {
        values.clear();
        freeArguments.clear();

        for (Option option : byLongName.values())
        {
            if (option.defaultValue != null)
            {
                values.put(option.longName, option.defaultValue);
            }
        }

        boolean doneWithOptions = false;

        for (int i = 0; i < args.length; i++)
        {
            final String arg = args[i];

            if (doneWithOptions || !arg.startsWith("-") || arg.equals("-"))
            {
                freeArguments.add(arg);
                continue;
            }

            if (arg.equals("--"))
            {
                doneWithOptions = true;
                continue;
            }

            final boolean isLong = arg.startsWith("--");
            final Option option = isLong ? byLongName.get(arg.substring(2)) : byShortName.get(arg.charAt(1));

            if (option == null)
            {
                throw new OptionException("The option '" + arg + "' is unknown");
            }

            /* Short options may carry their value: -lDEBUG */
            if (!isLong && arg.length() > 2)
            {
                if (!option.takesValue)
                {
                    throw new OptionException("The option '-" + option.shortName + "' does not take an argument");
                }

                values.put(option.longName, arg.substring(2));
            }
            else if (option.takesValue)
            {
                if (i + 1 >= args.length)
                {
                    throw new OptionException("The option '" + arg + "' expects an argument");
                }

                values.put(option.longName, args[++i]);
            }
            else
            {
                values.put(option.longName, "true");
            }
        }
    }

    /**
     * @return the value of the option, its default, or <code>null</code>
     */
    public String getArgument(final String longName)
    {
        return values.get(longName);
    }

    public boolean isSet(final String longName)
    {
        return values.containsKey(longName);
    }

    public List<String> getFreeArguments()
    {
        return freeArguments;
    }

    public static class Option
    {
        private final String longName;
        private final char shortName;
        private final boolean takesValue;
        private final String defaultValue;

        /**
         * A flag with no value.
         */
        public Option(final String longName, final char shortName)
        {
            this(longName, shortName, false, null);
        }

        public Option(final String longName, final char shortName, final boolean takesValue, final String defaultValue)
        {
            if (longName == null || longName.length() == 0)
            {
                throw new IllegalArgumentException("longName must not be empty");
            }

            this.longName = longName;
            this.shortName = shortName;
            this.takesValue = takesValue;
            this.defaultValue = defaultValue;
        }

        @Override
        public String toString()
        {
            return "--" + longName;
        }
    }

    public static class OptionException
        extends Exception
    {
        private static final long serialVersionUID = 7102418651356128203L;

        public OptionException(String message)
        {
            super(message);
        }
    }
}
