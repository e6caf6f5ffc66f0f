/*
 * Fanlog: an embeddable leveled logging core.
 * 
 * Copyright (c) Microsoft Corporation. All rights reserved.
 */

package com.edwardthomson.fanlog;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

public class UTF8Utils
{
    public static final Charset UTF8_CHARSET = StandardCharsets.UTF_8;

    public static final byte[] EMPTY = new byte[0];

    public static String decode(byte[] bytes)
    {
        return new String(bytes, UTF8_CHARSET);
    }

    public static String decode(byte[] bytes, int offset, int length)
    {
        return new String(bytes, offset, length, UTF8_CHARSET);
    }

    /**
     * @return the encoded string, or an empty array for <code>null</code> or
     *         the empty string
     */
    public static byte[] encode(String string)
    {
        if (string == null || string.length() == 0)
        {
            return EMPTY;
        }

        return string.getBytes(UTF8_CHARSET);
    }
}
