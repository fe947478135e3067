//
// ========================================================================
// Copyright (c) 1995 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.webprobe.http;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * <p>Encoding of cookie names and values for the {@code Cookie} request header.</p>
 * <p>Only the characters that would break the {@code name=value; ...} syntax are
 * escaped: {@code + ; % =} and NUL are percent encoded and spaces become {@code +}.
 * Decoding reverses this, turning {@code +} into a space before any percent
 * escape is resolved.</p>
 */
public class CookieCodec
{
    private static final String RESERVED = "+;%=\0";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private CookieCodec()
    {
    }

    /**
     * @param str the raw string, may be null
     * @return the string escaped for use as a cookie name or value, empty for null
     */
    public static String encode(String str)
    {
        if (str == null)
            return "";

        StringBuilder builder = null;
        for (int i = 0; i < str.length(); i++)
        {
            char c = str.charAt(i);
            if (RESERVED.indexOf(c) >= 0)
            {
                if (builder == null)
                {
                    builder = new StringBuilder(str.length() + 8);
                    builder.append(str, 0, i);
                }
                builder.append('%').append(HEX[(c >> 4) & 0xF]).append(HEX[c & 0xF]);
            }
            else if (c == ' ')
            {
                if (builder == null)
                {
                    builder = new StringBuilder(str.length() + 8);
                    builder.append(str, 0, i);
                }
                builder.append('+');
            }
            else if (builder != null)
            {
                builder.append(c);
            }
        }
        return builder == null ? str : builder.toString();
    }

    /**
     * <p>Decodes a cookie name or value.</p>
     * <p>Percent escapes are collected as UTF-8 bytes; an escape that is not
     * followed by two hex digits is kept literally.</p>
     *
     * @param str the encoded string, may be null
     * @return the decoded string, or null for null
     */
    public static String decode(String str)
    {
        if (str == null)
            return null;
        if (str.indexOf('+') < 0 && str.indexOf('%') < 0)
            return str;

        StringBuilder builder = new StringBuilder(str.length());
        ByteArrayOutputStream bytes = null;
        int length = str.length();
        for (int i = 0; i < length; i++)
        {
            char c = str.charAt(i);
            if (c == '%' && i + 2 < length)
            {
                int hi = hexValue(str.charAt(i + 1));
                int lo = hexValue(str.charAt(i + 2));
                if (hi >= 0 && lo >= 0)
                {
                    if (bytes == null)
                        bytes = new ByteArrayOutputStream();
                    bytes.write((hi << 4) + lo);
                    i += 2;
                    continue;
                }
            }

            if (bytes != null && bytes.size() > 0)
            {
                builder.append(new String(bytes.toByteArray(), StandardCharsets.UTF_8));
                bytes.reset();
            }
            builder.append(c == '+' ? ' ' : c);
        }

        if (bytes != null && bytes.size() > 0)
            builder.append(new String(bytes.toByteArray(), StandardCharsets.UTF_8));
        return builder.toString();
    }

    /**
     * @param name the cookie name
     * @param value the cookie value
     * @return the {@code name=value} pair as sent in a {@code Cookie} request header
     */
    public static String toWireString(String name, String value)
    {
        return encode(name) + "=" + encode(value);
    }

    private static int hexValue(char c)
    {
        if (c >= '0' && c <= '9')
            return c - '0';
        if (c >= 'a' && c <= 'f')
            return c - 'a' + 10;
        if (c >= 'A' && c <= 'F')
            return c - 'A' + 10;
        return -1;
    }
}
