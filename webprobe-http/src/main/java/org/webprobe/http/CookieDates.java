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

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * <p>Reads cookie expiry times.</p>
 * <p>An expiry is either a positive number of seconds since the epoch, as
 * found in Netscape cookie jars, or an HTTP style date as found in
 * {@code Expires} attributes. Dates are matched against a list of receive
 * formats, tried in order, after any leading day of week has been dropped.
 * Dates without a zone are taken as GMT.</p>
 */
public class CookieDates
{
    private static final Pattern WEEKDAY = Pattern.compile("^(?:mon|tue|wed|thu|fri|sat|sun)[a-z]*,?\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final String[] __dateReceiveFmt =
        {
            "d MMM yyyy HH:mm:ss zzz",
            "d MMM yyyy HH:mm:ss Z",
            "d MMM yyyy HH:mm:ss",
            "d-MMM-yyyy HH:mm:ss zzz",
            "d-MMM-yyyy HH:mm:ss",
            "MMM d HH:mm:ss yyyy",
            "MMM d HH:mm:ss yyyy zzz",
            "MMM d yyyy HH:mm:ss zzz",
            "MMM d yyyy HH:mm:ss",
            "MMM-d-yyyy HH:mm:ss zzz",
            "MMM-d-yyyy HH:mm:ss",
            "yyyy-MM-dd HH:mm:ss zzz",
            "yyyy-MM-dd HH:mm:ss"
        };

    private static final List<DateTimeFormatter> __dateReceive = new ArrayList<>();
    private static final DateTimeFormatter __dateSend = DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US).withZone(ZoneOffset.UTC);

    static
    {
        for (String pattern : __dateReceiveFmt)
        {
            __dateReceive.add(newFormatter(newBuilder().appendPattern(pattern)));
        }
        // RFC 850 two digit years
        __dateReceive.add(newFormatter(newBuilder()
            .appendPattern("d-MMM-")
            .appendValueReduced(ChronoField.YEAR, 2, 2, 1970)
            .appendPattern(" HH:mm:ss zzz")));
        __dateReceive.add(newFormatter(newBuilder()
            .appendPattern("d-MMM-")
            .appendValueReduced(ChronoField.YEAR, 2, 2, 1970)
            .appendPattern(" HH:mm:ss")));
        __dateReceive.add(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        __dateReceive.add(DateTimeFormatter.ISO_LOCAL_DATE_TIME.withZone(ZoneOffset.UTC));
    }

    private CookieDates()
    {
    }

    private static DateTimeFormatterBuilder newBuilder()
    {
        return new DateTimeFormatterBuilder().parseCaseInsensitive();
    }

    private static DateTimeFormatter newFormatter(DateTimeFormatterBuilder builder)
    {
        return builder.toFormatter(Locale.US).withZone(ZoneOffset.UTC);
    }

    /**
     * @param expires the expiry as text, either epoch seconds or an HTTP date
     * @return the absolute expiry time
     * @throws TimeParseException if the text is neither
     */
    public static Instant parse(String expires) throws TimeParseException
    {
        if (expires == null)
            throw new TimeParseException(null);

        String text = expires.trim();
        if (isDigits(text))
        {
            try
            {
                long seconds = Long.parseLong(text);
                if (seconds > 0)
                    return Instant.ofEpochSecond(seconds);
            }
            catch (NumberFormatException | DateTimeException x)
            {
                throw new TimeParseException(expires);
            }
        }

        Instant instant = parseDate(text);
        if (instant == null)
            throw new TimeParseException(expires);
        return instant;
    }

    /**
     * @param seconds seconds since the epoch
     * @return the absolute expiry time
     * @throws TimeParseException if the value is not positive
     */
    public static Instant parse(long seconds) throws TimeParseException
    {
        if (seconds <= 0)
            throw new TimeParseException(Long.toString(seconds));
        return Instant.ofEpochSecond(seconds);
    }

    /**
     * @param instant the time to format
     * @return the time formatted as used in {@code Expires} attributes
     */
    public static String format(Instant instant)
    {
        return __dateSend.format(instant);
    }

    private static Instant parseDate(String text)
    {
        String value = WHITESPACE.matcher(text).replaceAll(" ");
        value = WEEKDAY.matcher(value).replaceFirst("");

        Instant instant = tryFormats(value);
        if (instant == null && value.endsWith(" GMT"))
            instant = tryFormats(value.substring(0, value.length() - 4));
        return instant;
    }

    private static Instant tryFormats(String value)
    {
        for (DateTimeFormatter formatter : __dateReceive)
        {
            try
            {
                return Instant.from(formatter.parse(value));
            }
            catch (DateTimeException x)
            {
                // try the next format
            }
        }
        return null;
    }

    private static boolean isDigits(String text)
    {
        if (text.isEmpty())
            return false;
        for (int i = 0; i < text.length(); i++)
        {
            char c = text.charAt(i);
            if (c < '0' || c > '9')
                return false;
        }
        return true;
    }
}
