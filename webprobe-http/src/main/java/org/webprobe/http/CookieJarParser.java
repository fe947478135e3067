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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Parser for Netscape HTTP cookie jar files.</p>
 * <p>Each non blank line that does not start with {@code #} holds the tab
 * separated fields {@code domain, include-subdomains, path, secure, expires,
 * name, value}. The expiry column is optional: when it is missing, or does
 * not hold a time, the fields after {@code secure} are read as
 * {@code name, value} instead.</p>
 * <p>Each parsed line yields a raw attribute map keyed by
 * {@link CookieAttribute#key()}; the include-subdomains flag is not kept.</p>
 */
public class CookieJarParser
{
    private static final Logger LOG = LoggerFactory.getLogger(CookieJarParser.class);

    private static final int FIELDS_WITH_EXPIRY = 7;
    private static final int FIELDS_WITHOUT_EXPIRY = 6;
    private static final Pattern TRAILING_SPACE = Pattern.compile("[ \\r\\n]+$");

    private CookieJarParser()
    {
    }

    /**
     * @param file the cookie jar file, read as UTF-8
     * @return the raw attribute maps of the cookies in file order
     * @throws IOException if the file cannot be read
     */
    public static List<Map<String, Object>> parse(Path file) throws IOException
    {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8))
        {
            return parse(reader);
        }
    }

    /**
     * @param reader the cookie jar content, not closed by this method
     * @return the raw attribute maps of the cookies in line order
     * @throws IOException if the content cannot be read
     */
    public static List<Map<String, Object>> parse(Reader reader) throws IOException
    {
        BufferedReader lines = reader instanceof BufferedReader ? (BufferedReader)reader : new BufferedReader(reader);
        List<Map<String, Object>> cookies = new ArrayList<>();
        String line;
        int number = 0;
        while ((line = lines.readLine()) != null)
        {
            number++;
            Map<String, Object> cookie = parseLine(line);
            if (cookie != null)
                cookies.add(cookie);
            else if (LOG.isDebugEnabled())
                LOG.debug("Skipped cookie jar line {}", number);
        }
        return cookies;
    }

    /**
     * @param line one line of a cookie jar
     * @return the raw attribute map of the cookie on the line, or null if the
     * line is blank, a comment, or has too few fields
     */
    public static Map<String, Object> parseLine(String line)
    {
        if (line == null)
            return null;
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.charAt(0) == '#')
            return null;

        // trailing tabs delimit an empty value
        String[] fields = TRAILING_SPACE.matcher(line.stripLeading()).replaceFirst("").split("\t", -1);
        if (fields.length < FIELDS_WITHOUT_EXPIRY)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Too few fields ({}) in cookie jar line: {}", fields.length, trimmed);
            return null;
        }

        String domain = fields[0];
        String path = fields[2];
        String secure = fields[3];
        String expires = fields[4];
        String name = fields[5];
        String value = fields.length >= FIELDS_WITH_EXPIRY ? fields[6] : null;

        Object expiry = null;
        if (fields.length >= FIELDS_WITH_EXPIRY)
        {
            try
            {
                expiry = CookieDates.parse(expires);
            }
            catch (TimeParseException x)
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("No expiry in cookie jar line, shifting fields: {}", x.getMessage());
                value = name;
                name = expires;
            }
        }
        else
        {
            // no expiry column
            value = name;
            name = expires;
        }

        Map<String, Object> cookie = new LinkedHashMap<>();
        cookie.put(CookieAttribute.DOMAIN.key(), domain);
        cookie.put(CookieAttribute.PATH.key(), path);
        cookie.put(CookieAttribute.SECURE.key(), "TRUE".equals(secure));
        cookie.put(CookieAttribute.EXPIRES.key(), expiry);
        cookie.put(CookieAttribute.NAME.key(), name);
        cookie.put(CookieAttribute.VALUE.key(), value);
        return cookie;
    }
}
