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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Parser for {@code Set-Cookie} strings, as found in response headers and
 * in {@code <meta http-equiv="Set-Cookie">} tags.</p>
 * <p>A single string may carry several cookies separated by commas; a comma
 * only separates cookies when it is followed by a {@code name=} token, so the
 * commas inside {@code Expires} dates are left alone.</p>
 * <p>Each cookie yields a raw attribute map keyed by {@link CookieAttribute#key()}.
 * The name and value are decoded with {@link CookieCodec#decode(String)}.</p>
 */
public class SetCookieParser
{
    private static final Logger LOG = LoggerFactory.getLogger(SetCookieParser.class);

    private static final Pattern COOKIE_SEPARATOR = Pattern.compile(",(?=[^;,]*=)|,$");

    private SetCookieParser()
    {
    }

    /**
     * @param headerValue one {@code Set-Cookie} string
     * @return the raw attribute maps of the cookies in the string
     * @throws InvalidCookieException if a cookie has no {@code name=value} pair
     * @throws TimeParseException if an {@code Expires} attribute cannot be parsed
     */
    public static List<Map<String, Object>> parse(String headerValue)
    {
        if (headerValue == null)
            throw new InvalidCookieException("No Set-Cookie string");

        List<Map<String, Object>> cookies = new ArrayList<>();
        for (String cookieString : COOKIE_SEPARATOR.split(headerValue))
        {
            if (cookieString.isBlank())
                continue;
            cookies.add(parseCookie(cookieString));
        }
        return cookies;
    }

    /**
     * <p>Parses several {@code Set-Cookie} strings.</p>
     * <p>Identical strings are parsed once. Parsing is all or nothing: if any
     * string fails, the result is a failure holding that string's exception
     * and none of the cookies parsed from the other strings.</p>
     *
     * @param headerValues the {@code Set-Cookie} strings
     * @return the raw attribute maps of all cookies, in order, or the failure
     */
    public static ParseResult<Map<String, Object>> parseAll(Collection<String> headerValues)
    {
        Set<String> unique = new LinkedHashSet<>();
        for (String headerValue : headerValues)
        {
            if (headerValue != null)
                unique.add(headerValue);
        }

        List<Map<String, Object>> cookies = new ArrayList<>();
        for (String headerValue : unique)
        {
            try
            {
                cookies.addAll(parse(headerValue));
            }
            catch (IllegalArgumentException x)
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("Unable to parse Set-Cookie string {}", headerValue, x);
                return ParseResult.failure(x);
            }
        }
        return ParseResult.success(cookies);
    }

    private static Map<String, Object> parseCookie(String cookieString)
    {
        String[] cookieParts = cookieString.split(";");

        String nameValue = cookieParts[0];
        int equal = nameValue.indexOf('=');
        if (equal < 0)
            throw new InvalidCookieException("No name=value pair in cookie: " + cookieString);
        String name = nameValue.substring(0, equal).trim();
        if (name.isEmpty())
            throw new InvalidCookieException("Empty name in cookie: " + cookieString);
        String value = nameValue.substring(equal + 1).trim();

        Map<String, Object> cookie = new LinkedHashMap<>();
        cookie.put(CookieAttribute.NAME.key(), CookieCodec.decode(name));
        cookie.put(CookieAttribute.VALUE.key(), CookieCodec.decode(value));

        for (int i = 1; i < cookieParts.length; ++i)
        {
            String[] attributeParts = cookieParts[i].split("=", 2);
            String attributeName = attributeParts[0].trim().toLowerCase(Locale.ENGLISH);
            String attributeValue = attributeParts.length < 2 ? "" : attributeParts[1].trim();
            try
            {
                switch (attributeName)
                {
                    case "domain":
                        cookie.put(CookieAttribute.DOMAIN.key(), attributeValue);
                        break;
                    case "path":
                        cookie.put(CookieAttribute.PATH.key(), attributeValue);
                        break;
                    case "expires":
                        cookie.put(CookieAttribute.EXPIRES.key(), CookieDates.parse(attributeValue));
                        break;
                    case "max-age":
                        cookie.put(CookieAttribute.MAX_AGE.key(), Long.parseLong(attributeValue));
                        break;
                    case "version":
                        cookie.put(CookieAttribute.VERSION.key(), Integer.parseInt(attributeValue));
                        break;
                    case "comment":
                        cookie.put(CookieAttribute.COMMENT.key(), attributeValue);
                        break;
                    case "commenturl":
                        cookie.put(CookieAttribute.COMMENT_URL.key(), attributeValue);
                        break;
                    case "port":
                        cookie.put(CookieAttribute.PORT.key(), attributeValue);
                        break;
                    case "secure":
                        cookie.put(CookieAttribute.SECURE.key(), Boolean.TRUE);
                        break;
                    case "httponly":
                        cookie.put(CookieAttribute.HTTP_ONLY.key(), Boolean.TRUE);
                        break;
                    case "discard":
                        cookie.put(CookieAttribute.DISCARD.key(), Boolean.TRUE);
                        break;
                    default:
                        if (LOG.isDebugEnabled())
                            LOG.debug("Ignored cookie attribute {} in {}", attributeName, cookieString);
                        break;
                }
            }
            catch (NumberFormatException x)
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("Ignored malformed {} attribute in {}", attributeName, cookieString);
            }
        }
        return cookie;
    }
}
