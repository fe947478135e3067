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

package org.webprobe.element;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.webprobe.http.CookieJarParser;
import org.webprobe.http.ParseResult;
import org.webprobe.http.SetCookieParser;

/**
 * <p>Extracts {@link Cookie}s from cookie jars, {@code Set-Cookie} headers,
 * {@code <meta http-equiv="Set-Cookie">} tags and whole responses.</p>
 * <p>Apart from {@link #fromFile(String, Path)} and
 * {@link #fromSetCookie(String, String)}, extraction never fails: input that
 * cannot be parsed yields no cookies.</p>
 */
public class Cookies
{
    private static final Logger LOG = LoggerFactory.getLogger(Cookies.class);

    private static final String SET_COOKIE = "Set-Cookie";
    private static final Pattern HEAD = Pattern.compile("<head(.*)</head>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private Cookies()
    {
    }

    /**
     * @param url the owner URL of the cookies
     * @param file a Netscape format cookie jar
     * @return the cookies in the jar, in file order
     * @throws IOException if the jar cannot be read
     */
    public static List<Cookie> fromFile(String url, Path file) throws IOException
    {
        List<Cookie> cookies = new ArrayList<>();
        for (Map<String, Object> raw : CookieJarParser.parse(file))
        {
            cookies.add(new Cookie(url, raw));
        }
        return cookies;
    }

    /**
     * @param url the owner URL of the cookies
     * @param setCookie one {@code Set-Cookie} string, possibly holding several cookies
     * @return the cookies in the string
     * @throws IllegalArgumentException if the string cannot be parsed
     */
    public static List<Cookie> fromSetCookie(String url, String setCookie)
    {
        List<Cookie> cookies = new ArrayList<>();
        for (Map<String, Object> raw : SetCookieParser.parse(setCookie))
        {
            cookies.add(Cookie.fromDecoded(url, raw));
        }
        return cookies;
    }

    /**
     * @param url the owner URL of the cookies
     * @param headers response headers, each value a {@code String} or a collection of them
     * @return the cookies of the {@code Set-Cookie} headers, or the parse failure
     */
    public static ParseResult<Cookie> parseHeaders(String url, Map<String, ?> headers)
    {
        if (headers == null)
            return ParseResult.empty();

        List<String> setCookies = new ArrayList<>();
        for (Map.Entry<String, ?> entry : headers.entrySet())
        {
            if (!SET_COOKIE.equalsIgnoreCase(entry.getKey()))
                continue;
            Object value = entry.getValue();
            if (value instanceof Collection)
            {
                for (Object setCookie : (Collection<?>)value)
                {
                    if (setCookie != null)
                        setCookies.add(setCookie.toString());
                }
            }
            else if (value != null)
            {
                setCookies.add(value.toString());
            }
        }

        if (setCookies.isEmpty())
            return ParseResult.empty();
        return SetCookieParser.parseAll(setCookies).map(raw -> Cookie.fromDecoded(url, raw));
    }

    /**
     * @param url the owner URL of the cookies
     * @param headers response headers, each value a {@code String} or a collection of them
     * @return the cookies of the {@code Set-Cookie} headers, empty if any cannot be parsed
     */
    public static List<Cookie> fromHeaders(String url, Map<String, ?> headers)
    {
        ParseResult<Cookie> result = parseHeaders(url, headers);
        if (result.isFailure() && LOG.isDebugEnabled())
            LOG.debug("No cookies from headers of {}", url, result.getFailure());
        return result.getValues();
    }

    /**
     * <p>Extracts the cookies set by {@code <meta http-equiv="Set-Cookie">}
     * tags.</p>
     * <p>The HTML is only parsed if it has a {@code <head>} section that
     * mentions {@code set-cookie}.</p>
     *
     * @param url the owner URL of the cookies
     * @param html the document source
     * @return the cookies, empty if the document has none or they cannot be parsed
     */
    public static List<Cookie> fromDocument(String url, String html)
    {
        if (html == null)
            return Collections.emptyList();

        Matcher head = HEAD.matcher(html);
        if (!head.find() || !head.group(1).toLowerCase(Locale.ENGLISH).contains("set-cookie"))
            return Collections.emptyList();

        return fromDocument(url, Jsoup.parse(head.group(), url));
    }

    /**
     * @param url the owner URL of the cookies
     * @param document a parsed document
     * @return the cookies of its {@code <meta http-equiv="Set-Cookie">} tags, empty if they cannot be parsed
     */
    public static List<Cookie> fromDocument(String url, Document document)
    {
        List<Cookie> cookies = new ArrayList<>();
        try
        {
            for (org.jsoup.nodes.Element meta : document.select("meta[http-equiv]"))
            {
                if (SET_COOKIE.equalsIgnoreCase(meta.attr("http-equiv")))
                    cookies.addAll(fromSetCookie(url, meta.attr("content")));
            }
        }
        catch (RuntimeException x)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("No cookies from document of {}", url, x);
            return Collections.emptyList();
        }
        return cookies;
    }

    /**
     * @param response the response
     * @return the cookies of the response body followed by those of its headers, without duplicates
     */
    public static List<Cookie> fromResponse(HttpResponse response)
    {
        String url = response.getEffectiveUrl();
        Set<Cookie> cookies = new LinkedHashSet<>(fromDocument(url, response.getBody()));
        cookies.addAll(fromHeaders(url, response.getHeaders()));
        return new ArrayList<>(cookies);
    }
}
