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

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SetCookieParserTest
{
    @Test
    public void testParseCookie()
    {
        String value = "cookie2=val2; Expires=Thu, 01 Jan 1970 00:00:01 GMT; Path=/; Domain=.foo.com; HttpOnly; secure";
        List<Map<String, Object>> cookies = SetCookieParser.parse(value);
        assertThat(cookies, hasSize(1));
        Map<String, Object> cookie = cookies.get(0);
        assertThat(cookie.get("name"), is("cookie2"));
        assertThat(cookie.get("value"), is("val2"));
        assertThat(cookie.get("expires"), is(Instant.ofEpochSecond(1)));
        assertThat(cookie.get("path"), is("/"));
        assertThat(cookie.get("domain"), is(".foo.com"));
        assertThat(cookie.get("httponly"), is(true));
        assertThat(cookie.get("secure"), is(true));
    }

    @Test
    public void testParseDecodesNameAndValue()
    {
        Map<String, Object> cookie = SetCookieParser.parse("coo%40ki+e2=blah+val2%40").get(0);
        assertThat(cookie.get("name"), is("coo@ki e2"));
        assertThat(cookie.get("value"), is("blah val2@"));
    }

    @Test
    public void testAbsentFlags()
    {
        Map<String, Object> cookie = SetCookieParser.parse("cookie=val").get(0);
        assertThat(cookie.get("secure"), nullValue());
        assertThat(cookie.get("httponly"), nullValue());
        assertThat(cookie.containsKey("path"), is(false));
    }

    @Test
    public void testAttributes()
    {
        String value = "wd=deleted; max-Age=0; path=/a; domain=.domain.com; version=1; Comment=hello; CommentURL=http://c.com/; Port=\"80,8080\"; Discard; Unknown=x";
        Map<String, Object> cookie = SetCookieParser.parse(value).get(0);
        assertThat(cookie.get("max_age"), is(0L));
        assertThat(cookie.get("path"), is("/a"));
        assertThat(cookie.get("version"), is(1));
        assertThat(cookie.get("comment"), is("hello"));
        assertThat(cookie.get("comment_url"), is("http://c.com/"));
        assertThat(cookie.get("port"), is("\"80,8080\""));
        assertThat(cookie.get("discard"), is(true));
        assertThat(cookie.containsKey("unknown"), is(false));
    }

    @Test
    public void testMalformedNumbersAreIgnored()
    {
        Map<String, Object> cookie = SetCookieParser.parse("a=1; Max-Age=soon; Version=x").get(0);
        assertThat(cookie.get("name"), is("a"));
        assertThat(cookie.containsKey("max_age"), is(false));
        assertThat(cookie.containsKey("version"), is(false));
    }

    @Test
    public void testSeveralCookiesInOneString()
    {
        String value = "a=1; Expires=Thu, 01 Jan 1970 00:00:01 GMT; Path=/, b=2; HttpOnly";
        List<Map<String, Object>> cookies = SetCookieParser.parse(value);
        assertThat(cookies, hasSize(2));
        assertThat(cookies.get(0).get("name"), is("a"));
        assertThat(cookies.get(0).get("expires"), is(Instant.ofEpochSecond(1)));
        assertThat(cookies.get(0).get("path"), is("/"));
        assertThat(cookies.get(1).get("name"), is("b"));
        assertThat(cookies.get(1).get("httponly"), is(true));
    }

    @Test
    public void testCommaInValueDoesNotSplit()
    {
        List<Map<String, Object>> cookies = SetCookieParser.parse("list=a,b,c; Path=/");
        assertThat(cookies, hasSize(1));
        assertThat(cookies.get(0).get("value"), is("a,b,c"));
    }

    @Test
    public void testBadExpiresPropagates()
    {
        assertThrows(TimeParseException.class, () -> SetCookieParser.parse("a=1; Expires=whenever"));
    }

    @Test
    public void testMissingNameValue()
    {
        assertThrows(InvalidCookieException.class, () -> SetCookieParser.parse("justaname; Path=/"));
        assertThrows(InvalidCookieException.class, () -> SetCookieParser.parse("=value"));
        assertThrows(InvalidCookieException.class, () -> SetCookieParser.parse((String)null));
    }

    @Test
    public void testParseAllDeduplicates()
    {
        ParseResult<Map<String, Object>> result = SetCookieParser.parseAll(Arrays.asList("a=1; Path=/; Secure", "b=2; HttpOnly", "a=1; Path=/; Secure"));
        assertThat(result.isSuccess(), is(true));
        assertThat(result.getValues(), hasSize(2));
        assertThat(result.getValues().get(0).get("name"), is("a"));
        assertThat(result.getValues().get(0).get("secure"), is(true));
        assertThat(result.getValues().get(1).get("name"), is("b"));
        assertThat(result.getValues().get(1).get("httponly"), is(true));
    }

    @Test
    public void testParseAllIsAllOrNothing()
    {
        ParseResult<Map<String, Object>> result = SetCookieParser.parseAll(Arrays.asList("a=1", "b=2; Expires=never", "c=3"));
        assertThat(result.isFailure(), is(true));
        assertThat(result.getValues(), is(empty()));
        assertThat(result.getFailure(), instanceOf(TimeParseException.class));
    }

    @Test
    public void testParseAllEmpty()
    {
        ParseResult<Map<String, Object>> result = SetCookieParser.parseAll(Collections.emptyList());
        assertThat(result.isSuccess(), is(true));
        assertThat(result.getValues(), is(empty()));
    }
}
