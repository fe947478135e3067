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

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CookieJarParserTest
{
    private static final String JAR = "# Netscape HTTP Cookie File\n" +
        "# comment, should be ignored\n" +
        ".domain.com\tTRUE\t/path\tTRUE\tTue, 02 Oct 2012 19:25:57 GMT\tfirst_name\tfirst_value\n" +
        "\n" +
        "   \n" +
        "# ignored again\n" +
        "another-domain.com\tFALSE\t/\tFALSE\tsecond_name\tsecond_value\n" +
        "\n" +
        "# with expiry date as seconds since epoch\n" +
        ".blah-domain\tTRUE\t/\tFALSE\t1596981560\tNAME\tOP5jTLV6VhYHADJAbJ1ZR@L8~081210\n";

    @Test
    public void testParseFile(@TempDir Path dir) throws IOException
    {
        Path jar = dir.resolve("cookies.jar");
        Files.write(jar, JAR.getBytes(StandardCharsets.UTF_8));

        List<Map<String, Object>> cookies = CookieJarParser.parse(jar);
        assertThat(cookies, hasSize(3));

        Map<String, Object> first = cookies.get(0);
        assertThat(first.get("name"), is("first_name"));
        assertThat(first.get("value"), is("first_value"));
        assertThat(first.get("domain"), is(".domain.com"));
        assertThat(first.get("path"), is("/path"));
        assertThat(first.get("secure"), is(true));
        assertThat(first.get("expires"), is(Instant.parse("2012-10-02T19:25:57Z")));

        Map<String, Object> second = cookies.get(1);
        assertThat(second.get("name"), is("second_name"));
        assertThat(second.get("value"), is("second_value"));
        assertThat(second.get("domain"), is("another-domain.com"));
        assertThat(second.get("path"), is("/"));
        assertThat(second.get("secure"), is(false));
        assertThat(second.get("expires"), nullValue());

        Map<String, Object> third = cookies.get(2);
        assertThat(third.get("name"), is("NAME"));
        assertThat(third.get("value"), is("OP5jTLV6VhYHADJAbJ1ZR@L8~081210"));
        assertThat(third.get("domain"), is(".blah-domain"));
        assertThat(third.get("secure"), is(false));
        assertThat(third.get("expires"), is(Instant.ofEpochSecond(1596981560L)));
    }

    @Test
    public void testMissingFile(@TempDir Path dir)
    {
        assertThrows(IOException.class, () -> CookieJarParser.parse(dir.resolve("missing.jar")));
    }

    @Test
    public void testCommentsAndBlankLines()
    {
        assertThat(CookieJarParser.parseLine(""), nullValue());
        assertThat(CookieJarParser.parseLine(" \t "), nullValue());
        assertThat(CookieJarParser.parseLine("#.domain.com\tTRUE\t/\tFALSE\t1596981560\tNAME\tvalue"), nullValue());
        assertThat(CookieJarParser.parseLine("  # indented comment"), nullValue());
    }

    @Test
    public void testTooFewFields()
    {
        assertThat(CookieJarParser.parseLine(".domain.com\tTRUE\t/\tFALSE\tNAME"), nullValue());
        assertThat(CookieJarParser.parseLine("garbage"), nullValue());
    }

    @Test
    public void testUnparseableExpiryShiftsFields()
    {
        Map<String, Object> cookie = CookieJarParser.parseLine(".domain.com\tTRUE\t/\tFALSE\tnot-a-date\tNAME\tVALUE");
        assertThat(cookie.get("name"), is("not-a-date"));
        assertThat(cookie.get("value"), is("NAME"));
        assertThat(cookie.get("expires"), nullValue());
    }

    @Test
    public void testSixFieldsHaveNoExpiry()
    {
        Map<String, Object> cookie = CookieJarParser.parseLine("example.com\tFALSE\t/\tFALSE\t12345\tvalue");
        assertThat(cookie.get("name"), is("12345"));
        assertThat(cookie.get("value"), is("value"));
        assertThat(cookie.get("expires"), nullValue());
    }

    @Test
    public void testEmptyValue()
    {
        Map<String, Object> cookie = CookieJarParser.parseLine("example.com\tFALSE\t/\tTRUE\t1596981560\tNAME\t");
        assertThat(cookie.get("name"), is("NAME"));
        assertThat(cookie.get("value"), is(""));
        assertThat(cookie.get("secure"), is(true));
    }

    @Test
    public void testSecureFlagIsCaseSensitive()
    {
        Map<String, Object> cookie = CookieJarParser.parseLine("example.com\tFALSE\t/\ttrue\t1596981560\tNAME\tVALUE");
        assertThat(cookie.get("secure"), is(false));
    }

    @Test
    public void testParseReaderKeepsOrder() throws IOException
    {
        String jar = "b.com\tFALSE\t/\tFALSE\tb\t2\r\n" +
            "a.com\tFALSE\t/\tFALSE\ta\t1\r\n";
        List<Map<String, Object>> cookies = CookieJarParser.parse(new StringReader(jar));
        assertThat(cookies, hasSize(2));
        assertThat(cookies.get(0).get("name"), is("b"));
        assertThat(cookies.get(0).get("value"), is("2"));
        assertThat(cookies.get(1).get("name"), is("a"));
    }
}
