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

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class CookieAttributeTest
{
    @Test
    public void testDefaults()
    {
        Map<String, Object> defaults = CookieAttribute.defaults();
        assertThat(defaults.keySet(), contains("name", "value", "version", "port", "discard", "comment_url",
            "expires", "max_age", "comment", "secure", "path", "domain", "httponly"));
        assertThat(defaults.get("version"), is(0));
        assertThat(defaults.get("httponly"), is(false));
        assertThat(defaults.get("secure"), nullValue());

        defaults.put("version", 1);
        assertThat(CookieAttribute.defaults().get("version"), is(0));
    }

    @Test
    public void testForKey()
    {
        assertThat(CookieAttribute.forKey("max_age"), is(CookieAttribute.MAX_AGE));
        assertThat(CookieAttribute.forKey("httponly"), is(CookieAttribute.HTTP_ONLY));
        assertThat(CookieAttribute.forKey(null), nullValue());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Max-Age", "HttpOnly", "NAME", "session", ""})
    public void testNotAnAttribute(String key)
    {
        assertThat(CookieAttribute.isAttribute(key), is(false));
    }
}
