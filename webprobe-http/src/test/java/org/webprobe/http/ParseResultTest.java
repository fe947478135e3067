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

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

public class ParseResultTest
{
    @Test
    public void testSuccess()
    {
        ParseResult<String> result = ParseResult.success(List.of("a", "b"));
        assertThat(result.isSuccess(), is(true));
        assertThat(result.isFailure(), is(false));
        assertThat(result.getValues(), is(List.of("a", "b")));
        assertThat(result.getFailure(), nullValue());
    }

    @Test
    public void testEmptyIsSuccess()
    {
        ParseResult<String> result = ParseResult.empty();
        assertThat(result.isSuccess(), is(true));
        assertThat(result.getValues(), is(empty()));
    }

    @Test
    public void testFailure()
    {
        InvalidCookieException failure = new InvalidCookieException("bad");
        ParseResult<String> result = ParseResult.failure(failure);
        assertThat(result.isFailure(), is(true));
        assertThat(result.getValues(), is(empty()));
        assertThat(result.getFailure(), sameInstance(failure));
        assertThat(result.map(String::length).getFailure(), sameInstance(failure));
    }

    @Test
    public void testMap()
    {
        ParseResult<Integer> lengths = ParseResult.success(List.of("a", "bcd")).map(String::length);
        assertThat(lengths.getValues(), is(List.of(1, 3)));
    }

    @Test
    public void testMapFailure()
    {
        ParseResult<Integer> result = ParseResult.success(List.of("1", "x")).map(Integer::parseInt);
        assertThat(result.isFailure(), is(true));
        assertThat(result.getFailure(), instanceOf(NumberFormatException.class));
    }
}
