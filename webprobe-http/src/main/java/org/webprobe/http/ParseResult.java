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

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * <p>The outcome of parsing a batch of cookies.</p>
 * <p>A successful result holds the parsed values, possibly none; a failed
 * result holds the failure and no values. This lets callers tell a source
 * that genuinely carries no cookies from one that could not be parsed.</p>
 *
 * @param <T> the type of the parsed values
 */
public final class ParseResult<T>
{
    private final List<T> _values;
    private final RuntimeException _failure;

    private ParseResult(List<T> values, RuntimeException failure)
    {
        _values = values;
        _failure = failure;
    }

    public static <T> ParseResult<T> success(List<T> values)
    {
        return new ParseResult<>(List.copyOf(values), null);
    }

    public static <T> ParseResult<T> empty()
    {
        return new ParseResult<>(Collections.emptyList(), null);
    }

    public static <T> ParseResult<T> failure(RuntimeException failure)
    {
        return new ParseResult<>(Collections.emptyList(), Objects.requireNonNull(failure));
    }

    public boolean isSuccess()
    {
        return _failure == null;
    }

    public boolean isFailure()
    {
        return _failure != null;
    }

    /**
     * @return the parsed values, empty if parsing failed
     */
    public List<T> getValues()
    {
        return _values;
    }

    /**
     * @return the failure, or null if parsing succeeded
     */
    public RuntimeException getFailure()
    {
        return _failure;
    }

    /**
     * @param mapper the conversion applied to each value
     * @param <R> the type of the converted values
     * @return a result holding the converted values, or the same failure
     */
    public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper)
    {
        if (isFailure())
            return failure(_failure);
        try
        {
            return success(_values.stream().map(mapper).collect(Collectors.toList()));
        }
        catch (RuntimeException x)
        {
            return failure(x);
        }
    }

    @Override
    public String toString()
    {
        if (isFailure())
            return String.format("%s@%x{failure=%s}", getClass().getSimpleName(), hashCode(), _failure);
        return String.format("%s@%x{values=%d}", getClass().getSimpleName(), hashCode(), _values.size());
    }
}
