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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <p>The parts of a request an element fills in when it is submitted.</p>
 * <p>Parameters go to the query string or body, cookies to the {@code Cookie}
 * header and headers as they are.</p>
 */
public class RequestOptions
{
    private final Map<String, String> _parameters = new LinkedHashMap<>();
    private final Map<String, String> _cookies = new LinkedHashMap<>();
    private final Map<String, String> _headers = new LinkedHashMap<>();

    public Map<String, String> getParameters()
    {
        return Collections.unmodifiableMap(_parameters);
    }

    public RequestOptions parameters(Map<String, String> parameters)
    {
        _parameters.clear();
        _parameters.putAll(parameters);
        return this;
    }

    public Map<String, String> getCookies()
    {
        return Collections.unmodifiableMap(_cookies);
    }

    public RequestOptions cookies(Map<String, String> cookies)
    {
        _cookies.clear();
        _cookies.putAll(cookies);
        return this;
    }

    public Map<String, String> getHeaders()
    {
        return Collections.unmodifiableMap(_headers);
    }

    public RequestOptions header(String name, String value)
    {
        _headers.put(name, value);
        return this;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{parameters=%s,cookies=%s,headers=%s}", getClass().getSimpleName(), hashCode(), _parameters, _cookies, _headers);
    }
}
