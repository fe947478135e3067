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

/**
 * <p>Thrown when a cookie expiry can be read neither as seconds since the
 * epoch nor as an HTTP date.</p>
 */
public class TimeParseException extends IllegalArgumentException
{
    private final String _input;

    public TimeParseException(String input)
    {
        super("Unparseable time: " + input);
        _input = input;
    }

    /**
     * @return the text that could not be parsed
     */
    public String getInput()
    {
        return _input;
    }
}
