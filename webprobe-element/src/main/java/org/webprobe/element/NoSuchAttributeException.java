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

/**
 * Thrown when an attribute that cookies do not have is looked up.
 */
public class NoSuchAttributeException extends IllegalArgumentException
{
    private final String _attribute;

    public NoSuchAttributeException(String attribute)
    {
        super("No such cookie attribute: " + attribute);
        _attribute = attribute;
    }

    public String getAttribute()
    {
        return _attribute;
    }
}
