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
 * The kinds of page element a scanner can audit.
 */
public enum ElementType
{
    LINK("link"),
    FORM("form"),
    COOKIE("cookie");

    private final String _label;

    ElementType(String label)
    {
        _label = label;
    }

    public String label()
    {
        return _label;
    }

    @Override
    public String toString()
    {
        return _label;
    }
}
