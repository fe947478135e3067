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
 * The component auditing a page, as seen by the elements of that page.
 */
public interface Auditor
{
    /**
     * @return the page under audit
     */
    Page getPage();

    /**
     * Reports an informational message to the user.
     *
     * @param message the message
     */
    void printInfo(String message);
}
