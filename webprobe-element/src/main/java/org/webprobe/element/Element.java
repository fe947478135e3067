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

import java.util.Map;

/**
 * <p>An input-carrying element of a web page that a scanner can fuzz and submit.</p>
 * <p>Elements are not thread safe. Every element returned by {@link #copy()}
 * is fully independent of its source, so copies can be submitted
 * concurrently.</p>
 */
public interface Element
{
    ElementType getType();

    /**
     * @return the URL of the page the element belongs to
     */
    String getUrl();

    /**
     * @return the URL the element is submitted to
     */
    String getAction();

    /**
     * @return the HTTP method used to submit the element
     */
    String getMethod();

    /**
     * @return a copy of the element's inputs, name to value
     */
    Map<String, String> getInputs();

    void setInputs(Map<String, String> inputs);

    /**
     * @return a description of how this element was derived from the original, or null if it was not
     */
    String getAltered();

    void setAltered(String altered);

    /**
     * @return the auditor the element is attached to, or null for an orphan element
     */
    Auditor getAuditor();

    void setAuditor(Auditor auditor);

    /**
     * @return whether the element is detached from any auditor and page
     */
    default boolean isOrphan()
    {
        return getAuditor() == null;
    }

    /**
     * @return the live, modifiable submission options of this element
     */
    Map<String, Object> getOptions();

    /**
     * @return an independent copy of this element
     */
    Element copy();

    /**
     * Submits the element with its current inputs.
     *
     * @param transport the transport that issues the request
     */
    void submit(HttpTransport transport);
}
