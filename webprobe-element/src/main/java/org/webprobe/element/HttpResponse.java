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
 * An HTTP response cookies can be extracted from.
 */
public interface HttpResponse
{
    /**
     * @return the URL the response was finally served from
     */
    String getEffectiveUrl();

    String getBody();

    /**
     * @return the response headers, each value either a {@code String} or a collection of them
     */
    Map<String, ?> getHeaders();
}
