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

import java.util.List;

/**
 * <p>An element with a single fuzzable input that can be audited.</p>
 * <p>Auditing derives mutations of the element for a payload and submits each
 * of them.</p>
 */
public interface Auditable extends Element
{
    /**
     * @param payload the string to inject
     * @param mutationOptions options for generating mutations
     * @param auditOptions the scanner options in effect
     * @param transport the transport mutations are submitted through
     * @return the submitted mutations, empty if the audit was skipped
     */
    List<Element> audit(String payload, MutationOptions mutationOptions, AuditOptions auditOptions, HttpTransport transport);
}
