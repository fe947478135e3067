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
 * <p>The generic mutation capability.</p>
 * <p>Implementations apply each of their fuzzing strategies to an element,
 * yielding one independent copy per strategy with the element's input value
 * replaced according to that strategy and labelled through
 * {@link Element#setAltered(String)}.</p>
 *
 * @param <E> the type of element mutated
 */
public interface Mutable<E extends Element>
{
    /**
     * @param element the element to mutate, left unchanged
     * @param payload the string to inject
     * @param options options for generating mutations
     * @return the baseline mutations, in strategy order
     */
    List<E> mutate(E element, String payload, MutationOptions options);

    /**
     * @return a harmless value used where an input needs some value
     */
    String seed();
}
