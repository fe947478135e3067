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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Supplies placeholder values for inputs that have none.
 */
@FunctionalInterface
public interface InputFiller
{
    /**
     * Leaves every input as it is.
     */
    InputFiller NONE = LinkedHashMap::new;

    /**
     * @param inputs the inputs, name to value, left unchanged
     * @return a new map with every empty value replaced by a placeholder
     */
    Map<String, String> fill(Map<String, String> inputs);
}
