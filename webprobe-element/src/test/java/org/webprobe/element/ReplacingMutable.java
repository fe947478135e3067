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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Mutates each input of a cookie by replacing its value with the payload
 * and by appending the payload to the seed.
 */
public class ReplacingMutable implements Mutable<Cookie>
{
    public static final String SEED = "seed";

    @Override
    public List<Cookie> mutate(Cookie element, String payload, MutationOptions options)
    {
        List<Cookie> mutations = new ArrayList<>();
        for (Map.Entry<String, String> input : element.getInputs().entrySet())
        {
            mutations.add(mutate(element, input.getKey(), payload));
            mutations.add(mutate(element, input.getKey(), SEED + payload));
        }
        return mutations;
    }

    private static Cookie mutate(Cookie element, String name, String value)
    {
        Cookie mutation = element.copy();
        mutation.setInputs(Map.of(name, value));
        mutation.setAltered(name);
        return mutation;
    }

    @Override
    public String seed()
    {
        return SEED;
    }
}
