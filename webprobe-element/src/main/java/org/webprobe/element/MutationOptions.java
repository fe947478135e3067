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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <p>Options for generating the mutations of an element.</p>
 * <p>{@link #isParamFlip()} is handled by the element itself; every other
 * option is handed unchanged to the generic {@link Mutable} capability.
 * Instances are immutable.</p>
 */
public final class MutationOptions
{
    public static final MutationOptions DEFAULT = new MutationOptions(false, Collections.emptyMap());

    private final boolean _paramFlip;
    private final Map<String, Object> _options;

    private MutationOptions(boolean paramFlip, Map<String, Object> options)
    {
        _paramFlip = paramFlip;
        _options = options;
    }

    /**
     * @return whether an extra mutation carrying the payload as the input name is generated
     */
    public boolean isParamFlip()
    {
        return _paramFlip;
    }

    /**
     * @return the options for the generic mutation capability
     */
    public Map<String, Object> getOptions()
    {
        return _options;
    }

    public Object getOption(String name)
    {
        return _options.get(name);
    }

    public MutationOptions withParamFlip(boolean paramFlip)
    {
        return new MutationOptions(paramFlip, _options);
    }

    public MutationOptions withOption(String name, Object value)
    {
        Map<String, Object> options = new LinkedHashMap<>(_options);
        options.put(name, value);
        return new MutationOptions(_paramFlip, Collections.unmodifiableMap(options));
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{paramFlip=%b,options=%s}", getClass().getSimpleName(), hashCode(), _paramFlip, _options);
    }
}
