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

package org.webprobe.http;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <p>The fixed set of attributes a cookie element carries.</p>
 * <p>Each constant knows the key it is stored under in a raw attribute map,
 * as produced by {@link SetCookieParser} and {@link CookieJarParser}, and
 * the value it defaults to when a source does not supply it.</p>
 */
public enum CookieAttribute
{
    NAME("name"),
    VALUE("value"),
    VERSION("version", 0),
    PORT("port"),
    DISCARD("discard"),
    COMMENT_URL("comment_url"),
    EXPIRES("expires"),
    MAX_AGE("max_age"),
    COMMENT("comment"),
    SECURE("secure"),
    PATH("path"),
    DOMAIN("domain"),
    HTTP_ONLY("httponly", Boolean.FALSE);

    private static final Map<String, CookieAttribute> __keys = new HashMap<>();

    static
    {
        for (CookieAttribute attribute : values())
        {
            __keys.put(attribute.key(), attribute);
        }
    }

    private final String _key;
    private final Object _default;

    CookieAttribute(String key)
    {
        this(key, null);
    }

    CookieAttribute(String key, Object defaultValue)
    {
        _key = key;
        _default = defaultValue;
    }

    /**
     * @return the key used for this attribute in raw attribute maps
     */
    public String key()
    {
        return _key;
    }

    /**
     * @return the value this attribute takes when no source supplies one, possibly null
     */
    public Object defaultValue()
    {
        return _default;
    }

    /**
     * @param key the raw attribute key, matched exactly
     * @return the attribute stored under the key, or null if the key is not a cookie attribute
     */
    public static CookieAttribute forKey(String key)
    {
        if (key == null)
            return null;
        return __keys.get(key);
    }

    /**
     * @param key the raw attribute key
     * @return whether the key names one of the fixed cookie attributes
     */
    public static boolean isAttribute(String key)
    {
        return forKey(key) != null;
    }

    /**
     * @return a new modifiable map holding every attribute key mapped to its default value, in declaration order
     */
    public static Map<String, Object> defaults()
    {
        Map<String, Object> defaults = new LinkedHashMap<>();
        for (CookieAttribute attribute : values())
        {
            defaults.put(attribute.key(), attribute.defaultValue());
        }
        return defaults;
    }
}
