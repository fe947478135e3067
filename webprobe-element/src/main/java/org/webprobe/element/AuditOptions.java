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
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * <p>Scanner-wide options that affect how cookies are audited.</p>
 * <p>Instances are passed explicitly to {@link Cookie#audit(String, MutationOptions, AuditOptions, HttpTransport)}
 * and {@link Cookie#mutations(String, MutationOptions, AuditOptions)}.</p>
 */
public class AuditOptions
{
    public static final String EXCLUDE_COOKIES_PROPERTY = "webprobe.audit.excludeCookies";
    public static final String COOKIES_EXTENSIVELY_PROPERTY = "webprobe.audit.cookiesExtensively";

    private final Set<String> _excludedCookies = new LinkedHashSet<>();
    private boolean _auditCookiesExtensively;
    private InputFiller _inputFiller = InputFiller.NONE;

    public AuditOptions()
    {
    }

    public AuditOptions(AuditOptions options)
    {
        _excludedCookies.addAll(options._excludedCookies);
        _auditCookiesExtensively = options._auditCookiesExtensively;
        _inputFiller = options._inputFiller;
    }

    /**
     * <p>Reads the options from properties.</p>
     * <ul>
     * <li>{@value #EXCLUDE_COOKIES_PROPERTY}: comma separated names of cookies not to audit</li>
     * <li>{@value #COOKIES_EXTENSIVELY_PROPERTY}: {@code true} to submit cookie mutations along with the page's links and forms</li>
     * </ul>
     *
     * @param properties the properties to read
     * @return the options
     */
    public static AuditOptions from(Properties properties)
    {
        AuditOptions options = new AuditOptions();
        String excluded = properties.getProperty(EXCLUDE_COOKIES_PROPERTY);
        if (excluded != null)
        {
            for (String name : excluded.split(","))
            {
                String trimmed = name.trim();
                if (!trimmed.isEmpty())
                    options.addExcludedCookie(trimmed);
            }
        }
        options.setAuditCookiesExtensively(Boolean.parseBoolean(properties.getProperty(COOKIES_EXTENSIVELY_PROPERTY, "false").trim()));
        return options;
    }

    /**
     * @return the names of the cookies that must not be audited
     */
    public Set<String> getExcludedCookies()
    {
        return Collections.unmodifiableSet(_excludedCookies);
    }

    public void setExcludedCookies(Set<String> names)
    {
        _excludedCookies.clear();
        _excludedCookies.addAll(names);
    }

    public void addExcludedCookie(String name)
    {
        _excludedCookies.add(Objects.requireNonNull(name));
    }

    public boolean isExcludedCookie(String name)
    {
        return name != null && _excludedCookies.contains(name);
    }

    /**
     * @return whether cookie mutations are also submitted along with every link and form of the page
     */
    public boolean isAuditCookiesExtensively()
    {
        return _auditCookiesExtensively;
    }

    public void setAuditCookiesExtensively(boolean auditCookiesExtensively)
    {
        _auditCookiesExtensively = auditCookiesExtensively;
    }

    /**
     * @return the filler for empty inputs of page elements submitted along with cookie mutations
     */
    public InputFiller getInputFiller()
    {
        return _inputFiller;
    }

    public void setInputFiller(InputFiller inputFiller)
    {
        _inputFiller = Objects.requireNonNull(inputFiller);
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{excluded=%s,extensive=%b}", getClass().getSimpleName(), hashCode(), _excludedCookies, _auditCookiesExtensively);
    }
}
