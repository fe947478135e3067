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

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.webprobe.http.CookieAttribute;
import org.webprobe.http.CookieCodec;
import org.webprobe.http.CookieDates;

/**
 * <p>A cookie as a fuzzable element.</p>
 * <p>A cookie carries a single input, its name and value, which payloads are
 * injected into, together with the fixed set of {@link CookieAttribute
 * attributes}. The {@code name} and {@code value} attributes always mirror
 * the current input.</p>
 * <p>On construction from a raw attribute map the attributes missing from the
 * map take their defaults, the value is decoded once with
 * {@link CookieCodec#decode(String)}, and a missing path or domain is taken
 * from the owner URL. The input at the end of construction is kept as the
 * {@link #getOriginalInputs() original inputs}.</p>
 * <p>Cookies are always submitted with {@code GET}, their input going to the
 * {@code Cookie} header.</p>
 */
public class Cookie implements Auditable
{
    private static final Logger LOG = LoggerFactory.getLogger(Cookie.class);

    /**
     * The option under which page elements submitted along with a cookie
     * mutation carry that mutation's input.
     */
    public static final String COOKIES_OPTION = "cookies";
    /**
     * The option holding extra request headers, a map of names to values.
     */
    public static final String HEADERS_OPTION = "headers";
    public static final String PARAMETER_FLIP = "Parameter flip";

    private static final String GET = "GET";

    private final String _url;
    private final String _action;
    private final String _method;
    private final Map<String, Object> _attributes;
    private final Map<String, String> _inputs = new LinkedHashMap<>();
    private final Map<String, String> _original;
    private final Map<String, Object> _options;
    private String _altered;
    private Auditor _auditor;
    private boolean _scopeOverride;
    private Mutable<Cookie> _mutable;

    /**
     * @param url the owner URL
     * @param name the cookie name
     * @param value the cookie value, encoded as in a {@code Cookie} header
     */
    public Cookie(String url, String name, String value)
    {
        this(url, nameValue(name, value));
    }

    /**
     * <p>Creates a cookie from a raw attribute map.</p>
     * <p>If the map has both a {@code name} and a {@code value} they are the
     * input and the other known attributes are taken from the map. Otherwise
     * the map is a single {@code {name: value}} pair, so that
     * {@code {"session": "abc"}} is a cookie named {@code session} with
     * default attributes, whatever the name.</p>
     * <p>The value is decoded with {@link CookieCodec#decode(String)}.</p>
     *
     * @param url the owner URL
     * @param raw the raw attributes, keyed by {@link CookieAttribute#key()}
     * @throws IllegalArgumentException if the URL is invalid
     * @throws org.webprobe.http.TimeParseException if a textual expiry cannot be parsed
     */
    public Cookie(String url, Map<String, ?> raw)
    {
        this(url, raw, true);
    }

    /**
     * Creates a cookie from a raw attribute map whose name and value are
     * already decoded, as {@link org.webprobe.http.SetCookieParser} produces
     * them, so that the value is not decoded a second time.
     *
     * @param url the owner URL
     * @param raw the decoded raw attributes
     * @return the cookie
     * @see #Cookie(String, Map)
     */
    public static Cookie fromDecoded(String url, Map<String, ?> raw)
    {
        return new Cookie(url, raw, false);
    }

    private Cookie(String url, Map<String, ?> raw, boolean decode)
    {
        Objects.requireNonNull(url, "url");
        URI uri = URI.create(url);

        _url = url;
        _action = url;
        _method = GET;
        _options = new LinkedHashMap<>();
        _attributes = CookieAttribute.defaults();

        Map<String, ?> source = raw == null ? Collections.emptyMap() : raw;
        String name = null;
        String value = null;
        if (source.get(CookieAttribute.NAME.key()) != null && source.get(CookieAttribute.VALUE.key()) != null)
        {
            for (Map.Entry<String, ?> entry : source.entrySet())
            {
                CookieAttribute attribute = CookieAttribute.forKey(entry.getKey());
                if (attribute != null && entry.getValue() != null)
                    _attributes.put(attribute.key(), normalize(attribute, entry.getValue()));
            }
            name = source.get(CookieAttribute.NAME.key()).toString();
            value = source.get(CookieAttribute.VALUE.key()).toString();
        }
        else if (!source.isEmpty())
        {
            Map.Entry<String, ?> pair = source.entrySet().iterator().next();
            name = pair.getKey();
            value = Objects.toString(pair.getValue(), null);
        }

        if (decode && value != null && !value.isEmpty())
            value = CookieCodec.decode(value);
        setInput(name, value);

        if (_attributes.get(CookieAttribute.PATH.key()) == null)
        {
            String path = uri.getRawPath();
            _attributes.put(CookieAttribute.PATH.key(), path == null || path.isEmpty() ? "/" : path);
        }
        if (_attributes.get(CookieAttribute.DOMAIN.key()) == null)
            _attributes.put(CookieAttribute.DOMAIN.key(), uri.getHost());

        _original = Collections.unmodifiableMap(new LinkedHashMap<>(_inputs));
    }

    private Cookie(Cookie cookie)
    {
        _url = cookie._url;
        _action = cookie._action;
        _method = cookie._method;
        _attributes = new LinkedHashMap<>(cookie._attributes);
        _inputs.putAll(cookie._inputs);
        _original = cookie._original;
        _options = copyOptions(cookie._options);
        _altered = cookie._altered;
        _auditor = cookie._auditor;
        _scopeOverride = cookie._scopeOverride;
        _mutable = cookie._mutable;
    }

    private static Map<String, Object> nameValue(String name, String value)
    {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(CookieAttribute.NAME.key(), Objects.requireNonNull(name, "name"));
        raw.put(CookieAttribute.VALUE.key(), value == null ? "" : value);
        return raw;
    }

    private static Object normalize(CookieAttribute attribute, Object value)
    {
        switch (attribute)
        {
            case EXPIRES:
                if (value instanceof Instant)
                    return value;
                if (value instanceof Date)
                    return ((Date)value).toInstant();
                if (value instanceof Number)
                    return CookieDates.parse(((Number)value).longValue());
                String expires = value.toString();
                return expires.isBlank() ? null : CookieDates.parse(expires);
            case VERSION:
                if (value instanceof Number)
                    return ((Number)value).intValue();
                try
                {
                    return Integer.parseInt(value.toString().trim());
                }
                catch (NumberFormatException x)
                {
                    if (LOG.isDebugEnabled())
                        LOG.debug("Ignored cookie version {}", value);
                    return attribute.defaultValue();
                }
            case MAX_AGE:
                if (value instanceof Number)
                    return ((Number)value).longValue();
                try
                {
                    return Long.parseLong(value.toString().trim());
                }
                catch (NumberFormatException x)
                {
                    if (LOG.isDebugEnabled())
                        LOG.debug("Ignored cookie max age {}", value);
                    return attribute.defaultValue();
                }
            case SECURE:
            case HTTP_ONLY:
            case DISCARD:
                if (value instanceof Boolean)
                    return value;
                return Boolean.valueOf(value.toString().trim());
            default:
                return value.toString();
        }
    }

    private static Map<String, Object> copyOptions(Map<String, Object> options)
    {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : options.entrySet())
        {
            Object value = entry.getValue();
            if (value instanceof Map)
                value = new LinkedHashMap<>((Map<?, ?>)value);
            else if (value instanceof Collection)
                value = new ArrayList<>((Collection<?>)value);
            copy.put(entry.getKey(), value);
        }
        return copy;
    }

    @Override
    public ElementType getType()
    {
        return ElementType.COOKIE;
    }

    @Override
    public String getUrl()
    {
        return _url;
    }

    @Override
    public String getAction()
    {
        return _action;
    }

    @Override
    public String getMethod()
    {
        return _method;
    }

    @Override
    public Map<String, String> getInputs()
    {
        return new LinkedHashMap<>(_inputs);
    }

    /**
     * <p>Replaces the input with the first entry of the given map.</p>
     * <p>The {@code name} and {@code value} attributes follow the new input.
     * An empty map, or an entry with an empty name, leaves the cookie without
     * an input.</p>
     *
     * @param inputs the new input
     */
    @Override
    public void setInputs(Map<String, String> inputs)
    {
        String name = null;
        String value = null;
        if (inputs != null && !inputs.isEmpty())
        {
            Map.Entry<String, String> entry = inputs.entrySet().iterator().next();
            name = entry.getKey();
            value = entry.getValue();
        }
        setInput(name, value);
    }

    private void setInput(String name, String value)
    {
        _attributes.put(CookieAttribute.NAME.key(), name);
        _attributes.put(CookieAttribute.VALUE.key(), value);
        _inputs.clear();
        if (name != null && !name.isEmpty())
            _inputs.put(name, value);
    }

    /**
     * @return the input the cookie had when it was created
     */
    public Map<String, String> getOriginalInputs()
    {
        return _original;
    }

    /**
     * @return whether the input differs from the original input
     */
    public boolean isMutated()
    {
        return !_inputs.equals(_original);
    }

    /**
     * @return a copy of the input
     */
    public Map<String, String> simple()
    {
        return getInputs();
    }

    @Override
    public String getAltered()
    {
        return _altered;
    }

    @Override
    public void setAltered(String altered)
    {
        _altered = altered;
    }

    @Override
    public Auditor getAuditor()
    {
        return _auditor;
    }

    @Override
    public void setAuditor(Auditor auditor)
    {
        _auditor = auditor;
    }

    @Override
    public Map<String, Object> getOptions()
    {
        return _options;
    }

    /**
     * Exempts this cookie from the checks that restrict auditing to the
     * inputs found while crawling.
     */
    public void overrideInstanceScope()
    {
        _scopeOverride = true;
    }

    public boolean isScopeOverridden()
    {
        return _scopeOverride;
    }

    public Mutable<Cookie> getMutable()
    {
        return _mutable;
    }

    /**
     * @param mutable the generic mutation capability {@link #mutations(String, MutationOptions, AuditOptions)} builds on
     */
    public void setMutable(Mutable<Cookie> mutable)
    {
        _mutable = mutable;
    }

    /**
     * @param attribute an attribute name, as in {@link CookieAttribute#key()}
     * @return the value of the attribute, possibly null
     * @throws NoSuchAttributeException if cookies have no such attribute
     */
    public Object get(String attribute) throws NoSuchAttributeException
    {
        CookieAttribute cookieAttribute = CookieAttribute.forKey(attribute);
        if (cookieAttribute == null)
            throw new NoSuchAttributeException(attribute);
        return get(cookieAttribute);
    }

    public Object get(CookieAttribute attribute)
    {
        return _attributes.get(attribute.key());
    }

    /**
     * @param attribute an attribute name
     * @return whether {@link #get(String)} can look the name up
     */
    public boolean hasAttribute(String attribute)
    {
        return CookieAttribute.isAttribute(attribute);
    }

    /**
     * @return a copy of all attributes, keyed by {@link CookieAttribute#key()}
     */
    public Map<String, Object> getAttributes()
    {
        return Collections.unmodifiableMap(new LinkedHashMap<>(_attributes));
    }

    public String getName()
    {
        return (String)get(CookieAttribute.NAME);
    }

    public String getValue()
    {
        return (String)get(CookieAttribute.VALUE);
    }

    public Integer getVersion()
    {
        return (Integer)get(CookieAttribute.VERSION);
    }

    public String getPort()
    {
        return (String)get(CookieAttribute.PORT);
    }

    public Boolean getDiscard()
    {
        return (Boolean)get(CookieAttribute.DISCARD);
    }

    public String getCommentUrl()
    {
        return (String)get(CookieAttribute.COMMENT_URL);
    }

    public Instant getExpires()
    {
        return (Instant)get(CookieAttribute.EXPIRES);
    }

    public Long getMaxAge()
    {
        return (Long)get(CookieAttribute.MAX_AGE);
    }

    public String getComment()
    {
        return (String)get(CookieAttribute.COMMENT);
    }

    public Boolean getSecure()
    {
        return (Boolean)get(CookieAttribute.SECURE);
    }

    public String getPath()
    {
        return (String)get(CookieAttribute.PATH);
    }

    public String getDomain()
    {
        return (String)get(CookieAttribute.DOMAIN);
    }

    public Boolean getHttpOnly()
    {
        return (Boolean)get(CookieAttribute.HTTP_ONLY);
    }

    /**
     * @return whether the cookie must only be sent over an encrypted channel
     */
    public boolean isSecure()
    {
        return Boolean.TRUE.equals(getSecure());
    }

    /**
     * @return whether the cookie is hidden from client side scripts
     */
    public boolean isHttpOnly()
    {
        return Boolean.TRUE.equals(getHttpOnly());
    }

    /**
     * @return whether the cookie has no expiry and lasts for the session only
     */
    public boolean isSession()
    {
        return getExpires() == null;
    }

    /**
     * @return the expiry time, or null for a session cookie
     */
    public Instant getExpiresAt()
    {
        return getExpires();
    }

    /**
     * @param time the time to check against
     * @return whether the cookie has an expiry and the time is after it
     */
    public boolean isExpired(Instant time)
    {
        Instant expires = getExpires();
        return expires != null && time.isAfter(expires);
    }

    public boolean isExpired()
    {
        return isExpired(Instant.now());
    }

    @Override
    public Cookie copy()
    {
        return new Cookie(this);
    }

    /**
     * <p>Generates the mutations of this cookie for a payload.</p>
     * <p>The baseline mutations come from the generic {@link Mutable}
     * capability. With {@link MutationOptions#isParamFlip()} one more
     * mutation carries the payload as the cookie name. When auditing cookies
     * extensively, and the cookie is attached to an auditor, every mutation
     * is also applied to each link and form of the page that has inputs:
     * those elements are copied with their empty inputs filled, and carry the
     * mutation's input under {@link #COOKIES_OPTION}.</p>
     *
     * @param payload the string to inject
     * @param mutationOptions options for generating mutations
     * @param auditOptions the scanner options in effect
     * @return the mutations, without duplicates, cookies first
     * @throws IllegalStateException if no {@link Mutable} capability was set
     */
    public List<Element> mutations(String payload, MutationOptions mutationOptions, AuditOptions auditOptions)
    {
        Objects.requireNonNull(payload, "payload");
        Mutable<Cookie> mutable = _mutable;
        if (mutable == null)
            throw new IllegalStateException("No mutation capability for cookie " + getName());

        List<Element> mutations = new ArrayList<>(mutable.mutate(this, payload, mutationOptions.withParamFlip(false)));

        if (mutationOptions.isParamFlip())
        {
            Cookie flipped = copy();
            // the payload as a name matches no crawled cookie, so it would never be in scope
            flipped.overrideInstanceScope();
            flipped.setAltered(PARAMETER_FLIP);
            flipped.setInput(payload, mutable.seed());
            mutations.add(flipped);
        }

        Set<Element> unique = new LinkedHashSet<>(mutations);
        if (!isOrphan() && auditOptions.isAuditCookiesExtensively())
            unique.addAll(propagate(mutations, auditOptions.getInputFiller()));

        return new ArrayList<>(unique);
    }

    private List<Element> propagate(List<Element> mutations, InputFiller filler)
    {
        Page page = _auditor.getPage();
        if (page == null)
            return Collections.emptyList();

        Set<Element> elements = new LinkedHashSet<>(page.getLinks());
        elements.addAll(page.getForms());

        List<Element> propagated = new ArrayList<>();
        for (Element mutation : mutations)
        {
            for (Element element : elements)
            {
                if (element.getInputs().isEmpty())
                    continue;

                Element clone = element.copy();
                clone.setAltered("mutation for the '" + mutation.getAltered() + "' cookie");
                clone.setAuditor(_auditor);
                clone.getOptions().put(COOKIES_OPTION, mutation.getInputs());
                clone.setInputs(filler.fill(clone.getInputs()));
                propagated.add(clone);
            }
        }

        if (LOG.isDebugEnabled())
            LOG.debug("Propagated {} mutations of {} to {} page elements", mutations.size(), this, propagated.size());
        return propagated;
    }

    /**
     * <p>Audits the cookie unless its name is excluded by the options, in
     * which case the skip is reported to the auditor and nothing is
     * submitted.</p>
     */
    @Override
    public List<Element> audit(String payload, MutationOptions mutationOptions, AuditOptions auditOptions, HttpTransport transport)
    {
        if (auditOptions.isExcludedCookie(getName()))
        {
            String message = "Skipping audit of '" + getName() + "' cookie.";
            if (_auditor != null)
                _auditor.printInfo(message);
            LOG.info(message);
            return Collections.emptyList();
        }

        List<Element> mutations = mutations(payload, mutationOptions, auditOptions);
        for (Element mutation : mutations)
        {
            mutation.submit(transport);
        }
        return mutations;
    }

    /**
     * Submits the cookie as a {@code GET} to its action, sending its input in
     * the {@code Cookie} header, no parameters, and any headers held under
     * {@link #HEADERS_OPTION}.
     */
    @Override
    public void submit(HttpTransport transport)
    {
        RequestOptions request = new RequestOptions()
            .parameters(Collections.emptyMap())
            .cookies(getInputs());
        Object headers = _options.get(HEADERS_OPTION);
        if (headers instanceof Map)
        {
            for (Map.Entry<?, ?> header : ((Map<?, ?>)headers).entrySet())
            {
                request.header(String.valueOf(header.getKey()), String.valueOf(header.getValue()));
            }
        }
        if (LOG.isDebugEnabled())
            LOG.debug("Submitting {} to {}", this, _action);
        transport.get(_action, request);
    }

    /**
     * @return the cookie rendered with all its attributes, as in a {@code Set-Cookie} header
     */
    public String toSetCookieString()
    {
        StringBuilder builder = new StringBuilder(toString());
        if (getPath() != null)
            builder.append("; Path=").append(getPath());
        if (getDomain() != null)
            builder.append("; Domain=").append(getDomain());
        if (getExpires() != null)
            builder.append("; Expires=").append(CookieDates.format(getExpires()));
        if (getMaxAge() != null)
            builder.append("; Max-Age=").append(getMaxAge());
        if (getVersion() != null && getVersion() > 0)
            builder.append("; Version=").append(getVersion());
        if (getComment() != null)
            builder.append("; Comment=").append(getComment());
        if (getPort() != null)
            builder.append("; Port=").append(getPort());
        if (Boolean.TRUE.equals(getDiscard()))
            builder.append("; Discard");
        if (isSecure())
            builder.append("; Secure");
        if (isHttpOnly())
            builder.append("; HttpOnly");
        return builder.toString();
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        Cookie that = (Cookie)obj;
        return _scopeOverride == that._scopeOverride &&
            _action.equals(that._action) &&
            _method.equals(that._method) &&
            _inputs.equals(that._inputs) &&
            _attributes.equals(that._attributes) &&
            Objects.equals(_altered, that._altered);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(_action, _method, _inputs, _attributes, _altered, _scopeOverride);
    }

    /**
     * @return the {@code name=value} pair as sent in a {@code Cookie} request header
     */
    @Override
    public String toString()
    {
        return CookieCodec.toWireString(getName(), getValue());
    }
}
