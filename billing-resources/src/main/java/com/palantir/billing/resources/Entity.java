/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.palantir.billing.resources;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.MoreObjects;
import com.google.common.primitives.Ints;
import com.palantir.logsafe.Preconditions;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A typed billing object backed by its attribute map. Subclasses expose typed accessors over
 * {@link #getAttribute(String)} and {@link #setAttribute(String, Object)}; when used as a request payload only the
 * attributes are serialized, without the {@code _links} and {@code _embedded} sections returned by the API.
 */
@NotThreadSafe
public abstract class Entity implements Resource {

    static final String LINKS = "_links";
    static final String EMBEDDED = "_embedded";

    private final Map<String, Object> attributes;
    private final Map<String, Entity> embeddedEntities = new HashMap<>();

    protected Entity() {
        this(Collections.emptyMap());
    }

    protected Entity(Map<String, ?> data) {
        this.attributes = new LinkedHashMap<>(Preconditions.checkNotNull(data, "data"));
    }

    @Nullable
    public final Object getAttribute(String name) {
        return attributes.get(name);
    }

    /** Sets an attribute; a {@code null} value removes it. */
    public Entity setAttribute(String name, @Nullable Object value) {
        Preconditions.checkNotNull(name, "name");
        if (value == null) {
            attributes.remove(name);
        } else {
            attributes.put(name, value);
        }
        return this;
    }

    public final Optional<String> getId() {
        return Optional.ofNullable(getString("id"));
    }

    /** The href of this entity's {@code self} link, if the API returned one. */
    public final Optional<String> getSelfHref() {
        return Links.selfHref(attributes);
    }

    public final boolean hasEmbedded(String name) {
        return embeddedData(name) != null;
    }

    /**
     * Wraps the embedded resource {@code name} in its entity type. The wrapper is created on first access and then
     * reused, so changes made through it are kept.
     */
    public final <T extends Entity> Optional<T> embedded(String name, Function<Map<String, Object>, T> constructor) {
        Entity existing = embeddedEntities.get(name);
        if (existing != null) {
            @SuppressWarnings("unchecked")
            T typed = (T) existing;
            return Optional.of(typed);
        }
        Map<String, Object> data = embeddedData(name);
        if (data == null) {
            return Optional.empty();
        }
        T entity = constructor.apply(data);
        embeddedEntities.put(name, entity);
        return Optional.of(entity);
    }

    @Override
    public final Map<String, Object> data() {
        return Collections.unmodifiableMap(attributes);
    }

    /** The attributes sent when this entity is used as a request payload. */
    @JsonValue
    public final Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>(attributes);
        json.remove(LINKS);
        json.remove(EMBEDDED);
        return json;
    }

    @Nullable
    protected final String getString(String name) {
        Object value = attributes.get(name);
        return value == null ? null : String.valueOf(value);
    }

    @Nullable
    protected final Integer getInteger(String name) {
        Object value = attributes.get(name);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return value == null ? null : Ints.tryParse(String.valueOf(value));
    }

    @Nullable
    protected final Boolean getBoolean(String name) {
        Object value = attributes.get(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value == null ? null : Boolean.valueOf(String.valueOf(value));
    }

    @Nullable
    @SuppressWarnings("unchecked")
    protected final List<Object> getList(String name) {
        Object value = attributes.get(name);
        return value instanceof List ? (List<Object>) value : null;
    }

    @Nullable
    @SuppressWarnings("unchecked")
    private Map<String, Object> embeddedData(String name) {
        Object embedded = attributes.get(EMBEDDED);
        if (!(embedded instanceof Map)) {
            return null;
        }
        Object value = ((Map<?, ?>) embedded).get(name);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    @Override
    public String toString() {
        // Attribute values may hold customer data
        return MoreObjects.toStringHelper(this)
                .add("id", getId().orElse(null))
                .add("attributes", attributes.keySet())
                .toString();
    }
}
