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

import com.google.common.base.MoreObjects;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/** A response whose path has no registered type, exposing the decoded body as is. */
public final class GenericResource implements Resource {

    private final Object data;

    public GenericResource(Object data) {
        this.data = data;
    }

    @Override
    public Object data() {
        return data;
    }

    /** The body as a JSON object, empty if it was an array or a scalar. */
    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> asMap() {
        return data instanceof Map ? Optional.of((Map<String, Object>) data) : Optional.empty();
    }

    @Nullable
    public Object getAttribute(String name) {
        return asMap().map(map -> map.get(name)).orElse(null);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("type", data.getClass().getSimpleName())
                .toString();
    }
}
