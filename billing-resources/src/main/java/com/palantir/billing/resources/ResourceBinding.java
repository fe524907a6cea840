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

import com.palantir.logsafe.Preconditions;
import java.util.Map;
import java.util.function.Function;

/** The entity type a {@link PathPattern} resolves to, and whether the path addresses a collection of them. */
public final class ResourceBinding {

    private final Function<Map<String, Object>, ? extends Entity> constructor;
    private final boolean collection;

    private ResourceBinding(Function<Map<String, Object>, ? extends Entity> constructor, boolean collection) {
        this.constructor = Preconditions.checkNotNull(constructor, "constructor");
        this.collection = collection;
    }

    public static ResourceBinding item(Function<Map<String, Object>, ? extends Entity> constructor) {
        return new ResourceBinding(constructor, false);
    }

    public static ResourceBinding collection(Function<Map<String, Object>, ? extends Entity> constructor) {
        return new ResourceBinding(constructor, true);
    }

    public boolean isCollection() {
        return collection;
    }

    Entity newEntity(Map<String, Object> data) {
        return constructor.apply(data);
    }
}
