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

package com.palantir.billing.services;

import com.palantir.billing.core.BillingClient;
import com.palantir.billing.core.Clients;
import com.palantir.billing.resources.Entity;
import com.palantir.billing.resources.Resource;
import com.palantir.billing.resources.ResourceCollection;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Base class of the per-resource services. A service uses the client it was created with, or the
 * {@linkplain Clients#getDefault() default client} at call time when created without one.
 */
public abstract class Service {

    @Nullable
    private final BillingClient client;

    protected Service() {
        this.client = null;
    }

    protected Service(BillingClient client) {
        this.client = Preconditions.checkNotNull(client, "client");
    }

    protected final BillingClient client() {
        return client != null ? client : Clients.getDefault();
    }

    /** Returns {@code params} with {@code name} set to {@code value}, which takes precedence. */
    protected static Map<String, Object> withParam(String name, Object value, Map<String, ?> params) {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put(name, Preconditions.checkNotNull(value, "value"));
        params.forEach(merged::putIfAbsent);
        return merged;
    }

    protected static <T extends Entity> T entity(@Nullable Resource resource, Class<T> type) {
        if (!type.isInstance(resource)) {
            throw unexpected(resource, type);
        }
        return type.cast(resource);
    }

    protected static <T extends Entity> ResourceCollection<T> collection(@Nullable Resource resource, Class<T> type) {
        if (!(resource instanceof ResourceCollection)) {
            throw unexpected(resource, ResourceCollection.class);
        }
        return ((ResourceCollection<?>) resource).as(type);
    }

    private static SafeIllegalStateException unexpected(@Nullable Resource resource, Class<?> expected) {
        return new SafeIllegalStateException(
                "Unexpected resource type in response",
                SafeArg.of("expectedType", expected.getSimpleName()),
                SafeArg.of("actualType", resource == null ? "null" : resource.getClass().getSimpleName()));
    }
}
