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

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.primitives.Ints;
import com.palantir.billing.core.BillingClient;
import com.palantir.billing.resources.Entity;
import com.palantir.billing.resources.Resource;
import com.palantir.billing.resources.ResourceCollection;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;
import javax.annotation.Nullable;

/**
 * Pages through a collection with {@code limit} and {@code offset} parameters. Iteration stops after the page
 * which reaches the reported total, or after a short page when the API reports no total. Each iteration sends
 * fresh requests.
 */
public final class Paginator<T extends Entity> implements Iterable<ResourceCollection<T>> {

    public static final int DEFAULT_LIMIT = 100;
    static final String LIMIT = "limit";
    static final String OFFSET = "offset";

    private final BillingClient client;
    private final String path;
    private final ImmutableMap<String, Object> params;
    private final Class<T> type;
    private final int limit;
    private final int startOffset;

    Paginator(BillingClient client, String path, Map<String, ?> params, Class<T> type) {
        this.client = Preconditions.checkNotNull(client, "client");
        this.path = Preconditions.checkNotNull(path, "path");
        this.params = copyWithoutNulls(params);
        this.type = type;
        this.limit = intParam(params.get(LIMIT), DEFAULT_LIMIT);
        this.startOffset = intParam(params.get(OFFSET), 0);
        Preconditions.checkArgument(limit > 0, "limit must be positive", SafeArg.of("limit", limit));
        Preconditions.checkArgument(startOffset >= 0, "offset must not be negative", SafeArg.of("offset", startOffset));
    }

    @Override
    public Iterator<ResourceCollection<T>> iterator() {
        return new AbstractIterator<>() {
            private int offset = startOffset;
            private boolean done = false;

            @Override
            protected ResourceCollection<T> computeNext() {
                if (done) {
                    return endOfData();
                }
                ResourceCollection<T> page = fetch(offset);
                offset += page.size();
                done = isLastPage(page, offset);
                if (page.isEmpty()) {
                    return endOfData();
                }
                return page;
            }
        };
    }

    /** All items of all pages, fetched lazily page by page. */
    public Iterable<T> items() {
        return Iterables.concat(this);
    }

    private ResourceCollection<T> fetch(int offset) {
        Map<String, Object> pageParams = new LinkedHashMap<>(params);
        pageParams.put(LIMIT, limit);
        pageParams.put(OFFSET, offset);
        Resource resource = client.get(path, pageParams);
        return Service.collection(resource, type);
    }

    private boolean isLastPage(ResourceCollection<T> page, int nextOffset) {
        if (page.isEmpty()) {
            return true;
        }
        OptionalLong total = page.pagination().total();
        if (total.isPresent()) {
            return nextOffset >= total.getAsLong();
        }
        return page.size() < limit;
    }

    private static ImmutableMap<String, Object> copyWithoutNulls(Map<String, ?> params) {
        ImmutableMap.Builder<String, Object> copy = ImmutableMap.builder();
        params.forEach((name, value) -> {
            if (value != null && !name.equals(LIMIT) && !name.equals(OFFSET)) {
                copy.put(name, value);
            }
        });
        return copy.buildKeepingLast();
    }

    private static int intParam(@Nullable Object value, int defaultValue) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value == null) {
            return defaultValue;
        }
        Integer parsed = Ints.tryParse(String.valueOf(value));
        return parsed == null ? defaultValue : parsed;
    }
}
