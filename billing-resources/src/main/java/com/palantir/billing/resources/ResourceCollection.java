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
import com.google.common.collect.ImmutableList;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import java.util.Iterator;
import java.util.List;

/** One page of a resource collection. */
public final class ResourceCollection<T extends Resource> implements Resource, Iterable<T> {

    private final ImmutableList<T> items;
    private final Pagination pagination;
    private final Object data;

    public ResourceCollection(List<T> items, Pagination pagination, Object data) {
        this.items = ImmutableList.copyOf(items);
        this.pagination = Preconditions.checkNotNull(pagination, "pagination");
        this.data = Preconditions.checkNotNull(data, "data");
    }

    public List<T> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public Pagination pagination() {
        return pagination;
    }

    @Override
    public Object data() {
        return data;
    }

    @Override
    public Iterator<T> iterator() {
        return items.iterator();
    }

    /**
     * Views this page as a collection of {@code type}.
     *
     * @throws SafeIllegalStateException if an item is of another type
     */
    @SuppressWarnings("unchecked")
    public <U extends Resource> ResourceCollection<U> as(Class<U> type) {
        for (T item : items) {
            if (!type.isInstance(item)) {
                throw new SafeIllegalStateException(
                        "Collection item has an unexpected type",
                        SafeArg.of("expectedType", type.getSimpleName()),
                        SafeArg.of("actualType", item.getClass().getSimpleName()));
            }
        }
        return (ResourceCollection<U>) this;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("size", items.size())
                .add("pagination", pagination)
                .toString();
    }
}
