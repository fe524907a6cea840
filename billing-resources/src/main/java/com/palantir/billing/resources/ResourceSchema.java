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

import com.google.common.collect.ImmutableList;
import com.palantir.logsafe.Preconditions;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.concurrent.Immutable;

/** Table of resource paths and the entity types they resolve to. */
@Immutable
public final class ResourceSchema {

    private static final Comparator<Entry> SPECIFICITY = Comparator.<Entry>comparingInt(
                    entry -> entry.pattern.literalCount())
            .thenComparingInt(entry -> entry.pattern.size())
            .reversed();

    private final ImmutableList<Entry> entries;

    private ResourceSchema(List<Entry> entries) {
        // stable sort, so registration order breaks ties
        List<Entry> sorted = new ArrayList<>(entries);
        sorted.sort(SPECIFICITY);
        this.entries = ImmutableList.copyOf(sorted);
    }

    /** Finds the most specific binding matching {@code path}. */
    public Optional<ResourceBinding> lookup(String path) {
        List<String> segments = PathPattern.segments(path);
        if (segments.isEmpty()) {
            return Optional.empty();
        }
        for (Entry entry : entries) {
            if (entry.pattern.matches(segments)) {
                return Optional.of(entry.binding);
            }
        }
        return Optional.empty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Entry> entries = new ArrayList<>();

        private Builder() {}

        public Builder bind(String pattern, ResourceBinding binding) {
            entries.add(new Entry(PathPattern.of(pattern), Preconditions.checkNotNull(binding, "binding")));
            return this;
        }

        /** Binds {@code path} as a collection and {@code path/*} as one of its items. */
        public Builder resource(String path, Function<Map<String, Object>, ? extends Entity> constructor) {
            return bind(path, ResourceBinding.collection(constructor))
                    .bind(path + "/*", ResourceBinding.item(constructor));
        }

        public ResourceSchema build() {
            return new ResourceSchema(entries);
        }
    }

    private static final class Entry {
        private final PathPattern pattern;
        private final ResourceBinding binding;

        Entry(PathPattern pattern, ResourceBinding binding) {
            this.pattern = pattern;
            this.binding = binding;
        }
    }
}
