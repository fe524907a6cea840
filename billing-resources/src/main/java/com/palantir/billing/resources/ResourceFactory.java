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
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Turns a decoded response body into a {@link Resource}, choosing the type from the path the response belongs to.
 * Resolution never fails: bodies at unknown paths, or bodies whose shape does not fit their path, become
 * {@link GenericResource}s.
 */
@ThreadSafe
public final class ResourceFactory {

    private static final SafeLogger log = SafeLoggerFactory.get(ResourceFactory.class);
    private static final String ITEMS = "items";

    private final ResourceSchema schema;

    public ResourceFactory(ResourceSchema schema) {
        this.schema = Preconditions.checkNotNull(schema, "schema");
    }

    public Resource create(@Nullable String path, Object body) {
        return create(path, body, Pagination.empty());
    }

    /**
     * Creates the resource for {@code body} received from {@code path}.
     *
     * @param headerPagination pagination reported by response headers, used when a collection body has none
     */
    public Resource create(@Nullable String path, Object body, Pagination headerPagination) {
        Preconditions.checkNotNull(body, "body");
        Optional<ResourceBinding> binding = schema.lookup(path == null ? "" : path);
        if (binding.isEmpty()) {
            log.debug("No resource type registered for path", UnsafeArg.of("path", path));
            return new GenericResource(body);
        }
        if (binding.get().isCollection()) {
            return createCollection(binding.get(), body, headerPagination);
        }
        return createItem(binding.get(), body);
    }

    private Resource createCollection(ResourceBinding binding, Object body, Pagination headerPagination) {
        if (body instanceof List) {
            return new ResourceCollection<>(createItems(binding, (List<?>) body), headerPagination, body);
        }
        if (body instanceof Map) {
            Map<?, ?> envelope = (Map<?, ?>) body;
            Object items = envelope.get(ITEMS);
            if (items instanceof List) {
                Pagination pagination = Pagination.fromEnvelope(envelope).orElse(headerPagination);
                return new ResourceCollection<>(createItems(binding, (List<?>) items), pagination, body);
            }
            if (envelope.isEmpty()) {
                return new ResourceCollection<>(List.of(), headerPagination, body);
            }
            // a create on the collection path answers with the created item
            return createItem(binding, body);
        }
        return new GenericResource(body);
    }

    private List<Resource> createItems(ResourceBinding binding, List<?> items) {
        List<Resource> resources = new ArrayList<>(items.size());
        for (Object item : items) {
            resources.add(createCollectionItem(binding, item));
        }
        return resources;
    }

    private Resource createCollectionItem(ResourceBinding binding, Object item) {
        if (!(item instanceof Map)) {
            return new GenericResource(item);
        }
        Optional<String> selfPath = Links.selfHref((Map<?, ?>) item).flatMap(ResourceFactory::pathOf);
        if (selfPath.isPresent()) {
            Optional<ResourceBinding> itemBinding = schema.lookup(selfPath.get());
            if (itemBinding.isPresent() && !itemBinding.get().isCollection()) {
                return createItem(itemBinding.get(), item);
            }
        }
        return createItem(binding, item);
    }

    @SuppressWarnings("unchecked")
    private static Resource createItem(ResourceBinding binding, Object body) {
        if (body instanceof Map) {
            return binding.newEntity((Map<String, Object>) body);
        }
        return new GenericResource(body);
    }

    private static Optional<String> pathOf(String href) {
        try {
            return Optional.ofNullable(URI.create(href).getPath());
        } catch (IllegalArgumentException e) {
            log.info("Ignoring malformed self link", UnsafeArg.of("href", href), e);
            return Optional.empty();
        }
    }
}
