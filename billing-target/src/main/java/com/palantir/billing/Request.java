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

package com.palantir.billing;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimap;
import com.google.common.collect.Multimaps;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;

/** Defines the parameters of a single call to the billing API. */
@ThreadSafe
public final class Request {

    private final HttpMethod method;
    private final URI uri;
    private final ListMultimap<String, String> headerParams;
    private final Optional<RequestBody> body;

    private Request(Builder builder) {
        method = Preconditions.checkNotNull(builder.method, "method must be set");
        uri = Preconditions.checkNotNull(builder.uri, "uri must be set");
        headerParams = builder.unmodifiableHeaderParams();
        body = builder.body;
        if (body.isPresent() && !method.permitsRequestBody()) {
            throw new SafeIllegalArgumentException(
                    "Request method must not have a body", SafeArg.of("method", method));
        }
    }

    public HttpMethod method() {
        return method;
    }

    /**
     * The target of this request. Relative until a base URI has been applied, after which it is absolute and may be
     * handed to a {@link Transport}.
     */
    public URI uri() {
        return uri;
    }

    /**
     * The HTTP headers for this request, encoded as a map of {@code header-name: header-value}.
     * Headers names are compared in a case-insensitive fashion as per
     * https://tools.ietf.org/html/rfc7540#section-8.1.2.
     */
    public ListMultimap<String, String> headerParams() {
        return headerParams;
    }

    /** The HTTP request body for this request or empty if this request does not contain a body. */
    public Optional<RequestBody> body() {
        return body;
    }

    @Override
    public String toString() {
        return "Request{"
                + "method="
                + method
                + ", uri="
                + uri
                // Values are excluded to avoid the risk of logging credentials
                + ", headerParamsKeys="
                + headerParams.keySet()
                + ", body="
                + body
                + '}';
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        Request request = (Request) other;
        return method == request.method
                && uri.equals(request.uri)
                && headerParams.equals(request.headerParams)
                && body.equals(request.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, uri, headerParams, body);
    }

    public static Builder builder() {
        return new Builder();
    }

    @NotThreadSafe
    public static final class Builder {

        @SuppressWarnings("UnnecessaryLambda") // Avoid unnecessary allocation
        private static final com.google.common.base.Supplier<List<String>> MAP_VALUE_FACTORY = () -> new ArrayList<>(1);

        @Nullable
        private HttpMethod method;

        @Nullable
        private URI uri;

        private ListMultimap<String, String> headerParams = ImmutableListMultimap.of();

        private boolean headersMutable = false;

        private Optional<RequestBody> body = Optional.empty();

        private Builder() {}

        public Request.Builder from(Request existing) {
            Preconditions.checkNotNull(existing, "Request.builder().from() requires a non-null instance");

            method = existing.method;
            uri = existing.uri;
            headerParams = existing.headerParams;
            headersMutable = false;
            body = existing.body;
            return this;
        }

        public Request.Builder method(HttpMethod value) {
            method = Preconditions.checkNotNull(value, "method");
            return this;
        }

        public Request.Builder uri(URI value) {
            uri = Preconditions.checkNotNull(value, "uri");
            return this;
        }

        /** Appends a value to the given header. */
        public Request.Builder putHeaderParams(String key, String value) {
            Preconditions.checkArgumentNotNull(key, "Header name must not be null");
            Preconditions.checkArgumentNotNull(value, "Header value must not be null");
            mutableHeaderParams().put(key, value);
            return this;
        }

        /** Replaces all values of the given header with a single value. */
        public Request.Builder header(String key, String value) {
            Preconditions.checkArgumentNotNull(key, "Header name must not be null");
            Preconditions.checkArgumentNotNull(value, "Header value must not be null");
            ListMultimap<String, String> mutable = mutableHeaderParams();
            mutable.removeAll(key);
            mutable.put(key, value);
            return this;
        }

        public Request.Builder putAllHeaderParams(Multimap<String, ? extends String> entries) {
            if (entries.containsKey(null)) {
                throw new SafeIllegalArgumentException("Header name must not be null");
            }
            mutableHeaderParams().putAll(entries);
            return this;
        }

        public Request.Builder body(RequestBody value) {
            body = Optional.of(Preconditions.checkNotNull(value, "body"));
            return this;
        }

        @SuppressWarnings("unchecked")
        public Request.Builder body(Optional<? extends RequestBody> value) {
            body = (Optional<RequestBody>) value;
            return this;
        }

        private ListMultimap<String, String> mutableHeaderParams() {
            if (!headersMutable) {
                headersMutable = true;
                ListMultimap<String, String> mutable =
                        Multimaps.newListMultimap(new TreeMap<>(String.CASE_INSENSITIVE_ORDER), MAP_VALUE_FACTORY);
                if (!headerParams.isEmpty()) {
                    // Outperforms mutable.putAll(headerParams)
                    headerParams.forEach(mutable::put);
                }
                headerParams = mutable;
            }
            return headerParams;
        }

        private ListMultimap<String, String> unmodifiableHeaderParams() {
            return headersMutable ? Multimaps.unmodifiableListMultimap(headerParams) : headerParams;
        }

        public Request build() {
            Request request = new Request(this);
            // Further builder mutation must not leak into the built request
            headersMutable = false;
            return request;
        }
    }
}
