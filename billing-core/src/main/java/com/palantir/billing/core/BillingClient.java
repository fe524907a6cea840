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

package com.palantir.billing.core;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.net.HttpHeaders;
import com.palantir.billing.ConfigurationException;
import com.palantir.billing.HttpMethod;
import com.palantir.billing.Middleware;
import com.palantir.billing.Request;
import com.palantir.billing.Response;
import com.palantir.billing.UriTemplates;
import com.palantir.billing.entities.EntitySchema;
import com.palantir.billing.resources.Pagination;
import com.palantir.billing.resources.Resource;
import com.palantir.billing.resources.ResourceFactory;
import com.palantir.billing.resources.ResourceSchema;
import com.palantir.billing.serde.Encodings;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeUncheckedIoException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Sends requests to the billing API and turns responses into {@link Resource}s.
 *
 * <p>Every call expands a path template, serializes the payload to a JSON object and runs the request through the
 * middleware pipeline: base URI resolution, API key authentication, the configured extra links and finally the
 * transport. Error statuses are raised as {@link com.palantir.billing.RemoteException}s; successful bodies are
 * resolved to a typed resource from the path they belong to. The response is always closed.
 *
 * <p>Instances are safe for concurrent use when their transport is.
 */
@ThreadSafe
public final class BillingClient {
    private static final SafeLogger log = SafeLoggerFactory.get(BillingClient.class);

    public static final String CURRENT_VERSION = "v2.1";

    private final Middleware.Next pipeline;
    private final ResourceFactory resourceFactory;

    public BillingClient(ClientConfiguration config) {
        this(config, EntitySchema.defaultSchema());
    }

    public BillingClient(ClientConfiguration config, ResourceSchema schema) {
        Preconditions.checkNotNull(config, "config");
        String apiKey = config.apiKey()
                .filter(key -> !Strings.isNullOrEmpty(key.trim()))
                .orElseThrow(() -> new ConfigurationException("An API key is required"));

        MiddlewareChain chain = new MiddlewareChain()
                .attach(BaseUriMiddleware.of(config.baseUrl().orElse(ClientConfiguration.BASE_HOST), CURRENT_VERSION))
                .attach(new ApiKeyAuthenticationMiddleware(apiKey));
        config.middleware().forEach(chain::attach);
        this.pipeline = chain.bind(config.transport().orElseGet(HttpClientTransport::create));
        this.resourceFactory = new ResourceFactory(schema);
    }

    /**
     * Sends one request.
     *
     * @param payload serialized as a JSON object; POST, PUT and PATCH always send one, DELETE only when given,
     *     and GET and HEAD drop it
     * @param pathTemplate a path relative to the API root, with {@code {name}} placeholders
     * @param params fill placeholders by name; the others become query parameters
     * @param headers added to the request; {@code Content-Type} is always {@code application/json}
     * @return the resolved resource, or {@code null} for HEAD and DELETE
     */
    @Nullable
    public Resource send(
            HttpMethod method,
            @Nullable Object payload,
            String pathTemplate,
            Map<String, ?> params,
            Map<String, String> headers) {
        Preconditions.checkNotNull(method, "method");
        Preconditions.checkNotNull(pathTemplate, "pathTemplate");
        Map<String, Object> query = params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
        if (payload != null && !method.permitsRequestBody()) {
            log.debug("Dropping payload of a request without body", SafeArg.of("method", method));
        }

        Request.Builder request = Request.builder().method(method).uri(UriTemplates.build(pathTemplate, query));
        if (headers != null) {
            headers.forEach(request::header);
        }
        request.header(HttpHeaders.CONTENT_TYPE, Encodings.JSON_CONTENT_TYPE);
        if (method.requiresRequestBody() || (payload != null && method.permitsRequestBody())) {
            request.body(Encodings.jsonObject(payload));
        }
        return execute(request.build());
    }

    private Resource execute(Request request) {
        try (Response response = pipeline.proceed(request)) {
            if (ErrorDecoder.INSTANCE.isError(response)) {
                throw ErrorDecoder.INSTANCE.decode(response);
            }
            if (request.method().discardsResponseBody()) {
                return null;
            }
            String path = resolvedPath(request, response);
            Object body = decode(response);
            return resourceFactory.create(path, body, Pagination.fromHeaders(response.headers()));
        }
    }

    private static String resolvedPath(Request request, Response response) {
        Optional<String> location = response.getFirstHeader(HttpHeaders.LOCATION);
        if (location.isPresent()) {
            try {
                String path = URI.create(location.get()).getPath();
                if (!Strings.isNullOrEmpty(path)) {
                    return path;
                }
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring malformed Location header", UnsafeArg.of("location", location.get()), e);
            }
        }
        return request.uri().getPath();
    }

    private static Object decode(Response response) {
        try {
            return Encodings.decode(response.body());
        } catch (IOException e) {
            throw new SafeUncheckedIoException("Failed to decode response body", e, SafeArg.of("status", response.code()));
        }
    }

    @Nullable
    public Resource get(String pathTemplate) {
        return get(pathTemplate, ImmutableMap.of());
    }

    @Nullable
    public Resource get(String pathTemplate, Map<String, ?> params) {
        return get(pathTemplate, params, ImmutableMap.of());
    }

    @Nullable
    public Resource get(String pathTemplate, Map<String, ?> params, Map<String, String> headers) {
        return send(HttpMethod.GET, null, pathTemplate, params, headers);
    }

    public void head(String pathTemplate) {
        head(pathTemplate, ImmutableMap.of());
    }

    public void head(String pathTemplate, Map<String, ?> params) {
        head(pathTemplate, params, ImmutableMap.of());
    }

    public void head(String pathTemplate, Map<String, ?> params, Map<String, String> headers) {
        send(HttpMethod.HEAD, null, pathTemplate, params, headers);
    }

    @Nullable
    public Resource post(@Nullable Object payload, String pathTemplate) {
        return post(payload, pathTemplate, ImmutableMap.of());
    }

    @Nullable
    public Resource post(@Nullable Object payload, String pathTemplate, Map<String, ?> params) {
        return post(payload, pathTemplate, params, ImmutableMap.of());
    }

    @Nullable
    public Resource post(
            @Nullable Object payload, String pathTemplate, Map<String, ?> params, Map<String, String> headers) {
        return send(HttpMethod.POST, payload, pathTemplate, params, headers);
    }

    @Nullable
    public Resource put(@Nullable Object payload, String pathTemplate) {
        return put(payload, pathTemplate, ImmutableMap.of());
    }

    @Nullable
    public Resource put(@Nullable Object payload, String pathTemplate, Map<String, ?> params) {
        return put(payload, pathTemplate, params, ImmutableMap.of());
    }

    @Nullable
    public Resource put(
            @Nullable Object payload, String pathTemplate, Map<String, ?> params, Map<String, String> headers) {
        return send(HttpMethod.PUT, payload, pathTemplate, params, headers);
    }

    @Nullable
    public Resource patch(@Nullable Object payload, String pathTemplate) {
        return patch(payload, pathTemplate, ImmutableMap.of());
    }

    @Nullable
    public Resource patch(@Nullable Object payload, String pathTemplate, Map<String, ?> params) {
        return patch(payload, pathTemplate, params, ImmutableMap.of());
    }

    @Nullable
    public Resource patch(
            @Nullable Object payload, String pathTemplate, Map<String, ?> params, Map<String, String> headers) {
        return send(HttpMethod.PATCH, payload, pathTemplate, params, headers);
    }

    public void delete(String pathTemplate) {
        delete(pathTemplate, ImmutableMap.of());
    }

    public void delete(String pathTemplate, Map<String, ?> params) {
        delete(pathTemplate, params, ImmutableMap.of());
    }

    public void delete(String pathTemplate, Map<String, ?> params, Map<String, String> headers) {
        send(HttpMethod.DELETE, null, pathTemplate, params, headers);
    }

    @Override
    public String toString() {
        return "BillingClient{version=" + CURRENT_VERSION + '}';
    }
}
