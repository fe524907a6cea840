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

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.common.net.HttpHeaders;
import com.palantir.billing.Request;
import com.palantir.billing.RequestBody;
import com.palantir.billing.Response;
import com.palantir.billing.Transport;
import com.palantir.billing.TransportException;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeRuntimeException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import javax.annotation.concurrent.ThreadSafe;

/** The default {@link Transport}, sending requests with the JDK {@link HttpClient}. */
@ThreadSafe
public final class HttpClientTransport implements Transport {
    private static final SafeLogger log = SafeLoggerFactory.get(HttpClientTransport.class);

    static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient client;
    private final Duration requestTimeout;

    private HttpClientTransport(HttpClient client, Duration requestTimeout) {
        this.client = Preconditions.checkNotNull(client, "client");
        this.requestTimeout = Preconditions.checkNotNull(requestTimeout, "requestTimeout");
    }

    /** A transport which does not follow redirects, so {@code Location} headers reach the client. */
    public static HttpClientTransport create() {
        return of(
                HttpClient.newBuilder()
                        .followRedirects(HttpClient.Redirect.NEVER)
                        .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
                        .build(),
                DEFAULT_REQUEST_TIMEOUT);
    }

    public static HttpClientTransport of(HttpClient client, Duration requestTimeout) {
        return new HttpClientTransport(client, requestTimeout);
    }

    @Override
    public Response send(Request request) {
        Preconditions.checkArgument(
                request.uri().isAbsolute(), "Request URI must be absolute", UnsafeArg.of("uri", request.uri()));
        HttpRequest.Builder httpRequest = HttpRequest.newBuilder()
                .uri(request.uri())
                .timeout(requestTimeout)
                .method(request.method().name(), toBody(request.body()));

        request.headerParams().forEach(httpRequest::header);
        request.body()
                .filter(ignored -> !request.headerParams().containsKey(HttpHeaders.CONTENT_TYPE))
                .ifPresent(body -> httpRequest.header(HttpHeaders.CONTENT_TYPE, body.contentType()));

        try {
            return toResponse(client.send(httpRequest.build(), HttpResponse.BodyHandlers.ofInputStream()));
        } catch (IOException e) {
            throw new TransportException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(e);
        }
    }

    private static Response toResponse(HttpResponse<InputStream> response) {
        ListMultimap<String, String> headers = MultimapBuilder.treeKeys(String.CASE_INSENSITIVE_ORDER)
                .arrayListValues()
                .build();
        response.headers().map().forEach(headers::putAll);
        return new Response() {
            @Override
            public InputStream body() {
                return response.body();
            }

            @Override
            public int code() {
                return response.statusCode();
            }

            @Override
            public ListMultimap<String, String> headers() {
                return headers;
            }

            @Override
            public void close() {
                try {
                    body().close();
                } catch (IOException e) {
                    log.warn("Failed to close response", SafeArg.of("status", response.statusCode()), e);
                }
            }
        };
    }

    private static HttpRequest.BodyPublisher toBody(Optional<RequestBody> requestBody) {
        if (requestBody.isEmpty()) {
            return HttpRequest.BodyPublishers.noBody();
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (RequestBody body = requestBody.get()) {
            body.writeTo(bytes);
        } catch (IOException e) {
            throw new SafeRuntimeException("Failed to write request body", e);
        }
        return HttpRequest.BodyPublishers.ofByteArray(bytes.toByteArray());
    }

    @Override
    public String toString() {
        return "HttpClientTransport{requestTimeout=" + requestTimeout + '}';
    }
}
