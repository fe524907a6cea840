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

package com.palantir.billing.httpurlconnection;

import com.google.common.collect.Iterables;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.common.collect.Multimaps;
import com.google.common.net.HttpHeaders;
import com.google.common.primitives.Ints;
import com.palantir.billing.HttpMethod;
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
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A blocking {@link Transport} on {@link HttpURLConnection}, for environments without {@code java.net.http}.
 *
 * <p>{@code HttpURLConnection} cannot send PATCH, so PATCH requests are sent as POST carrying an
 * {@code X-HTTP-Method-Override: PATCH} header.
 */
@ThreadSafe
public final class HttpUrlConnectionTransport implements Transport {
    private static final SafeLogger log = SafeLoggerFactory.get(HttpUrlConnectionTransport.class);

    static final String METHOD_OVERRIDE_HEADER = "X-HTTP-Method-Override";
    private static final int CHUNK_SIZE = 1024 * 8;

    private final Duration connectTimeout;
    private final Duration readTimeout;

    private HttpUrlConnectionTransport(Duration connectTimeout, Duration readTimeout) {
        this.connectTimeout = Preconditions.checkNotNull(connectTimeout, "connectTimeout");
        this.readTimeout = Preconditions.checkNotNull(readTimeout, "readTimeout");
    }

    public static HttpUrlConnectionTransport create() {
        return of(Duration.ofSeconds(10), Duration.ofSeconds(60));
    }

    public static HttpUrlConnectionTransport of(Duration connectTimeout, Duration readTimeout) {
        return new HttpUrlConnectionTransport(connectTimeout, readTimeout);
    }

    @Override
    public Response send(Request request) {
        Preconditions.checkArgument(
                request.uri().isAbsolute(), "Request URI must be absolute", UnsafeArg.of("uri", request.uri()));
        try {
            return execute(request);
        } catch (IOException e) {
            throw new TransportException(e);
        }
    }

    private Response execute(Request request) throws IOException {
        HttpURLConnection connection =
                (HttpURLConnection) request.uri().toURL().openConnection();
        if (request.method() == HttpMethod.PATCH) {
            connection.setRequestMethod(HttpMethod.POST.name());
            connection.setRequestProperty(METHOD_OVERRIDE_HEADER, HttpMethod.PATCH.name());
        } else {
            connection.setRequestMethod(request.method().name());
        }

        request.headerParams().forEach(connection::addRequestProperty);

        connection.setConnectTimeout(Ints.checkedCast(connectTimeout.toMillis()));
        connection.setReadTimeout(Ints.checkedCast(readTimeout.toMillis()));

        // Location headers must reach the client
        connection.setInstanceFollowRedirects(false);
        connection.setAllowUserInteraction(false);
        connection.setUseCaches(false);
        connection.setDoOutput(request.body().isPresent());
        connection.setDoInput(true);

        if (request.body().isPresent()) {
            try (RequestBody body = request.body().get()) {
                OptionalLong length = body.contentLength();
                if (length.isPresent()) {
                    connection.setFixedLengthStreamingMode(length.getAsLong());
                } else {
                    connection.setChunkedStreamingMode(CHUNK_SIZE);
                }
                if (!request.headerParams().containsKey(HttpHeaders.CONTENT_TYPE)) {
                    connection.setRequestProperty(HttpHeaders.CONTENT_TYPE, body.contentType());
                }
                try (OutputStream requestBodyStream = connection.getOutputStream()) {
                    body.writeTo(requestBodyStream);
                }
            }
        }
        return new HttpUrlConnectionResponse(connection);
    }

    @Override
    public String toString() {
        return "HttpUrlConnectionTransport{connectTimeout=" + connectTimeout + ", readTimeout=" + readTimeout + '}';
    }

    private static final class HttpUrlConnectionResponse implements Response {

        private final HttpURLConnection connection;
        private final int code;

        @Nullable
        private final String reasonPhrase;

        private final ListMultimap<String, String> headers;

        HttpUrlConnectionResponse(HttpURLConnection connection) throws IOException {
            this.connection = connection;
            // blocks until the response is received
            this.code = connection.getResponseCode();
            this.reasonPhrase = connection.getResponseMessage();
            ListMultimap<String, String> responseHeaders = MultimapBuilder.treeKeys(String.CASE_INSENSITIVE_ORDER)
                    .arrayListValues()
                    .build();
            connection.getHeaderFields().forEach((headerName, headerValues) -> {
                // the status line is reported under a null name
                if (headerName != null) {
                    responseHeaders.putAll(headerName, Iterables.filter(headerValues, Objects::nonNull));
                }
            });
            this.headers = Multimaps.unmodifiableListMultimap(responseHeaders);
        }

        @Override
        public InputStream body() {
            if (code >= 400) {
                InputStream errorStream = connection.getErrorStream();
                return errorStream == null ? new ByteArrayInputStream(new byte[0]) : errorStream;
            }
            try {
                return connection.getInputStream();
            } catch (IOException e) {
                throw new SafeRuntimeException("Failed to read response stream", e, SafeArg.of("status", code));
            }
        }

        @Override
        public int code() {
            return code;
        }

        @Override
        public String reasonPhrase() {
            return reasonPhrase == null || reasonPhrase.isEmpty() ? Response.super.reasonPhrase() : reasonPhrase;
        }

        @Override
        public ListMultimap<String, String> headers() {
            return headers;
        }

        @Override
        public Optional<String> getFirstHeader(String header) {
            return Optional.ofNullable(connection.getHeaderField(header));
        }

        @Override
        public void close() {
            try {
                body().close();
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to close response", SafeArg.of("status", code), e);
            }
        }

        @Override
        public String toString() {
            return "HttpUrlConnectionResponse{code=" + code + '}';
        }
    }
}
