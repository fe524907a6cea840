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

import com.google.common.collect.ImmutableList;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import com.palantir.logsafe.exceptions.SafeRuntimeException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A {@link Transport} answering from canned responses keyed by method and path, recording every request it
 * receives. Paths are matched against the absolute request path, e.g. {@code /v2.1/websites/w-1}.
 */
@ThreadSafe
public final class MockTransport implements Transport {

    private final Map<String, Function<Request, ? extends Response>> stubs = new ConcurrentHashMap<>();
    private final List<Request> requests = new CopyOnWriteArrayList<>();
    private final List<Response> responses = new CopyOnWriteArrayList<>();

    /** Answers every {@code method path} request with a fresh response from {@code response}. */
    public MockTransport on(HttpMethod method, String path, Supplier<? extends Response> response) {
        return on(method, path, request -> response.get());
    }

    public MockTransport on(HttpMethod method, String path, Function<Request, ? extends Response> response) {
        stubs.put(key(method, path), response);
        return this;
    }

    /** Answers {@code method path} with a JSON body. */
    public MockTransport respond(HttpMethod method, String path, int code, String body) {
        return on(method, path, () -> TestResponse.json(code, body));
    }

    @Override
    public Response send(Request request) {
        requests.add(request);
        Function<Request, ? extends Response> stub = stubs.get(key(request.method(), request.uri().getPath()));
        if (stub == null) {
            throw new SafeIllegalStateException(
                    "No response stubbed for request",
                    SafeArg.of("method", request.method()),
                    UnsafeArg.of("uri", request.uri()));
        }
        Response response = stub.apply(request);
        responses.add(response);
        return response;
    }

    public List<Request> requests() {
        return ImmutableList.copyOf(requests);
    }

    public Request lastRequest() {
        if (requests.isEmpty()) {
            throw new SafeIllegalStateException("No requests were sent");
        }
        return requests.get(requests.size() - 1);
    }

    /** The responses handed out so far, in order. */
    public List<Response> responses() {
        return ImmutableList.copyOf(responses);
    }

    /** Reads the body of {@code request} as UTF-8 text. */
    public static Optional<String> bodyText(Request request) {
        return request.body().map(body -> {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            try {
                body.writeTo(out);
            } catch (IOException e) {
                throw new SafeRuntimeException("Failed to write request body", e);
            }
            return out.toString(StandardCharsets.UTF_8);
        });
    }

    private static String key(HttpMethod method, String path) {
        return method + " " + path;
    }
}
