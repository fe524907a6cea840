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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.palantir.billing.HttpMethod;
import com.palantir.billing.Middleware;
import com.palantir.billing.Request;
import com.palantir.billing.Response;
import com.palantir.billing.TestResponse;
import com.palantir.billing.Transport;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public final class MiddlewareChainTest {

    private static final Request REQUEST =
            Request.builder().method(HttpMethod.GET).uri(URI.create("websites")).build();

    @Mock
    private Transport transport;

    private final List<String> events = new ArrayList<>();

    @Test
    public void firstAttachedRunsFirstAndSeesResponseLast() {
        when(transport.send(any())).thenAnswer(invocation -> {
            events.add("transport");
            return new TestResponse();
        });
        Middleware.Next pipeline = new MiddlewareChain()
                .attach(recording("a"))
                .attach(recording("b"))
                .attach(recording("c"))
                .bind(transport);

        pipeline.proceed(REQUEST);

        assertThat(events).containsExactly("a>", "b>", "c>", "transport", "<c", "<b", "<a");
    }

    @Test
    public void linksMayRewriteTheRequest() {
        TestResponse response = new TestResponse();
        when(transport.send(any())).thenReturn(response);
        Middleware.Next pipeline = new MiddlewareChain()
                .attach((request, next) ->
                        next.proceed(Request.builder().from(request).header("X-Trace", "1").build()))
                .bind(transport);

        assertThat(pipeline.proceed(REQUEST)).isSameAs(response);
        verify(transport).send(Request.builder().from(REQUEST).header("X-Trace", "1").build());
    }

    @Test
    public void linksMayShortCircuit() {
        TestResponse cached = new TestResponse().code(304);
        Middleware.Next pipeline = new MiddlewareChain()
                .attach((request, next) -> cached)
                .attach(recording("never"))
                .bind(transport);

        assertThat(pipeline.proceed(REQUEST)).isSameAs(cached);
        assertThat(events).isEmpty();
        verifyNoInteractions(transport);
    }

    @Test
    public void emptyChainCallsTransport() {
        TestResponse response = new TestResponse();
        when(transport.send(REQUEST)).thenReturn(response);
        assertThat(new MiddlewareChain().bind(transport).proceed(REQUEST)).isSameAs(response);
    }

    @Test
    public void bindingSnapshotsTheLinks() {
        when(transport.send(any())).thenReturn(new TestResponse());
        MiddlewareChain chain = new MiddlewareChain().attach(recording("a"));
        Middleware.Next pipeline = chain.bind(transport);
        chain.attach(recording("late"));

        pipeline.proceed(REQUEST);

        assertThat(events).containsExactly("a>", "<a");
    }

    @Test
    public void chainsNest() {
        when(transport.send(any())).thenReturn(new TestResponse());
        MiddlewareChain inner = new MiddlewareChain().attach(recording("inner"));
        Middleware.Next pipeline = new MiddlewareChain()
                .attach(recording("outer"))
                .attach(inner)
                .attach(recording("last"))
                .bind(transport);

        pipeline.proceed(REQUEST);

        assertThat(events).containsExactly("outer>", "inner>", "last>", "<last", "<inner", "<outer");
    }

    private Middleware recording(String name) {
        return (request, next) -> {
            events.add(name + ">");
            Response response = next.proceed(request);
            events.add("<" + name);
            return response;
        };
    }
}
