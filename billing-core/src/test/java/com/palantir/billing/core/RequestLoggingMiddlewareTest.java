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
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.google.common.base.Ticker;
import com.palantir.billing.HttpMethod;
import com.palantir.billing.Middleware;
import com.palantir.billing.Request;
import com.palantir.billing.TestResponse;
import com.palantir.billing.TransportException;
import java.net.ConnectException;
import java.net.URI;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public final class RequestLoggingMiddlewareTest {

    private static final Request REQUEST = Request.builder()
            .method(HttpMethod.GET)
            .uri(URI.create("https://api.rebilly.com/v2.1/websites"))
            .build();

    @Mock
    private Middleware.Next next;

    @Mock
    private Ticker ticker;

    @Test
    public void passesResponseThrough() {
        TestResponse response = new TestResponse().code(201);
        when(next.proceed(REQUEST)).thenReturn(response);
        when(ticker.read()).thenReturn(0L, 5_000_000L);

        assertThat(new RequestLoggingMiddleware(ticker).handle(REQUEST, next)).isSameAs(response);
        assertThat(response.isClosed()).isFalse();
    }

    @Test
    public void rethrowsFailures() {
        TransportException failure = new TransportException(new ConnectException("refused"));
        when(next.proceed(REQUEST)).thenThrow(failure);

        assertThatThrownBy(() -> new RequestLoggingMiddleware().handle(REQUEST, next)).isSameAs(failure);
    }
}
