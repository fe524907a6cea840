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

import com.palantir.billing.AbstractTransportTest;
import com.palantir.billing.HttpMethod;
import com.palantir.billing.Request;
import com.palantir.billing.Response;
import com.palantir.billing.Transport;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.net.URI;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.Test;

public final class HttpClientTransportTest extends AbstractTransportTest {

    @Override
    protected Transport createTransport() {
        return HttpClientTransport.create();
    }

    @Test
    public void sendsPatch() throws Exception {
        server.enqueue(new MockResponse().setBody(JSON));

        try (Response response = transport.send(Request.builder()
                .method(HttpMethod.PATCH)
                .uri(uri("/v2.1/bank-accounts/ba-1"))
                .body(jsonBody("{\"bankName\":\"Second\"}"))
                .build())) {
            assertThat(response.code()).isEqualTo(200);
        }

        RecordedRequest recorded = takeRequest();
        assertThat(recorded.getMethod()).isEqualTo("PATCH");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"bankName\":\"Second\"}");
    }

    @Test
    public void reportsStandardReasonPhrase() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(409));
        try (Response response = transport.send(get("/v2.1/websites"))) {
            assertThat(response.reasonPhrase()).isEqualTo("Conflict");
        }
    }

    @Test
    public void rejectsRelativeUris() {
        assertThatThrownBy(() -> transport.send(Request.builder()
                        .method(HttpMethod.GET)
                        .uri(URI.create("websites"))
                        .build()))
                .isInstanceOf(SafeIllegalArgumentException.class);
    }
}
