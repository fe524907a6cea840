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

import com.palantir.billing.Middleware;
import com.palantir.billing.Request;
import com.palantir.billing.Response;
import com.palantir.logsafe.Preconditions;

/** Authenticates every request with the account's secret API key. */
final class ApiKeyAuthenticationMiddleware implements Middleware {

    static final String HEADER = "REB-APIKEY";

    private final String apiKey;

    ApiKeyAuthenticationMiddleware(String apiKey) {
        this.apiKey = Preconditions.checkNotNull(apiKey, "apiKey");
    }

    @Override
    public Response handle(Request request, Next next) {
        return next.proceed(Request.builder().from(request).header(HEADER, apiKey).build());
    }

    @Override
    public String toString() {
        return "ApiKeyAuthenticationMiddleware{}";
    }
}
