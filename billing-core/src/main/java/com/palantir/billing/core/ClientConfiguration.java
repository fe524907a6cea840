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

import com.palantir.billing.BillingImmutablesStyle;
import com.palantir.billing.Middleware;
import com.palantir.billing.Transport;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/** Settings a {@link BillingClient} is built from. Only {@link #apiKey()} is required. */
@Value.Immutable
@BillingImmutablesStyle
public interface ClientConfiguration {

    String BASE_HOST = "https://api.rebilly.com";
    String SANDBOX_HOST = "https://api-sandbox.rebilly.com";

    /** The account's secret API key, sent with every request. */
    @Value.Redacted
    Optional<String> apiKey();

    /** Scheme and host of the API, {@link #BASE_HOST} when absent. */
    Optional<String> baseUrl();

    /** Defaults to an {@link HttpClientTransport} which does not follow redirects. */
    Optional<Transport> transport();

    /** Links run after the base URI and credentials are applied, in order, before the transport. */
    List<Middleware> middleware();

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableClientConfiguration.Builder {}
}
