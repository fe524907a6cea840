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

import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Process-wide default {@link BillingClient}, for code which cannot pass a client explicitly. Nothing registers
 * itself here; applications call {@link #setDefault} once at startup.
 */
@ThreadSafe
public final class Clients {

    private static final AtomicReference<BillingClient> DEFAULT = new AtomicReference<>();

    private Clients() {}

    public static void setDefault(BillingClient client) {
        DEFAULT.set(Preconditions.checkNotNull(client, "client"));
    }

    /** @throws SafeIllegalStateException if no default client was set */
    public static BillingClient getDefault() {
        BillingClient client = DEFAULT.get();
        if (client == null) {
            throw new SafeIllegalStateException("No default billing client has been set");
        }
        return client;
    }

    /** Clears the default client. */
    public static void reset() {
        DEFAULT.set(null);
    }
}
