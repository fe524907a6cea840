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

import com.palantir.billing.MockTransport;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public final class ClientsTest {

    @AfterEach
    public void after() {
        Clients.reset();
    }

    @Test
    public void noDefaultUntilSet() {
        assertThatThrownBy(Clients::getDefault).isInstanceOf(SafeIllegalStateException.class);
    }

    @Test
    public void constructingAClientDoesNotRegisterIt() {
        newClient();
        assertThatThrownBy(Clients::getDefault).isInstanceOf(SafeIllegalStateException.class);
    }

    @Test
    public void setAndReset() {
        BillingClient client = newClient();
        Clients.setDefault(client);
        assertThat(Clients.getDefault()).isSameAs(client);

        Clients.reset();
        assertThatThrownBy(Clients::getDefault).isInstanceOf(SafeIllegalStateException.class);
    }

    private static BillingClient newClient() {
        return new BillingClient(ClientConfiguration.builder()
                .apiKey("key")
                .transport(new MockTransport())
                .build());
    }
}
