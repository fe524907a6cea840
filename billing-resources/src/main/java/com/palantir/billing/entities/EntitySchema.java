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

package com.palantir.billing.entities;

import com.palantir.billing.resources.ResourceBinding;
import com.palantir.billing.resources.ResourceSchema;

/** The resource paths of the billing API with a typed entity. */
public final class EntitySchema {

    private static final ResourceSchema DEFAULT = ResourceSchema.builder()
            .resource("bank-accounts", BankAccount::new)
            .bind("bank-accounts/*/deactivation", ResourceBinding.item(BankAccount::new))
            .resource("websites", Website::new)
            .resource("lead-sources", LeadSource::new)
            .resource("organizations", Organization::new)
            .resource("checkout-pages", CheckoutPage::new)
            .resource("tracking/api", ApiTracking::new)
            .build();

    private EntitySchema() {}

    public static ResourceSchema defaultSchema() {
        return DEFAULT;
    }
}
