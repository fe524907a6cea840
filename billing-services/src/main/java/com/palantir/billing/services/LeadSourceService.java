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

package com.palantir.billing.services;

import com.google.common.collect.ImmutableMap;
import com.palantir.billing.core.BillingClient;
import com.palantir.billing.entities.LeadSource;
import com.palantir.billing.resources.ResourceCollection;
import java.util.Map;

/** Marketing attribution of customers, at {@code lead-sources}. */
public final class LeadSourceService extends EntityService<LeadSource> {

    private static final String COLLECTION = "lead-sources";
    private static final String ID = "leadSourceId";

    public LeadSourceService() {
        super(COLLECTION, ID, LeadSource.class);
    }

    public LeadSourceService(BillingClient client) {
        super(client, COLLECTION, ID, LeadSource.class);
    }

    public Paginator<LeadSource> paginator(Map<String, ?> params) {
        return doPaginator(params);
    }

    public ResourceCollection<LeadSource> search(Map<String, ?> params) {
        return doSearch(params);
    }

    public ResourceCollection<LeadSource> search() {
        return doSearch(ImmutableMap.of());
    }

    public LeadSource load(String leadSourceId, Map<String, ?> params) {
        return doLoad(leadSourceId, params);
    }

    public LeadSource load(String leadSourceId) {
        return doLoad(leadSourceId, ImmutableMap.of());
    }

    public LeadSource create(Object data) {
        return doCreate(data, null);
    }
}
