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
import com.palantir.billing.entities.ApiTracking;
import com.palantir.billing.resources.ResourceCollection;
import java.util.Map;

/** Read-only log of API requests made against the account, at {@code tracking/api}. */
public final class ApiTrackingService extends EntityService<ApiTracking> {

    private static final String COLLECTION = "tracking/api";
    private static final String ID = "logId";

    public ApiTrackingService() {
        super(COLLECTION, ID, ApiTracking.class);
    }

    public ApiTrackingService(BillingClient client) {
        super(client, COLLECTION, ID, ApiTracking.class);
    }

    public Paginator<ApiTracking> paginator(Map<String, ?> params) {
        return doPaginator(params);
    }

    public ResourceCollection<ApiTracking> search(Map<String, ?> params) {
        return doSearch(params);
    }

    public ResourceCollection<ApiTracking> search() {
        return doSearch(ImmutableMap.of());
    }

    public ApiTracking load(String logId, Map<String, ?> params) {
        return doLoad(logId, params);
    }

    public ApiTracking load(String logId) {
        return doLoad(logId, ImmutableMap.of());
    }
}
