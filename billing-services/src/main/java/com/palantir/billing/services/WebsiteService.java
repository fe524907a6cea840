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
import com.palantir.billing.entities.Website;
import com.palantir.billing.resources.ResourceCollection;
import java.util.Map;
import javax.annotation.Nullable;

/** Websites the merchant sells through, at {@code websites}. */
public final class WebsiteService extends EntityService<Website> {

    private static final String COLLECTION = "websites";
    private static final String ID = "websiteId";

    public WebsiteService() {
        super(COLLECTION, ID, Website.class);
    }

    public WebsiteService(BillingClient client) {
        super(client, COLLECTION, ID, Website.class);
    }

    public Paginator<Website> paginator(Map<String, ?> params) {
        return doPaginator(params);
    }

    public ResourceCollection<Website> search(Map<String, ?> params) {
        return doSearch(params);
    }

    public ResourceCollection<Website> search() {
        return doSearch(ImmutableMap.of());
    }

    public Website load(String websiteId, Map<String, ?> params) {
        return doLoad(websiteId, params);
    }

    public Website load(String websiteId) {
        return doLoad(websiteId, ImmutableMap.of());
    }

    public Website create(Object data) {
        return doCreate(data, null);
    }

    /** Creates by PUT when {@code websiteId} is given, letting the caller choose the id. */
    public Website create(Object data, @Nullable String websiteId) {
        return doCreate(data, websiteId);
    }

    public Website update(String websiteId, Object data) {
        return doPut(websiteId, data);
    }

    public void delete(String websiteId) {
        doDelete(websiteId);
    }
}
