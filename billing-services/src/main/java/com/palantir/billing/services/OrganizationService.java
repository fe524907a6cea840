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
import com.palantir.billing.entities.Organization;
import com.palantir.billing.resources.ResourceCollection;
import java.util.Map;
import javax.annotation.Nullable;

/** Legal entities of the merchant account, at {@code organizations}. */
public final class OrganizationService extends EntityService<Organization> {

    private static final String COLLECTION = "organizations";
    private static final String ID = "organizationId";

    public OrganizationService() {
        super(COLLECTION, ID, Organization.class);
    }

    public OrganizationService(BillingClient client) {
        super(client, COLLECTION, ID, Organization.class);
    }

    public Paginator<Organization> paginator(Map<String, ?> params) {
        return doPaginator(params);
    }

    public ResourceCollection<Organization> search(Map<String, ?> params) {
        return doSearch(params);
    }

    public ResourceCollection<Organization> search() {
        return doSearch(ImmutableMap.of());
    }

    public Organization load(String organizationId, Map<String, ?> params) {
        return doLoad(organizationId, params);
    }

    public Organization load(String organizationId) {
        return doLoad(organizationId, ImmutableMap.of());
    }

    public Organization create(Object data) {
        return doCreate(data, null);
    }

    /** Creates by PUT when {@code organizationId} is given, letting the caller choose the id. */
    public Organization create(Object data, @Nullable String organizationId) {
        return doCreate(data, organizationId);
    }

    public Organization update(String organizationId, Object data) {
        return doPut(organizationId, data);
    }

    public void delete(String organizationId) {
        doDelete(organizationId);
    }
}
