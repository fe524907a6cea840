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
import com.palantir.billing.entities.CheckoutPage;
import com.palantir.billing.resources.ResourceCollection;
import java.util.Map;
import javax.annotation.Nullable;

/** Hosted checkout pages, at {@code checkout-pages}. */
public final class CheckoutPageService extends EntityService<CheckoutPage> {

    private static final String COLLECTION = "checkout-pages";
    private static final String ID = "checkoutPageId";

    public CheckoutPageService() {
        super(COLLECTION, ID, CheckoutPage.class);
    }

    public CheckoutPageService(BillingClient client) {
        super(client, COLLECTION, ID, CheckoutPage.class);
    }

    public Paginator<CheckoutPage> paginator(Map<String, ?> params) {
        return doPaginator(params);
    }

    public ResourceCollection<CheckoutPage> search(Map<String, ?> params) {
        return doSearch(params);
    }

    public ResourceCollection<CheckoutPage> search() {
        return doSearch(ImmutableMap.of());
    }

    public CheckoutPage load(String checkoutPageId, Map<String, ?> params) {
        return doLoad(checkoutPageId, params);
    }

    public CheckoutPage load(String checkoutPageId) {
        return doLoad(checkoutPageId, ImmutableMap.of());
    }

    public CheckoutPage create(Object data) {
        return doCreate(data, null);
    }

    /** Creates by PUT when {@code checkoutPageId} is given, letting the caller choose the id. */
    public CheckoutPage create(Object data, @Nullable String checkoutPageId) {
        return doCreate(data, checkoutPageId);
    }

    public CheckoutPage update(String checkoutPageId, Object data) {
        return doPut(checkoutPageId, data);
    }

    public void delete(String checkoutPageId) {
        doDelete(checkoutPageId);
    }
}
