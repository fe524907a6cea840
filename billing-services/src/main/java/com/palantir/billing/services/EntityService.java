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
import com.palantir.billing.resources.Entity;
import com.palantir.billing.resources.ResourceCollection;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Operations shared by services of one collection path, e.g. {@code websites} with items at
 * {@code websites/{websiteId}}. Subclasses publish the subset their resource supports.
 */
abstract class EntityService<T extends Entity> extends Service {

    private final String collectionPath;
    private final String idName;
    private final String itemPath;
    private final Class<T> type;

    EntityService(String collectionPath, String idName, Class<T> type) {
        this.collectionPath = collectionPath;
        this.idName = idName;
        this.itemPath = collectionPath + "/{" + idName + "}";
        this.type = type;
    }

    EntityService(BillingClient client, String collectionPath, String idName, Class<T> type) {
        super(client);
        this.collectionPath = collectionPath;
        this.idName = idName;
        this.itemPath = collectionPath + "/{" + idName + "}";
        this.type = type;
    }

    final String itemPath() {
        return itemPath;
    }

    final Map<String, Object> idParam(String id) {
        return withParam(idName, id, ImmutableMap.of());
    }

    final Class<T> type() {
        return type;
    }

    final Paginator<T> doPaginator(Map<String, ?> params) {
        return new Paginator<>(client(), collectionPath, params, type);
    }

    final ResourceCollection<T> doSearch(Map<String, ?> params) {
        return collection(client().get(collectionPath, params), type);
    }

    final T doLoad(String id, Map<String, ?> params) {
        return entity(client().get(itemPath, withParam(idName, id, params)), type);
    }

    /** Creates with a server-assigned id by POST, or with the given id by PUT. */
    final T doCreate(@Nullable Object data, @Nullable String id) {
        if (id != null) {
            return doPut(id, data);
        }
        return entity(client().post(data, collectionPath), type);
    }

    final T doPut(String id, @Nullable Object data) {
        return entity(client().put(data, itemPath, idParam(id)), type);
    }

    final T doPatch(String id, @Nullable Object data) {
        return entity(client().patch(data, itemPath, idParam(id)), type);
    }

    final void doDelete(String id) {
        client().delete(itemPath, idParam(id));
    }
}
