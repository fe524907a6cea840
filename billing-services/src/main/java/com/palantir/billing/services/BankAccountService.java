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
import com.palantir.billing.entities.BankAccount;
import com.palantir.billing.resources.Entity;
import com.palantir.billing.resources.ResourceCollection;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/** Bank accounts of customers, at {@code bank-accounts}. */
public final class BankAccountService extends EntityService<BankAccount> {

    private static final String COLLECTION = "bank-accounts";
    private static final String ID = "bankAccountId";

    public BankAccountService() {
        super(COLLECTION, ID, BankAccount.class);
    }

    public BankAccountService(BillingClient client) {
        super(client, COLLECTION, ID, BankAccount.class);
    }

    public Paginator<BankAccount> paginator(Map<String, ?> params) {
        return doPaginator(params);
    }

    public ResourceCollection<BankAccount> search(Map<String, ?> params) {
        return doSearch(params);
    }

    public ResourceCollection<BankAccount> search() {
        return doSearch(ImmutableMap.of());
    }

    public BankAccount load(String bankAccountId, Map<String, ?> params) {
        return doLoad(bankAccountId, params);
    }

    public BankAccount load(String bankAccountId) {
        return doLoad(bankAccountId, ImmutableMap.of());
    }

    public BankAccount create(Object data) {
        return doCreate(data, null);
    }

    public BankAccount create(Object data, @Nullable String bankAccountId) {
        return doCreate(data, bankAccountId);
    }

    /** Creates an account from a payment token, with {@code data} carrying the remaining attributes. */
    public BankAccount createFromToken(String token, @Nullable Object data, @Nullable String bankAccountId) {
        Preconditions.checkNotNull(token, "token");
        Map<String, Object> payload = toMap(data);
        payload.put("token", token);
        return doCreate(payload, bankAccountId);
    }

    public BankAccount createFromToken(String token, @Nullable Object data) {
        return createFromToken(token, data, null);
    }

    public BankAccount update(String bankAccountId, Object data) {
        return doPatch(bankAccountId, data);
    }

    public BankAccount deactivate(String bankAccountId) {
        return entity(
                client().post(ImmutableMap.of(), itemPath() + "/deactivation", idParam(bankAccountId)), type());
    }

    private static Map<String, Object> toMap(@Nullable Object data) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (data == null) {
            return payload;
        }
        if (data instanceof Entity) {
            payload.putAll(((Entity) data).toJson());
        } else if (data instanceof Map) {
            ((Map<?, ?>) data).forEach((key, value) -> payload.put(String.valueOf(key), value));
        } else {
            throw new SafeIllegalArgumentException(
                    "Token payload must be an entity or a map",
                    SafeArg.of("type", data.getClass().getSimpleName()));
        }
        return payload;
    }
}
