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

import com.palantir.billing.resources.Entity;
import java.util.Map;
import javax.annotation.Nullable;

/** A customer's bank account used as an ACH payment instrument. */
public final class BankAccount extends Entity {

    public BankAccount() {}

    public BankAccount(Map<String, ?> data) {
        super(data);
    }

    @Nullable
    public String getCustomerId() {
        return getString("customerId");
    }

    public BankAccount setCustomerId(String value) {
        setAttribute("customerId", value);
        return this;
    }

    @Nullable
    public String getBankName() {
        return getString("bankName");
    }

    public BankAccount setBankName(String value) {
        setAttribute("bankName", value);
        return this;
    }

    @Nullable
    public String getRoutingNumber() {
        return getString("routingNumber");
    }

    public BankAccount setRoutingNumber(String value) {
        setAttribute("routingNumber", value);
        return this;
    }

    /** Only sent on create; the API reports {@link #getLast4()} instead. */
    public BankAccount setAccountNumber(String value) {
        setAttribute("accountNumber", value);
        return this;
    }

    @Nullable
    public String getAccountType() {
        return getString("accountType");
    }

    public BankAccount setAccountType(String value) {
        setAttribute("accountType", value);
        return this;
    }

    /** Payment token to create the account from, in place of raw account details. */
    public BankAccount setToken(String value) {
        setAttribute("token", value);
        return this;
    }

    @Nullable
    public String getLast4() {
        return getString("last4");
    }

    @Nullable
    public String getStatus() {
        return getString("status");
    }

    @Nullable
    public String getCreatedTime() {
        return getString("createdTime");
    }

    @Nullable
    public String getUpdatedTime() {
        return getString("updatedTime");
    }
}
