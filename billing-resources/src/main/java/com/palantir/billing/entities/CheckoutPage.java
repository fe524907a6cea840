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

/** A hosted page selling one plan on a website. */
public final class CheckoutPage extends Entity {

    public CheckoutPage() {}

    public CheckoutPage(Map<String, ?> data) {
        super(data);
    }

    @Nullable
    public String getName() {
        return getString("name");
    }

    public CheckoutPage setName(String value) {
        setAttribute("name", value);
        return this;
    }

    /** Path of the page below the website's checkout URI. */
    @Nullable
    public String getUriPath() {
        return getString("uriPath");
    }

    public CheckoutPage setUriPath(String value) {
        setAttribute("uriPath", value);
        return this;
    }

    @Nullable
    public String getPlanId() {
        return getString("planId");
    }

    public CheckoutPage setPlanId(String value) {
        setAttribute("planId", value);
        return this;
    }

    @Nullable
    public String getWebsiteId() {
        return getString("websiteId");
    }

    public CheckoutPage setWebsiteId(String value) {
        setAttribute("websiteId", value);
        return this;
    }

    @Nullable
    public String getRedirectUrl() {
        return getString("redirectUrl");
    }

    public CheckoutPage setRedirectUrl(String value) {
        setAttribute("redirectUrl", value);
        return this;
    }

    /** Seconds to wait on the thank-you page before redirecting. */
    @Nullable
    public Integer getRedirectTimeout() {
        return getInteger("redirectTimeout");
    }

    public CheckoutPage setRedirectTimeout(int value) {
        setAttribute("redirectTimeout", value);
        return this;
    }

    @Nullable
    public Boolean getIsActive() {
        return getBoolean("isActive");
    }

    public CheckoutPage setIsActive(boolean value) {
        setAttribute("isActive", value);
        return this;
    }

    @Nullable
    public Boolean getAllowCustomCustomerId() {
        return getBoolean("allowCustomCustomerId");
    }

    public CheckoutPage setAllowCustomCustomerId(boolean value) {
        setAttribute("allowCustomCustomerId", value);
        return this;
    }

    @Nullable
    public String getCreatedTime() {
        return getString("createdTime");
    }
}
