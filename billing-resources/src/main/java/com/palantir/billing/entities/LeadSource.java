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

/** Marketing attribution of a customer: where and how they were acquired. */
public final class LeadSource extends Entity {

    public LeadSource() {}

    public LeadSource(Map<String, ?> data) {
        super(data);
    }

    @Nullable
    public String getCustomerId() {
        return getString("customerId");
    }

    public LeadSource setCustomerId(String value) {
        setAttribute("customerId", value);
        return this;
    }

    @Nullable
    public String getMedium() {
        return getString("medium");
    }

    public LeadSource setMedium(String value) {
        setAttribute("medium", value);
        return this;
    }

    @Nullable
    public String getSource() {
        return getString("source");
    }

    public LeadSource setSource(String value) {
        setAttribute("source", value);
        return this;
    }

    @Nullable
    public String getCampaign() {
        return getString("campaign");
    }

    public LeadSource setCampaign(String value) {
        setAttribute("campaign", value);
        return this;
    }

    @Nullable
    public String getTerm() {
        return getString("term");
    }

    public LeadSource setTerm(String value) {
        setAttribute("term", value);
        return this;
    }

    @Nullable
    public String getContent() {
        return getString("content");
    }

    public LeadSource setContent(String value) {
        setAttribute("content", value);
        return this;
    }

    @Nullable
    public String getAffiliate() {
        return getString("affiliate");
    }

    public LeadSource setAffiliate(String value) {
        setAttribute("affiliate", value);
        return this;
    }

    @Nullable
    public String getClickId() {
        return getString("clickId");
    }

    public LeadSource setClickId(String value) {
        setAttribute("clickId", value);
        return this;
    }

    @Nullable
    public String getReferrer() {
        return getString("referrer");
    }

    public LeadSource setReferrer(String value) {
        setAttribute("referrer", value);
        return this;
    }

    @Nullable
    public String getCreatedTime() {
        return getString("createdTime");
    }
}
