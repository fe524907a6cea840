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

/** The legal entity a merchant account bills under. */
public final class Organization extends Entity {

    public Organization() {}

    public Organization(Map<String, ?> data) {
        super(data);
    }

    @Nullable
    public String getName() {
        return getString("name");
    }

    public Organization setName(String value) {
        setAttribute("name", value);
        return this;
    }

    @Nullable
    public String getAddress() {
        return getString("address");
    }

    public Organization setAddress(String value) {
        setAttribute("address", value);
        return this;
    }

    @Nullable
    public String getCity() {
        return getString("city");
    }

    public Organization setCity(String value) {
        setAttribute("city", value);
        return this;
    }

    @Nullable
    public String getRegion() {
        return getString("region");
    }

    public Organization setRegion(String value) {
        setAttribute("region", value);
        return this;
    }

    /** ISO 3166 alpha-2 country code. */
    @Nullable
    public String getCountry() {
        return getString("country");
    }

    public Organization setCountry(String value) {
        setAttribute("country", value);
        return this;
    }

    @Nullable
    public String getPostalCode() {
        return getString("postalCode");
    }

    public Organization setPostalCode(String value) {
        setAttribute("postalCode", value);
        return this;
    }

    @Nullable
    public String getCreatedTime() {
        return getString("createdTime");
    }
}
