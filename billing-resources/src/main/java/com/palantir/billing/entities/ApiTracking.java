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
import java.util.Optional;
import javax.annotation.Nullable;

/** A logged call to the billing API, read-only. */
public final class ApiTracking extends Entity {

    public ApiTracking() {}

    public ApiTracking(Map<String, ?> data) {
        super(data);
    }

    /** HTTP status the API answered with. */
    @Nullable
    public Integer getStatus() {
        return getInteger("status");
    }

    @Nullable
    public String getUrl() {
        return getString("url");
    }

    @Nullable
    public String getRoute() {
        return getString("route");
    }

    @Nullable
    public String getMethod() {
        return getString("method");
    }

    @Nullable
    public String getRequest() {
        return getString("request");
    }

    @Nullable
    public String getResponse() {
        return getString("response");
    }

    /** The user who made the call, when the API embedded it. */
    public Optional<TrackingUser> getUser() {
        return embedded("user", TrackingUser::new);
    }

    /** Milliseconds the API took to answer. */
    @Nullable
    public Integer getDuration() {
        return getInteger("duration");
    }

    @Nullable
    public String getCreatedTime() {
        return getString("createdTime");
    }
}
