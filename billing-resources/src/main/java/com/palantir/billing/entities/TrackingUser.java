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

public final class TrackingUser extends Entity {

    public TrackingUser(Map<String, ?> data) {
        super(data);
    }

    @Nullable
    public String getEmail() {
        return getString("email");
    }

    @Nullable
    public String getFirstName() {
        return getString("firstName");
    }

    @Nullable
    public String getLastName() {
        return getString("lastName");
    }
}
