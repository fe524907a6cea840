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

package com.palantir.billing.resources;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Reads hypermedia links, either {@code [{"rel": "self", "href": ...}]} or {@code {"self": {"href": ...}}}. */
final class Links {

    private static final String SELF = "self";

    private Links() {}

    static Optional<String> selfHref(Map<?, ?> data) {
        Object links = data.get(Entity.LINKS);
        if (links instanceof List) {
            for (Object link : (List<?>) links) {
                if (link instanceof Map && SELF.equals(((Map<?, ?>) link).get("rel"))) {
                    return href((Map<?, ?>) link);
                }
            }
        } else if (links instanceof Map) {
            Object self = ((Map<?, ?>) links).get(SELF);
            if (self instanceof Map) {
                return href((Map<?, ?>) self);
            }
        }
        return Optional.empty();
    }

    private static Optional<String> href(Map<?, ?> link) {
        Object href = link.get("href");
        return href instanceof String ? Optional.of((String) href) : Optional.empty();
    }
}
