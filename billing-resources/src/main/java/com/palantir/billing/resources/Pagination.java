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

import com.google.common.collect.ListMultimap;
import com.google.common.primitives.Longs;
import com.palantir.billing.BillingImmutablesStyle;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.immutables.value.Value;

/** Position of a page within a collection, as reported by the API. */
@Value.Immutable
@BillingImmutablesStyle
public interface Pagination {

    String TOTAL_HEADER = "Pagination-Total";
    String OFFSET_HEADER = "Pagination-Offset";
    String LIMIT_HEADER = "Pagination-Limit";

    OptionalLong total();

    OptionalLong offset();

    OptionalLong limit();

    static Pagination empty() {
        return builder().build();
    }

    /** Reads the {@code Pagination-*} response headers. Absent or malformed values are left empty. */
    static Pagination fromHeaders(ListMultimap<String, String> headers) {
        return builder()
                .total(header(headers, TOTAL_HEADER))
                .offset(header(headers, OFFSET_HEADER))
                .limit(header(headers, LIMIT_HEADER))
                .build();
    }

    /** Reads {@code total}, {@code offset} and {@code limit} of a collection envelope, if it carries any. */
    static Optional<Pagination> fromEnvelope(Map<?, ?> envelope) {
        Pagination pagination = builder()
                .total(number(envelope.get("total")))
                .offset(number(envelope.get("offset")))
                .limit(number(envelope.get("limit")))
                .build();
        return pagination.equals(empty()) ? Optional.empty() : Optional.of(pagination);
    }

    private static OptionalLong header(ListMultimap<String, String> headers, String name) {
        for (Map.Entry<String, String> entry : headers.entries()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return parse(entry.getValue());
            }
        }
        return OptionalLong.empty();
    }

    private static OptionalLong number(Object value) {
        if (value instanceof Number) {
            return OptionalLong.of(((Number) value).longValue());
        }
        return value instanceof String ? parse((String) value) : OptionalLong.empty();
    }

    private static OptionalLong parse(String value) {
        Long parsed = Longs.tryParse(value.trim());
        return parsed == null ? OptionalLong.empty() : OptionalLong.of(parsed);
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutablePagination.Builder {}
}
