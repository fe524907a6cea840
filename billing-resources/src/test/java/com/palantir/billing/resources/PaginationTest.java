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

import static org.assertj.core.api.Assertions.assertThat;

import com.google.common.collect.ImmutableListMultimap;
import java.util.Map;
import org.junit.jupiter.api.Test;

public final class PaginationTest {

    @Test
    public void readsHeadersIgnoringCase() {
        Pagination pagination = Pagination.fromHeaders(ImmutableListMultimap.of(
                "PAGINATION-TOTAL", "12", "pagination-offset", "10", "Pagination-Limit", " 2 "));
        assertThat(pagination.total()).hasValue(12);
        assertThat(pagination.offset()).hasValue(10);
        assertThat(pagination.limit()).hasValue(2);
    }

    @Test
    public void malformedHeadersAreEmpty() {
        Pagination pagination = Pagination.fromHeaders(ImmutableListMultimap.of("Pagination-Total", "many"));
        assertThat(pagination).isEqualTo(Pagination.empty());
    }

    @Test
    public void envelopeWithoutPaginationIsEmpty() {
        assertThat(Pagination.fromEnvelope(Map.of("items", "x"))).isEmpty();
        assertThat(Pagination.fromEnvelope(Map.of("total", "3")))
                .hasValueSatisfying(pagination -> assertThat(pagination.total()).hasValue(3));
    }
}
