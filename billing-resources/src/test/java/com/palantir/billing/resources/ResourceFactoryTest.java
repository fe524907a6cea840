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
import com.google.common.collect.ImmutableMap;
import com.palantir.billing.entities.ApiTracking;
import com.palantir.billing.entities.BankAccount;
import com.palantir.billing.entities.EntitySchema;
import com.palantir.billing.entities.Website;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public final class ResourceFactoryTest {

    private final ResourceFactory factory = new ResourceFactory(EntitySchema.defaultSchema());

    @Test
    public void resolvesItemPath() {
        Resource resource = factory.create("/v2.1/bank-accounts/ba-1", Map.of("id", "ba-1", "bankName", "First"));
        assertThat(resource).isInstanceOf(BankAccount.class);
        BankAccount account = (BankAccount) resource;
        assertThat(account.getId()).hasValue("ba-1");
        assertThat(account.getBankName()).isEqualTo("First");
    }

    @Test
    public void resolvesRelativeAndUnversionedPaths() {
        assertThat(factory.create("websites/w-1", Map.of())).isInstanceOf(Website.class);
        assertThat(factory.create("/v2/websites/w-1/", Map.of())).isInstanceOf(Website.class);
    }

    @Test
    public void resolvesSubActionPath() {
        assertThat(factory.create("/v2.1/bank-accounts/ba-1/deactivation", Map.of("status", "inactive")))
                .isInstanceOf(BankAccount.class);
    }

    @Test
    public void resolvesMultiSegmentCollections() {
        assertThat(factory.create("tracking/api/t-1", Map.of())).isInstanceOf(ApiTracking.class);
        assertThat(factory.create("tracking/api", List.of())).isInstanceOf(ResourceCollection.class);
    }

    @Test
    public void emptyObjectAtCollectionPathIsEmptyCollection() {
        assertThat(factory.create("/v2.1/bank-accounts", Map.of()))
                .isInstanceOfSatisfying(ResourceCollection.class, collection -> assertThat(collection.isEmpty())
                        .isTrue());
        assertThat(factory.create("/v2.1/bank-accounts", Map.of("id", "ba-1"))).isInstanceOf(BankAccount.class);
    }

    @Test
    public void unknownPathsAreGeneric() {
        Map<String, Object> body = Map.of("id", "x");
        assertThat(factory.create("/v2.1/customers/c-1", body))
                .isInstanceOfSatisfying(GenericResource.class, generic -> {
                    assertThat(generic.data()).isSameAs(body);
                    assertThat(generic.getAttribute("id")).isEqualTo("x");
                });
        assertThat(factory.create("", body)).isInstanceOf(GenericResource.class);
        assertThat(factory.create("/", body)).isInstanceOf(GenericResource.class);
        assertThat(factory.create(null, body)).isInstanceOf(GenericResource.class);
    }

    @Test
    public void itemPathWithArrayBodyIsGeneric() {
        assertThat(factory.create("websites/w-1", List.of(1, 2))).isInstanceOf(GenericResource.class);
    }

    @Test
    public void collectionFromArrayUsesHeaderPagination() {
        Pagination headers = Pagination.fromHeaders(ImmutableListMultimap.of(
                "pagination-total", "7", "Pagination-Offset", "0", "Pagination-Limit", "2"));
        Resource resource =
                factory.create("/v2.1/websites", List.of(Map.of("id", "w-1"), Map.of("id", "w-2")), headers);

        assertThat(resource).isInstanceOf(ResourceCollection.class);
        ResourceCollection<Website> websites = ((ResourceCollection<?>) resource).as(Website.class);
        assertThat(websites.items()).extracting(website -> website.getId().orElseThrow())
                .containsExactly("w-1", "w-2");
        assertThat(websites.pagination().total()).hasValue(7);
        assertThat(websites.pagination().limit()).hasValue(2);
    }

    @Test
    public void collectionFromEnvelopePrefersEnvelopePagination() {
        Map<String, Object> body = ImmutableMap.of(
                "items", List.of(Map.of("id", "w-1")), "total", 40, "offset", 20, "limit", 1);
        Pagination headers = Pagination.fromHeaders(ImmutableListMultimap.of("Pagination-Total", "7"));

        ResourceCollection<?> collection = (ResourceCollection<?>) factory.create("websites", body, headers);

        assertThat(collection.size()).isEqualTo(1);
        assertThat(collection.pagination().total()).hasValue(40);
        assertThat(collection.pagination().offset()).hasValue(20);
        assertThat(collection.data()).isSameAs(body);
    }

    @Test
    public void collectionItemsUseTheirSelfLink() {
        Map<String, Object> website = Map.of(
                "id", "w-1", "_links", List.of(Map.of("rel", "self", "href", "https://api.rebilly.com/v2.1/websites/w-1")));
        Map<String, Object> plain = Map.of("id", "ba-1");
        Map<String, Object> unknown = Map.of("_links", List.of(Map.of("rel", "self", "href", "/v2.1/plans/p-1")));

        ResourceCollection<?> collection =
                (ResourceCollection<?>) factory.create("bank-accounts", List.of(website, plain, unknown, "text"));

        assertThat(collection.items().get(0)).isInstanceOf(Website.class);
        assertThat(collection.items().get(1)).isInstanceOf(BankAccount.class);
        assertThat(collection.items().get(2)).isInstanceOf(BankAccount.class);
        assertThat(collection.items().get(3)).isInstanceOf(GenericResource.class);
    }

    @Test
    public void objectAtCollectionPathIsItem() {
        assertThat(factory.create("/v2.1/bank-accounts", Map.of("id", "ba-9"))).isInstanceOf(BankAccount.class);
    }

    @Test
    public void moreLiteralSegmentsWin() {
        ResourceSchema schema = ResourceSchema.builder()
                .bind("things/*/*", ResourceBinding.item(Website::new))
                .bind("things/*/special", ResourceBinding.item(BankAccount::new))
                .build();
        ResourceFactory custom = new ResourceFactory(schema);
        assertThat(custom.create("things/1/special", Map.of())).isInstanceOf(BankAccount.class);
        assertThat(custom.create("things/1/other", Map.of())).isInstanceOf(Website.class);
    }

    @Test
    public void registrationOrderBreaksTies() {
        ResourceSchema schema = ResourceSchema.builder()
                .bind("things/*", ResourceBinding.item(Website::new))
                .bind("things/*", ResourceBinding.item(BankAccount::new))
                .build();
        assertThat(new ResourceFactory(schema).create("things/1", Map.of())).isInstanceOf(Website.class);
    }
}
