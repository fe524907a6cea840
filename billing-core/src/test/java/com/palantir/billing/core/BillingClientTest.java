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

package com.palantir.billing.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableMap;
import com.palantir.billing.ClientException;
import com.palantir.billing.ConfigurationException;
import com.palantir.billing.FieldError;
import com.palantir.billing.HttpMethod;
import com.palantir.billing.MockTransport;
import com.palantir.billing.NotFoundException;
import com.palantir.billing.Request;
import com.palantir.billing.Response;
import com.palantir.billing.ServerException;
import com.palantir.billing.TestResponse;
import com.palantir.billing.UnprocessableEntityException;
import com.palantir.billing.entities.BankAccount;
import com.palantir.billing.entities.Website;
import com.palantir.billing.resources.GenericResource;
import com.palantir.billing.resources.Resource;
import com.palantir.billing.resources.ResourceCollection;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

public final class BillingClientTest {

    private static final String API_KEY = "secret-key";

    private final MockTransport transport = new MockTransport();
    private final BillingClient client = new BillingClient(ClientConfiguration.builder()
            .apiKey(API_KEY)
            .transport(transport)
            .build());

    @Test
    public void substitutesPlaceholdersAndRoutesRestToQuery() {
        transport.respond(HttpMethod.GET, "/v2.1/bank-accounts/abc123", 200, "{\"id\":\"abc123\"}");

        Resource resource = client.get(
                "bank-accounts/{bankAccountId}", ImmutableMap.of("bankAccountId", "abc123", "expand", "customer"));

        assertThat(transport.lastRequest().uri())
                .isEqualTo(URI.create("https://api.rebilly.com/v2.1/bank-accounts/abc123?expand=customer"));
        assertThat(resource).isInstanceOfSatisfying(BankAccount.class, account -> assertThat(account.getId())
                .hasValue("abc123"));
    }

    @Test
    public void appliesAuthenticationAndContentType() {
        transport.respond(HttpMethod.GET, "/v2.1/websites", 200, "[]");

        client.get("websites", ImmutableMap.of(), ImmutableMap.of("X-Request-Id", "r-1", "Content-Type", "text/plain"));

        Request request = transport.lastRequest();
        assertThat(request.headerParams().get("REB-APIKEY")).containsExactly(API_KEY);
        assertThat(request.headerParams().get("x-request-id")).containsExactly("r-1");
        assertThat(request.headerParams().get("content-type")).containsExactly("application/json");
        assertThat(request.body()).isEmpty();
    }

    @Test
    public void emptyPayloadIsSentAsEmptyObject() {
        transport.respond(HttpMethod.POST, "/v2.1/bank-accounts/ba-1/deactivation", 201, "{\"id\":\"ba-1\"}");

        client.post(null, "bank-accounts/{id}/deactivation", ImmutableMap.of("id", "ba-1"));
        assertThat(MockTransport.bodyText(transport.lastRequest())).hasValue("{}");

        client.post(List.of(), "bank-accounts/{id}/deactivation", ImmutableMap.of("id", "ba-1"));
        assertThat(MockTransport.bodyText(transport.lastRequest())).hasValue("{}");
    }

    @Test
    public void entityPayloadIsSerializedFromAttributes() {
        transport.respond(HttpMethod.PUT, "/v2.1/websites/w-1", 200, "{\"id\":\"w-1\",\"name\":\"Shop\"}");

        Resource resource = client.put(new Website().setName("Shop"), "websites/{id}", ImmutableMap.of("id", "w-1"));

        assertThat(MockTransport.bodyText(transport.lastRequest())).hasValue("{\"name\":\"Shop\"}");
        assertThat(resource).isInstanceOfSatisfying(Website.class, website -> assertThat(website.getName())
                .isEqualTo("Shop"));
    }

    @Test
    public void payloadOnGetIsDropped() {
        transport.respond(HttpMethod.GET, "/v2.1/websites", 200, "[]");

        client.send(HttpMethod.GET, Map.of("a", 1), "websites", Map.of(), Map.of());

        assertThat(transport.lastRequest().body()).isEmpty();
    }

    @Test
    public void deleteCarriesPayloadWhenGiven() {
        transport.respond(HttpMethod.DELETE, "/v2.1/websites/w-1", 204, "");

        client.send(HttpMethod.DELETE, Map.of("reason", "closed"), "websites/w-1", Map.of(), Map.of());
        assertThat(MockTransport.bodyText(transport.lastRequest())).hasValue("{\"reason\":\"closed\"}");

        client.delete("websites/w-1");
        assertThat(transport.lastRequest().body()).isEmpty();
    }

    @Test
    public void headAndDeleteReturnNothing() {
        transport.respond(HttpMethod.HEAD, "/v2.1/websites/w-1", 200, "{\"id\":\"w-1\"}");
        transport.respond(HttpMethod.DELETE, "/v2.1/websites/w-1", 204, "");

        assertThat(client.send(HttpMethod.HEAD, null, "websites/w-1", Map.of(), Map.of()))
                .isNull();
        assertThat(client.send(HttpMethod.DELETE, null, "websites/w-1", Map.of(), Map.of()))
                .isNull();
        assertThat(transport.responses()).allSatisfy(response -> assertThat(((TestResponse) response).isClosed())
                .isTrue());
    }

    @Test
    public void locationHeaderSelectsResourceType() {
        transport.on(
                HttpMethod.POST,
                "/v2.1/customers/c-1/bank-accounts",
                () -> TestResponse.json(201, "{\"id\":\"ba-7\",\"bankName\":\"First\"}")
                        .withHeader("Location", "https://api.rebilly.com/v2.1/bank-accounts/ba-7"));

        Resource resource = client.post(Map.of("bankName", "First"), "customers/c-1/bank-accounts");

        assertThat(resource).isInstanceOfSatisfying(BankAccount.class, account -> {
            assertThat(account.getId()).hasValue("ba-7");
            assertThat(account.getBankName()).isEqualTo("First");
        });
    }

    @Test
    public void malformedLocationFallsBackToRequestPath() {
        transport.on(
                HttpMethod.POST,
                "/v2.1/websites",
                () -> TestResponse.json(201, "{\"id\":\"w-2\"}").withHeader("Location", "http://bad host/x"));

        assertThat(client.post(Map.of("name", "Shop"), "websites")).isInstanceOf(Website.class);
    }

    @Test
    public void unknownPathsAreGeneric() {
        transport.respond(HttpMethod.GET, "/v2.1/customers/c-1", 200, "{\"id\":\"c-1\"}");
        assertThat(client.get("customers/c-1")).isInstanceOf(GenericResource.class);
    }

    @Test
    public void collectionsCarryHeaderPagination() {
        transport.on(
                HttpMethod.GET,
                "/v2.1/websites",
                () -> TestResponse.json(200, "[{\"id\":\"w-1\"}]")
                        .withHeader("Pagination-Total", "3")
                        .withHeader("Pagination-Limit", "1")
                        .withHeader("Pagination-Offset", "0"));

        Resource resource = client.get("websites", ImmutableMap.of("limit", 1, "offset", 0));

        assertThat(transport.lastRequest().uri().getQuery()).isEqualTo("limit=1&offset=0");
        assertThat(resource).isInstanceOfSatisfying(ResourceCollection.class, collection -> {
            assertThat(collection.items()).hasSize(1).allSatisfy(item -> assertThat(item).isInstanceOf(Website.class));
            assertThat(collection.pagination().total()).hasValue(3);
        });
    }

    @Test
    public void emptySuccessBodyResolvesToEmptyEntity() {
        transport.respond(HttpMethod.PATCH, "/v2.1/bank-accounts/ba-1", 200, "");
        Resource resource = client.patch(Map.of("bankName", "Second"), "bank-accounts/{id}", Map.of("id", "ba-1"));
        assertThat(resource).isInstanceOfSatisfying(BankAccount.class, account -> assertThat(account.data())
                .isEmpty());
    }

    @Test
    public void mapsStatusesToExceptions() {
        transport.respond(HttpMethod.GET, "/v2.1/websites/missing", 404, "{}");
        transport.respond(HttpMethod.GET, "/v2.1/websites/forbidden", 403, "{}");
        transport.respond(HttpMethod.GET, "/v2.1/websites/broken", 502, "{}");

        assertThatThrownBy(() -> client.get("websites/missing")).isExactlyInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> client.get("websites/forbidden"))
                .isExactlyInstanceOf(ClientException.class)
                .satisfies(e -> assertThat(((ClientException) e).getStatus()).isEqualTo(403));
        assertThatThrownBy(() -> client.get("websites/broken"))
                .isExactlyInstanceOf(ServerException.class)
                .satisfies(e -> assertThat(((ServerException) e).getStatus()).isEqualTo(502));
        assertThat(transport.responses()).allSatisfy(response -> assertThat(((TestResponse) response).isClosed())
                .isTrue());
    }

    @Test
    public void validationFailureCarriesDetails() {
        transport.respond(
                HttpMethod.POST,
                "/v2.1/bank-accounts",
                422,
                "{\"details\":[\"routingNumber is invalid\",{\"field\":\"accountType\",\"message\":\"unknown\"}]}");

        assertThatThrownBy(() -> client.post(new BankAccount().setRoutingNumber("1"), "bank-accounts"))
                .isInstanceOfSatisfying(UnprocessableEntityException.class, e -> assertThat(e.getDetails())
                        .containsExactly(
                                FieldError.of("routingNumber is invalid"), FieldError.of("accountType", "unknown")));
    }

    @Test
    public void extraMiddlewareRunsAfterBuiltIns() {
        List<Request> seen = new ArrayList<>();
        BillingClient withMiddleware = new BillingClient(ClientConfiguration.builder()
                .apiKey(API_KEY)
                .baseUrl(ClientConfiguration.SANDBOX_HOST)
                .transport(transport)
                .addMiddleware((request, next) -> {
                    seen.add(request);
                    return next.proceed(request);
                })
                .build());
        transport.respond(HttpMethod.GET, "/v2.1/websites", 200, "[]");

        withMiddleware.get("websites");

        assertThat(seen).singleElement().satisfies(request -> {
            assertThat(request.uri()).isEqualTo(URI.create("https://api-sandbox.rebilly.com/v2.1/websites"));
            assertThat(request.headerParams().get("REB-APIKEY")).containsExactly(API_KEY);
        });
    }

    @Test
    public void missingApiKeyIsAConfigurationError() {
        assertThatThrownBy(() -> new BillingClient(ClientConfiguration.builder().transport(transport).build()))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new BillingClient(
                        ClientConfiguration.builder().apiKey(" ").transport(transport).build()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    public void callerParametersAreNotModified() {
        transport.respond(HttpMethod.GET, "/v2.1/websites/w-1", 200, "{}");
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("id", "w-1");
        client.get("websites/{id}", params);
        assertThat(params).containsOnlyKeys("id");
    }

    @Test
    public void concurrentCallsAreIndependent() throws Exception {
        transport.on(HttpMethod.GET, "/v2.1/websites/w-1", request -> TestResponse.json(200, "{\"id\":\"w-1\"}"));
        transport.on(HttpMethod.GET, "/v2.1/bank-accounts/ba-1", request -> TestResponse.json(200, "{\"id\":\"ba-1\"}"));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Resource>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String path = i % 2 == 0 ? "websites/w-1" : "bank-accounts/ba-1";
                futures.add(executor.submit(() -> client.get(path)));
            }
            for (int i = 0; i < futures.size(); i++) {
                Resource resource = futures.get(i).get(10, TimeUnit.SECONDS);
                assertThat(resource).isInstanceOf(i % 2 == 0 ? Website.class : BankAccount.class);
            }
        } finally {
            executor.shutdownNow();
        }
        assertThat(transport.requests()).hasSize(200);
        assertThat(transport.responses()).allSatisfy(response -> assertThat(((TestResponse) response).isClosed())
                .isTrue());
    }

    @Test
    public void transportResponsesAreClosedWhenDecodingFails() {
        transport.respond(HttpMethod.GET, "/v2.1/websites/w-1", 200, "{not json");
        assertThatThrownBy(() -> client.get("websites/w-1")).isInstanceOf(RuntimeException.class);
        Response response = transport.responses().get(0);
        assertThat(((TestResponse) response).isClosed()).isTrue();
    }
}
