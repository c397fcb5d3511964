/*
 * Copyright (c) 2025 Cumulocity GmbH.
 *
 * SPDX-License-Identifier: Apache-2.0
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 *  @authors Christof Strack, Stefan Witschel
 *
 */

package pulsar.mapper.core;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import pulsar.mapper.MapperTestHelper;
import pulsar.mapper.configuration.IsolationMode;
import pulsar.mapper.configuration.PlatformConfiguration;
import pulsar.mapper.configuration.ServiceConfiguration;
import pulsar.mapper.model.TenantContext;
import reactor.core.publisher.Mono;

class CredentialResolverTest {

    private static final String SUBSCRIPTIONS = "{\"users\":["
            + "{\"tenant\":\"t100\",\"name\":\"service_a\",\"password\":\"pa\"},"
            + "{\"tenant\":\"t200\",\"name\":\"service_b\",\"password\":\"pb\"},"
            + "{\"tenant\":\"t100\",\"name\":\"service_dup\",\"password\":\"px\"},"
            + "{\"tenant\":\"t300\",\"name\":\"service_c\"}"
            + "],\"next\":null}";

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private PlatformConfiguration platformConfiguration;
    private ServiceConfiguration serviceConfiguration;

    @BeforeEach
    void setUp() {
        platformConfiguration = new PlatformConfiguration();
        platformConfiguration.setBaseUrl(MapperTestHelper.TEST_BASE_URL);
        platformConfiguration.setPulsarServiceUrl("pulsar://cumulocity:6650");
        serviceConfiguration = MapperTestHelper.serviceConfiguration();
    }

    private void multiTenant() {
        platformConfiguration.setIsolation(IsolationMode.MULTI_TENANT);
        platformConfiguration.setBootstrapTenant("management");
        platformConfiguration.setBootstrapUser("servicebootstrap_pulsar-mapper");
        platformConfiguration.setBootstrapPassword("bootstrap-secret");
    }

    private CredentialResolver resolverAnswering(Function<ClientRequest, ClientResponse> exchange) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(exchange.apply(request));
        });
        return new CredentialResolver(platformConfiguration, serviceConfiguration, builder);
    }

    private static ClientResponse response(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    @Test
    void testPerTenantUsesServiceUser() throws Exception {
        platformConfiguration.setTenant("t100");
        platformConfiguration.setUser("service_pulsar-mapper");
        platformConfiguration.setPassword("secret");

        Map<String, TenantContext> tenants = resolverAnswering(r -> response(HttpStatus.OK, "{}")).resolve();

        assertEquals(1, tenants.size());
        TenantContext context = tenants.get("t100");
        assertEquals("t100/service_pulsar-mapper", context.getQualifiedUser());
        assertEquals("persistent://t100/mqtt/from-device", context.getTopic());
        assertEquals("pulsar-mapper", context.getSubscriptionName());
        assertEquals(MapperTestHelper.TEST_BASE_URL, context.getBaseUrl());
        assertTrue(requests.isEmpty());
    }

    @Test
    void testPerTenantWithoutCredentialsFails() {
        platformConfiguration.setTenant("t100");
        platformConfiguration.setUser("service_pulsar-mapper");

        assertThrows(StartupException.class, () -> resolverAnswering(r -> response(HttpStatus.OK, "{}")).resolve());
    }

    @Test
    void testMultiTenantReadsSubscriptions() throws Exception {
        multiTenant();

        Map<String, TenantContext> tenants = resolverAnswering(r -> response(HttpStatus.OK, SUBSCRIPTIONS))
                .resolve();

        // duplicate t100 and incomplete t300 are skipped, order is kept
        assertEquals(List.of("t100", "t200"), new ArrayList<>(tenants.keySet()));
        assertEquals("service_a", tenants.get("t100").getUser());
        assertEquals("pb", tenants.get("t200").getPassword());
        assertEquals("persistent://t200/mqtt/from-device", tenants.get("t200").getTopic());
        assertThrows(UnsupportedOperationException.class, () -> tenants.remove("t100"));

        ClientRequest request = requests.get(0);
        assertEquals(CredentialResolver.SUBSCRIPTIONS_PATH, request.url().getPath());
        String credentials = Base64.getEncoder().encodeToString(
                "management/servicebootstrap_pulsar-mapper:bootstrap-secret".getBytes(StandardCharsets.UTF_8));
        assertEquals("Basic " + credentials, request.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testMultiTenantRetriesTransientErrors() throws Exception {
        multiTenant();
        AtomicInteger calls = new AtomicInteger();

        Map<String, TenantContext> tenants = resolverAnswering(r -> calls.incrementAndGet() <= 2
                ? response(HttpStatus.SERVICE_UNAVAILABLE, "")
                : response(HttpStatus.OK, SUBSCRIPTIONS)).resolve();

        assertEquals(2, tenants.size());
        assertEquals(3, requests.size());
    }

    @Test
    void testMultiTenantFailsAfterRetriesAreExhausted() {
        multiTenant();

        StartupException exception = assertThrows(StartupException.class,
                () -> resolverAnswering(r -> response(HttpStatus.BAD_GATEWAY, "")).resolve());

        assertEquals(serviceConfiguration.getBootstrapMaxAttempts().intValue(), requests.size());
        assertNotNull(exception.getCause());
    }

    @Test
    void testMultiTenantDoesNotRetryRejectedCredentials() {
        multiTenant();

        assertThrows(StartupException.class,
                () -> resolverAnswering(r -> response(HttpStatus.UNAUTHORIZED, "")).resolve());
        assertEquals(1, requests.size());
    }

    @Test
    void testMultiTenantWithoutSubscriptionsFails() {
        multiTenant();

        assertThrows(StartupException.class,
                () -> resolverAnswering(r -> response(HttpStatus.OK, "{\"users\":[]}")).resolve());
    }

    @Test
    void testMultiTenantWithoutBootstrapCredentialsFails() {
        platformConfiguration.setIsolation(IsolationMode.MULTI_TENANT);

        assertThrows(StartupException.class,
                () -> resolverAnswering(r -> response(HttpStatus.OK, SUBSCRIPTIONS)).resolve());
        assertTrue(requests.isEmpty());
    }
}
