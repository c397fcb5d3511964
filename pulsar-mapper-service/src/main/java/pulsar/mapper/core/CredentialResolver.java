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

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import lombok.extern.slf4j.Slf4j;
import pulsar.mapper.configuration.IsolationMode;
import pulsar.mapper.configuration.PlatformConfiguration;
import pulsar.mapper.configuration.ServiceConfiguration;
import pulsar.mapper.model.ApplicationSubscriptions;
import pulsar.mapper.model.ApplicationSubscriptions.ServiceUser;
import pulsar.mapper.model.TenantContext;
import reactor.util.retry.Retry;

/**
 * Determines the tenants this process serves and their credentials.
 */
@Slf4j
@Component
public class CredentialResolver {

    public static final String SUBSCRIPTIONS_PATH = "/application/currentApplication/subscriptions";

    private final PlatformConfiguration platformConfiguration;
    private final ServiceConfiguration serviceConfiguration;
    private final WebClient.Builder webClientBuilder;

    @Autowired
    public CredentialResolver(PlatformConfiguration platformConfiguration,
            ServiceConfiguration serviceConfiguration, WebClient.Builder webClientBuilder) {
        this.platformConfiguration = platformConfiguration;
        this.serviceConfiguration = serviceConfiguration;
        this.webClientBuilder = webClientBuilder;
    }

    /**
     * @return immutable map from tenant id to its context, in the order the
     *         platform reported the tenants
     * @throws StartupException when no tenant can be resolved
     */
    public Map<String, TenantContext> resolve() throws StartupException {
        if (StringUtils.isBlank(platformConfiguration.getBaseUrl())) {
            throw new StartupException("C8Y_BASEURL is not set");
        }
        IsolationMode isolation = platformConfiguration.getIsolation();
        log.info("Resolving tenant credentials, isolation: {}", isolation);
        if (isolation == IsolationMode.MULTI_TENANT) {
            return resolveSubscribedTenants();
        }
        return resolveServiceUser();
    }

    private Map<String, TenantContext> resolveServiceUser() throws StartupException {
        String tenant = platformConfiguration.getTenant();
        String user = platformConfiguration.getUser();
        String password = platformConfiguration.getPassword();
        if (StringUtils.isAnyBlank(tenant, user, password)) {
            throw new StartupException(
                    "Per tenant isolation requires C8Y_TENANT, C8Y_USER and C8Y_PASSWORD to be set");
        }
        TenantContext context = createTenantContext(tenant, user, password);
        log.info("{} - Resolved service user: {}", tenant, context);
        return Collections.singletonMap(tenant, context);
    }

    private Map<String, TenantContext> resolveSubscribedTenants() throws StartupException {
        String bootstrapTenant = platformConfiguration.getBootstrapTenant();
        String bootstrapUser = platformConfiguration.getBootstrapUser();
        String bootstrapPassword = platformConfiguration.getBootstrapPassword();
        if (StringUtils.isAnyBlank(bootstrapTenant, bootstrapUser, bootstrapPassword)) {
            throw new StartupException("Multi tenant isolation requires C8Y_BOOTSTRAP_TENANT, "
                    + "C8Y_BOOTSTRAP_USER and C8Y_BOOTSTRAP_PASSWORD to be set");
        }

        ApplicationSubscriptions subscriptions = fetchSubscriptions(bootstrapTenant, bootstrapUser,
                bootstrapPassword);

        Map<String, TenantContext> tenants = new LinkedHashMap<>();
        if (subscriptions != null && subscriptions.getUsers() != null) {
            for (ServiceUser serviceUser : subscriptions.getUsers()) {
                if (serviceUser == null || StringUtils.isAnyBlank(serviceUser.getTenant(), serviceUser.getName(),
                        serviceUser.getPassword())) {
                    log.warn("{} - Skipping incomplete subscription entry: {}", bootstrapTenant, serviceUser);
                    continue;
                }
                if (tenants.containsKey(serviceUser.getTenant())) {
                    log.warn("{} - Duplicate subscription entry ignored", serviceUser.getTenant());
                    continue;
                }
                tenants.put(serviceUser.getTenant(), createTenantContext(serviceUser.getTenant(),
                        serviceUser.getName(), serviceUser.getPassword()));
            }
        }
        if (tenants.isEmpty()) {
            throw new StartupException("No tenant is subscribed to the microservice");
        }
        log.info("{} - Resolved {} subscribed tenant(s): {}", bootstrapTenant, tenants.size(), tenants.keySet());
        return Collections.unmodifiableMap(tenants);
    }

    private ApplicationSubscriptions fetchSubscriptions(String tenant, String user, String password)
            throws StartupException {
        int maxAttempts = Math.max(1, serviceConfiguration.getBootstrapMaxAttempts());
        WebClient client = webClientBuilder.clone()
                .baseUrl(platformConfiguration.getBaseUrl())
                .defaultHeaders(headers -> headers.setBasicAuth(tenant + "/" + user, password,
                        StandardCharsets.UTF_8))
                .build();
        try {
            return client.get()
                    .uri(SUBSCRIPTIONS_PATH)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(ApplicationSubscriptions.class)
                    .timeout(Duration.ofSeconds(serviceConfiguration.getRequestTimeoutSeconds()))
                    .retryWhen(Retry.backoff(maxAttempts - 1,
                            Duration.ofMillis(serviceConfiguration.getBootstrapInitialBackoffMillis()))
                            .maxBackoff(Duration.ofMillis(serviceConfiguration.getBootstrapMaxBackoffMillis()))
                            .filter(CredentialResolver::isTransient)
                            .doBeforeRetry(signal -> log.warn(
                                    "{} - Fetching subscriptions failed (attempt {} of {}), retrying: {}", tenant,
                                    signal.totalRetries() + 1, maxAttempts, signal.failure().getMessage()))
                            .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                    .block();
        } catch (RuntimeException e) {
            log.error("{} - Fetching subscriptions failed: {}", tenant, e.getMessage());
            throw new StartupException("Could not fetch tenant subscriptions: " + e.getMessage(), e);
        }
    }

    private TenantContext createTenantContext(String tenant, String user, String password) {
        return TenantContext.builder()
                .tenant(tenant)
                .user(user)
                .password(password)
                .baseUrl(platformConfiguration.getBaseUrl())
                .topic(TenantContext.deriveTopic(tenant, serviceConfiguration.getPulsarNamespace(),
                        serviceConfiguration.getPulsarTopic()))
                .subscriptionName(serviceConfiguration.getSubscriptionName())
                .build();
    }

    /**
     * Connection failures, timeouts, 429 and 5xx are worth another attempt.
     */
    static boolean isTransient(Throwable error) {
        if (error instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) error).getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return error instanceof WebClientRequestException
                || error instanceof TimeoutException;
    }
}
