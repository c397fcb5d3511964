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

package pulsar.mapper.connector;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.apache.pulsar.client.api.AuthenticationFactory;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;
import pulsar.mapper.configuration.PlatformConfiguration;
import pulsar.mapper.configuration.ServiceConfiguration;
import pulsar.mapper.model.TenantContext;

/**
 * Builds Pulsar clients authenticated as a tenant's service user against the
 * MQTT Service broker.
 */
@Slf4j
@Component
public class PulsarClientFactory {

    public static final String AUTHENTICATION_BASIC = "org.apache.pulsar.client.impl.auth.AuthenticationBasic";

    private static final int DEFAULT_CONNECTION_TIMEOUT = 30;
    private static final int DEFAULT_OPERATION_TIMEOUT = 30;
    private static final int DEFAULT_KEEP_ALIVE = 30;

    private final PlatformConfiguration platformConfiguration;
    private final ServiceConfiguration serviceConfiguration;
    private final ObjectMapper objectMapper;

    public PulsarClientFactory(PlatformConfiguration platformConfiguration,
            ServiceConfiguration serviceConfiguration, ObjectMapper objectMapper) {
        this.platformConfiguration = platformConfiguration;
        this.serviceConfiguration = serviceConfiguration;
        this.objectMapper = objectMapper;
    }

    public PulsarClient createClient(TenantContext tenant) throws PulsarClientException {
        String serviceUrl = platformConfiguration.getPulsarServiceUrl();
        PulsarClient client = PulsarClient.builder()
                .serviceUrl(serviceUrl)
                .authentication(AuthenticationFactory.create(AUTHENTICATION_BASIC, authenticationParams(tenant)))
                .connectionTimeout(DEFAULT_CONNECTION_TIMEOUT, TimeUnit.SECONDS)
                .operationTimeout(DEFAULT_OPERATION_TIMEOUT, TimeUnit.SECONDS)
                .keepAliveInterval(DEFAULT_KEEP_ALIVE, TimeUnit.SECONDS)
                .listenerThreads(serviceConfiguration.getListenerThreads())
                .build();
        log.info("{} - Pulsar client created for {}", tenant.getTenant(), serviceUrl);
        return client;
    }

    /**
     * JSON parameters of {@code AuthenticationBasic}:
     * {@code {"userId":"{tenant}/{user}","password":"..."}}.
     */
    String authenticationParams(TenantContext tenant) throws PulsarClientException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("userId", tenant.getQualifiedUser());
        params.put("password", tenant.getPassword());
        try {
            return objectMapper.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new PulsarClientException(e);
        }
    }
}
