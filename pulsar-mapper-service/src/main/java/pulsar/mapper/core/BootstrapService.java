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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import pulsar.mapper.configuration.ServiceConfiguration;
import pulsar.mapper.connector.ConnectorException;
import pulsar.mapper.connector.PulsarClientFactory;
import pulsar.mapper.connector.TenantConsumer;
import pulsar.mapper.model.ConnectorStatusEvent;
import pulsar.mapper.model.TenantContext;
import pulsar.mapper.processor.MessageProcessor;

/**
 * Starts one consumer per tenant once the application is ready and drains
 * them on shutdown.
 */
@Slf4j
@Service
public class BootstrapService {

    private final CredentialResolver credentialResolver;
    private final C8YAgent c8yAgent;
    private final PulsarClientFactory pulsarClientFactory;
    private final MessageProcessor messageProcessor;
    private final ServiceConfiguration serviceConfiguration;
    private final ExecutorService processingThreadPool;

    private volatile Map<String, TenantContext> tenants = Collections.emptyMap();

    // every started tenant, including the ones that failed to connect
    private final Map<String, TenantConsumer> tenantConsumers = Collections.synchronizedMap(new LinkedHashMap<>());

    public BootstrapService(CredentialResolver credentialResolver, C8YAgent c8yAgent,
            PulsarClientFactory pulsarClientFactory, MessageProcessor messageProcessor,
            ServiceConfiguration serviceConfiguration,
            @Qualifier("processingThreadPool") ExecutorService processingThreadPool) {
        this.credentialResolver = credentialResolver;
        this.c8yAgent = c8yAgent;
        this.pulsarClientFactory = pulsarClientFactory;
        this.messageProcessor = messageProcessor;
        this.serviceConfiguration = serviceConfiguration;
        this.processingThreadPool = processingThreadPool;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() throws StartupException {
        log.info("Starting pulsar mapper with configuration: {}", serviceConfiguration);
        start();
    }

    /**
     * Resolves the tenants and subscribes each of them. A tenant that cannot
     * be connected is excluded, the others keep running.
     *
     * @throws StartupException when no tenant could be started
     */
    public synchronized void start() throws StartupException {
        Map<String, TenantContext> resolved = credentialResolver.resolve();
        this.tenants = resolved;
        c8yAgent.initializeTenantClients(resolved.values());

        List<String> failed = new ArrayList<>();
        for (TenantContext tenantContext : resolved.values()) {
            String tenant = tenantContext.getTenant();
            TenantConsumer consumer = createTenantConsumer(tenantContext);
            tenantConsumers.put(tenant, consumer);
            try {
                consumer.connect();
            } catch (ConnectorException e) {
                failed.add(tenant);
                log.error("{} - Tenant excluded, consumer could not be started (recoverable: {}): {}", tenant,
                        e.isRecoverable(), e.getMessage(), e);
            }
        }

        int started = resolved.size() - failed.size();
        if (started == 0) {
            throw new StartupException("No tenant consumer could be started, failed tenants: " + failed);
        }
        log.info("Started {} of {} tenant consumer(s), failed: {}", started, resolved.size(), failed);
    }

    TenantConsumer createTenantConsumer(TenantContext tenantContext) {
        return new TenantConsumer(tenantContext, pulsarClientFactory, messageProcessor, processingThreadPool,
                serviceConfiguration);
    }

    /**
     * Stops accepting messages, waits for in-flight messages bounded by the
     * shutdown timeout and closes every consumer.
     */
    @PreDestroy
    public void shutdown() {
        List<TenantConsumer> consumers;
        synchronized (tenantConsumers) {
            consumers = new ArrayList<>(tenantConsumers.values());
        }
        log.info("Shutting down {} tenant consumer(s)", consumers.size());
        consumers.forEach(TenantConsumer::stopAccepting);

        long deadline = System.nanoTime() + Duration.ofSeconds(serviceConfiguration.getShutdownTimeoutSeconds())
                .toNanos();
        for (TenantConsumer consumer : consumers) {
            Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
            try {
                if (!consumer.awaitInFlight(remaining)) {
                    log.warn("{} - Shutdown timeout reached with messages in flight, they will be redelivered",
                            consumer.getTenantContext().getTenant());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} - Interrupted while waiting for in-flight messages",
                        consumer.getTenantContext().getTenant());
                break;
            }
        }
        consumers.forEach(TenantConsumer::disconnect);
        log.info("Pulsar mapper stopped");
    }

    public Map<String, TenantContext> getTenants() {
        return tenants;
    }

    public boolean isAnyConsumerConnected() {
        synchronized (tenantConsumers) {
            return tenantConsumers.values().stream().anyMatch(TenantConsumer::isConnected);
        }
    }

    public List<ConnectorStatusEvent> getConsumerStatus() {
        List<ConnectorStatusEvent> status = new ArrayList<>();
        synchronized (tenantConsumers) {
            tenantConsumers.values().forEach(consumer -> status.add(consumer.getStatus()));
        }
        return status;
    }
}
