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

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.StringUtils;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.ConsumerBuilder;
import org.apache.pulsar.client.api.DeadLetterPolicy;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;
import org.apache.pulsar.client.api.SubscriptionType;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import pulsar.mapper.configuration.ServiceConfiguration;
import pulsar.mapper.model.ConnectorStatus;
import pulsar.mapper.model.ConnectorStatusEvent;
import pulsar.mapper.model.TenantContext;
import pulsar.mapper.processor.MessageProcessor;

/**
 * Shared subscription on the inbound topic of one tenant. Owns the tenant's
 * Pulsar client and consumer.
 */
@Slf4j
public class TenantConsumer {

    public static final String TENANT_PLACEHOLDER = "{tenant}";

    @Getter
    private final TenantContext tenantContext;
    private final String tenant;
    private final PulsarClientFactory pulsarClientFactory;
    private final ServiceConfiguration serviceConfiguration;

    @Getter
    private final PulsarCallback callback;
    private final ConnectionStateManager connectionStateManager;

    private PulsarClient pulsarClient;
    private volatile Consumer<byte[]> platformConsumer;

    public TenantConsumer(TenantContext tenantContext, PulsarClientFactory pulsarClientFactory,
            MessageProcessor messageProcessor, ExecutorService processingThreadPool,
            ServiceConfiguration serviceConfiguration) {
        this.tenantContext = tenantContext;
        this.tenant = tenantContext.getTenant();
        this.pulsarClientFactory = pulsarClientFactory;
        this.serviceConfiguration = serviceConfiguration;
        this.callback = new PulsarCallback(tenantContext, messageProcessor, processingThreadPool,
                serviceConfiguration);
        this.connectionStateManager = new ConnectionStateManager(tenant, tenantContext.getTopic());
    }

    /**
     * Subscribes with bounded retries and exponential backoff.
     *
     * @throws ConnectorException when the broker rejects the credentials or
     *                            every attempt failed
     */
    public synchronized void connect() throws ConnectorException {
        if (isConnected()) {
            log.debug("{} - Already connected", tenant);
            return;
        }
        int maxAttempts = Math.max(1, serviceConfiguration.getConnectMaxAttempts());
        PulsarClientException lastException = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ConnectorException("Interrupted while connecting tenant " + tenant);
            }
            try {
                connectionStateManager.updateStatus(ConnectorStatus.CONNECTING, true);
                subscribeToTowardsPlatformTopic();
                connectionStateManager.setConnected(true);
                log.info("{} - Subscribed to topic: [{}], subscription: [{}]", tenant, tenantContext.getTopic(),
                        tenantContext.getSubscriptionName());
                return;
            } catch (PulsarClientException.AuthenticationException
                    | PulsarClientException.AuthorizationException e) {
                log.error("{} - Broker rejected credentials of {}: {}", tenant, tenantContext.getQualifiedUser(),
                        e.getMessage());
                cleanupOnConnectionFailure();
                closeClient();
                connectionStateManager.updateStatusWithError(e);
                throw new ConnectorException("Broker rejected credentials for tenant " + tenant, e, false);
            } catch (PulsarClientException e) {
                lastException = e;
                log.warn("{} - Connection attempt {} of {} failed: {}", tenant, attempt, maxAttempts,
                        e.getMessage());
                cleanupOnConnectionFailure();
                connectionStateManager.updateStatusWithError(e);
            }

            if (attempt < maxAttempts) {
                long backoff = serviceConfiguration.getConnectBackoffMillis() * (1L << (attempt - 1));
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ConnectorException("Interrupted while connecting tenant " + tenant, e);
                }
            }
        }
        closeClient();
        throw new ConnectorException(
                "Could not subscribe tenant " + tenant + " after " + maxAttempts + " attempts", lastException);
    }

    private void subscribeToTowardsPlatformTopic() throws PulsarClientException {
        if (pulsarClient == null || pulsarClient.isClosed()) {
            pulsarClient = pulsarClientFactory.createClient(tenantContext);
        }
        ConsumerBuilder<byte[]> builder = pulsarClient.newConsumer()
                .topic(tenantContext.getTopic())
                .subscriptionName(tenantContext.getSubscriptionName())
                .subscriptionType(SubscriptionType.Shared)
                .receiverQueueSize(serviceConfiguration.getReceiverQueueSize())
                .negativeAckRedeliveryDelay(serviceConfiguration.getNegativeAckRedeliveryDelaySeconds(),
                        TimeUnit.SECONDS)
                .messageListener(callback);
        if (serviceConfiguration.hasDeadLetterTopic()) {
            String deadLetterTopic = StringUtils.replace(serviceConfiguration.getDeadLetterTopic(),
                    TENANT_PLACEHOLDER, tenant);
            builder = builder.deadLetterPolicy(DeadLetterPolicy.builder()
                    .maxRedeliverCount(serviceConfiguration.getMaxRedeliveryCount())
                    .deadLetterTopic(deadLetterTopic)
                    .build());
            log.info("{} - Dead letter topic: [{}] after {} redeliveries", tenant, deadLetterTopic,
                    serviceConfiguration.getMaxRedeliveryCount());
        }
        platformConsumer = builder.subscribe();
    }

    private void cleanupOnConnectionFailure() {
        if (platformConsumer != null) {
            try {
                platformConsumer.close();
            } catch (PulsarClientException e) {
                log.debug("{} - Error closing consumer during cleanup: {}", tenant, e.getMessage());
            }
            platformConsumer = null;
        }
        connectionStateManager.setConnected(false);
    }

    /**
     * Stops taking new work: the listener negatively acknowledges further
     * deliveries and the consumer stops fetching.
     */
    public void stopAccepting() {
        callback.stopAccepting();
        Consumer<byte[]> consumer = platformConsumer;
        if (consumer != null) {
            consumer.pause();
        }
    }

    public boolean awaitInFlight(Duration timeout) throws InterruptedException {
        return callback.awaitInFlight(timeout);
    }

    public synchronized void disconnect() {
        log.info("{} - Disconnecting consumer of topic: [{}]", tenant, tenantContext.getTopic());
        connectionStateManager.updateStatus(ConnectorStatus.DISCONNECTING, true);
        if (platformConsumer != null) {
            try {
                platformConsumer.close();
            } catch (PulsarClientException e) {
                log.error("{} - Error closing consumer", tenant, e);
            }
            platformConsumer = null;
        }
        closeClient();
        connectionStateManager.setConnected(false);
        connectionStateManager.updateStatus(ConnectorStatus.DISCONNECTED, true);
        log.info("{} - Disconnected", tenant);
    }

    private void closeClient() {
        if (pulsarClient != null) {
            try {
                pulsarClient.close();
            } catch (PulsarClientException e) {
                log.error("{} - Error closing Pulsar client", tenant, e);
            }
            pulsarClient = null;
        }
    }

    public boolean isConnected() {
        Consumer<byte[]> consumer = platformConsumer;
        return connectionStateManager.isConnected() && consumer != null && consumer.isConnected();
    }

    public ConnectorStatusEvent getStatus() {
        return connectionStateManager.getStatusSnapshot();
    }
}
