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
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.Message;
import org.apache.pulsar.client.api.MessageListener;
import org.apache.pulsar.client.api.PulsarClientException;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import pulsar.mapper.configuration.ServiceConfiguration;
import pulsar.mapper.model.ProcessingOutcome;
import pulsar.mapper.model.TenantContext;
import pulsar.mapper.processor.ConnectorMessage;
import pulsar.mapper.processor.MessageProcessor;

/**
 * Listener of one tenant subscription. Hands messages to the processing pool
 * and settles them with the broker according to the processing outcome.
 */
@Slf4j
public class PulsarCallback implements MessageListener<byte[]> {

    public static final String PULSAR_PROPERTY_TOPIC = "topic";
    public static final String PULSAR_PROPERTY_CLIENT_ID = "clientID";

    private final TenantContext tenantContext;
    private final String tenant;
    private final MessageProcessor messageProcessor;
    private final ExecutorService processingThreadPool;
    private final ServiceConfiguration serviceConfiguration;

    // one permit per message handed to the pool, blocks the listener thread when exhausted
    private final Semaphore permits;
    private final Object inFlightMonitor = new Object();
    private int inFlight = 0;
    private volatile boolean accepting = true;

    private final Counter receivedCounter;
    private final Counter acknowledgedCounter;
    private final Counter rejectedCounter;
    private final Counter redeliveredCounter;

    public PulsarCallback(TenantContext tenantContext, MessageProcessor messageProcessor,
            ExecutorService processingThreadPool, ServiceConfiguration serviceConfiguration) {
        this.tenantContext = tenantContext;
        this.tenant = tenantContext.getTenant();
        this.messageProcessor = messageProcessor;
        this.processingThreadPool = processingThreadPool;
        this.serviceConfiguration = serviceConfiguration;
        this.permits = new Semaphore(Math.max(1, serviceConfiguration.getProcessingThreads()));
        this.receivedCounter = messageCounter("received");
        this.acknowledgedCounter = messageCounter("acknowledged");
        this.rejectedCounter = messageCounter("rejected");
        this.redeliveredCounter = messageCounter("redelivered");
    }

    @Override
    public void received(Consumer<byte[]> consumer, Message<byte[]> message) {
        receivedCounter.increment();
        if (!accepting) {
            log.debug("{} - Not accepting messages, message {} will be redelivered", tenant,
                    message.getMessageId());
            negativeAcknowledge(consumer, message);
            return;
        }

        ConnectorMessage connectorMessage = ConnectorMessage.builder()
                .tenant(tenant)
                .messageId(String.valueOf(message.getMessageId()))
                .publishTime(message.getPublishTime())
                .redeliveryCount(message.getRedeliveryCount())
                .clientId(message.getProperty(PULSAR_PROPERTY_CLIENT_ID))
                .topic(message.getProperty(PULSAR_PROPERTY_TOPIC))
                .payload(message.getData())
                .build();

        if (serviceConfiguration.isLogPayload()) {
            log.info("{} - INITIAL: message {} on MQTT topic: [{}], client: {}", tenant,
                    connectorMessage.getMessageId(), connectorMessage.getTopic(), connectorMessage.getClientId());
        }

        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} - Interrupted while waiting for a processing slot, message {} will be redelivered",
                    tenant, connectorMessage.getMessageId());
            negativeAcknowledge(consumer, message);
            return;
        }

        incrementInFlight();
        try {
            processingThreadPool.submit(() -> {
                try {
                    ProcessingOutcome outcome = messageProcessor.process(tenantContext, connectorMessage);
                    applyOutcome(consumer, message, outcome);
                } catch (RuntimeException e) {
                    log.error("{} - Unexpected error processing message {}", tenant,
                            connectorMessage.getMessageId(), e);
                    applyOutcome(consumer, message, redeliveriesExhausted(message)
                            ? ProcessingOutcome.REJECT
                            : ProcessingOutcome.REDELIVER);
                } finally {
                    permits.release();
                    decrementInFlight();
                }
            });
        } catch (RejectedExecutionException e) {
            permits.release();
            decrementInFlight();
            log.warn("{} - Processing pool rejected message {}, it will be redelivered: {}", tenant,
                    connectorMessage.getMessageId(), e.getMessage());
            negativeAcknowledge(consumer, message);
        }
    }

    void applyOutcome(Consumer<byte[]> consumer, Message<byte[]> message, ProcessingOutcome outcome) {
        switch (outcome) {
            case ACKNOWLEDGE:
                if (serviceConfiguration.isLogPayload()) {
                    log.info("{} - END: Sending ack for message {}", tenant, message.getMessageId());
                }
                acknowledge(consumer, message);
                acknowledgedCounter.increment();
                break;
            case REJECT:
                // a negative ack always redelivers on Pulsar, dropping is an ack
                log.debug("{} - END: Sending ack for rejected message {}", tenant, message.getMessageId());
                acknowledge(consumer, message);
                rejectedCounter.increment();
                break;
            case REDELIVER:
            default:
                log.debug("{} - END: Sending negative ack for message {}", tenant, message.getMessageId());
                negativeAcknowledge(consumer, message);
                break;
        }
    }

    private boolean redeliveriesExhausted(Message<byte[]> message) {
        return !serviceConfiguration.hasDeadLetterTopic()
                && message.getRedeliveryCount() >= serviceConfiguration.getMaxRedeliveryCount();
    }

    private void acknowledge(Consumer<byte[]> consumer, Message<byte[]> message) {
        try {
            consumer.acknowledge(message);
        } catch (PulsarClientException e) {
            log.error("{} - Error acknowledging message {}, broker will redeliver it", tenant,
                    message.getMessageId(), e);
        }
    }

    private void negativeAcknowledge(Consumer<byte[]> consumer, Message<byte[]> message) {
        consumer.negativeAcknowledge(message);
        redeliveredCounter.increment();
    }

    /**
     * Messages delivered from now on are negatively acknowledged.
     */
    public void stopAccepting() {
        accepting = false;
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * Waits until every message handed to the pool has been settled.
     *
     * @return true when nothing is in flight anymore
     */
    public boolean awaitInFlight(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (inFlightMonitor) {
            while (inFlight > 0) {
                long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
                if (remainingMillis <= 0) {
                    log.warn("{} - {} message(s) still in flight after {}", tenant, inFlight, timeout);
                    return false;
                }
                inFlightMonitor.wait(remainingMillis);
            }
            return true;
        }
    }

    public int getInFlight() {
        synchronized (inFlightMonitor) {
            return inFlight;
        }
    }

    private void incrementInFlight() {
        synchronized (inFlightMonitor) {
            inFlight++;
        }
    }

    private void decrementInFlight() {
        synchronized (inFlightMonitor) {
            inFlight--;
            if (inFlight == 0) {
                inFlightMonitor.notifyAll();
            }
        }
    }

    private Counter messageCounter(String outcome) {
        return Counter.builder("pulsar_mapper_messages_total")
                .tag("tenant", tenant)
                .tag("outcome", outcome)
                .register(Metrics.globalRegistry);
    }
}
