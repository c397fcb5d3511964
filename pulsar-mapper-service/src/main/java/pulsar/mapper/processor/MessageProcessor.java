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

package pulsar.mapper.processor;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import pulsar.mapper.configuration.ServiceConfiguration;
import pulsar.mapper.core.C8YAgent;
import pulsar.mapper.core.DeviceResolver;
import pulsar.mapper.model.MappedEntity;
import pulsar.mapper.model.ProcessingOutcome;
import pulsar.mapper.model.SubmissionResult;
import pulsar.mapper.model.SubmissionStatus;
import pulsar.mapper.model.TenantContext;

/**
 * Runs one message through decode, map, device resolution and submission and
 * decides how the message is settled with the broker.
 */
@Slf4j
@Component
public class MessageProcessor {

    static final int LOGGED_PAYLOAD_BYTES = 200;

    private final PayloadDecoder payloadDecoder;
    private final EntityMapper entityMapper;
    private final DeviceResolver deviceResolver;
    private final C8YAgent c8yAgent;
    private final ServiceConfiguration serviceConfiguration;

    public MessageProcessor(PayloadDecoder payloadDecoder, EntityMapper entityMapper, DeviceResolver deviceResolver,
            C8YAgent c8yAgent, ServiceConfiguration serviceConfiguration) {
        this.payloadDecoder = payloadDecoder;
        this.entityMapper = entityMapper;
        this.deviceResolver = deviceResolver;
        this.c8yAgent = c8yAgent;
        this.serviceConfiguration = serviceConfiguration;
    }

    public ProcessingOutcome process(TenantContext tenantContext, ConnectorMessage message) {
        String tenant = tenantContext.getTenant();
        try {
            if (!matchesTopicFilter(message)) {
                log.debug("{} - Skipping message {} on MQTT topic [{}], filter is [{}]", tenant,
                        message.getMessageId(), message.getTopic(), serviceConfiguration.getMqttTopicFilter());
                return ProcessingOutcome.ACKNOWLEDGE;
            }
            if (serviceConfiguration.isLogPayload()) {
                log.info("{} - PROCESSING: message {} from client {} on MQTT topic [{}]: {}", tenant,
                        message.getMessageId(), message.getClientId(), message.getTopic(),
                        message.truncatedPayload(LOGGED_PAYLOAD_BYTES));
            }

            DecodedPayload payload;
            try {
                payload = payloadDecoder.decode(message);
            } catch (DecodeException e) {
                log.error("{} - Dropping undecodable message {}: {}, payload (hex): {}", tenant,
                        message.getMessageId(), e.getMessage(), message.hexPayload(LOGGED_PAYLOAD_BYTES));
                return ProcessingOutcome.REJECT;
            }

            MappedEntity entity;
            try {
                entity = entityMapper.map(payload);
            } catch (MappingException e) {
                log.error("{} - Dropping unmappable message {} ({}): {}, payload: {}", tenant,
                        message.getMessageId(), e.getKind(), e.getMessage(),
                        message.truncatedPayload(LOGGED_PAYLOAD_BYTES));
                return ProcessingOutcome.REJECT;
            }

            SubmissionResult result;
            try {
                MappedEntity resolved = deviceResolver.resolve(tenantContext, entity);
                result = c8yAgent.submit(tenantContext, resolved);
                if (isUnknownDevice(result)) {
                    // managed object deleted on the platform, the next message creates it again
                    deviceResolver.evict(tenantContext, entity.getDeviceId());
                }
            } catch (ProcessingException e) {
                log.warn("{} - Device resolution for {} failed: {}", tenant, entity.getDeviceId(), e.getMessage());
                result = SubmissionResult.fromHttpStatus(e.getHttpStatusCode(), e.getMessage());
            }
            return settle(tenant, message, result);
        } catch (RuntimeException e) {
            log.error("{} - Unexpected error processing message {}", tenant, message.getMessageId(), e);
            return redeliverOrDrop(tenant, message, 0, e.toString());
        }
    }

    private ProcessingOutcome settle(String tenant, ConnectorMessage message, SubmissionResult result) {
        switch (result.getStatus()) {
            case SUCCESS:
                return ProcessingOutcome.ACKNOWLEDGE;
            case PERMANENT_REJECTION:
            case VALIDATION_FAILURE:
                log.error("{} - Platform rejected message {} ({} {}): {}, payload: {}", tenant,
                        message.getMessageId(), result.getStatus(), result.getHttpStatus(), result.getMessage(),
                        message.truncatedPayload(LOGGED_PAYLOAD_BYTES));
                return ProcessingOutcome.REJECT;
            case TRANSIENT_FAILURE:
            default:
                return redeliverOrDrop(tenant, message, result.getHttpStatus(), result.getMessage());
        }
    }

    /**
     * Without a dead letter topic the broker redelivers forever, so the
     * message is dropped once {@code maxRedeliveryCount} is reached.
     */
    private ProcessingOutcome redeliverOrDrop(String tenant, ConnectorMessage message, int httpStatus,
            String reason) {
        if (!serviceConfiguration.hasDeadLetterTopic()
                && message.getRedeliveryCount() >= serviceConfiguration.getMaxRedeliveryCount()) {
            log.warn("{} - Dropping message {} after {} redeliveries, last error ({}): {}", tenant,
                    message.getMessageId(), message.getRedeliveryCount(), httpStatus, reason);
            return ProcessingOutcome.REJECT;
        }
        log.warn("{} - Failure for message {} (redelivery {}), requesting redelivery: {}",
                tenant, message.getMessageId(), message.getRedeliveryCount(), reason);
        return ProcessingOutcome.REDELIVER;
    }

    private boolean isUnknownDevice(SubmissionResult result) {
        return result.getStatus() == SubmissionStatus.PERMANENT_REJECTION
                && (result.getHttpStatus() == 404 || result.getHttpStatus() == 422);
    }

    private boolean matchesTopicFilter(ConnectorMessage message) {
        String filter = serviceConfiguration.getMqttTopicFilter();
        return StringUtils.isEmpty(filter) || filter.equals(message.getTopic());
    }
}
