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

package pulsar.mapper.configuration;

import java.util.HashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import pulsar.mapper.model.AlarmSeverity;

/**
 * Settings of the mapping pipeline. Read once at startup.
 */
@Data
@ToString
@Component
public class ServiceConfiguration {

    public ServiceConfiguration() {
        this.logPayload = false;
        this.subscriptionName = "pulsar-mapper";
        this.pulsarNamespace = "mqtt";
        this.pulsarTopic = "from-device";
        this.deadLetterTopic = "";
        this.negativeAckRedeliveryDelaySeconds = 10;
        this.maxInflightSubmissions = 20;
        this.processingThreads = 10;
        this.listenerThreads = 2;
        this.receiverQueueSize = 100;
        this.shutdownTimeoutSeconds = 30;
        this.connectMaxAttempts = 3;
        this.connectBackoffMillis = 2000L;
        this.bootstrapMaxAttempts = 5;
        this.bootstrapInitialBackoffMillis = 500L;
        this.bootstrapMaxBackoffMillis = 10000L;
        this.requestTimeoutSeconds = 30;
        this.mqttTopicFilter = "";
        this.resolveExternalId = true;
        this.externalIdType = "c8y_Serial";
        this.devicePrefix = "MyDevice-";
        this.deviceType = "mqtt_pulsar_Device";
        this.deviceCacheSize = 10000;
        this.defaultMeasurementType = "c8y_PulsarMeasurement";
        this.measurementUnits = new HashMap<>();
        this.defaultEventType = "c8y_PulsarEvent";
        this.defaultAlarmType = "c8y_PulsarAlarm";
    }

    @Value("${APP.logPayload}")
    private Boolean logPayload;

    @Value("${APP.subscriptionName}")
    private String subscriptionName;

    @Value("${APP.pulsarNamespace}")
    private String pulsarNamespace;

    @Value("${APP.pulsarTopic}")
    private String pulsarTopic;

    // required, no default
    @NotNull
    @Value("${APP.alarm.defaultSeverity}")
    private AlarmSeverity defaultAlarmSeverity;

    // required, no default
    @NotNull
    @Value("${APP.maxRedeliveryCount}")
    private Integer maxRedeliveryCount;

    @Value("${APP.deadLetterTopic:}")
    private String deadLetterTopic;

    @Value("${APP.negativeAckRedeliveryDelaySeconds}")
    private Integer negativeAckRedeliveryDelaySeconds;

    @Value("${APP.maxInflightSubmissions}")
    private Integer maxInflightSubmissions;

    @Value("${APP.processingThreads}")
    private Integer processingThreads;

    @Value("${APP.listenerThreads}")
    private Integer listenerThreads;

    @Value("${APP.receiverQueueSize}")
    private Integer receiverQueueSize;

    @Value("${APP.shutdownTimeoutSeconds}")
    private Integer shutdownTimeoutSeconds;

    @Value("${APP.connectMaxAttempts}")
    private Integer connectMaxAttempts;

    @Value("${APP.connectBackoffMillis}")
    private Long connectBackoffMillis;

    @Value("${APP.bootstrap.maxAttempts}")
    private Integer bootstrapMaxAttempts;

    @Value("${APP.bootstrap.initialBackoffMillis}")
    private Long bootstrapInitialBackoffMillis;

    @Value("${APP.bootstrap.maxBackoffMillis}")
    private Long bootstrapMaxBackoffMillis;

    @Value("${APP.requestTimeoutSeconds}")
    private Integer requestTimeoutSeconds;

    @Value("${APP.mqttTopicFilter:}")
    private String mqttTopicFilter;

    @Value("${APP.resolveExternalId}")
    private Boolean resolveExternalId;

    @Value("${APP.externalIdType}")
    private String externalIdType;

    @Value("${APP.devicePrefix}")
    private String devicePrefix;

    @Value("${APP.deviceType}")
    private String deviceType;

    @Value("${APP.deviceCacheSize}")
    private Integer deviceCacheSize;

    @Value("${APP.measurement.defaultType}")
    private String defaultMeasurementType;

    @Value("#{${APP.measurement.units:{:}}}")
    private Map<String, String> measurementUnits;

    @Value("${APP.event.defaultType}")
    private String defaultEventType;

    @Value("${APP.alarm.defaultType}")
    private String defaultAlarmType;

    @PostConstruct
    void validate() {
        if (defaultAlarmSeverity == null) {
            throw new IllegalStateException("APP.alarm.defaultSeverity (DEFAULT_ALARM_SEVERITY) must be configured");
        }
        if (maxRedeliveryCount == null || maxRedeliveryCount < 0) {
            throw new IllegalStateException("APP.maxRedeliveryCount (MAX_REDELIVERY_COUNT) must be configured");
        }
    }

    public boolean isLogPayload() {
        return Boolean.TRUE.equals(logPayload);
    }

    public boolean hasDeadLetterTopic() {
        return deadLetterTopic != null && !deadLetterTopic.isBlank();
    }
}
