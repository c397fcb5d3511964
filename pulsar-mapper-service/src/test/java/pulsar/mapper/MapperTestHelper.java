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

package pulsar.mapper;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import pulsar.mapper.configuration.ServiceConfiguration;
import pulsar.mapper.model.AlarmSeverity;
import pulsar.mapper.model.TenantContext;
import pulsar.mapper.processor.ConnectorMessage;

public final class MapperTestHelper {

    public static final String TEST_TENANT = "t100";
    public static final String TEST_USER = "service_pulsar-mapper";
    public static final String TEST_PASSWORD = "secret";
    public static final String TEST_BASE_URL = "http://cumulocity:8111";
    public static final Instant INGESTION_TIME = Instant.parse("2026-01-14T08:30:00Z");
    public static final Clock FIXED_CLOCK = Clock.fixed(INGESTION_TIME, ZoneOffset.UTC);

    private MapperTestHelper() {
    }

    /**
     * Configuration as shipped in application.properties, with MINOR as
     * default severity and 3 redeliveries.
     */
    public static ServiceConfiguration serviceConfiguration() {
        ServiceConfiguration configuration = new ServiceConfiguration();
        configuration.setDefaultAlarmSeverity(AlarmSeverity.MINOR);
        configuration.setMaxRedeliveryCount(3);
        Map<String, String> units = new HashMap<>();
        units.put("temperature", "°C");
        units.put("pressure", "kPa");
        configuration.setMeasurementUnits(units);
        configuration.setConnectBackoffMillis(1L);
        configuration.setBootstrapInitialBackoffMillis(1L);
        configuration.setBootstrapMaxBackoffMillis(5L);
        configuration.setRequestTimeoutSeconds(5);
        configuration.setShutdownTimeoutSeconds(5);
        return configuration;
    }

    public static TenantContext tenantContext(String tenant) {
        return TenantContext.builder()
                .tenant(tenant)
                .user(TEST_USER)
                .password(TEST_PASSWORD)
                .baseUrl(TEST_BASE_URL)
                .topic(TenantContext.deriveTopic(tenant, TenantContext.DEFAULT_NAMESPACE, TenantContext.DEFAULT_TOPIC))
                .subscriptionName("pulsar-mapper")
                .build();
    }

    public static ConnectorMessage message(String json) {
        return message(json.getBytes(StandardCharsets.UTF_8), 0);
    }

    public static ConnectorMessage message(byte[] payload, int redeliveryCount) {
        return ConnectorMessage.builder()
                .tenant(TEST_TENANT)
                .messageId("1:0:-1:0")
                .publishTime(INGESTION_TIME.toEpochMilli())
                .redeliveryCount(redeliveryCount)
                .clientId("device-42")
                .topic("sensors/device-42")
                .payload(payload)
                .build();
    }
}
