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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import pulsar.mapper.App;
import pulsar.mapper.MapperTestHelper;
import pulsar.mapper.configuration.PlatformConfiguration;
import pulsar.mapper.model.TenantContext;

class PulsarClientFactoryTest {

    private final ObjectMapper objectMapper = App.baseObjectMapper();

    @Test
    void testAuthenticationParamsUseTenantQualifiedUser() throws Exception {
        PulsarClientFactory factory = new PulsarClientFactory(new PlatformConfiguration(),
                MapperTestHelper.serviceConfiguration(), objectMapper);
        TenantContext tenantContext = TenantContext.builder()
                .tenant("t100")
                .user("service_pulsar-mapper")
                .password("se\"cret")
                .baseUrl(MapperTestHelper.TEST_BASE_URL)
                .topic("persistent://t100/mqtt/from-device")
                .subscriptionName("pulsar-mapper")
                .build();

        JsonNode params = objectMapper.readTree(factory.authenticationParams(tenantContext));

        assertEquals("t100/service_pulsar-mapper", params.get("userId").asText());
        assertEquals("se\"cret", params.get("password").asText());
    }
}
