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

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Connection settings and credentials handed to the microservice by the
 * platform through its environment.
 */
@Data
@Component
public class PlatformConfiguration {

    @Value("${C8Y_BASEURL}")
    private String baseUrl;

    @Value("${C8Y_BASEURL_PULSAR}")
    private String pulsarServiceUrl;

    @Value("${C8Y_MICROSERVICE_ISOLATION:PER_TENANT}")
    private IsolationMode isolation = IsolationMode.PER_TENANT;

    @Value("${C8Y_TENANT:}")
    private String tenant;

    @Value("${C8Y_USER:}")
    private String user;

    @Value("${C8Y_PASSWORD:}")
    private String password;

    @Value("${C8Y_BOOTSTRAP_TENANT:}")
    private String bootstrapTenant;

    @Value("${C8Y_BOOTSTRAP_USER:}")
    private String bootstrapUser;

    @Value("${C8Y_BOOTSTRAP_PASSWORD:}")
    private String bootstrapPassword;

    @Override
    public String toString() {
        return "PlatformConfiguration(baseUrl=" + baseUrl + ", pulsarServiceUrl=" + pulsarServiceUrl
                + ", isolation=" + isolation + ", tenant=" + tenant + ", user=" + user
                + ", bootstrapTenant=" + bootstrapTenant + ", bootstrapUser=" + bootstrapUser + ")";
    }
}
