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

package pulsar.mapper.model;

import lombok.Builder;
import lombok.Value;

/**
 * Everything needed to consume and submit on behalf of one subscribed tenant.
 * Created once at startup, never mutated afterwards.
 */
@Value
@Builder
public class TenantContext {

    public static final String DEFAULT_NAMESPACE = "mqtt";
    public static final String DEFAULT_TOPIC = "from-device";

    String tenant;
    String user;
    String password;
    String baseUrl;
    String topic;
    String subscriptionName;

    /**
     * Username used by the Pulsar basic authentication and by the REST API:
     * {@code {tenant}/{user}}.
     */
    public String getQualifiedUser() {
        return tenant + "/" + user;
    }

    public static String deriveTopic(String tenant, String namespace, String topic) {
        return String.format("persistent://%s/%s/%s", tenant, namespace, topic);
    }

    @Override
    public String toString() {
        // no password
        return "TenantContext(tenant=" + tenant + ", user=" + user + ", baseUrl=" + baseUrl + ", topic=" + topic
                + ", subscriptionName=" + subscriptionName + ")";
    }
}
