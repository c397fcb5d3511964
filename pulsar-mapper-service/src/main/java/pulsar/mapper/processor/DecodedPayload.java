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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Value;

/**
 * JSON object of a message. The client id and the ingestion time travel with
 * it as fallbacks for device identifier and timestamp.
 */
@Value
public class DecodedPayload {

    Map<String, Object> content;
    String clientId;
    Instant ingestionTime;

    public DecodedPayload(Map<String, Object> content, String clientId, Instant ingestionTime) {
        this.content = Collections.unmodifiableMap(new LinkedHashMap<>(content));
        this.clientId = clientId;
        this.ingestionTime = ingestionTime;
    }
}
