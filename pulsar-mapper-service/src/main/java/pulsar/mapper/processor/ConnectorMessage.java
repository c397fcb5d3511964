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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.commons.codec.binary.Hex;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;

/**
 * A message as delivered by the broker, detached from the client library.
 */
@Value
@Builder
public class ConnectorMessage {

    @NotNull
    String tenant;

    @NotNull
    String messageId;

    long publishTime;

    int redeliveryCount;

    /** {@code clientID} of the publishing MQTT client */
    String clientId;

    /** MQTT topic the device published to */
    String topic;

    byte[] payload;

    /**
     * Payload prefix for log output, undecodable bytes replaced.
     */
    public String truncatedPayload(int maxBytes) {
        if (payload == null) {
            return "<null>";
        }
        int length = Math.min(payload.length, maxBytes);
        String text = new String(payload, 0, length, StandardCharsets.UTF_8);
        return payload.length > maxBytes ? text + "...(" + payload.length + " bytes)" : text;
    }

    /**
     * Payload prefix as hex, for bytes that are not valid UTF-8.
     */
    public String hexPayload(int maxBytes) {
        if (payload == null) {
            return "<null>";
        }
        String hex = Hex.encodeHexString(Arrays.copyOf(payload, Math.min(payload.length, maxBytes)));
        return payload.length > maxBytes ? hex + "...(" + payload.length + " bytes)" : hex;
    }
}
