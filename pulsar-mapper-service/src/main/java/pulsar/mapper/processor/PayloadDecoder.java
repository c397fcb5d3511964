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

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

/**
 * Turns raw message bytes into a {@link DecodedPayload}. Bytes must be valid
 * UTF-8 and hold exactly one JSON object.
 */
@Component
public class PayloadDecoder {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ObjectReader treeReader;
    private final Clock clock;

    @Autowired
    public PayloadDecoder(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    public PayloadDecoder(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        // floats stay exact, 1e400 must not become Infinity
        this.treeReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS,
                DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        this.clock = clock;
    }

    public DecodedPayload decode(ConnectorMessage message) throws DecodeException {
        byte[] payload = message.getPayload();
        if (payload == null || payload.length == 0) {
            throw new DecodeException("Payload is null or empty");
        }

        String text;
        try {
            // the String constructor would silently replace malformed input
            CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
            text = decoder.decode(ByteBuffer.wrap(payload)).toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("Payload is not valid UTF-8: " + e.getMessage(), e);
        }

        try {
            JsonNode node = treeReader.readTree(text);
            if (node == null || !node.isObject()) {
                throw new DecodeException("Payload is not a JSON object");
            }
            Map<String, Object> content = objectMapper.convertValue(node, MAP_TYPE);
            return new DecodedPayload(content, message.getClientId(), clock.instant());
        } catch (JsonProcessingException e) {
            throw new DecodeException("Failed to deserialize JSON payload: " + e.getOriginalMessage(), e);
        }
    }
}
