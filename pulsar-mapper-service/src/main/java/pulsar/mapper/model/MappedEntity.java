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

import java.time.Instant;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Closed set of entities a device message can be mapped to. Callers dispatch
 * through {@link MappedEntityVisitor}, so adding a kind breaks every
 * dispatch site at compile time.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class MappedEntity {

    private final String deviceId;
    private final String type;
    private final Instant time;

    // package private: Measurement, Event and Alarm are the only kinds
    MappedEntity(String deviceId, String type, Instant time) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("deviceId must not be empty");
        }
        if (time == null) {
            throw new IllegalArgumentException("time must not be null");
        }
        this.deviceId = deviceId;
        this.type = type;
        this.time = time;
    }

    public abstract <R> R accept(MappedEntityVisitor<R> visitor);

    /**
     * Returns a copy of this entity owned by another device, e.g. after the
     * external id was resolved to the managed object id.
     */
    public abstract MappedEntity withDeviceId(String deviceId);

    public abstract EntityKind getKind();
}
