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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class Measurement extends MappedEntity {

    // Structure: < Fragment, < Series, Value > >
    private final Map<String, Map<String, MeasurementValue>> fragments;

    public Measurement(String deviceId, String type, Instant time,
            Map<String, Map<String, MeasurementValue>> fragments) {
        super(deviceId, type, time);
        Map<String, Map<String, MeasurementValue>> copy = new LinkedHashMap<>();
        fragments.forEach((fragment, series) -> copy.put(fragment,
                Collections.unmodifiableMap(new LinkedHashMap<>(series))));
        this.fragments = Collections.unmodifiableMap(copy);
    }

    /**
     * Series of one fragment, empty if the fragment does not exist.
     */
    public Map<String, MeasurementValue> getSeries(String fragment) {
        return fragments.getOrDefault(fragment, Collections.emptyMap());
    }

    @Override
    public <R> R accept(MappedEntityVisitor<R> visitor) {
        return visitor.visitMeasurement(this);
    }

    @Override
    public Measurement withDeviceId(String deviceId) {
        return new Measurement(deviceId, getType(), getTime(), fragments);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.MEASUREMENT;
    }
}
