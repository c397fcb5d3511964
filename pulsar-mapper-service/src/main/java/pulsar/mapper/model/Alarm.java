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
public class Alarm extends MappedEntity {

    private final String text;
    private final AlarmSeverity severity;
    private final AlarmStatus status;
    private final Map<String, Object> customFragments;

    public Alarm(String deviceId, String type, Instant time, String text, AlarmSeverity severity,
            AlarmStatus status, Map<String, Object> customFragments) {
        super(deviceId, type, time);
        this.text = text;
        this.severity = severity;
        this.status = status;
        this.customFragments = Collections.unmodifiableMap(new LinkedHashMap<>(customFragments));
    }

    @Override
    public <R> R accept(MappedEntityVisitor<R> visitor) {
        return visitor.visitAlarm(this);
    }

    @Override
    public Alarm withDeviceId(String deviceId) {
        return new Alarm(deviceId, getType(), getTime(), text, severity, status, customFragments);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.ALARM;
    }
}
