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

public enum EntityKind {
    MEASUREMENT,
    EVENT,
    ALARM;

    /**
     * Resolves the value of the {@code type} field of a message, ignoring case.
     *
     * @return the kind or {@code null} if the value does not name one
     */
    public static EntityKind fromPayloadType(Object value) {
        if (!(value instanceof String)) {
            return null;
        }
        for (EntityKind kind : values()) {
            if (kind.name().equalsIgnoreCase(((String) value).trim())) {
                return kind;
            }
        }
        return null;
    }
}
