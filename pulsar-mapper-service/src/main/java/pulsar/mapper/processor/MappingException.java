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

import lombok.Getter;

/**
 * Payload was decoded but has a shape that cannot be mapped. Only the producer
 * can fix it.
 */
@Getter
public class MappingException extends Exception {

    private final MappingErrorKind kind;

    public MappingException(MappingErrorKind kind, String errorMessage) {
        super(errorMessage);
        this.kind = kind;
    }

    public MappingException(MappingErrorKind kind, String errorMessage, Throwable cause) {
        super(errorMessage, cause);
        this.kind = kind;
    }
}
