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

package pulsar.mapper.connector;

/**
 * Broker connection failure of one tenant consumer.
 */
public class ConnectorException extends Exception {

    private final boolean recoverable;

    public ConnectorException(String message) {
        this(message, null, true);
    }

    public ConnectorException(String message, Throwable cause) {
        this(message, cause, true);
    }

    public ConnectorException(String message, Throwable cause, boolean recoverable) {
        super(message, cause);
        this.recoverable = recoverable;
    }

    /**
     * @return false when retrying cannot help, e.g. rejected credentials
     */
    public boolean isRecoverable() {
        return recoverable;
    }
}
