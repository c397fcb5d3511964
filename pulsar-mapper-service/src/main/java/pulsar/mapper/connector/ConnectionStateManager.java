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

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.commons.lang3.mutable.MutableBoolean;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import pulsar.mapper.model.ConnectorStatus;
import pulsar.mapper.model.ConnectorStatusEvent;

/**
 * Connection state and status transitions of one tenant consumer.
 */
@Slf4j
public class ConnectionStateManager {

    private final String tenant;
    private final MutableBoolean connectionState = new MutableBoolean(false);

    @Getter
    private final AtomicReference<ConnectorStatusEvent> connectorStatus;

    public ConnectionStateManager(String tenant, String topic) {
        this.tenant = tenant;
        this.connectorStatus = new AtomicReference<>(ConnectorStatusEvent.unknown(tenant, topic));
    }

    public synchronized boolean isConnected() {
        return connectionState.booleanValue();
    }

    public synchronized void setConnected(boolean connected) {
        boolean wasConnected = connectionState.booleanValue();
        connectionState.setValue(connected);

        if (wasConnected != connected) {
            log.info("{} - Connection state changed: {} -> {}", tenant, wasConnected, connected);
            updateStatus(connected ? ConnectorStatus.CONNECTED : ConnectorStatus.DISCONNECTED, true);
        }
    }

    public void updateStatus(ConnectorStatus status, boolean clearMessage) {
        connectorStatus.get().updateStatus(status, clearMessage);
    }

    public void updateStatusWithError(Exception e) {
        ConnectorStatusEvent currentStatus = connectorStatus.get();
        synchronized (currentStatus) {
            currentStatus.setMessage(buildErrorMessage(e));
            currentStatus.updateStatus(ConnectorStatus.FAILED, false);
        }
    }

    private String buildErrorMessage(Exception e) {
        StringBuilder messageBuilder = new StringBuilder()
                .append(e.getClass().getName())
                .append(": ")
                .append(e.getMessage());

        Optional.ofNullable(e.getCause()).ifPresent(cause -> messageBuilder.append(" --- Caused by ")
                .append(cause.getClass().getName())
                .append(": ")
                .append(cause.getMessage()));

        return messageBuilder.toString();
    }

    public ConnectorStatus getCurrentStatus() {
        return connectorStatus.get().getStatus();
    }

    public ConnectorStatusEvent getStatusSnapshot() {
        return connectorStatus.get().copy();
    }
}
