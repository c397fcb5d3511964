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

import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ConnectorStatusEvent {
    @NotNull
    private String tenant;

    @NotNull
    private String topic;

    @NotNull
    private ConnectorStatus status;

    private String message;

    @NotNull
    private String date;

    public ConnectorStatusEvent() {
        this.status = ConnectorStatus.UNKNOWN;
    }

    public static ConnectorStatusEvent unknown(String tenant, String topic) {
        ConnectorStatusEvent res = new ConnectorStatusEvent();
        res.tenant = tenant;
        res.topic = topic;
        res.updateStatus(ConnectorStatus.UNKNOWN, true);
        return res;
    }

    public synchronized void updateStatus(ConnectorStatus st, boolean clearMessage) {
        DateFormat dateFormat = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss");
        date = dateFormat.format(new Date());
        status = st;
        if (clearMessage)
            message = "";
    }

    public synchronized ConnectorStatusEvent copy() {
        ConnectorStatusEvent res = new ConnectorStatusEvent();
        res.tenant = tenant;
        res.topic = topic;
        res.status = status;
        res.message = message;
        res.date = date;
        return res;
    }
}
