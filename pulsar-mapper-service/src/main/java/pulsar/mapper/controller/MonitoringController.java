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

package pulsar.mapper.controller;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import pulsar.mapper.core.BootstrapService;
import pulsar.mapper.model.ConnectorStatusEvent;

@Slf4j
@RestController
@Tag(name = "Monitoring Controller", description = "API for service health and the status of the tenant consumers")
public class MonitoringController {

    @Autowired
    BootstrapService bootstrapService;

    @Operation(summary = "Service health", description = "Returns UP as long as at least one tenant consumer is connected to the broker.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "At least one tenant consumer is connected", content = @Content(mediaType = "application/json")),
            @ApiResponse(responseCode = "503", description = "No tenant consumer is connected", content = @Content(mediaType = "application/json"))
    })
    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, String>> getHealth() {
        if (bootstrapService.isAnyConsumerConnected()) {
            return new ResponseEntity<>(Collections.singletonMap("status", "UP"), HttpStatus.OK);
        }
        log.warn("Health check failed, no tenant consumer connected");
        return new ResponseEntity<>(Collections.singletonMap("status", "DOWN"), HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Operation(summary = "Get tenant consumer status", description = "Retrieves the connection status of the consumer of every subscribed tenant, including the last error message.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status retrieved successfully", content = @Content(mediaType = "application/json", array = @ArraySchema(schema = @Schema(implementation = ConnectorStatusEvent.class))))
    })
    @GetMapping(value = "/monitoring/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ConnectorStatusEvent>> getConsumerStatus() {
        return new ResponseEntity<>(bootstrapService.getConsumerStatus(), HttpStatus.OK);
    }
}
