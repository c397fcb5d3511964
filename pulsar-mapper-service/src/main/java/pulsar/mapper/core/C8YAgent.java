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

package pulsar.mapper.core;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import pulsar.mapper.configuration.ServiceConfiguration;
import pulsar.mapper.model.Alarm;
import pulsar.mapper.model.Event;
import pulsar.mapper.model.MappedEntity;
import pulsar.mapper.model.MappedEntityVisitor;
import pulsar.mapper.model.Measurement;
import pulsar.mapper.model.SubmissionResult;
import pulsar.mapper.model.TenantContext;
import pulsar.mapper.processor.ProcessingException;

/**
 * REST adapter towards the Cumulocity platform. Holds one immutable
 * {@link WebClient} per tenant and bounds concurrent calls with a semaphore.
 * No call is retried here, retries are left to broker redelivery.
 */
@Slf4j
@Component
public class C8YAgent {

    public static final String MEASUREMENT_COLLECTION_PATH = "/measurement/measurements";
    public static final String EVENT_COLLECTION_PATH = "/event/events";
    public static final String ALARM_COLLECTION_PATH = "/alarm/alarms";
    public static final String MANAGED_OBJECT_COLLECTION_PATH = "/inventory/managedObjects";
    public static final String EXTERNAL_ID_PATH = "/identity/externalIds/{type}/{externalId}";
    public static final String GLOBAL_ID_EXTERNAL_IDS_PATH = "/identity/globalIds/{id}/externalIds";

    public static final MediaType MEASUREMENT_MEDIA_TYPE = MediaType
            .parseMediaType("application/vnd.com.nsn.cumulocity.measurement+json");
    public static final MediaType EVENT_MEDIA_TYPE = MediaType
            .parseMediaType("application/vnd.com.nsn.cumulocity.event+json");
    public static final MediaType ALARM_MEDIA_TYPE = MediaType
            .parseMediaType("application/vnd.com.nsn.cumulocity.alarm+json");
    public static final MediaType MANAGED_OBJECT_MEDIA_TYPE = MediaType
            .parseMediaType("application/vnd.com.nsn.cumulocity.managedobject+json");
    public static final MediaType EXTERNAL_ID_MEDIA_TYPE = MediaType
            .parseMediaType("application/vnd.com.nsn.cumulocity.externalid+json");

    private static final int MAX_ERROR_BODY_LENGTH = 500;

    private static final RequestBuilder REQUEST_BUILDER = new RequestBuilder();

    private final WebClient.Builder webClientBuilder;
    private final ServiceConfiguration serviceConfiguration;
    private final ObjectMapper objectMapper;

    @Getter
    private final Semaphore c8ySemaphore;

    private volatile Map<String, WebClient> tenantClients = Collections.emptyMap();

    @Autowired
    public C8YAgent(WebClient.Builder webClientBuilder, ServiceConfiguration serviceConfiguration,
            ObjectMapper objectMapper) {
        this.webClientBuilder = webClientBuilder;
        this.serviceConfiguration = serviceConfiguration;
        this.objectMapper = objectMapper;
        this.c8ySemaphore = new Semaphore(serviceConfiguration.getMaxInflightSubmissions(), true);
    }

    /**
     * Builds the per-tenant clients. Called once by the coordinator before any
     * consumer is started.
     */
    public void initializeTenantClients(Collection<TenantContext> tenants) {
        Map<String, WebClient> clients = new LinkedHashMap<>();
        for (TenantContext tenant : tenants) {
            clients.put(tenant.getTenant(), webClientBuilder.clone()
                    .baseUrl(tenant.getBaseUrl())
                    .defaultHeaders(headers -> headers.setBasicAuth(tenant.getQualifiedUser(),
                            tenant.getPassword(), StandardCharsets.UTF_8))
                    .build());
            log.info("{} - Platform client created for base url: {}", tenant.getTenant(), tenant.getBaseUrl());
        }
        this.tenantClients = Collections.unmodifiableMap(clients);
    }

    /**
     * Sends one entity with exactly one POST and classifies the response.
     */
    public SubmissionResult submit(TenantContext tenant, MappedEntity entity) {
        String tenantId = tenant.getTenant();
        WebClient client = tenantClients.get(tenantId);
        if (client == null) {
            log.error("{} - No platform client bound to tenant", tenantId);
            return SubmissionResult.validationFailure("No platform client bound to tenant " + tenantId);
        }

        C8YRequest request = entity.accept(REQUEST_BUILDER);
        String body;
        try {
            body = objectMapper.writeValueAsString(request.getBody());
        } catch (JsonProcessingException e) {
            log.error("{} - Could not serialize {} for device {}", tenantId, entity.getKind(), entity.getDeviceId(),
                    e);
            return count(entity, SubmissionResult.validationFailure("Serialization failed: " + e.getMessage()));
        }
        if (serviceConfiguration.isLogPayload()) {
            log.info("{} - SEND: {} {}", tenantId, request.getPath(), body);
        }

        SubmissionResult result;
        try {
            ResponseEntity<Void> response = withPermit(tenantId, () -> client.post()
                    .uri(request.getPath())
                    .contentType(request.getMediaType())
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .toBodilessEntity()
                    .block(requestTimeout()));
            int status = response == null ? 0 : response.getStatusCode().value();
            result = SubmissionResult.fromHttpStatus(status, "Unexpected response status " + status);
        } catch (WebClientResponseException e) {
            result = SubmissionResult.fromHttpStatus(e.getStatusCode().value(), describe(e));
        } catch (WebClientRequestException e) {
            result = SubmissionResult.transientFailure(0, "Request failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = SubmissionResult.transientFailure(0, "Interrupted while waiting for a platform connection");
        } catch (RuntimeException e) {
            // timeouts from block() and anything unexpected
            result = SubmissionResult.transientFailure(0, e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        if (result.isSuccess()) {
            log.debug("{} - SEND: {} posted for device {}, status {}", tenantId, entity.getKind(),
                    entity.getDeviceId(), result.getHttpStatus());
        } else {
            log.warn("{} - SEND: {} for device {} failed with {} ({}): {}", tenantId, entity.getKind(),
                    entity.getDeviceId(), result.getStatus(), result.getHttpStatus(), result.getMessage());
        }
        return count(entity, result);
    }

    /**
     * Looks up the managed object registered for an external id.
     *
     * @return the managed object id, empty when the platform answers 404
     */
    public Optional<String> resolveExternalId(TenantContext tenant, String externalIdType, String externalId)
            throws ProcessingException {
        WebClient client = requireClient(tenant);
        try {
            JsonNode node = withPermit(tenant.getTenant(), () -> client.get()
                    .uri(EXTERNAL_ID_PATH, externalIdType, externalId)
                    .accept(MediaType.APPLICATION_JSON, EXTERNAL_ID_MEDIA_TYPE)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(requestTimeout()));
            String id = node == null ? null : node.path("managedObject").path("id").asText(null);
            if (StringUtils.isBlank(id)) {
                throw new ProcessingException("External id response without managed object id for "
                        + externalIdType + "/" + externalId);
            }
            return Optional.of(id);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == 404) {
                log.debug("{} - External id {}/{} not found", tenant.getTenant(), externalIdType, externalId);
                return Optional.empty();
            }
            throw new ProcessingException("Resolving external id " + externalId + " failed: " + describe(e), e,
                    e.getStatusCode().value());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessingException("Interrupted while resolving external id " + externalId, e);
        } catch (RuntimeException e) {
            throw new ProcessingException("Resolving external id " + externalId + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Creates a device managed object. The external id is only used for its
     * name, it is registered separately by {@link #registerExternalId}.
     *
     * @return id of the new managed object
     */
    public String createManagedObject(TenantContext tenant, String externalId) throws ProcessingException {
        WebClient client = requireClient(tenant);
        Map<String, Object> device = new LinkedHashMap<>();
        device.put("name", serviceConfiguration.getDevicePrefix() + externalId);
        device.put("type", serviceConfiguration.getDeviceType());
        device.put("c8y_IsDevice", Collections.emptyMap());

        try {
            JsonNode created = withPermit(tenant.getTenant(), () -> client.post()
                    .uri(MANAGED_OBJECT_COLLECTION_PATH)
                    .contentType(MANAGED_OBJECT_MEDIA_TYPE)
                    .accept(MediaType.APPLICATION_JSON, MANAGED_OBJECT_MEDIA_TYPE)
                    .bodyValue(writeJson(device))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(requestTimeout()));
            String id = created == null ? null : created.path("id").asText(null);
            if (StringUtils.isBlank(id)) {
                throw new ProcessingException("Device creation response without id for " + externalId);
            }
            log.info("{} - Created device {} for external id {}", tenant.getTenant(), id, externalId);
            return id;
        } catch (WebClientResponseException e) {
            throw new ProcessingException("Creating device " + externalId + " failed: " + describe(e), e,
                    e.getStatusCode().value());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessingException("Interrupted while creating device " + externalId, e);
        } catch (RuntimeException e) {
            throw new ProcessingException("Creating device " + externalId + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Registers an external id for an existing managed object.
     */
    public void registerExternalId(TenantContext tenant, String managedObjectId, String externalIdType,
            String externalId) throws ProcessingException {
        WebClient client = requireClient(tenant);
        Map<String, Object> identity = new LinkedHashMap<>();
        identity.put("externalId", externalId);
        identity.put("type", externalIdType);

        try {
            withPermit(tenant.getTenant(), () -> client.post()
                    .uri(GLOBAL_ID_EXTERNAL_IDS_PATH, managedObjectId)
                    .contentType(EXTERNAL_ID_MEDIA_TYPE)
                    .accept(MediaType.APPLICATION_JSON, EXTERNAL_ID_MEDIA_TYPE)
                    .bodyValue(writeJson(identity))
                    .retrieve()
                    .toBodilessEntity()
                    .block(requestTimeout()));
            log.info("{} - Registered external id {}/{} for device {}", tenant.getTenant(), externalIdType,
                    externalId, managedObjectId);
        } catch (WebClientResponseException e) {
            throw new ProcessingException("Registering external id " + externalId + " failed: " + describe(e), e,
                    e.getStatusCode().value());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessingException("Interrupted while registering external id " + externalId, e);
        } catch (RuntimeException e) {
            throw new ProcessingException("Registering external id " + externalId + " failed: " + e.getMessage(),
                    e);
        }
    }

    private WebClient requireClient(TenantContext tenant) throws ProcessingException {
        WebClient client = tenantClients.get(tenant.getTenant());
        if (client == null) {
            throw new ProcessingException("No platform client bound to tenant " + tenant.getTenant(), 400);
        }
        return client;
    }

    private <T> T withPermit(String tenant, Supplier<T> call) throws InterruptedException {
        if (c8ySemaphore.availablePermits() == 0) {
            log.debug("{} - All platform connections busy, waiting", tenant);
        }
        c8ySemaphore.acquire();
        try {
            return call.get();
        } finally {
            c8ySemaphore.release();
        }
    }

    private String writeJson(Map<String, Object> body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize request body", e);
        }
    }

    private Duration requestTimeout() {
        return Duration.ofSeconds(serviceConfiguration.getRequestTimeoutSeconds());
    }

    private static String describe(WebClientResponseException e) {
        return e.getStatusCode().value() + " " + StringUtils.abbreviate(e.getResponseBodyAsString(),
                MAX_ERROR_BODY_LENGTH);
    }

    private static SubmissionResult count(MappedEntity entity, SubmissionResult result) {
        Counter.builder("pulsar_mapper_submissions_total")
                .tag("api", entity.getKind().name())
                .tag("result", result.getStatus().name())
                .register(Metrics.globalRegistry)
                .increment();
        return result;
    }

    @Getter
    static class C8YRequest {
        private final String path;
        private final MediaType mediaType;
        private final Map<String, Object> body;

        C8YRequest(String path, MediaType mediaType, Map<String, Object> body) {
            this.path = path;
            this.mediaType = mediaType;
            this.body = body;
        }
    }

    /**
     * Renders entities in the platform's REST representation.
     */
    static class RequestBuilder implements MappedEntityVisitor<C8YRequest> {

        @Override
        public C8YRequest visitMeasurement(Measurement measurement) {
            Map<String, Object> body = header(measurement);
            measurement.getFragments().forEach((fragment, series) -> {
                Map<String, Object> seriesBody = new LinkedHashMap<>();
                series.forEach((name, value) -> {
                    Map<String, Object> valueBody = new LinkedHashMap<>();
                    valueBody.put("value", value.getValue());
                    if (StringUtils.isNotEmpty(value.getUnit())) {
                        valueBody.put("unit", value.getUnit());
                    }
                    seriesBody.put(name, valueBody);
                });
                body.putIfAbsent(fragment, seriesBody);
            });
            return new C8YRequest(MEASUREMENT_COLLECTION_PATH, MEASUREMENT_MEDIA_TYPE, body);
        }

        @Override
        public C8YRequest visitEvent(Event event) {
            Map<String, Object> body = header(event);
            body.put("text", event.getText());
            event.getCustomFragments().forEach(body::putIfAbsent);
            return new C8YRequest(EVENT_COLLECTION_PATH, EVENT_MEDIA_TYPE, body);
        }

        @Override
        public C8YRequest visitAlarm(Alarm alarm) {
            Map<String, Object> body = header(alarm);
            body.put("text", alarm.getText());
            body.put("severity", alarm.getSeverity().name());
            body.put("status", alarm.getStatus().name());
            alarm.getCustomFragments().forEach(body::putIfAbsent);
            return new C8YRequest(ALARM_COLLECTION_PATH, ALARM_MEDIA_TYPE, body);
        }

        private static Map<String, Object> header(MappedEntity entity) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("source", Collections.singletonMap("id", entity.getDeviceId()));
            body.put("type", entity.getType());
            body.put("time", DateTimeFormatter.ISO_INSTANT.format(entity.getTime()));
            return body;
        }
    }
}
