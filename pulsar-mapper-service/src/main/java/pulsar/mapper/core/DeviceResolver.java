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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import pulsar.mapper.configuration.ServiceConfiguration;
import pulsar.mapper.core.cache.InboundExternalIdCache;
import pulsar.mapper.model.MappedEntity;
import pulsar.mapper.model.SubmissionResult;
import pulsar.mapper.model.TenantContext;
import pulsar.mapper.processor.ProcessingException;

/**
 * Replaces the device identifier of an entity, an external id, by the id of
 * the managed object registered for it. Unknown devices are created.
 * <p>
 * Creation and registration of the external id are two calls. When the
 * registration fails the created managed object is remembered and only the
 * registration is repeated with the next message of that device.
 */
@Slf4j
@Component
public class DeviceResolver {

    private final C8YAgent c8yAgent;
    private final ServiceConfiguration serviceConfiguration;
    private final Map<String, InboundExternalIdCache> inboundExternalIdCaches = new ConcurrentHashMap<>();

    // tenant:externalId to managed objects created but not registered yet
    private final Map<String, String> pendingRegistrations = new ConcurrentHashMap<>();

    public DeviceResolver(C8YAgent c8yAgent, ServiceConfiguration serviceConfiguration) {
        this.c8yAgent = c8yAgent;
        this.serviceConfiguration = serviceConfiguration;
    }

    public MappedEntity resolve(TenantContext tenant, MappedEntity entity) throws ProcessingException {
        if (!Boolean.TRUE.equals(serviceConfiguration.getResolveExternalId())) {
            return entity;
        }
        String externalId = entity.getDeviceId();
        InboundExternalIdCache cache = getInboundExternalIdCache(tenant.getTenant());
        String managedObjectId = cache.getIdByExternalId(externalId);
        if (managedObjectId == null) {
            // misses are serialized per tenant so concurrent messages of a new device create it once
            synchronized (cache) {
                managedObjectId = cache.getIdByExternalId(externalId);
                if (managedObjectId == null) {
                    managedObjectId = lookupOrCreate(tenant, externalId);
                    cache.putIdForExternalId(externalId, managedObjectId);
                }
            }
        }
        return entity.withDeviceId(managedObjectId);
    }

    /**
     * Forgets the managed object of an external id, e.g. after the platform
     * answered 404 for it.
     */
    public void evict(TenantContext tenant, String externalId) {
        if (!Boolean.TRUE.equals(serviceConfiguration.getResolveExternalId())) {
            return;
        }
        InboundExternalIdCache cache = getInboundExternalIdCache(tenant.getTenant());
        if (cache.getIdByExternalId(externalId) != null) {
            cache.removeIdForExternalId(externalId);
            log.info("{} - Evicted device for external id {} from cache", tenant.getTenant(), externalId);
        }
    }

    public InboundExternalIdCache getInboundExternalIdCache(String tenant) {
        return inboundExternalIdCaches.computeIfAbsent(tenant,
                t -> new InboundExternalIdCache(serviceConfiguration.getDeviceCacheSize(), t));
    }

    private String lookupOrCreate(TenantContext tenant, String externalId) throws ProcessingException {
        String externalIdType = serviceConfiguration.getExternalIdType();
        String managedObjectId = c8yAgent.resolveExternalId(tenant, externalIdType, externalId).orElse(null);
        String pendingKey = tenant.getTenant() + ":" + externalId;
        if (managedObjectId != null) {
            pendingRegistrations.remove(pendingKey);
            return managedObjectId;
        }
        // a device created by an earlier attempt whose registration failed is reused
        managedObjectId = pendingRegistrations.get(pendingKey);
        if (managedObjectId == null) {
            log.info("{} - Device with external id {}/{} not found, creating it", tenant.getTenant(),
                    externalIdType, externalId);
            managedObjectId = c8yAgent.createManagedObject(tenant, externalId);
            pendingRegistrations.put(pendingKey, managedObjectId);
        } else {
            log.info("{} - Retrying registration of external id {}/{} for device {}", tenant.getTenant(),
                    externalIdType, externalId, managedObjectId);
        }
        try {
            c8yAgent.registerExternalId(tenant, managedObjectId, externalIdType, externalId);
        } catch (ProcessingException e) {
            if (SubmissionResult.isPermanent(e.getHttpStatusCode())) {
                // retrying the same device cannot succeed
                pendingRegistrations.remove(pendingKey);
            }
            throw e;
        }
        pendingRegistrations.remove(pendingKey);
        return managedObjectId;
    }
}
