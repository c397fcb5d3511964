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

package pulsar.mapper.core.cache;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded LRU cache from external id to managed object id, one per tenant.
 */
public class InboundExternalIdCache {

	private final Map<String, String> cache;

	public InboundExternalIdCache(int cacheSize, String tenant) {
		this.cache = Collections.synchronizedMap(new LinkedHashMap<String, String>(16, 0.75f, true) {
			@Override
			protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
				return size() > cacheSize;
			}
		});
		Tags tag = Tags.of("tenant", tenant);
		Gauge.builder("pulsar_mapper_inbound_identity_cache_size", this.cache, Map::size)
				.tags(tag)
				.register(Metrics.globalRegistry);
	}

	public String getIdByExternalId(String externalId) {
		return cache.get(externalId);
	}

	public void putIdForExternalId(String externalId, String managedObjectId) {
		cache.put(externalId, managedObjectId);
	}

	public void removeIdForExternalId(String externalId) {
		cache.remove(externalId);
	}

	public int getCacheSize() {
		return cache.size();
	}
}
