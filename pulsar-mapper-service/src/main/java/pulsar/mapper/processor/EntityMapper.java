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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import pulsar.mapper.configuration.ServiceConfiguration;
import pulsar.mapper.model.Alarm;
import pulsar.mapper.model.AlarmSeverity;
import pulsar.mapper.model.AlarmStatus;
import pulsar.mapper.model.EntityKind;
import pulsar.mapper.model.Event;
import pulsar.mapper.model.MappedEntity;
import pulsar.mapper.model.Measurement;
import pulsar.mapper.model.MeasurementValue;

/**
 * Maps a decoded device message to a measurement, event or alarm.
 * <p>
 * Recognized top level keys are {@code device_id}, {@code timestamp},
 * {@code type} and {@code data}. A {@code type} of {@code measurement},
 * {@code event} or {@code alarm} selects the structured mapping of
 * {@code data}; any other payload is read as a flat measurement where every
 * numeric field becomes a series. Unknown fields are ignored.
 * <p>
 * The mapper only reads its configuration, it has no other state and can be
 * called concurrently.
 */
@Component
public class EntityMapper {

    public static final String KEY_DEVICE_ID = "device_id";
    public static final String KEY_TIMESTAMP = "timestamp";
    public static final String KEY_TIME = "time";
    public static final String KEY_TYPE = "type";
    public static final String KEY_DATA = "data";
    public static final String KEY_TEXT = "text";
    public static final String KEY_SEVERITY = "severity";
    public static final String KEY_STATUS = "status";
    public static final String KEY_VALUE = "value";
    public static final String KEY_UNIT = "unit";

    private static final Set<String> TOP_LEVEL_KEYS = Set.of(KEY_DEVICE_ID, KEY_TIMESTAMP, KEY_TYPE, KEY_DATA);
    private static final Set<String> DATA_KEYS = Set.of(KEY_DEVICE_ID, KEY_TIMESTAMP, KEY_TIME, KEY_TYPE,
            KEY_TEXT, KEY_SEVERITY, KEY_STATUS);

    // offset date time first, then local date time and date, both read as UTC
    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            value -> OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
            value -> LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
            value -> LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC)
                    .toInstant());

    private final ServiceConfiguration serviceConfiguration;

    public EntityMapper(ServiceConfiguration serviceConfiguration) {
        this.serviceConfiguration = serviceConfiguration;
    }

    public MappedEntity map(DecodedPayload payload) throws MappingException {
        Map<String, Object> content = payload.getContent();
        String deviceId = resolveDeviceId(content, payload.getClientId());
        EntityKind kind = EntityKind.fromPayloadType(content.get(KEY_TYPE));

        if (kind == null) {
            Instant time = resolveTime(content, Collections.emptyMap(), payload.getIngestionTime());
            String type = textOrDefault(content.get(KEY_TYPE), serviceConfiguration.getDefaultMeasurementType());
            return new Measurement(deviceId, type, time, extractFragments(type, content, TOP_LEVEL_KEYS));
        }

        Map<String, Object> data = resolveData(content);
        Instant time = resolveTime(content, data, payload.getIngestionTime());
        switch (kind) {
            case MEASUREMENT:
                return mapMeasurement(deviceId, time, data);
            case EVENT:
                return mapEvent(deviceId, time, data);
            case ALARM:
                return mapAlarm(deviceId, time, data);
            default:
                throw new IllegalStateException("Unsupported entity kind: " + kind);
        }
    }

    private Measurement mapMeasurement(String deviceId, Instant time, Map<String, Object> data)
            throws MappingException {
        String type = textOrDefault(data.get(KEY_TYPE), serviceConfiguration.getDefaultMeasurementType());
        return new Measurement(deviceId, type, time, extractFragments(type, data, DATA_KEYS));
    }

    private Event mapEvent(String deviceId, Instant time, Map<String, Object> data) {
        String type = textOrDefault(data.get(KEY_TYPE), serviceConfiguration.getDefaultEventType());
        String text = textOrDefault(data.get(KEY_TEXT), type);
        return new Event(deviceId, type, time, text, extractCustomFragments(data));
    }

    private Alarm mapAlarm(String deviceId, Instant time, Map<String, Object> data) throws MappingException {
        String type = textOrDefault(data.get(KEY_TYPE), serviceConfiguration.getDefaultAlarmType());
        String text = textOrDefault(data.get(KEY_TEXT), type);

        AlarmSeverity severity = serviceConfiguration.getDefaultAlarmSeverity();
        Object rawSeverity = data.get(KEY_SEVERITY);
        if (rawSeverity != null) {
            severity = rawSeverity instanceof String ? AlarmSeverity.parse((String) rawSeverity) : null;
            if (severity == null) {
                throw new MappingException(MappingErrorKind.INVALID_SEVERITY,
                        "Unknown alarm severity: " + rawSeverity);
            }
        }
        if (severity == null) {
            throw new IllegalStateException("No default alarm severity configured");
        }

        AlarmStatus status = AlarmStatus.ACTIVE;
        Object rawStatus = data.get(KEY_STATUS);
        if (rawStatus != null) {
            status = rawStatus instanceof String ? AlarmStatus.parse((String) rawStatus) : null;
            if (status == null) {
                throw new MappingException(MappingErrorKind.INVALID_DATA, "Unknown alarm status: " + rawStatus);
            }
        }
        return new Alarm(deviceId, type, time, text, severity, status, extractCustomFragments(data));
    }

    private String resolveDeviceId(Map<String, Object> content, String clientId) throws MappingException {
        Object raw = content.get(KEY_DEVICE_ID);
        if (raw instanceof String && StringUtils.isNotBlank((String) raw)) {
            return ((String) raw).trim();
        }
        if (raw instanceof Number) {
            return toBigDecimal((Number) raw).toPlainString();
        }
        if (StringUtils.isNotBlank(clientId)) {
            return clientId.trim();
        }
        throw new MappingException(MappingErrorKind.MISSING_DEVICE_ID,
                "Neither a device_id field nor a clientID property identifies the device");
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> resolveData(Map<String, Object> content) throws MappingException {
        Object data = content.get(KEY_DATA);
        if (data == null) {
            Map<String, Object> fields = new LinkedHashMap<>(content);
            fields.keySet().removeAll(TOP_LEVEL_KEYS);
            return fields;
        }
        if (data instanceof Map) {
            return (Map<String, Object>) data;
        }
        throw new MappingException(MappingErrorKind.INVALID_DATA, "Field data is not a JSON object");
    }

    private Instant resolveTime(Map<String, Object> content, Map<String, Object> data, Instant ingestionTime)
            throws MappingException {
        Object raw = content.get(KEY_TIMESTAMP);
        if (raw == null) {
            raw = data.get(KEY_TIMESTAMP);
        }
        if (raw == null) {
            raw = data.get(KEY_TIME);
        }
        if (raw == null) {
            return ingestionTime;
        }
        return parseTimestamp(raw);
    }

    static Instant parseTimestamp(Object raw) throws MappingException {
        if (raw instanceof Number) {
            try {
                return Instant.ofEpochMilli(toBigDecimal((Number) raw).longValueExact());
            } catch (MappingException | ArithmeticException e) {
                throw new MappingException(MappingErrorKind.INVALID_TIMESTAMP,
                        "Timestamp is not a whole number of epoch milliseconds: " + raw, e);
            }
        }
        if (raw instanceof String && StringUtils.isNotBlank((String) raw)) {
            String value = ((String) raw).trim();
            DateTimeParseException lastError = null;
            for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
                try {
                    return parser.apply(value);
                } catch (DateTimeParseException e) {
                    lastError = e;
                }
            }
            throw new MappingException(MappingErrorKind.INVALID_TIMESTAMP,
                    "Timestamp is not ISO 8601: " + value + " (" + lastError.getMessage() + ")");
        }
        throw new MappingException(MappingErrorKind.INVALID_TIMESTAMP, "Timestamp has unsupported value: " + raw);
    }

    /**
     * Numeric fields become series of {@code defaultFragment}, value objects
     * ({@code {"value": 1, "unit": "C"}}) keep their own unit, objects made of
     * value objects or numbers become fragments of their own.
     */
    private Map<String, Map<String, MeasurementValue>> extractFragments(String defaultFragment,
            Map<String, Object> fields, Set<String> skip) throws MappingException {
        Map<String, Map<String, MeasurementValue>> fragments = new LinkedHashMap<>();
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            String key = field.getKey();
            Object value = field.getValue();
            if (skip.contains(key)) {
                continue;
            }
            if (value instanceof Number) {
                fragments.computeIfAbsent(defaultFragment, f -> new LinkedHashMap<>())
                        .put(key, new MeasurementValue(toBigDecimal((Number) value), unitFor(key)));
            } else if (value instanceof Map) {
                Map<?, ?> object = (Map<?, ?>) value;
                MeasurementValue single = toMeasurementValue(key, object);
                if (single != null) {
                    fragments.computeIfAbsent(defaultFragment, f -> new LinkedHashMap<>()).put(key, single);
                    continue;
                }
                Map<String, MeasurementValue> series = new LinkedHashMap<>();
                for (Map.Entry<?, ?> inner : object.entrySet()) {
                    String seriesName = String.valueOf(inner.getKey());
                    if (inner.getValue() instanceof Number) {
                        series.put(seriesName,
                                new MeasurementValue(toBigDecimal((Number) inner.getValue()), unitFor(seriesName)));
                    } else if (inner.getValue() instanceof Map) {
                        MeasurementValue mv = toMeasurementValue(seriesName, (Map<?, ?>) inner.getValue());
                        if (mv != null) {
                            series.put(seriesName, mv);
                        }
                    }
                }
                if (!series.isEmpty()) {
                    fragments.computeIfAbsent(key, f -> new LinkedHashMap<>()).putAll(series);
                }
            }
        }
        if (fragments.isEmpty()) {
            throw new MappingException(MappingErrorKind.NO_VALUES, "Payload contains no numeric values");
        }
        return fragments;
    }

    private MeasurementValue toMeasurementValue(String series, Map<?, ?> object) throws MappingException {
        Object value = object.get(KEY_VALUE);
        if (!(value instanceof Number)) {
            return null;
        }
        Object unit = object.get(KEY_UNIT);
        return new MeasurementValue(toBigDecimal((Number) value),
                unit instanceof String ? (String) unit : unitFor(series));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> extractCustomFragments(Map<String, Object> data) {
        Map<String, Object> fragments = new LinkedHashMap<>();
        data.forEach((key, value) -> {
            if (!DATA_KEYS.contains(key) && value instanceof Map) {
                fragments.put(key, Collections.unmodifiableMap(new LinkedHashMap<>((Map<String, Object>) value)));
            }
        });
        return fragments;
    }

    private String unitFor(String series) {
        Map<String, String> units = serviceConfiguration.getMeasurementUnits();
        String unit = units == null ? null : units.get(series);
        return unit == null ? "" : unit;
    }

    private static String textOrDefault(Object value, String defaultValue) {
        if (value instanceof String && StringUtils.isNotBlank((String) value)) {
            return (String) value;
        }
        return defaultValue;
    }

    private static BigDecimal toBigDecimal(Number number) throws MappingException {
        if ((number instanceof Double && !Double.isFinite(number.doubleValue()))
                || (number instanceof Float && !Float.isFinite(number.floatValue()))) {
            throw new MappingException(MappingErrorKind.INVALID_DATA, "Numeric value is not finite: " + number);
        }
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        }
        return new BigDecimal(number.toString());
    }
}
