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

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import pulsar.mapper.App;
import pulsar.mapper.MapperTestHelper;
import pulsar.mapper.configuration.ServiceConfiguration;
import pulsar.mapper.model.Alarm;
import pulsar.mapper.model.AlarmSeverity;
import pulsar.mapper.model.AlarmStatus;
import pulsar.mapper.model.Event;
import pulsar.mapper.model.MappedEntity;
import pulsar.mapper.model.Measurement;
import pulsar.mapper.model.MeasurementValue;

class EntityMapperTest {

    private ServiceConfiguration serviceConfiguration;
    private PayloadDecoder payloadDecoder;
    private EntityMapper entityMapper;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = App.baseObjectMapper();
        serviceConfiguration = MapperTestHelper.serviceConfiguration();
        payloadDecoder = new PayloadDecoder(objectMapper, MapperTestHelper.FIXED_CLOCK);
        entityMapper = new EntityMapper(serviceConfiguration);
    }

    private DecodedPayload decode(String json) throws DecodeException {
        return payloadDecoder.decode(MapperTestHelper.message(json));
    }

    private DecodedPayload decodeWithoutClientId(String json) throws DecodeException {
        return payloadDecoder.decode(ConnectorMessage.builder()
                .tenant(MapperTestHelper.TEST_TENANT)
                .messageId("1:0:-1:0")
                .payload(json.getBytes(StandardCharsets.UTF_8))
                .build());
    }

    @Test
    void testFlatMeasurementFromTopLevelNumbers() throws Exception {
        MappedEntity entity = entityMapper.map(
                decode("{\"timestamp\":\"2026-01-14T12:00:00Z\",\"temperature\":23.5,\"pressure\":90}"));

        Measurement measurement = assertInstanceOf(Measurement.class, entity);
        assertEquals("device-42", measurement.getDeviceId());
        assertEquals("c8y_PulsarMeasurement", measurement.getType());
        assertEquals(Instant.parse("2026-01-14T12:00:00Z"), measurement.getTime());

        Map<String, MeasurementValue> series = measurement.getSeries("c8y_PulsarMeasurement");
        assertEquals(2, series.size());
        assertEquals(new MeasurementValue(new BigDecimal("23.5"), "°C"), series.get("temperature"));
        assertEquals(new MeasurementValue(new BigDecimal("90"), "kPa"), series.get("pressure"));
    }

    @Test
    void testFlatMeasurementUsesDeviceIdAndCustomType() throws Exception {
        Measurement measurement = (Measurement) entityMapper.map(
                decode("{\"device_id\":\"d7\",\"type\":\"c8y_Climate\",\"humidity\":41,\"label\":\"ignored\"}"));

        assertEquals("d7", measurement.getDeviceId());
        assertEquals("c8y_Climate", measurement.getType());
        assertEquals(new MeasurementValue(new BigDecimal("41"), ""),
                measurement.getSeries("c8y_Climate").get("humidity"));
        assertFalse(measurement.getSeries("c8y_Climate").containsKey("label"));
    }

    @Test
    void testNumericDeviceIdIsUsedAsText() throws Exception {
        MappedEntity entity = entityMapper.map(decode("{\"device_id\":4711,\"temperature\":1}"));
        assertEquals("4711", entity.getDeviceId());
    }

    @Test
    void testValueObjectsAndNestedFragments() throws Exception {
        Measurement measurement = (Measurement) entityMapper.map(decode(
                "{\"temperature\":{\"value\":21.0,\"unit\":\"K\"},"
                        + "\"c8y_Battery\":{\"level\":{\"value\":80,\"unit\":\"%\"},\"voltage\":3.7}}"));

        assertEquals(new MeasurementValue(new BigDecimal("21.0"), "K"),
                measurement.getSeries("c8y_PulsarMeasurement").get("temperature"));
        Map<String, MeasurementValue> battery = measurement.getSeries("c8y_Battery");
        assertEquals(new MeasurementValue(new BigDecimal("80"), "%"), battery.get("level"));
        assertEquals(new MeasurementValue(new BigDecimal("3.7"), ""), battery.get("voltage"));
    }

    @Test
    void testMissingTimestampUsesIngestionTime() throws Exception {
        MappedEntity entity = entityMapper.map(decode("{\"temperature\":20}"));
        assertEquals(MapperTestHelper.INGESTION_TIME, entity.getTime());
    }

    @Test
    void testTimestampForms() throws Exception {
        assertEquals(Instant.parse("2026-01-14T10:00:00Z"),
                entityMapper.map(decode("{\"timestamp\":\"2026-01-14T12:00:00+02:00\",\"t\":1}")).getTime());
        assertEquals(Instant.parse("2026-01-14T12:00:00Z"),
                entityMapper.map(decode("{\"timestamp\":\"2026-01-14T12:00:00\",\"t\":1}")).getTime());
        assertEquals(Instant.ofEpochMilli(1768392000000L),
                entityMapper.map(decode("{\"timestamp\":1768392000000,\"t\":1}")).getTime());
    }

    @Test
    void testMissingDeviceIdFails() {
        MappingException exception = assertThrows(MappingException.class,
                () -> entityMapper.map(decodeWithoutClientId("{\"temperature\":23.5}")));
        assertEquals(MappingErrorKind.MISSING_DEVICE_ID, exception.getKind());
    }

    @Test
    void testBlankDeviceIdWithoutClientIdFails() {
        MappingException exception = assertThrows(MappingException.class,
                () -> entityMapper.map(decodeWithoutClientId("{\"device_id\":\"  \",\"temperature\":23.5}")));
        assertEquals(MappingErrorKind.MISSING_DEVICE_ID, exception.getKind());
    }

    @Test
    void testInvalidTimestampFails() {
        MappingException unparseable = assertThrows(MappingException.class,
                () -> entityMapper.map(decode("{\"timestamp\":\"yesterday\",\"temperature\":23.5}")));
        assertEquals(MappingErrorKind.INVALID_TIMESTAMP, unparseable.getKind());

        MappingException wrongType = assertThrows(MappingException.class,
                () -> entityMapper.map(decode("{\"timestamp\":true,\"temperature\":23.5}")));
        assertEquals(MappingErrorKind.INVALID_TIMESTAMP, wrongType.getKind());
    }

    @Test
    void testNumericTimestampMustBeWholeEpochMillis() throws Exception {
        assertEquals(Instant.ofEpochMilli(1768392000000L),
                entityMapper.map(decode("{\"timestamp\":1768392000000.0,\"t\":1}")).getTime());

        for (String timestamp : new String[] { "1768392000000.5", "1e30", "99999999999999999999999" }) {
            MappingException exception = assertThrows(MappingException.class,
                    () -> entityMapper.map(decode("{\"timestamp\":" + timestamp + ",\"temperature\":23.5}")));
            assertEquals(MappingErrorKind.INVALID_TIMESTAMP, exception.getKind(), timestamp);
        }
    }

    @Test
    void testNumberBeyondDoubleRangeIsKeptExact() throws Exception {
        Measurement measurement = (Measurement) entityMapper.map(decode("{\"temperature\":1e400}"));

        assertEquals(new MeasurementValue(new BigDecimal("1E+400"), "°C"),
                measurement.getSeries("c8y_PulsarMeasurement").get("temperature"));
    }

    @Test
    void testNonFiniteValueFails() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("temperature", Double.POSITIVE_INFINITY);
        DecodedPayload payload = new DecodedPayload(content, "device-42", MapperTestHelper.INGESTION_TIME);

        MappingException exception = assertThrows(MappingException.class, () -> entityMapper.map(payload));
        assertEquals(MappingErrorKind.INVALID_DATA, exception.getKind());
    }

    @Test
    void testPayloadWithoutValuesFails() {
        MappingException exception = assertThrows(MappingException.class,
                () -> entityMapper.map(decode("{\"device_id\":\"d1\",\"status\":\"ok\"}")));
        assertEquals(MappingErrorKind.NO_VALUES, exception.getKind());
    }

    @Test
    void testMappingIsIdempotent() throws Exception {
        DecodedPayload payload = decode(
                "{\"device_id\":\"d1\",\"type\":\"event\",\"data\":{\"type\":\"c8y_Door\",\"c8y_Position\":{\"lat\":1}}}");
        assertEquals(entityMapper.map(payload), entityMapper.map(payload));

        DecodedPayload measurement = decode("{\"temperature\":23.5}");
        assertEquals(entityMapper.map(measurement), entityMapper.map(measurement));
    }

    @Test
    void testAlarmWithoutSeverityUsesConfiguredDefault() throws Exception {
        MappedEntity entity = entityMapper.map(decode(
                "{\"device_id\":\"d1\",\"type\":\"alarm\",\"data\":{\"type\":\"c8y_TemperatureAlarm\",\"text\":\"high temp\"}}"));

        Alarm alarm = assertInstanceOf(Alarm.class, entity);
        assertEquals("d1", alarm.getDeviceId());
        assertEquals("c8y_TemperatureAlarm", alarm.getType());
        assertEquals("high temp", alarm.getText());
        assertEquals(AlarmSeverity.MINOR, alarm.getSeverity());
        assertEquals(AlarmStatus.ACTIVE, alarm.getStatus());
        assertEquals(MapperTestHelper.INGESTION_TIME, alarm.getTime());
    }

    @Test
    void testAlarmDefaultSeverityFollowsConfiguration() throws Exception {
        serviceConfiguration.setDefaultAlarmSeverity(AlarmSeverity.CRITICAL);
        Alarm alarm = (Alarm) entityMapper.map(decode("{\"type\":\"ALARM\",\"data\":{\"text\":\"door open\"}}"));
        assertEquals(AlarmSeverity.CRITICAL, alarm.getSeverity());
        assertEquals("c8y_PulsarAlarm", alarm.getType());
    }

    @Test
    void testAlarmSeverityAndStatusAreCaseInsensitive() throws Exception {
        Alarm alarm = (Alarm) entityMapper.map(decode(
                "{\"device_id\":\"d1\",\"type\":\"alarm\",\"data\":{\"severity\":\"major\",\"status\":\"cleared\","
                        + "\"time\":\"2026-01-14T12:00:00Z\"}}"));
        assertEquals(AlarmSeverity.MAJOR, alarm.getSeverity());
        assertEquals(AlarmStatus.CLEARED, alarm.getStatus());
        assertEquals("c8y_PulsarAlarm", alarm.getText());
        assertEquals(Instant.parse("2026-01-14T12:00:00Z"), alarm.getTime());
    }

    @Test
    void testUnknownAlarmSeverityFails() {
        MappingException exception = assertThrows(MappingException.class, () -> entityMapper.map(
                decode("{\"device_id\":\"d1\",\"type\":\"alarm\",\"data\":{\"severity\":\"catastrophic\"}}")));
        assertEquals(MappingErrorKind.INVALID_SEVERITY, exception.getKind());
    }

    @Test
    void testDataThatIsNotAnObjectFails() {
        MappingException exception = assertThrows(MappingException.class,
                () -> entityMapper.map(decode("{\"device_id\":\"d1\",\"type\":\"event\",\"data\":[1,2]}")));
        assertEquals(MappingErrorKind.INVALID_DATA, exception.getKind());
    }

    @Test
    void testEventKeepsObjectFieldsAsFragments() throws Exception {
        Event event = (Event) entityMapper.map(decode(
                "{\"device_id\":\"d1\",\"timestamp\":\"2026-01-14T12:00:00Z\",\"type\":\"event\","
                        + "\"data\":{\"type\":\"c8y_LocationUpdate\",\"text\":\"moved\",\"c8y_Position\":{\"lat\":51.2,\"lng\":6.7},"
                        + "\"ignored\":\"plain\"}}"));

        assertEquals("c8y_LocationUpdate", event.getType());
        assertEquals("moved", event.getText());
        assertEquals(1, event.getCustomFragments().size());
        @SuppressWarnings("unchecked")
        Map<String, Object> position = (Map<String, Object>) event.getCustomFragments().get("c8y_Position");
        assertEquals(51.2, position.get("lat"));
    }

    @Test
    void testStructuredPayloadWithoutDataUsesTopLevelFields() throws Exception {
        Event event = (Event) entityMapper.map(decode("{\"device_id\":\"d1\",\"type\":\"event\",\"text\":\"boot\"}"));
        assertEquals("c8y_PulsarEvent", event.getType());
        assertEquals("boot", event.getText());
    }

    @Test
    void testStructuredMeasurement() throws Exception {
        Measurement measurement = (Measurement) entityMapper.map(decode(
                "{\"device_id\":\"d1\",\"type\":\"measurement\",\"data\":{\"type\":\"c8y_Weather\",\"temperature\":-3}}"));
        assertEquals("c8y_Weather", measurement.getType());
        assertEquals(new MeasurementValue(new BigDecimal("-3"), "°C"),
                measurement.getSeries("c8y_Weather").get("temperature"));
    }
}
