package com.palmid.palm.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.palmid.palm.PalmFixtures;
import com.palmid.palm.domain.PalmRegistration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PalmRecordSerializerTest {

    private final PalmRecordSerializer serializer = new PalmRecordSerializer();

    private static final String VALID_RECORD = "{\n"
        + "  \"identity\": \"555-1111\",\n"
        + "  \"signature\": \"0123456789abcdef\",\n"
        + "  \"normalizedDistances\": {\"middle_knuckle_wrist\": 1.0, \"index_knuckle_wrist\": 0.97},\n"
        + "  \"rawDistances\": {\"middle_knuckle_wrist\": 210.0, \"index_knuckle_wrist\": 203.9},\n"
        + "  \"registeredAt\": \"2025-03-01T09:15:30Z\",\n"
        + "  \"lastUsed\": \"2025-03-02T10:00:00Z\"\n"
        + "}";

    @Test
    void shouldWriteExactlyTheRecordFieldsInOrder() throws Exception {
        PalmRegistration registration = PalmFixtures.registration("555-1111", PalmFixtures.canonicalVector(0.0));

        JsonNode json = new ObjectMapper().readTree(serializer.write(registration));

        List<String> fields = new ArrayList<>();
        json.fieldNames().forEachRemaining(fields::add);
        assertThat(fields).containsExactly("identity", "signature", "normalizedDistances", "rawDistances",
            "registeredAt", "lastUsed");
        assertThat(json.get("registeredAt").asText()).isEqualTo("2025-03-01T09:15:30Z");
        assertThat(json.get("normalizedDistances").get("middle_knuckle_wrist").asDouble()).isEqualTo(1.0);
        assertThat(json.get("normalizedDistances").size()).isEqualTo(10);
    }

    @Test
    void shouldReadBackWhatItWrites() {
        PalmRegistration registration = PalmFixtures.registration("555-1111", PalmFixtures.canonicalVector(0.0));

        RecordReadResult result = serializer.parse(serializer.write(registration));

        assertThat(result.getStatus()).isEqualTo(RecordReadResult.Status.VALID);
        assertThat(result.getRegistration()).contains(registration);
    }

    @Test
    void shouldParseHandWrittenRecord() {
        RecordReadResult result = serializer.parse(VALID_RECORD.getBytes(StandardCharsets.UTF_8));

        assertThat(result.getStatus()).isEqualTo(RecordReadResult.Status.VALID);
        PalmRegistration registration = result.getRegistration().orElseThrow();
        assertThat(registration.getLastUsed()).isEqualTo(Instant.parse("2025-03-02T10:00:00Z"));
        assertThat(registration.getRawDistances().get("middle_knuckle_wrist")).hasValue(210.0);
    }

    @Test
    @DisplayName("Timestamps without an offset are read as UTC")
    void shouldReadLocalTimestampsAsUtc() {
        String legacy = VALID_RECORD.replace("2025-03-01T09:15:30Z", "2025-03-01T09:15:30.123456");

        RecordReadResult result = serializer.parse(legacy.getBytes(StandardCharsets.UTF_8));

        assertThat(result.getRegistration()).map(PalmRegistration::getRegisteredAt)
            .contains(Instant.parse("2025-03-01T09:15:30.123456Z"));
    }

    @Test
    void shouldReportAbsentFile(@TempDir Path dir) {
        assertThat(serializer.read(dir.resolve("missing.json")).getStatus()).isEqualTo(RecordReadResult.Status.ABSENT);
    }

    @Test
    void shouldFlagMalformedRecordsAsCorrupt() {
        assertCorrupt("");
        assertCorrupt("{not json");
        assertCorrupt("null");
        assertCorrupt("[]");
        assertCorrupt(VALID_RECORD + " {}");
        assertCorrupt(VALID_RECORD.replace("\"lastUsed\": \"2025-03-02T10:00:00Z\"\n", "\"lastUsed\": null\n"));
        assertCorrupt(VALID_RECORD.replace(",\n  \"lastUsed\": \"2025-03-02T10:00:00Z\"", ""));
        assertCorrupt(VALID_RECORD.replace("\"identity\"", "\"extra\": 1, \"identity\""));
        assertCorrupt(VALID_RECORD.replace("0123456789abcdef", "not-a-signature"));
        assertCorrupt(VALID_RECORD.replace("\"middle_knuckle_wrist\": 1.0, \"index_knuckle_wrist\": 0.97", ""));
        assertCorrupt(VALID_RECORD.replace("2025-03-01T09:15:30Z", "yesterday"));
    }

    private void assertCorrupt(String content) {
        RecordReadResult result = serializer.parse(content.getBytes(StandardCharsets.UTF_8));
        assertThat(result.getStatus()).as(content).isEqualTo(RecordReadResult.Status.CORRUPT);
        assertThat(result.getProblem()).isPresent();
    }
}
