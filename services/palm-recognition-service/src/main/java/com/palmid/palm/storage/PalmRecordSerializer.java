package com.palmid.palm.storage;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.palmid.palm.domain.PalmRegistration;
import com.palmid.palm.exception.PalmStorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Strict JSON codec for persisted palm registrations.
 *
 * <p>Unknown, missing or null fields are rejected. Timestamps are written as ISO-8601 UTC
 * instants; timestamps without an offset are read as UTC.
 */
public class PalmRecordSerializer {

    private final ObjectMapper mapper;

    public PalmRecordSerializer() {
        this.mapper = createRecordMapper();
    }

    static ObjectMapper createRecordMapper() {
        SimpleModule utcTimestamps = new SimpleModule("palm-utc-timestamps");
        utcTimestamps.addDeserializer(Instant.class, new UtcInstantDeserializer());

        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .addModule(utcTimestamps)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    }

    public byte[] write(PalmRegistration registration) {
        try {
            return mapper.writeValueAsBytes(registration);
        } catch (JsonProcessingException e) {
            throw new PalmStorageException("Failed to serialize palm record for " + registration.getIdentity(), e);
        }
    }

    public RecordReadResult read(Path file) {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return RecordReadResult.absent();
        } catch (IOException e) {
            throw new PalmStorageException("Failed to read palm record " + file.getFileName(), e);
        }
        return parse(content);
    }

    public RecordReadResult parse(byte[] content) {
        if (content.length == 0) {
            return RecordReadResult.corrupt("empty record");
        }
        try {
            PalmRegistration registration = mapper.readValue(content, PalmRegistration.class);
            if (registration == null) {
                return RecordReadResult.corrupt("null record");
            }
            return RecordReadResult.valid(registration);
        } catch (JsonProcessingException e) {
            return RecordReadResult.corrupt(e.getOriginalMessage() != null
                ? e.getOriginalMessage() : e.getClass().getSimpleName());
        } catch (IOException e) {
            return RecordReadResult.corrupt(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    static class UtcInstantDeserializer extends StdScalarDeserializer<Instant> {

        UtcInstantDeserializer() {
            super(Instant.class);
        }

        @Override
        public Instant deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            String text = parser.getValueAsString();
            if (text == null || text.isBlank()) {
                return (Instant) context.handleUnexpectedToken(Instant.class, parser);
            }
            try {
                return Instant.parse(text.trim());
            } catch (DateTimeParseException ignored) {
                try {
                    return LocalDateTime.parse(text.trim()).toInstant(ZoneOffset.UTC);
                } catch (DateTimeParseException e) {
                    return (Instant) context.handleWeirdStringValue(Instant.class, text, "not an ISO-8601 timestamp");
                }
            }
        }
    }
}
