package com.palmid.palm.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.palmid.common.exception.ErrorCode;
import com.palmid.palm.PalmFixtures;
import com.palmid.palm.domain.RegistrationSummary;
import com.palmid.palm.dto.PalmCommandResponse;
import com.palmid.palm.dto.RecognitionData;
import com.palmid.palm.dto.RegistrationData;
import com.palmid.palm.service.PalmRecognitionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Palm Command Line Runner Tests")
class PalmCommandLineRunnerTest {

    @Mock
    private PalmRecognitionService palmRecognitionService;

    private final ObjectMapper objectMapper = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .build();

    private ByteArrayOutputStream stdout;
    private PalmCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        stdout = new ByteArrayOutputStream();
        runner = new PalmCommandLineRunner(palmRecognitionService, objectMapper,
            new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    private JsonNode output() throws Exception {
        return objectMapper.readTree(stdout.toString(StandardCharsets.UTF_8));
    }

    @Test
    void shouldPrintRegistrationResult() throws Exception {
        // Given
        when(palmRecognitionService.register(Paths.get("hand.jpg"), "555-1111"))
            .thenReturn(PalmCommandResponse.success("Palm registered successfully", RegistrationData.builder()
                .identity("555-1111")
                .signature(PalmFixtures.REFERENCE_SIGNATURE)
                .registeredAt(PalmFixtures.REGISTERED_AT)
                .build()));

        // When
        runner.run("register", "hand.jpg", "555-1111");

        // Then
        JsonNode json = output();
        assertThat(json.get("success").asBoolean()).isTrue();
        assertThat(json.get("message").asText()).isEqualTo("Palm registered successfully");
        assertThat(json.get("data").get("signature").asText()).isEqualTo(PalmFixtures.REFERENCE_SIGNATURE);
        assertThat(json.get("data").get("registeredAt").asText()).isEqualTo("2025-03-01T09:15:30Z");
        assertThat(json.has("match")).isFalse();
        assertThat(runner.getExitCode()).isEqualTo(PalmCommandLineRunner.EXIT_OK);
    }

    @Test
    @DisplayName("A domain failure still exits with 0")
    void shouldExitZeroForDomainFailure() throws Exception {
        when(palmRecognitionService.register(any(), anyString()))
            .thenReturn(PalmCommandResponse.failure("Palm already registered for this identity. "
                + "Please delete existing registration first.", ErrorCode.BIO_ALREADY_REGISTERED.getCode()));

        runner.run("register", "hand.jpg", "555-1111");

        assertThat(output().get("success").asBoolean()).isFalse();
        assertThat(runner.getExitCode()).isEqualTo(PalmCommandLineRunner.EXIT_OK);
    }

    @Test
    void shouldRecognizeAgainstIdentityWithThreshold() throws Exception {
        when(palmRecognitionService.recognize(Paths.get("probe.jpg"), "555-1111", 0.2))
            .thenReturn(PalmCommandResponse.builder()
                .success(true)
                .match(true)
                .message("Palm recognized successfully")
                .data(RecognitionData.builder().identity("555-1111").distance(0.05).confidence(0.95).threshold(0.2).build())
                .build());

        runner.run("recognize", "probe.jpg", "555-1111", "0.2");

        JsonNode json = output();
        assertThat(json.get("match").asBoolean()).isTrue();
        assertThat(json.get("data").get("confidence").asDouble()).isEqualTo(0.95);
        assertThat(runner.getExitCode()).isEqualTo(PalmCommandLineRunner.EXIT_OK);
    }

    @Test
    @DisplayName("'-' as identity selects open-set recognition")
    void shouldTreatDashAsOpenSet() {
        when(palmRecognitionService.recognize(Paths.get("probe.jpg"), null, 0.1))
            .thenReturn(PalmCommandResponse.builder().success(true).match(false).message("Palm not recognized").build());

        runner.run("recognize", "probe.jpg", "-", "0.1");

        verify(palmRecognitionService).recognize(Paths.get("probe.jpg"), null, 0.1);
    }

    @Test
    void shouldUseDefaultsWhenOptionalArgumentsAreOmitted() {
        when(palmRecognitionService.recognize(Paths.get("probe.jpg"), null, null))
            .thenReturn(PalmCommandResponse.builder().success(true).match(false).message("Palm not recognized").build());

        runner.execute(List.of("recognize", "probe.jpg"));

        verify(palmRecognitionService).recognize(Paths.get("probe.jpg"), null, null);
    }

    @Test
    void shouldListRegistrations() throws Exception {
        when(palmRecognitionService.list()).thenReturn(PalmCommandResponse.builder()
            .success(true)
            .count(1)
            .records(List.of(new RegistrationSummary("555-1111", PalmFixtures.REGISTERED_AT, PalmFixtures.REGISTERED_AT)))
            .build());

        runner.run("list");

        JsonNode json = output();
        assertThat(json.get("count").asInt()).isEqualTo(1);
        assertThat(json.get("records").get(0).get("identity").asText()).isEqualTo("555-1111");
        assertThat(json.get("records").get(0).get("lastUsed").asText()).isEqualTo("2025-03-01T09:15:30Z");
    }

    @Test
    void shouldDeleteRegistration() throws Exception {
        when(palmRecognitionService.delete("555-1111"))
            .thenReturn(PalmCommandResponse.success("Palm registration deleted successfully", null));

        runner.run("delete", "555-1111");

        JsonNode json = output();
        assertThat(json.get("success").asBoolean()).isTrue();
        assertThat(json.has("data")).isFalse();
    }

    @Test
    void shouldIgnoreSpringOptions() {
        when(palmRecognitionService.list()).thenReturn(PalmCommandResponse.builder().success(true).count(0).build());

        runner.run("--palmid.palm.storage.directory=/tmp/palms", "list");

        verify(palmRecognitionService).list();
        assertThat(runner.getExitCode()).isEqualTo(PalmCommandLineRunner.EXIT_OK);
    }

    @Test
    void shouldExitOneForUnknownCommand() throws Exception {
        runner.run("enroll", "hand.jpg");

        JsonNode json = output();
        assertThat(json.get("success").asBoolean()).isFalse();
        assertThat(json.get("message").asText()).startsWith("Unknown command: enroll");
        assertThat(json.get("errorCode").asText()).isEqualTo(ErrorCode.SYS_USAGE_ERROR.getCode());
        assertThat(runner.getExitCode()).isEqualTo(PalmCommandLineRunner.EXIT_FAILURE);
        verifyNoInteractions(palmRecognitionService);
    }

    @Test
    void shouldExitOneForMissingArguments() throws Exception {
        runner.run("register", "hand.jpg");

        assertThat(output().get("message").asText()).isEqualTo("Usage: register <image_path> <identity>");
        assertThat(runner.getExitCode()).isEqualTo(PalmCommandLineRunner.EXIT_FAILURE);
    }

    @Test
    void shouldExitOneForNoCommand() {
        runner.run();

        assertThat(runner.getExitCode()).isEqualTo(PalmCommandLineRunner.EXIT_FAILURE);
    }

    @Test
    void shouldExitOneForNonNumericThreshold() throws Exception {
        runner.run("recognize", "probe.jpg", "555-1111", "high");

        assertThat(output().get("message").asText()).isEqualTo("Threshold must be a number: high");
        assertThat(runner.getExitCode()).isEqualTo(PalmCommandLineRunner.EXIT_FAILURE);
        verifyNoInteractions(palmRecognitionService);
    }

    @Test
    @DisplayName("Unexpected failures are reported as JSON with exit code 1")
    void shouldReportUnexpectedFailure() throws Exception {
        when(palmRecognitionService.list()).thenThrow(new IllegalStateException("disk on fire"));

        runner.run("list");

        JsonNode json = output();
        assertThat(json.get("success").asBoolean()).isFalse();
        assertThat(json.get("message").asText()).isEqualTo("Error: disk on fire");
        assertThat(json.get("errorCode").asText()).isEqualTo(ErrorCode.SYS_INTERNAL_ERROR.getCode());
        assertThat(runner.getExitCode()).isEqualTo(PalmCommandLineRunner.EXIT_FAILURE);
    }
}
