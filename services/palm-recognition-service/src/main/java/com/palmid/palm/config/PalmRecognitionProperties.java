package com.palmid.palm.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Palm recognition configuration (palmid.palm.*)
 */
@Data
@Validated
@ConfigurationProperties(prefix = "palmid.palm")
public class PalmRecognitionProperties {

    @Valid
    private Storage storage = new Storage();

    @Valid
    private Matching matching = new Matching();

    @Valid
    private Detection detection = new Detection();

    @Data
    public static class Storage {
        /**
         * Directory holding one JSON record per registered identity
         */
        @NotBlank
        private String directory = "./palm_data";
    }

    @Data
    public static class Matching {
        /**
         * Maximum normalized distance accepted as a match when the caller gives no threshold
         */
        @DecimalMin("0.0")
        private double defaultThreshold = 0.13;
    }

    @Data
    public static class Detection {
        /**
         * Keypoint provider: landmark-file reads detector output exported next to the image,
         * none reports the model as unavailable
         */
        @NotNull
        private ProviderType provider = ProviderType.LANDMARK_FILE;

        /**
         * Deadline for a single keypoint detection call
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        @NotBlank
        private String landmarkSuffix = ".landmarks.json";

        @Min(1)
        private int workerThreads = 2;
    }

    public enum ProviderType {
        LANDMARK_FILE,
        NONE
    }
}
