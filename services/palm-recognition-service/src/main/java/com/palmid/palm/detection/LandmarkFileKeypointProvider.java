package com.palmid.palm.detection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.palmid.palm.domain.HandLandmarks;
import com.palmid.palm.domain.Landmark;
import com.palmid.palm.exception.DetectionException;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads landmarks exported by an external hand keypoint detector.
 *
 * <p>For an image {@code palm.jpg} the detector output is expected next to it as
 * {@code palm.jpg.landmarks.json} (the suffix is configurable):
 * <pre>
 * {"landmarks": [{"x": 312.5, "y": 488.0, "confidence": 0.97}, ... 21 entries]}
 * </pre>
 * An empty landmark list means the detector saw no hand.
 */
@Slf4j
public class LandmarkFileKeypointProvider implements KeypointProvider {

    private final ObjectMapper objectMapper;
    private final String landmarkSuffix;

    public LandmarkFileKeypointProvider(ObjectMapper objectMapper, String landmarkSuffix) {
        this.objectMapper = objectMapper;
        this.landmarkSuffix = landmarkSuffix;
    }

    @Override
    public HandLandmarks detect(Path image) {
        Path landmarkFile = landmarkFileFor(image);
        if (!Files.isRegularFile(landmarkFile)) {
            throw new DetectionException(DetectionError.NOT_FOUND,
                "No hand landmarks available for image " + image.getFileName());
        }

        LandmarkDocument document;
        try {
            document = objectMapper.readValue(landmarkFile.toFile(), LandmarkDocument.class);
        } catch (IOException e) {
            throw new DetectionException(DetectionError.NOT_FOUND,
                "Unreadable hand landmarks for image " + image.getFileName(), e);
        }

        if (document == null || document.getLandmarks() == null || document.getLandmarks().isEmpty()) {
            throw new DetectionException(DetectionError.NOT_FOUND, "No hand keypoints detected");
        }

        List<Landmark> landmarks = new ArrayList<>(document.getLandmarks().size());
        try {
            for (int i = 0; i < document.getLandmarks().size(); i++) {
                LandmarkEntry entry = document.getLandmarks().get(i);
                if (entry == null || entry.getX() == null || entry.getY() == null || entry.getConfidence() == null) {
                    throw new IllegalArgumentException("Landmark " + i + " is incomplete");
                }
                landmarks.add(new Landmark(i, entry.getX(), entry.getY(), entry.getConfidence()));
            }
            HandLandmarks hand = HandLandmarks.of(landmarks);
            log.debug("Detected {} keypoints with avg confidence {}", HandLandmarks.LANDMARK_COUNT,
                String.format(Locale.ROOT, "%.3f", hand.averageConfidence()));
            return hand;
        } catch (IllegalArgumentException e) {
            throw new DetectionException(DetectionError.NOT_FOUND,
                "Invalid hand landmarks for image " + image.getFileName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String getName() {
        return "landmark-file";
    }

    Path landmarkFileFor(Path image) {
        return image.resolveSibling(image.getFileName().toString() + landmarkSuffix);
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LandmarkDocument {
        private List<LandmarkEntry> landmarks;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LandmarkEntry {
        private Double x;
        private Double y;
        private Double confidence;
    }
}
