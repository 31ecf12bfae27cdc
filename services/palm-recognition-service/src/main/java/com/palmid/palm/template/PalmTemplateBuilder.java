package com.palmid.palm.template;

import com.palmid.palm.domain.DistanceVector;
import com.palmid.palm.domain.HandLandmarks;
import com.palmid.palm.domain.KnucklePoint;
import com.palmid.palm.domain.Landmark;
import com.palmid.palm.domain.PalmTemplate;
import com.palmid.palm.exception.TemplateBuildException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a detected hand into a scale-invariant palm template.
 *
 * <p>Steps: take the five knuckle landmarks, reject the detection if any of them is below
 * {@link #MIN_KNUCKLE_CONFIDENCE}, measure all ten pairwise distances, divide them by the
 * wrist to middle knuckle distance and hash the result into a signature.
 */
@Slf4j
public class PalmTemplateBuilder {

    public static final double MIN_KNUCKLE_CONFIDENCE = 0.5;

    private final PalmSignatureGenerator signatureGenerator;
    private final Clock clock;

    public PalmTemplateBuilder(PalmSignatureGenerator signatureGenerator, Clock clock) {
        this.signatureGenerator = signatureGenerator;
        this.clock = clock;
    }

    public PalmTemplate build(HandLandmarks landmarks) {
        checkKnuckleConfidence(landmarks);

        DistanceVector rawDistances = knuckleDistances(landmarks);
        DistanceVector normalizedDistances = normalize(rawDistances);
        String signature = signatureGenerator.generate(normalizedDistances);

        log.debug("Built palm template {} from {} measurements", signature, normalizedDistances.size());
        return PalmTemplate.builder()
            .signature(signature)
            .rawDistances(rawDistances)
            .normalizedDistances(normalizedDistances)
            .landmarks(landmarks)
            .createdAt(clock.instant())
            .build();
    }

    DistanceVector knuckleDistances(HandLandmarks landmarks) {
        List<KnucklePoint> points = KnucklePoint.all();
        Map<String, Double> distances = new HashMap<>();
        for (int i = 0; i < points.size(); i++) {
            Landmark first = landmarks.get(points.get(i));
            for (int j = i + 1; j < points.size(); j++) {
                Landmark second = landmarks.get(points.get(j));
                distances.put(DistanceVector.pairKey(points.get(i), points.get(j)), first.distanceTo(second));
            }
        }
        return DistanceVector.of(distances);
    }

    DistanceVector normalize(DistanceVector rawDistances) {
        double reference = rawDistances.get(DistanceVector.REFERENCE_KEY)
            .orElseThrow(() -> new TemplateBuildException(BuildFailure.MISSING_REFERENCE,
                "Reference distance " + DistanceVector.REFERENCE_KEY + " is missing"));
        if (reference <= 0.0) {
            // wrist and middle knuckle detected at the same pixel
            throw new TemplateBuildException(BuildFailure.MISSING_REFERENCE,
                "Reference distance " + DistanceVector.REFERENCE_KEY + " is zero");
        }
        return rawDistances.scaledBy(reference);
    }

    private void checkKnuckleConfidence(HandLandmarks landmarks) {
        double lowest = Double.MAX_VALUE;
        for (KnucklePoint point : KnucklePoint.all()) {
            lowest = Math.min(lowest, landmarks.get(point).getConfidence());
        }
        if (lowest < MIN_KNUCKLE_CONFIDENCE) {
            log.info("Low confidence in knuckle detection (min: {})", String.format(Locale.ROOT, "%.3f", lowest));
            throw new TemplateBuildException(BuildFailure.INSUFFICIENT_CONFIDENCE,
                String.format(Locale.ROOT, "Low confidence in knuckle detection (min: %.3f)", lowest));
        }
    }
}
