package com.palmid.palm.service;

import com.palmid.common.exception.BusinessException;
import com.palmid.common.exception.ErrorCode;
import com.palmid.palm.config.PalmRecognitionProperties;
import com.palmid.palm.detection.KeypointProvider;
import com.palmid.palm.domain.HandLandmarks;
import com.palmid.palm.domain.PalmRegistration;
import com.palmid.palm.domain.PalmTemplate;
import com.palmid.palm.domain.RegistrationSummary;
import com.palmid.palm.dto.PalmCommandResponse;
import com.palmid.palm.dto.RecognitionData;
import com.palmid.palm.dto.RegistrationData;
import com.palmid.palm.exception.DuplicateRegistrationException;
import com.palmid.palm.matching.MatchResult;
import com.palmid.palm.matching.PalmMatchEngine;
import com.palmid.palm.metrics.PalmRecognitionMetrics;
import com.palmid.palm.storage.PalmTemplateStore;
import com.palmid.palm.template.PalmTemplateBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.palmid.palm.util.PalmLogMasking.maskIdentity;

/**
 * Palm registration and recognition pipeline: keypoint provider, template builder,
 * template store and match engine.
 *
 * <p>Recognition runs in one of two modes. Targeted: an identity is given and only that
 * registration is compared. Open-set: every registration is searched for the nearest one.
 * A match updates the registration's {@code lastUsed}.
 *
 * <p>Domain failures (detection, duplicate registration, storage) are returned as
 * unsuccessful {@link PalmCommandResponse}s, never thrown to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PalmRecognitionService {

    private final KeypointProvider keypointProvider;
    private final PalmTemplateBuilder templateBuilder;
    private final PalmTemplateStore templateStore;
    private final PalmMatchEngine matchEngine;
    private final PalmRecognitionMetrics metrics;
    private final PalmRecognitionProperties properties;
    private final Clock palmClock;

    public PalmCommandResponse register(Path image, String identity) {
        log.info("Starting palm registration for {}", maskIdentity(identity));
        try {
            templateStore.requireValidIdentity(identity);
            requireImage(image);

            // cheap check before running detection; register() re-checks under the identity lock
            if (templateStore.load(identity).isPresent()) {
                throw new DuplicateRegistrationException(identity);
            }

            PalmTemplate template = createTemplate(image);
            PalmRegistration registration = templateStore.register(identity, template);

            return PalmCommandResponse.success("Palm registered successfully", RegistrationData.builder()
                .identity(registration.getIdentity())
                .signature(registration.getSignature())
                .registeredAt(registration.getRegisteredAt())
                .build());
        } catch (DuplicateRegistrationException e) {
            log.warn("Palm already registered for {}", maskIdentity(identity));
            return PalmCommandResponse.failure(
                "Palm already registered for this identity. Please delete existing registration first.",
                e.getCode());
        } catch (BusinessException e) {
            log.warn("Palm registration failed for {} [errorId={}]: {}", maskIdentity(identity), e.getErrorId(),
                e.getMessage());
            return PalmCommandResponse.failure(e.getReason(), e.getCode());
        }
    }

    /**
     * @param identity  registration to compare against, or null for open-set recognition
     * @param threshold maximum accepted distance, or null for the configured default
     */
    public PalmCommandResponse recognize(Path image, String identity, Double threshold) {
        log.info("Starting palm recognition against {}",
            identity == null ? "all registered palms" : maskIdentity(identity));
        try {
            double effectiveThreshold = resolveThreshold(threshold);
            if (identity != null) {
                templateStore.requireValidIdentity(identity);
            }
            requireImage(image);

            PalmTemplate template = createTemplate(image);
            RecognitionDecision decision = recognize(template, identity, effectiveThreshold);
            return toResponse(decision);
        } catch (BusinessException e) {
            metrics.recordRecognition(PalmRecognitionMetrics.OUTCOME_FAILED);
            log.warn("Palm recognition failed [errorId={}]: {}", e.getErrorId(), e.getMessage());
            return PalmCommandResponse.builder()
                .success(false)
                .match(false)
                .message(e.getReason())
                .errorCode(e.getCode())
                .build();
        }
    }

    /**
     * Compare an already built template against the store.
     *
     * @param identity null for open-set recognition
     */
    public RecognitionDecision recognize(PalmTemplate template, String identity, double threshold) {
        RecognitionDecision decision = identity != null
            ? recognizeTargeted(template, identity, threshold)
            : recognizeOpenSet(template, threshold);

        if (decision.isMatched()) {
            Optional<PalmRegistration> touched = templateStore.touch(decision.getIdentity(), palmClock.instant());
            if (touched.isEmpty()) {
                log.warn("Registration for {} removed while it was being matched", maskIdentity(decision.getIdentity()));
            }
            log.info("Palm recognized as {} (distance {}, threshold {})", maskIdentity(decision.getIdentity()),
                format(decision.getBestDistance()), threshold);
        } else {
            log.info("No matching palm found ({}, best distance {}, threshold {})", decision.getOutcome(),
                format(decision.getBestDistance()), threshold);
        }
        metrics.recordRecognition(outcomeTag(decision.getOutcome()));
        return decision;
    }

    public PalmCommandResponse delete(String identity) {
        try {
            if (templateStore.delete(identity)) {
                return PalmCommandResponse.success("Palm registration deleted successfully", null);
            }
            return PalmCommandResponse.failure("No palm registered for this identity",
                ErrorCode.BIO_NOT_REGISTERED.getCode());
        } catch (BusinessException e) {
            log.warn("Palm deletion failed for {} [errorId={}]: {}", maskIdentity(identity), e.getErrorId(),
                e.getMessage());
            return PalmCommandResponse.failure(e.getReason(), e.getCode());
        }
    }

    public PalmCommandResponse list() {
        try {
            List<RegistrationSummary> records = templateStore.listAll();
            log.info("Found {} registered palm(s)", records.size());
            return PalmCommandResponse.builder()
                .success(true)
                .count(records.size())
                .records(records)
                .build();
        } catch (BusinessException e) {
            log.warn("Listing registered palms failed [errorId={}]: {}", e.getErrorId(), e.getMessage());
            return PalmCommandResponse.failure(e.getReason(), e.getCode());
        }
    }

    private RecognitionDecision recognizeTargeted(PalmTemplate template, String identity, double threshold) {
        Optional<PalmRegistration> registration = templateStore.load(identity);
        if (registration.isEmpty()) {
            return RecognitionDecision.builder()
                .outcome(RecognitionDecision.Outcome.NOT_REGISTERED)
                .identity(identity)
                .bestDistance(Double.POSITIVE_INFINITY)
                .threshold(threshold)
                .candidatesCompared(0)
                .build();
        }
        double distance = matchEngine.distance(template.getNormalizedDistances(),
            registration.get().getNormalizedDistances());
        // no shared measurement is never a match, whatever the threshold
        boolean matched = Double.isFinite(distance) && matchEngine.decide(distance, threshold);
        return RecognitionDecision.builder()
            .outcome(matched ? RecognitionDecision.Outcome.MATCH : RecognitionDecision.Outcome.NO_MATCH)
            .identity(identity)
            .bestDistance(distance)
            .threshold(threshold)
            .candidatesCompared(1)
            .build();
    }

    private RecognitionDecision recognizeOpenSet(PalmTemplate template, double threshold) {
        List<PalmRegistration> candidates = templateStore.loadAll();
        if (candidates.isEmpty()) {
            return RecognitionDecision.builder()
                .outcome(RecognitionDecision.Outcome.EMPTY_STORE)
                .bestDistance(Double.POSITIVE_INFINITY)
                .threshold(threshold)
                .candidatesCompared(0)
                .build();
        }
        log.debug("Comparing against {} registered palm(s)", candidates.size());
        MatchResult result = matchEngine.search(template, candidates);
        boolean matched = result.getBest().isPresent() && Double.isFinite(result.getBestDistance())
            && matchEngine.decide(result.getBestDistance(), threshold);
        return RecognitionDecision.builder()
            .outcome(matched ? RecognitionDecision.Outcome.MATCH : RecognitionDecision.Outcome.NO_MATCH)
            .identity(matched ? result.getBestCandidate().getIdentity() : null)
            .bestDistance(result.getBestDistance())
            .threshold(threshold)
            .candidatesCompared(result.getCandidatesCompared())
            .build();
    }

    private PalmCommandResponse toResponse(RecognitionDecision decision) {
        switch (decision.getOutcome()) {
            case MATCH:
                return PalmCommandResponse.builder()
                    .success(true)
                    .match(true)
                    .message("Palm recognized successfully")
                    .data(RecognitionData.builder()
                        .identity(decision.getIdentity())
                        .distance(decision.getBestDistance())
                        .confidence(decision.getConfidence())
                        .threshold(decision.getThreshold())
                        .build())
                    .build();
            case NOT_REGISTERED:
                return PalmCommandResponse.builder()
                    .success(false)
                    .match(false)
                    .message("No palm registered for " + decision.getIdentity())
                    .errorCode(ErrorCode.BIO_NOT_REGISTERED.getCode())
                    .build();
            case EMPTY_STORE:
                return PalmCommandResponse.builder()
                    .success(false)
                    .match(false)
                    .message(ErrorCode.BIO_EMPTY_DATABASE.getDefaultMessage())
                    .errorCode(ErrorCode.BIO_EMPTY_DATABASE.getCode())
                    .build();
            case NO_MATCH:
            default:
                return PalmCommandResponse.builder()
                    .success(true)
                    .match(false)
                    .message("Palm not recognized")
                    .errorCode(Double.isInfinite(decision.getBestDistance())
                        ? ErrorCode.BIO_NO_COMMON_MEASUREMENTS.getCode() : null)
                    .data(RecognitionData.builder()
                        .distance(decision.getBestDistance())
                        .threshold(decision.getThreshold())
                        .build())
                    .build();
        }
    }

    private PalmTemplate createTemplate(Path image) {
        HandLandmarks landmarks = keypointProvider.detect(image);
        PalmTemplate template = templateBuilder.build(landmarks);
        log.info("Palm template created with signature {} ({} measurements)", template.getSignature(),
            template.getNormalizedDistances().size());
        return template;
    }

    private double resolveThreshold(Double threshold) {
        double effective = threshold != null ? threshold : properties.getMatching().getDefaultThreshold();
        if (!Double.isFinite(effective) || effective < 0.0) {
            throw new BusinessException(ErrorCode.VAL_INVALID_THRESHOLD,
                "Threshold must be a finite non-negative number: " + effective);
        }
        return effective;
    }

    private static void requireImage(Path image) {
        if (image == null || !Files.exists(image)) {
            throw new BusinessException(ErrorCode.VAL_IMAGE_NOT_FOUND, "Image not found: " + image);
        }
    }

    private static String outcomeTag(RecognitionDecision.Outcome outcome) {
        switch (outcome) {
            case MATCH:
                return PalmRecognitionMetrics.OUTCOME_MATCH;
            case NOT_REGISTERED:
                return PalmRecognitionMetrics.OUTCOME_NOT_REGISTERED;
            case EMPTY_STORE:
                return PalmRecognitionMetrics.OUTCOME_EMPTY_STORE;
            case NO_MATCH:
            default:
                return PalmRecognitionMetrics.OUTCOME_NO_MATCH;
        }
    }

    private static String format(double distance) {
        return String.format(Locale.ROOT, "%.6f", distance);
    }
}
