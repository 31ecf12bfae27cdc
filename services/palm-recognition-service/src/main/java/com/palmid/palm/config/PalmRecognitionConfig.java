package com.palmid.palm.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.palmid.palm.detection.KeypointProvider;
import com.palmid.palm.detection.LandmarkFileKeypointProvider;
import com.palmid.palm.detection.TimeBoundKeypointProvider;
import com.palmid.palm.detection.UnavailableKeypointProvider;
import com.palmid.palm.matching.PalmMatchEngine;
import com.palmid.palm.metrics.PalmRecognitionMetrics;
import com.palmid.palm.storage.PalmRecordSerializer;
import com.palmid.palm.storage.PalmTemplateStore;
import com.palmid.palm.template.PalmSignatureGenerator;
import com.palmid.palm.template.PalmTemplateBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the palm recognition components from {@link PalmRecognitionProperties}.
 */
@Configuration
@EnableConfigurationProperties(PalmRecognitionProperties.class)
@Slf4j
public class PalmRecognitionConfig {

    @Bean
    public Clock palmClock() {
        return Clock.systemUTC();
    }

    @Bean
    public PalmRecognitionMetrics palmRecognitionMetrics(MeterRegistry meterRegistry) {
        return new PalmRecognitionMetrics(meterRegistry);
    }

    @Bean
    public PalmSignatureGenerator palmSignatureGenerator() {
        return new PalmSignatureGenerator();
    }

    @Bean
    public PalmTemplateBuilder palmTemplateBuilder(PalmSignatureGenerator signatureGenerator, Clock palmClock) {
        return new PalmTemplateBuilder(signatureGenerator, palmClock);
    }

    @Bean
    public PalmMatchEngine palmMatchEngine() {
        return new PalmMatchEngine();
    }

    @Bean
    public PalmRecordSerializer palmRecordSerializer() {
        return new PalmRecordSerializer();
    }

    @Bean
    public PalmTemplateStore palmTemplateStore(PalmRecognitionProperties properties,
                                               PalmRecordSerializer serializer,
                                               PalmRecognitionMetrics metrics,
                                               Clock palmClock) {
        return new PalmTemplateStore(Paths.get(properties.getStorage().getDirectory()), serializer, metrics, palmClock);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService keypointDetectionExecutor(PalmRecognitionProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "palm-keypoint-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.getDetection().getWorkerThreads(), threadFactory);
    }

    @Bean
    public KeypointProvider keypointProvider(PalmRecognitionProperties properties,
                                             ObjectMapper objectMapper,
                                             ExecutorService keypointDetectionExecutor) {
        PalmRecognitionProperties.Detection detection = properties.getDetection();
        KeypointProvider delegate;
        switch (detection.getProvider()) {
            case LANDMARK_FILE:
                delegate = new LandmarkFileKeypointProvider(objectMapper, detection.getLandmarkSuffix());
                break;
            case NONE:
            default:
                delegate = new UnavailableKeypointProvider();
                break;
        }
        log.info("Using keypoint provider '{}' with {} ms timeout", delegate.getName(),
            detection.getTimeout().toMillis());
        return new TimeBoundKeypointProvider(delegate, keypointDetectionExecutor, detection.getTimeout());
    }
}
