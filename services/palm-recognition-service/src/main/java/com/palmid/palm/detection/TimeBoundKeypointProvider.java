package com.palmid.palm.detection;

import com.palmid.palm.domain.HandLandmarks;
import com.palmid.palm.exception.DetectionException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a delegate provider on a worker pool and bounds each call by a deadline.
 * A call that misses the deadline is cancelled and reported as {@link DetectionError#TIMEOUT}.
 */
@Slf4j
public class TimeBoundKeypointProvider implements KeypointProvider {

    private final KeypointProvider delegate;
    private final ExecutorService executor;
    private final Duration timeout;

    public TimeBoundKeypointProvider(KeypointProvider delegate, ExecutorService executor, Duration timeout) {
        this.delegate = delegate;
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public HandLandmarks detect(Path image) {
        Future<HandLandmarks> future = executor.submit(() -> delegate.detect(image));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Keypoint detection by {} exceeded {} ms", delegate.getName(), timeout.toMillis());
            throw new DetectionException(DetectionError.TIMEOUT,
                "Hand keypoint detection timed out after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DetectionException(DetectionError.TIMEOUT, "Hand keypoint detection interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Keypoint provider " + delegate.getName() + " failed", cause);
        }
    }

    @Override
    public String getName() {
        return delegate.getName();
    }
}
