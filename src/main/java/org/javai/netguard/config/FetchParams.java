package org.javai.netguard.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Parameters handed to the location-sampling collaborator.
 *
 * @param timeout How long a single position fix may take
 * @param sampleInterval Minimum time between samples
 * @param minMovementMeters Minimum displacement before a new sample is delivered
 * @param accuracy Requested fix accuracy
 */
public record FetchParams(Duration timeout, Duration sampleInterval, double minMovementMeters, SamplingAccuracy accuracy) {

    public FetchParams {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(sampleInterval, "sampleInterval must not be null");
        Objects.requireNonNull(accuracy, "accuracy must not be null");
        if (minMovementMeters < 0) {
            throw new IllegalArgumentException("minMovementMeters must be >= 0, was: " + minMovementMeters);
        }
    }

    public long timeoutMs() {
        return timeout.toMillis();
    }

    public long sampleIntervalMs() {
        return sampleInterval.toMillis();
    }
}
