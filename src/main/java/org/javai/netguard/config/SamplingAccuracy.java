package org.javai.netguard.config;

/**
 * Accuracy level requested from the location sampler.
 */
public enum SamplingAccuracy {
    HIGHEST,
    HIGH,
    BALANCED,
    LOW
}
