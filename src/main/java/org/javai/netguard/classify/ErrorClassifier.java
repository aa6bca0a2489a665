package org.javai.netguard.classify;

import org.javai.netguard.ClassifiedError;

/**
 * Maps an arbitrary failure into a {@link ClassifiedError}.
 * Implementations must be pure: the same failure always yields the same kind and verdict.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Classifies a failure.
     *
     * @param failure The exception, HTTP failure or timeout that ended an attempt
     * @return the classified error
     */
    ClassifiedError classify(Throwable failure);
}
