package org.javai.netguard.network;

/**
 * Handle returned by {@link StatusMonitor#subscribe(StatusListener)}.
 * Unsubscribing more than once has no further effect.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
