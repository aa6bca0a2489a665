package org.javai.netguard.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Produces futures that complete after a delay. Cancelling the returned future abandons the wait.
 */
@FunctionalInterface
public interface Delayer {

    CompletableFuture<Void> delay(Duration duration);

    /**
     * Delays on the JDK's shared delay scheduler; no threads are owned by the caller.
     * A delay that is cancelled early releases its scheduled timer task.
     */
    static Delayer system() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) {
                return CompletableFuture.completedFuture(null);
            }
            return new CompletableFuture<Void>().completeOnTimeout(null, duration.toMillis(), TimeUnit.MILLISECONDS);
        };
    }
}
