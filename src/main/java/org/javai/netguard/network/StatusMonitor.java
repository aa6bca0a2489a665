package org.javai.netguard.network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Observes connectivity and classifies it into {@link NetworkStatus} snapshots.
 *
 * <p>Snapshots arrive either pushed by the platform through {@link #accept(ConnectivitySample)}
 * or pulled through {@link #refresh()}. Listeners are notified only when
 * {@code online}, {@code linkType} or {@code degraded} change, on the thread that delivered
 * the observation, in the order observations were made.
 *
 * <p>No retry logic lives here.
 */
public final class StatusMonitor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(StatusMonitor.class);

    /**
     * Wi-Fi signal below this strength marks the link as degraded.
     */
    public static final int WEAK_WIFI_SIGNAL_DBM = -70;

    private final ConnectivityProbe probe;
    private final Clock clock;
    private final List<StatusListener> listeners = new CopyOnWriteArrayList<>();
    private final Object observationLock = new Object();

    private volatile NetworkStatus current;

    public StatusMonitor(ConnectivityProbe probe) {
        this(probe, Clock.systemUTC());
    }

    public StatusMonitor(ConnectivityProbe probe, Clock clock) {
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        // Assume online until the platform says otherwise so the first fetch is not refused.
        this.current = NetworkStatus.online(LinkType.UNKNOWN, false, clock.instant());
    }

    /**
     * Returns the last known snapshot. Never blocks.
     */
    public NetworkStatus current() {
        return current;
    }

    /**
     * Registers a listener for materially different snapshots.
     *
     * @param listener the listener
     * @return a handle that removes the listener
     */
    public Subscription subscribe(StatusListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        AtomicBoolean active = new AtomicBoolean(true);
        return () -> {
            if (active.compareAndSet(true, false)) {
                listeners.remove(listener);
            }
        };
    }

    /**
     * Forces an active probe, notifying listeners synchronously if the status changed.
     * If the probe fails, the last known snapshot is returned unchanged.
     *
     * @return the snapshot after the probe
     */
    public NetworkStatus refresh() {
        ConnectivitySample sample;
        try {
            sample = probe.probe();
        } catch (IOException e) {
            LOG.warn("Connectivity probe failed, keeping last known status {}", current, e);
            return current;
        }
        return accept(sample);
    }

    /**
     * Records a platform observation, typically from a connectivity-change event.
     *
     * @param sample the raw connectivity facts
     * @return the resulting snapshot
     */
    public NetworkStatus accept(ConnectivitySample sample) {
        Objects.requireNonNull(sample, "sample must not be null");
        NetworkStatus next = classify(sample);
        synchronized (observationLock) {
            boolean changed = current.materiallyDiffers(next);
            current = next;
            if (changed) {
                LOG.debug("Network status changed to online={}, link={}, degraded={}",
                        next.online(), next.linkType(), next.degraded());
                notifyListeners(next);
            }
        }
        return next;
    }

    /**
     * Removes all listeners.
     */
    @Override
    public void close() {
        listeners.clear();
    }

    NetworkStatus classify(ConnectivitySample sample) {
        if (!sample.online()) {
            return NetworkStatus.offline(clock.instant());
        }
        return NetworkStatus.online(sample.linkType(), isDegraded(sample), clock.instant());
    }

    static boolean isDegraded(ConnectivitySample sample) {
        return switch (sample.linkType()) {
            case CELLULAR -> sample.cellularGeneration() != null && sample.cellularGeneration().isSlow();
            case WIFI -> sample.wifiSignalDbm() != null && sample.wifiSignalDbm() < WEAK_WIFI_SIGNAL_DBM;
            default -> false;
        };
    }

    private void notifyListeners(NetworkStatus status) {
        for (StatusListener listener : listeners) {
            try {
                listener.onStatusChange(status);
            } catch (RuntimeException e) {
                LOG.error("Network status listener {} failed", listener, e);
            }
        }
    }
}
