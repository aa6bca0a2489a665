package org.javai.netguard.network;

import java.time.Instant;
import java.util.Objects;

/**
 * An immutable snapshot of classified connectivity. Superseded, never mutated.
 *
 * @param online Whether remote fetches can be attempted
 * @param linkType The link in use
 * @param degraded Whether the link is online but too slow for default settings
 * @param observedAt When the snapshot was taken
 */
public record NetworkStatus(boolean online, LinkType linkType, boolean degraded, Instant observedAt) {

    public NetworkStatus {
        Objects.requireNonNull(linkType, "linkType must not be null");
        Objects.requireNonNull(observedAt, "observedAt must not be null");
    }

    public static NetworkStatus online(LinkType linkType, boolean degraded, Instant observedAt) {
        return new NetworkStatus(true, linkType, degraded, observedAt);
    }

    public static NetworkStatus offline(Instant observedAt) {
        return new NetworkStatus(false, LinkType.UNKNOWN, false, observedAt);
    }

    /**
     * Whether {@code other} differs in any of the fields that drive policy.
     * The observation time is ignored.
     */
    public boolean materiallyDiffers(NetworkStatus other) {
        Objects.requireNonNull(other, "other must not be null");
        return online != other.online || linkType != other.linkType || degraded != other.degraded;
    }
}
