package org.javai.netguard.network;

import java.util.Objects;

/**
 * Raw connectivity facts as delivered by the platform probe.
 *
 * @param connected Whether a network interface is up
 * @param internetReachable Whether the internet is reachable through it (null when the platform does not know)
 * @param linkType The link in use
 * @param cellularGeneration Radio generation for cellular links (may be null)
 * @param wifiSignalDbm Wi-Fi signal strength in dBm (may be null)
 */
public record ConnectivitySample(
        boolean connected,
        Boolean internetReachable,
        LinkType linkType,
        CellularGeneration cellularGeneration,
        Integer wifiSignalDbm
) {

    public ConnectivitySample {
        Objects.requireNonNull(linkType, "linkType must not be null");
    }

    public static ConnectivitySample wired() {
        return new ConnectivitySample(true, true, LinkType.WIRED, null, null);
    }

    public static ConnectivitySample wifi(int signalDbm) {
        return new ConnectivitySample(true, true, LinkType.WIFI, null, signalDbm);
    }

    public static ConnectivitySample cellular(CellularGeneration generation) {
        return new ConnectivitySample(true, true, LinkType.CELLULAR, generation, null);
    }

    public static ConnectivitySample disconnected() {
        return new ConnectivitySample(false, false, LinkType.UNKNOWN, null, null);
    }

    /**
     * Online means connected with the internet reachable. An unknown reachability counts as offline.
     */
    public boolean online() {
        return connected && Boolean.TRUE.equals(internetReachable);
    }
}
