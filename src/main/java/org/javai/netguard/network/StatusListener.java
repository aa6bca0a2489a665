package org.javai.netguard.network;

/**
 * Receives materially different network snapshots. Must not block.
 */
@FunctionalInterface
public interface StatusListener {

    void onStatusChange(NetworkStatus status);
}
