package org.javai.netguard.network;

import java.io.IOException;

/**
 * Actively queries the platform for the current connectivity.
 * The only seam through which {@link StatusMonitor} touches the platform.
 */
@FunctionalInterface
public interface ConnectivityProbe {

    /**
     * Probes the platform.
     *
     * @return the current connectivity facts
     * @throws IOException if the platform could not be queried
     */
    ConnectivitySample probe() throws IOException;
}
