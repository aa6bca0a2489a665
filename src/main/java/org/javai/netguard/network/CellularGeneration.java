package org.javai.netguard.network;

/**
 * Cellular radio generation as reported by the platform.
 */
public enum CellularGeneration {
    G2,
    G3,
    G4,
    G5,
    UNKNOWN;

    /**
     * Whether this generation is too slow for default fetch settings.
     */
    public boolean isSlow() {
        return this == G2 || this == G3;
    }
}
