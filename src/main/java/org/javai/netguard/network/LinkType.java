package org.javai.netguard.network;

/**
 * The physical link a device is using, ordered from richest to poorest.
 */
public enum LinkType {
    WIRED,
    WIFI,
    CELLULAR,
    UNKNOWN
}
