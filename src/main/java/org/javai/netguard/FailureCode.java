package org.javai.netguard;

import java.util.Objects;

/**
 * A namespaced, stable identifier for a specific failure.
 *
 * @param namespace The layer that produced the failure (e.g., "network", "http", "operation")
 * @param name The specific failure within that namespace (e.g., "dns", "timeout", "429")
 */
public record FailureCode(String namespace, String name) {

    public FailureCode {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static FailureCode of(String namespace, String name) {
        return new FailureCode(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + ":" + name;
    }
}
