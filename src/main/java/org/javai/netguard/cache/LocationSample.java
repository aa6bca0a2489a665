package org.javai.netguard.cache;

import java.util.Objects;

/**
 * A position fix from the location provider.
 *
 * @param coordinates Where the device is
 * @param accuracyMeters Radius of uncertainty; smaller is better
 */
public record LocationSample(Coordinates coordinates, double accuracyMeters) {

    public LocationSample {
        Objects.requireNonNull(coordinates, "coordinates must not be null");
    }

    public static LocationSample of(double latitude, double longitude, double accuracyMeters) {
        return new LocationSample(Coordinates.of(latitude, longitude), accuracyMeters);
    }
}
