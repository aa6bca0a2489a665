package org.javai.netguard.cache;

/**
 * A WGS84 position in decimal degrees.
 */
public record Coordinates(double latitude, double longitude) {

    public Coordinates {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("latitude must be within [-90, 90], was: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("longitude must be within [-180, 180], was: " + longitude);
        }
    }

    public static Coordinates of(double latitude, double longitude) {
        return new Coordinates(latitude, longitude);
    }

    /**
     * Whether both axes differ from {@code other} by at most {@code toleranceDegrees}.
     */
    public boolean isWithin(Coordinates other, double toleranceDegrees) {
        return Math.abs(latitude - other.latitude) <= toleranceDegrees
                && Math.abs(longitude - other.longitude) <= toleranceDegrees;
    }
}
