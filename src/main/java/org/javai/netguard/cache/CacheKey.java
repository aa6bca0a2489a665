package org.javai.netguard.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Objects;

/**
 * Cache key built from coordinates rounded to {@value #DECIMAL_PLACES} decimal places (about 11 m)
 * plus an optional parameter fingerprint. Nearby requests deliberately share a key.
 */
public record CacheKey(String value) {

    public static final int DECIMAL_PLACES = 4;

    private static final ObjectMapper CANONICAL_JSON = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public CacheKey {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static CacheKey of(Coordinates coordinates) {
        return of(coordinates, Map.of());
    }

    /**
     * @param coordinates the requested position
     * @param params request parameters (e.g., data type); serialized as JSON with sorted keys
     */
    public static CacheKey of(Coordinates coordinates, Map<String, ?> params) {
        Objects.requireNonNull(coordinates, "coordinates must not be null");
        String location = round(coordinates.latitude()) + "," + round(coordinates.longitude());
        if (params == null || params.isEmpty()) {
            return new CacheKey(location);
        }
        return new CacheKey(location + "_" + fingerprint(params));
    }

    static String round(double degrees) {
        BigDecimal rounded = BigDecimal.valueOf(degrees).setScale(DECIMAL_PLACES, RoundingMode.HALF_UP);
        // -0.00001 rounds to a signed zero; normalize so both hemispheres share the key.
        return rounded.signum() == 0 ? BigDecimal.ZERO.setScale(DECIMAL_PLACES).toPlainString() : rounded.toPlainString();
    }

    private static String fingerprint(Map<String, ?> params) {
        try {
            return CANONICAL_JSON.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache parameters are not serializable: " + params.keySet(), e);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
