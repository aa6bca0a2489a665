package org.javai.netguard.cache;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CacheKeyTest {

    @Test
    void of_roundsToFourDecimalPlaces() {
        assertThat(CacheKey.of(Coordinates.of(40.712776, -74.005974)).value()).isEqualTo("40.7128,-74.0060");
    }

    @Test
    void of_nearbyPositions_collide() {
        CacheKey a = CacheKey.of(Coordinates.of(51.50071, -0.12462));
        CacheKey b = CacheKey.of(Coordinates.of(51.50074, -0.12458));

        assertThat(a).isEqualTo(b);
    }

    @Test
    void of_tinyNegative_normalizesToZero() {
        assertThat(CacheKey.of(Coordinates.of(-0.00001, 0.00001)).value()).isEqualTo("0.0000,0.0000");
    }

    @Test
    void of_params_appendsCanonicalJson() {
        CacheKey key = CacheKey.of(Coordinates.of(40.7128, -74.006), Map.of("type", "current"));

        assertThat(key.value()).isEqualTo("40.7128,-74.0060_{\"type\":\"current\"}");
    }

    @Test
    void of_paramOrder_doesNotMatter() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("units", "metric");
        first.put("days", 5);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("days", 5);
        second.put("units", "metric");

        Coordinates position = Coordinates.of(48.8566, 2.3522);

        assertThat(CacheKey.of(position, first)).isEqualTo(CacheKey.of(position, second));
        assertThat(CacheKey.of(position, first).value()).endsWith("_{\"days\":5,\"units\":\"metric\"}");
    }

    @Test
    void of_emptyParams_sameAsNone() {
        Coordinates position = Coordinates.of(48.8566, 2.3522);

        assertThat(CacheKey.of(position, Map.of())).isEqualTo(CacheKey.of(position));
    }

    @Test
    void coordinates_outOfRange_throws() {
        assertThatThrownBy(() -> Coordinates.of(91, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Coordinates.of(0, -181)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Coordinates.of(Double.NaN, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
