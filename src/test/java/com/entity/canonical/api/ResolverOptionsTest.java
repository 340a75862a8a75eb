package com.entity.canonical.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ResolverOptionsTest {

    @Test
    @DisplayName("Defaults match the documented values")
    void testDefaults() {
        ResolverOptions options = ResolverOptions.defaults();

        assertEquals(10, options.getTopK());
        assertEquals(20, options.getSampleSize());
        assertEquals(100, options.getMaxGroups());
        assertEquals(10.0, options.getKeywordBoost());
        assertEquals(2.0, options.getFullTextBoost());
        assertEquals(1.0, options.getNgramBoost());
        assertEquals(50, options.getBatchSize());
        assertEquals(2, options.getMaxInFlightBatches());
        assertEquals("synonym", options.getIndexPrefix());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    @DisplayName("Counts must be positive")
    void testNonPositiveCounts(int value) {
        assertThrows(IllegalArgumentException.class, () -> ResolverOptions.builder().topK(value));
        assertThrows(IllegalArgumentException.class, () -> ResolverOptions.builder().sampleSize(value));
        assertThrows(IllegalArgumentException.class, () -> ResolverOptions.builder().maxGroups(value));
        assertThrows(IllegalArgumentException.class, () -> ResolverOptions.builder().batchSize(value));
        assertThrows(IllegalArgumentException.class, () -> ResolverOptions.builder().maxInFlightBatches(value));
    }

    @Test
    @DisplayName("Boosts must keep keyword above full text above n-gram")
    void testBoostOrder() {
        assertThrows(IllegalArgumentException.class, () -> ResolverOptions.builder().boosts(1, 2, 3).build());
        assertThrows(IllegalArgumentException.class, () -> ResolverOptions.builder().boosts(5, 0, 0));

        ResolverOptions equal = ResolverOptions.builder().boosts(3, 3, 3).build();
        assertEquals(3.0, equal.getNgramBoost());
    }

    @Test
    @DisplayName("Index prefix must not be blank")
    void testIndexPrefix() {
        assertThrows(IllegalArgumentException.class, () -> ResolverOptions.builder().indexPrefix(" ").build());
        assertEquals("kb", ResolverOptions.builder().indexPrefix("kb").build().getIndexPrefix());
    }
}
