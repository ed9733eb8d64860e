package io.github.cyfko.veracity.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CachePolicy Tests")
class CachePolicyTest {

    @Test
    @DisplayName("Should expose the preset sizes")
    void testPresets() {
        assertEquals(new CachePolicy(true, 1000), CachePolicy.defaults());
        assertEquals(new CachePolicy(true, 500), CachePolicy.strict());
        assertEquals(new CachePolicy(true, 2000), CachePolicy.relaxed());
        assertEquals(new CachePolicy(true, 64), CachePolicy.custom(64));
        assertFalse(CachePolicy.none().cacheEnabled());
    }

    @Test
    @DisplayName("Should reject a non-positive size")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> CachePolicy.custom(0));
        assertThrows(IllegalArgumentException.class, () -> new CachePolicy(false, -1));
    }
}
