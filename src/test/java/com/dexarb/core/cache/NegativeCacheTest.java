package com.dexarb.core.cache;

import com.dexarb.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NegativeCacheTest {

    private MutableClock clock;
    private NegativeCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
        cache = new NegativeCache(new NegativeCache.TtlPolicy(Duration.ofHours(1), Duration.ofMinutes(10),
                Duration.ofMinutes(30)), clock);
    }

    @Test
    void missingEntryLivesForItsTtl() {
        String key = NegativeCache.poolKey("univ3", "0xaaa", "0xbbb", 500);
        cache.markMissing(key);

        clock.advance(Duration.ofSeconds(3599));
        assertTrue(cache.isNegative(key));

        clock.advance(Duration.ofSeconds(2));
        assertFalse(cache.isNegative(key));
        assertTrue(cache.lookup(key).isEmpty());
    }

    @Test
    void lowLiquidityExpiresSooner() {
        String key = NegativeCache.poolKey("baseswap", "0xaaa", "0xbbb", null);
        cache.markLowLiquidity(key);

        clock.advance(Duration.ofMinutes(9));
        assertTrue(cache.isNegative(key));
        clock.advance(Duration.ofMinutes(2));
        assertFalse(cache.isNegative(key));
    }

    @Test
    void foundEntriesCarryTheirPayloadAndAreNotNegative() {
        String key = NegativeCache.poolKey("univ3", "0xaaa", "0xbbb", 3000);
        cache.markFound(key, "0xpool");

        assertFalse(cache.isNegative(key));
        assertEquals(Optional.of("0xpool"), cache.found(key));
    }

    @Test
    void poolKeyIgnoresTokenOrderAndCase() {
        assertEquals(NegativeCache.poolKey("univ3", "0xBBB", "0xaaa", 500),
                NegativeCache.poolKey("univ3", "0xAAA", "0xbbb", 500));
        assertNotEquals(NegativeCache.poolKey("univ3", "0xaaa", "0xbbb", 500),
                NegativeCache.poolKey("univ3", "0xaaa", "0xbbb", 3000));
    }

    @Test
    void sweepDropsOnlyExpiredEntries() {
        cache.markMissing("a");
        cache.markLowLiquidity("b");
        clock.advance(Duration.ofMinutes(15));

        assertEquals(1, cache.sweep());
        assertEquals(1, cache.size());
        assertTrue(cache.isNegative("a"));
    }
}
