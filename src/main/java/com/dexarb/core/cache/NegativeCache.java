package com.dexarb.core.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers lookups that failed (and, for a shorter while, ones that succeeded) so repeated ticks do not
 * re-query registries for pools that do not exist. Expiry is evaluated against the injected clock on read.
 */
@Slf4j
public class NegativeCache {

    public enum Kind {
        MISSING,
        LOW_LIQUIDITY,
        FOUND
    }

    public record TtlPolicy(Duration missing, Duration lowLiquidity, Duration found) {

        public Duration ttl(Kind kind) {
            return switch (kind) {
                case MISSING -> missing;
                case LOW_LIQUIDITY -> lowLiquidity;
                case FOUND -> found;
            };
        }
    }

    public record Entry(Kind kind, Instant expiresAt, String payload) {
    }

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final TtlPolicy policy;
    private final Clock clock;

    public NegativeCache(TtlPolicy policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Key for a pool lookup: venue, sorted lower-case addresses, and fee tier when the venue has one.
     */
    public static String poolKey(String venue, String tokenA, String tokenB, Integer fee) {
        String a = tokenA.toLowerCase(Locale.ROOT);
        String b = tokenB.toLowerCase(Locale.ROOT);
        String pair = a.compareTo(b) <= 0 ? a + "/" + b : b + "/" + a;
        return venue + ":" + pair + (fee != null ? "@" + fee : "");
    }

    public static String usdRouteKey(String token) {
        return "usd-route:" + token.toLowerCase(Locale.ROOT);
    }

    public void markMissing(String key) {
        put(key, Kind.MISSING, null);
    }

    public void markLowLiquidity(String key) {
        put(key, Kind.LOW_LIQUIDITY, null);
    }

    public void markFound(String key, String payload) {
        put(key, Kind.FOUND, payload);
    }

    public Optional<Entry> lookup(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public boolean isNegative(String key) {
        return lookup(key).map(e -> e.kind() != Kind.FOUND).orElse(false);
    }

    public Optional<String> found(String key) {
        return lookup(key).filter(e -> e.kind() == Kind.FOUND).map(Entry::payload);
    }

    public void invalidate(String key) {
        entries.remove(key);
    }

    /**
     * Drops expired entries. Reads already ignore them; this only bounds memory.
     */
    public int sweep() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> !now.isBefore(e.getValue().expiresAt()));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Swept {} expired cache entries", removed);
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    private void put(String key, Kind kind, String payload) {
        entries.put(key, new Entry(kind, clock.instant().plus(policy.ttl(kind)), payload));
    }
}
