package com.toolgate.lockdown;

import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;

/**
 * Construction options for {@link AccessLockdownCache}.
 *
 * @param ttl       lifetime of an entry after its last write; zero or negative disables expiry
 * @param cacheName label used in logs
 * @param ticker    time source, replaceable in tests
 */
public record LockdownOptions(Duration ttl, String cacheName, Ticker ticker) {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(20);
    public static final String DEFAULT_CACHE_NAME = "repo-access-cache";

    public LockdownOptions {
        if (ttl == null) {
            ttl = DEFAULT_TTL;
        }
        if (cacheName == null || cacheName.isBlank()) {
            cacheName = DEFAULT_CACHE_NAME;
        }
        if (ticker == null) {
            ticker = Ticker.systemTicker();
        }
    }

    public static LockdownOptions defaults() {
        return new LockdownOptions(null, null, null);
    }

    public LockdownOptions withTtl(Duration ttl) {
        return new LockdownOptions(ttl, cacheName, ticker);
    }

    public LockdownOptions withCacheName(String cacheName) {
        return new LockdownOptions(ttl, cacheName, ticker);
    }

    public LockdownOptions withTicker(Ticker ticker) {
        return new LockdownOptions(ttl, cacheName, ticker);
    }

    /** True when entries never expire. */
    public boolean expiryDisabled() {
        return ttl.isZero() || ttl.isNegative();
    }
}
