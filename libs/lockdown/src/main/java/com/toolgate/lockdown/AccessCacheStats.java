package com.toolgate.lockdown;

/**
 * Counters for {@link AccessLockdownCache}. A hit means no upstream query was needed.
 */
public record AccessCacheStats(long hits, long misses, long evictions) {
}
