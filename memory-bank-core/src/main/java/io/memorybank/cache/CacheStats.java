package io.memorybank.cache;

import java.time.Instant;

/**
 * Point-in-time copy of the cache counters.
 */
public record CacheStats(
    long hits,
    long misses,
    long evictions,
    
    /** Accesses that found a stale entry and re-read the file */
    long reloads,
    
    /** Distinct entries inserted since the cache was created */
    long totalFiles,
    
    int currentSize,
    int maxSize,
    
    /** hits / (hits + misses), or 0 when there were no accesses */
    double hitRate,
    
    Instant lastReset
) {
    public static CacheStats of(long hits, long misses, long evictions, long reloads,
                                long totalFiles, int currentSize, int maxSize, Instant lastReset) {
        long lookups = hits + misses;
        double hitRate = lookups == 0 ? 0.0 : (double) hits / lookups;
        return new CacheStats(hits, misses, evictions, reloads, totalFiles, currentSize, maxSize, hitRate, lastReset);
    }
}
