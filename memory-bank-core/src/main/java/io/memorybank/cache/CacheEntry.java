package io.memorybank.cache;

import java.time.Instant;

/**
 * Cached file content together with the modification time it was read at.
 */
public record CacheEntry(
    String content,
    
    /** On-disk modification time observed when the content was read or written */
    long mtimeMs,
    
    Instant lastAccessed,
    
    long accessCount
) {
    static CacheEntry loaded(String content, long mtimeMs, Instant now) {
        return new CacheEntry(content, mtimeMs, now, 1);
    }
    
    CacheEntry accessed(Instant now) {
        return new CacheEntry(content, mtimeMs, now, accessCount + 1);
    }
    
    CacheEntry replaced(String newContent, long newMtimeMs, Instant now) {
        return new CacheEntry(newContent, newMtimeMs, now, accessCount + 1);
    }
}
