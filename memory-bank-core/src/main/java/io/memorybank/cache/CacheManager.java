package io.memorybank.cache;

import io.memorybank.ErrorKind;
import io.memorybank.MemoryBankException;
import io.memorybank.OperationResult;
import io.memorybank.fs.FileStat;
import io.memorybank.fs.RetryingFileOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * LRU cache of file contents validated against on-disk modification times.
 *
 * <p>An entry is served only while its recorded mtime matches the file and,
 * when a max age is configured, it was accessed within that age. Otherwise the
 * file is re-read. Once the cache holds more than {@code maxSize} entries the
 * least recently accessed ones are evicted.</p>
 *
 * <p>Map and counter updates happen under a single monitor; file I/O runs
 * outside it so slow disks do not block unrelated lookups.</p>
 */
public class CacheManager {
    
    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);
    
    private final RetryingFileOperations fileOps;
    private final int maxSize;
    private final Duration maxAge;
    private final Clock clock;
    
    private final Object lock = new Object();
    
    // Iteration order is access order: the first entry is the least recently used
    private final LinkedHashMap<Path, CacheEntry> entries = new LinkedHashMap<>();
    
    private long hits;
    private long misses;
    private long evictions;
    private long reloads;
    private long totalFiles;
    private Instant lastReset;
    
    public CacheManager(RetryingFileOperations fileOps, int maxSize, Duration maxAge) {
        this(fileOps, maxSize, maxAge, Clock.systemUTC());
    }
    
    /**
     * @param maxSize Maximum number of entries, at least 1
     * @param maxAge Maximum idle time of an entry; {@link Duration#ZERO} disables expiry
     */
    public CacheManager(RetryingFileOperations fileOps, int maxSize, Duration maxAge, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1, got " + maxSize);
        }
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must be non-negative");
        }
        this.fileOps = fileOps;
        this.maxSize = maxSize;
        this.maxAge = maxAge;
        this.clock = clock;
        this.lastReset = clock.instant();
    }
    
    // ==================== Lookup ====================
    
    /**
     * Returns the content of a file, reading it when it is absent or stale.
     */
    public OperationResult<String> get(Path path) {
        OperationResult<FileStat> stat = fileOps.stat(path);
        if (stat.isFailure()) {
            if (stat.hasErrorKind(ErrorKind.NOT_FOUND)) {
                dropVanished(path);
            }
            return stat.asFailure();
        }
        long mtimeMs = stat.value().mtimeMs();
        
        synchronized (lock) {
            CacheEntry entry = entries.get(path);
            Instant now = clock.instant();
            if (entry != null && entry.mtimeMs() == mtimeMs && !isExpired(entry, now)) {
                hits++;
                touch(path, entry.accessed(now));
                return OperationResult.success(entry.content());
            }
            if (entry == null) {
                misses++;
                log.debug("Cache miss: {}", path);
            } else {
                reloads++;
                log.debug("Cache entry stale, reloading: {}", path);
            }
        }
        
        OperationResult<String> read = fileOps.read(path);
        if (read.isFailure()) {
            if (read.hasErrorKind(ErrorKind.NOT_FOUND)) {
                dropVanished(path);
            }
            return read;
        }
        
        synchronized (lock) {
            try {
                return OperationResult.success(storeLoaded(path, read.value(), mtimeMs));
            } catch (MemoryBankException e) {
                log.error("Cache invariant violated while storing {}: {}", path, e.getMessage());
                return OperationResult.failure(e);
            }
        }
    }
    
    /**
     * Returns the cached entry without touching statistics or LRU order.
     */
    public Optional<CacheEntry> peek(Path path) {
        synchronized (lock) {
            return Optional.ofNullable(entries.get(path));
        }
    }
    
    public boolean contains(Path path) {
        synchronized (lock) {
            return entries.containsKey(path);
        }
    }
    
    // ==================== Modification ====================
    
    /**
     * Records content that was just written, reading its mtime from disk.
     */
    public OperationResult<Void> put(Path path, String content) {
        OperationResult<FileStat> stat = fileOps.stat(path);
        if (stat.isFailure()) {
            return stat.asFailure();
        }
        return put(path, content, stat.value().mtimeMs());
    }
    
    /**
     * Records content that was just written with a known mtime.
     *
     * <p>Unlike a load, a put always replaces the existing entry.</p>
     */
    public OperationResult<Void> put(Path path, String content, long mtimeMs) {
        synchronized (lock) {
            Instant now = clock.instant();
            CacheEntry existing = entries.get(path);
            try {
                if (existing == null) {
                    insert(path, CacheEntry.loaded(content, mtimeMs, now));
                } else {
                    touch(path, existing.replaced(content, mtimeMs, now));
                }
            } catch (MemoryBankException e) {
                log.error("Cache invariant violated while storing {}: {}", path, e.getMessage());
                return OperationResult.failure(e);
            }
            return OperationResult.ok();
        }
    }
    
    public void invalidate(Path path) {
        synchronized (lock) {
            if (entries.remove(path) != null) {
                log.debug("Invalidated cache entry: {}", path);
            }
        }
    }
    
    /**
     * Drops every entry. Counters are left untouched.
     */
    public void invalidate() {
        synchronized (lock) {
            int dropped = entries.size();
            entries.clear();
            log.debug("Invalidated {} cache entries", dropped);
        }
    }
    
    // ==================== Statistics ====================
    
    public CacheStats getStats() {
        synchronized (lock) {
            return CacheStats.of(hits, misses, evictions, reloads, totalFiles, entries.size(), maxSize, lastReset);
        }
    }
    
    /**
     * Zeroes hits, misses, evictions and reloads. {@code totalFiles} keeps counting.
     */
    public void resetStats() {
        synchronized (lock) {
            hits = 0;
            misses = 0;
            evictions = 0;
            reloads = 0;
            lastReset = clock.instant();
        }
    }
    
    public int getMaxSize() {
        return maxSize;
    }
    
    public Duration getMaxAge() {
        return maxAge;
    }
    
    // ==================== Internal ====================
    
    // Callers hold the lock
    private String storeLoaded(Path path, String content, long mtimeMs) {
        Instant now = clock.instant();
        CacheEntry existing = entries.get(path);
        if (existing == null) {
            insert(path, CacheEntry.loaded(content, mtimeMs, now));
            return content;
        }
        if (existing.mtimeMs() > mtimeMs) {
            // A newer write landed while this read was in flight
            touch(path, existing.accessed(now));
            return existing.content();
        }
        touch(path, existing.replaced(content, mtimeMs, now));
        return content;
    }
    
    private void insert(Path path, CacheEntry entry) {
        entries.put(path, entry);
        totalFiles++;
        evictOverflow();
    }
    
    private void touch(Path path, CacheEntry entry) {
        entries.remove(path);
        entries.put(path, entry);
    }
    
    private void evictOverflow() {
        while (entries.size() > maxSize) {
            Iterator<Map.Entry<Path, CacheEntry>> oldest = entries.entrySet().iterator();
            if (!oldest.hasNext()) {
                throw MemoryBankException.cacheInconsistency(String.format(
                    "Cache size %d exceeds %d but no entry can be evicted", entries.size(), maxSize));
            }
            Path evicted = oldest.next().getKey();
            oldest.remove();
            evictions++;
            log.debug("Evicted least recently used entry: {}", evicted);
        }
    }
    
    private boolean isExpired(CacheEntry entry, Instant now) {
        return !maxAge.isZero() && Duration.between(entry.lastAccessed(), now).compareTo(maxAge) > 0;
    }
    
    private void dropVanished(Path path) {
        synchronized (lock) {
            if (entries.remove(path) != null) {
                log.debug("File vanished, dropped cache entry: {}", path);
            }
        }
    }
}
