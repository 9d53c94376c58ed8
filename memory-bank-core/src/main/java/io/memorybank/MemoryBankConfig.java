package io.memorybank;

import io.memorybank.fs.RetryPolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;

/**
 * Configuration for creating a MemoryBank.
 */
public record MemoryBankConfig(
    /** Directory holding the memory bank files */
    Path root,
    
    /** Maximum number of cached files */
    int cacheMaxSize,
    
    /** Idle time after which a cached file is re-read; zero disables expiry */
    Duration cacheMaxAge,
    
    /** Retry behaviour for transient I/O failures */
    RetryPolicy retryPolicy,
    
    /** Root-relative location of the persisted metadata index */
    String indexFile,
    
    /** Whether the metadata index is written to disk after changes */
    boolean persistIndex
) {
    public static final String PREFIX = "memorybank.";
    public static final String CACHE_MAX_SIZE = PREFIX + "cache.max-size";
    public static final String CACHE_MAX_AGE = PREFIX + "cache.max-age";
    public static final String RETRY_MAX_ATTEMPTS = PREFIX + "retry.max-attempts";
    public static final String RETRY_BASE_DELAY = PREFIX + "retry.base-delay";
    public static final String RETRY_MAX_DELAY = PREFIX + "retry.max-delay";
    public static final String INDEX_FILE = PREFIX + "index.file";
    public static final String INDEX_PERSIST = PREFIX + "index.persist";
    
    public static final int DEFAULT_CACHE_MAX_SIZE = 100;
    public static final Duration DEFAULT_CACHE_MAX_AGE = Duration.ofHours(1);
    public static final String DEFAULT_INDEX_FILE = ".index/metadata.json";
    
    public MemoryBankConfig {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        if (cacheMaxSize < 1) {
            throw new IllegalArgumentException("cacheMaxSize must be at least 1, got " + cacheMaxSize);
        }
        if (cacheMaxAge == null || cacheMaxAge.isNegative()) {
            throw new IllegalArgumentException("cacheMaxAge must be non-negative");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (indexFile == null || indexFile.isBlank()) {
            throw new IllegalArgumentException("indexFile cannot be blank");
        }
    }
    
    public static MemoryBankConfig defaultConfig(Path root) {
        return new MemoryBankConfig(
            root,
            DEFAULT_CACHE_MAX_SIZE,
            DEFAULT_CACHE_MAX_AGE,
            RetryPolicy.defaults(),
            DEFAULT_INDEX_FILE,
            true
        );
    }
    
    /**
     * Reads {@code memorybank.*} properties; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static MemoryBankConfig fromProperties(Path root, Properties props) {
        MemoryBankConfig defaults = defaultConfig(root);
        RetryPolicy retry = new RetryPolicy(
            intProperty(props, RETRY_MAX_ATTEMPTS, defaults.retryPolicy().maxAttempts()),
            durationProperty(props, RETRY_BASE_DELAY, defaults.retryPolicy().baseDelay()),
            durationProperty(props, RETRY_MAX_DELAY, defaults.retryPolicy().maxDelay()),
            defaults.retryPolicy().backoffFactor()
        );
        return new MemoryBankConfig(
            root,
            intProperty(props, CACHE_MAX_SIZE, defaults.cacheMaxSize()),
            durationProperty(props, CACHE_MAX_AGE, defaults.cacheMaxAge()),
            retry,
            props.getProperty(INDEX_FILE, defaults.indexFile()).trim(),
            Boolean.parseBoolean(props.getProperty(INDEX_PERSIST, String.valueOf(defaults.persistIndex())).trim())
        );
    }
    
    public MemoryBankConfig withCacheMaxSize(int cacheMaxSize) {
        return new MemoryBankConfig(root, cacheMaxSize, cacheMaxAge, retryPolicy, indexFile, persistIndex);
    }
    
    public MemoryBankConfig withCacheMaxAge(Duration cacheMaxAge) {
        return new MemoryBankConfig(root, cacheMaxSize, cacheMaxAge, retryPolicy, indexFile, persistIndex);
    }
    
    public MemoryBankConfig withRetryPolicy(RetryPolicy retryPolicy) {
        return new MemoryBankConfig(root, cacheMaxSize, cacheMaxAge, retryPolicy, indexFile, persistIndex);
    }
    
    public MemoryBankConfig withPersistIndex(boolean persistIndex) {
        return new MemoryBankConfig(root, cacheMaxSize, cacheMaxAge, retryPolicy, indexFile, persistIndex);
    }
    
    private static int intProperty(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Invalid integer for %s: '%s'", key, value), e);
        }
    }
    
    private static Duration durationProperty(Properties props, String key, Duration defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(String.format("Invalid ISO-8601 duration for %s: '%s'", key, value), e);
        }
    }
}
