package io.memorybank.metadata;

import java.time.Instant;
import java.util.Map;

/**
 * Statistics about a MetadataIndex.
 */
public record IndexStats(
    /** Number of indexed documents */
    int totalEntries,
    
    /** Documents by validation status */
    Map<ValidationStatus, Integer> byValidationStatus,
    
    /** Documents by front-matter type */
    Map<String, Integer> byType,
    
    /** Documents by tag */
    Map<String, Integer> byTag,
    
    /** Combined size of all documents in bytes */
    long totalSizeBytes,
    
    long totalLines,
    
    /** Time of the last full rebuild or load, null if never built */
    Instant lastBuilt
) {}
