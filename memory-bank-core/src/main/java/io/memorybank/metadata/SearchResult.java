package io.memorybank.metadata;

import java.util.List;

/**
 * One page of metadata search results.
 */
public record SearchResult(
    List<MetadataIndexEntry> entries,
    
    /** Number of matching entries before paging */
    int total,
    
    int offset,
    
    int limit,
    
    /** Whether entries exist beyond this page */
    boolean hasMore
) {
    public SearchResult {
        entries = List.copyOf(entries);
    }
}
