package io.memorybank.metadata;

/**
 * Fields metadata search results can be ordered by.
 */
public enum SortField {
    UPDATED,
    CREATED,
    TITLE,
    SIZE,
    
    /** Match quality against the free-text query; falls back to UPDATED without one */
    RELEVANCE
}
