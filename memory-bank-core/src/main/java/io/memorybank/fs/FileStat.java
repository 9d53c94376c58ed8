package io.memorybank.fs;

/**
 * Snapshot of file attributes.
 */
public record FileStat(
    /** Last modification time in epoch milliseconds */
    long mtimeMs,
    
    /** Size in bytes */
    long size,
    
    boolean directory,
    
    boolean regularFile
) {}
