package io.memorybank;

/**
 * Failure categories reported by memory bank operations.
 */
public enum ErrorKind {
    /** Identifier contains parent segments, an absolute prefix or a NUL byte */
    INVALID_PATH,
    
    /** Normalized path resolves outside the memory bank root */
    PATH_ESCAPE,
    
    /** Identifier is not one of the known file types */
    UNKNOWN_FILE_TYPE,
    
    NOT_FOUND,
    
    PERMISSION_DENIED,
    
    /** Transient I/O failure that outlasted the retry budget */
    TRANSIENT_IO,
    
    /** Any other permanent I/O failure */
    IO_ERROR,
    
    /** Content does not match the schema of its type */
    VALIDATION_FAILED,
    
    /** Internal cache invariant was violated */
    CACHE_INCONSISTENCY,
    
    HEALTH_CHECK_FAILED,
    
    TIMEOUT,
    
    INTERNAL;
    
    /**
     * Returns true for input validation failures, which are never retried.
     */
    public boolean isInputError() {
        return this == INVALID_PATH || this == PATH_ESCAPE || this == UNKNOWN_FILE_TYPE;
    }
}
