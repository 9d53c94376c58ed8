package io.memorybank.metadata;

/**
 * Outcome of checking a document's front-matter against its type's schema.
 */
public enum ValidationStatus {
    VALID,
    INVALID,
    
    /** No schema is registered for the document's type */
    UNKNOWN
}
