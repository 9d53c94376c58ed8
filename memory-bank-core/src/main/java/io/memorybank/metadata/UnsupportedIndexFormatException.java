package io.memorybank.metadata;

/**
 * Exception thrown when a persisted index has an unsupported format version.
 */
public class UnsupportedIndexFormatException extends RuntimeException {
    
    private final int version;
    
    public UnsupportedIndexFormatException(int version) {
        super(String.format("Unsupported metadata index format version: %d", version));
        this.version = version;
    }
    
    public int getVersion() {
        return version;
    }
}
