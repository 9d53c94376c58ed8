package io.memorybank;

/**
 * Exception describing a failed memory bank operation.
 *
 * <p>Carried inside a failed {@link OperationResult}; public operations never
 * let it escape as a thrown exception.</p>
 */
public class MemoryBankException extends RuntimeException {
    
    private final ErrorKind kind;
    private final String code;
    
    public MemoryBankException(ErrorKind kind, String message) {
        this(kind, kind.name(), message, null);
    }
    
    public MemoryBankException(ErrorKind kind, String code, String message) {
        this(kind, code, message, null);
    }
    
    public MemoryBankException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code != null ? code : kind.name();
    }
    
    public static MemoryBankException invalidPath(String identifier, String reason) {
        return new MemoryBankException(ErrorKind.INVALID_PATH, String.format(
            "Invalid path '%s': %s", identifier, reason));
    }
    
    public static MemoryBankException pathEscape(String identifier) {
        return new MemoryBankException(ErrorKind.PATH_ESCAPE, String.format(
            "Path '%s' resolves outside the memory bank root", identifier));
    }
    
    public static MemoryBankException unknownFileType(String identifier) {
        return new MemoryBankException(ErrorKind.UNKNOWN_FILE_TYPE, String.format(
            "Unknown memory bank file type: '%s'", identifier));
    }
    
    public static MemoryBankException cacheInconsistency(String message) {
        return new MemoryBankException(ErrorKind.CACHE_INCONSISTENCY, message);
    }
    
    public ErrorKind getKind() {
        return kind;
    }
    
    /**
     * Returns the structured error code, e.g. {@code ENOENT} or {@code TRANSIENT_EXHAUSTED}.
     */
    public String getCode() {
        return code;
    }
}
