package io.memorybank;

import io.memorybank.metadata.ValidationStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Loaded state of one memory bank document. Replaced, never mutated, on update.
 */
public record MemoryBankFile(
    MemoryBankFileType type,
    
    /** Root-relative path with '/' separators */
    String relativePath,
    
    /** Full UTF-8 text exactly as stored */
    String content,
    
    /** File modification time after the last successful write or load */
    Instant lastUpdated,
    
    /** Parsed front-matter, empty when the document has none */
    Map<String, Object> metadata,
    
    /** Document text without the front-matter block */
    String body,
    
    ValidationStatus validationStatus,
    
    List<String> validationErrors
) {
    public MemoryBankFile {
        metadata = metadata == null ? Map.of() : metadata;
        body = body == null ? content : body;
        validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
    }
    
    public boolean isValid() {
        return validationStatus != ValidationStatus.INVALID;
    }
}
