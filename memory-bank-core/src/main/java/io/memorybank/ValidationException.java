package io.memorybank;

import java.util.List;

/**
 * Front-matter of a document does not satisfy its type's schema.
 */
public class ValidationException extends MemoryBankException {
    
    private final String relativePath;
    private final List<String> errors;
    
    public ValidationException(String relativePath, List<String> errors) {
        super(ErrorKind.VALIDATION_FAILED, String.format(
            "Validation failed for %s: %s", relativePath, String.join("; ", errors)));
        this.relativePath = relativePath;
        this.errors = List.copyOf(errors);
    }
    
    public String getRelativePath() {
        return relativePath;
    }
    
    public List<String> getErrors() {
        return errors;
    }
}
