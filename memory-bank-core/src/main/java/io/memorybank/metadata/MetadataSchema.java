package io.memorybank.metadata;

import java.util.List;
import java.util.Map;

/**
 * Validation rules for the front-matter of one document type.
 */
@FunctionalInterface
public interface MetadataSchema {
    
    /**
     * Checks parsed front-matter.
     *
     * @return Human-readable problems, empty when the metadata is valid
     */
    List<String> validate(Map<String, Object> metadata);
}
