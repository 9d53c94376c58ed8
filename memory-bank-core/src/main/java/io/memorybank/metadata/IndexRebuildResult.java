package io.memorybank.metadata;

import java.time.Duration;
import java.util.Map;

/**
 * Summary of a full index rebuild.
 */
public record IndexRebuildResult(
    /** Markdown files found under the root */
    int filesProcessed,
    
    int filesIndexed,
    
    /** Read failures keyed by relative path */
    Map<String, String> errors,
    
    Duration duration
) {
    public IndexRebuildResult {
        errors = Map.copyOf(errors);
    }
    
    public int filesErrored() {
        return errors.size();
    }
}
