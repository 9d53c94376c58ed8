package io.memorybank.parser;

import java.util.Map;

/**
 * Result of splitting a document into its YAML header and body.
 */
public record Frontmatter(
    /** Parsed header values; empty when there is no header or it is malformed */
    Map<String, Object> metadata,
    
    /** Content after the header, or the whole document when there is none */
    String body,
    
    /** Whether a header block was found */
    boolean present,
    
    /** Parse error message for a malformed header, null otherwise */
    String error
) {
    public static Frontmatter absent(String content) {
        return new Frontmatter(Map.of(), content, false, null);
    }
    
    public boolean isMalformed() {
        return error != null;
    }
    
    public String getString(String key) {
        Object value = metadata.get(key);
        return value != null ? value.toString() : null;
    }
}
