package io.memorybank.metadata;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Indexed metadata of one document, keyed by its root-relative path.
 */
public record MetadataIndexEntry(
    /** Root-relative path with '/' separators */
    String relativePath,
    
    /** Front-matter id, or the path when the header has none */
    String id,
    
    /** Front-matter type, or "unknown" */
    String type,
    
    String title,
    
    String description,
    
    Set<String> tags,
    
    ValidationStatus validationStatus,
    
    List<String> validationErrors,
    
    /** UTF-8 encoded size of the whole document */
    long sizeBytes,
    
    int lineCount,
    
    Instant created,
    
    /** Never moves backwards for the same path while the entry exists */
    Instant updated,
    
    Instant lastIndexed
) {
    public static final String UNKNOWN_TYPE = "unknown";
    
    public MetadataIndexEntry {
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
        description = description == null ? "" : description;
        type = type == null ? UNKNOWN_TYPE : type;
        validationStatus = validationStatus == null ? ValidationStatus.UNKNOWN : validationStatus;
    }
    
    /**
     * Returns true if every requested tag is present, ignoring case.
     */
    public boolean hasAllTags(Collection<String> requested) {
        if (requested.isEmpty()) {
            return true;
        }
        Set<String> lower = new LinkedHashSet<>();
        for (String tag : tags) {
            lower.add(tag.toLowerCase(Locale.ROOT));
        }
        for (String tag : requested) {
            if (!lower.contains(tag.toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }
    
    /**
     * Lower-cased text matched by free-text queries.
     */
    String searchableText() {
        StringBuilder sb = new StringBuilder();
        if (title != null) {
            sb.append(title).append(' ');
        }
        sb.append(description).append(' ')
            .append(relativePath).append(' ')
            .append(type).append(' ')
            .append(String.join(" ", tags));
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
