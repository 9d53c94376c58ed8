package io.memorybank.metadata;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Criteria for querying the metadata index. Unset criteria match everything.
 *
 * <pre>{@code
 * MetadataFilter filter = MetadataFilter.builder()
 *     .tags("arch")
 *     .validationStatus(ValidationStatus.VALID)
 *     .sortBy(SortField.SIZE)
 *     .limit(10)
 *     .build();
 * }</pre>
 */
public final class MetadataFilter {
    
    public static final int DEFAULT_LIMIT = 50;
    
    private final List<String> tags;
    private final String type;
    private final ValidationStatus validationStatus;
    private final String text;
    private final Instant createdAfter;
    private final Instant createdBefore;
    private final Instant updatedAfter;
    private final Instant updatedBefore;
    private final Long minSize;
    private final Long maxSize;
    private final Integer minLines;
    private final Integer maxLines;
    private final SortField sortBy;
    private final SortOrder sortOrder;
    private final int offset;
    private final int limit;
    
    private MetadataFilter(Builder b) {
        this.tags = List.copyOf(b.tags);
        this.type = b.type;
        this.validationStatus = b.validationStatus;
        this.text = b.text == null || b.text.isBlank() ? null : b.text.trim().toLowerCase(Locale.ROOT);
        this.createdAfter = b.createdAfter;
        this.createdBefore = b.createdBefore;
        this.updatedAfter = b.updatedAfter;
        this.updatedBefore = b.updatedBefore;
        this.minSize = b.minSize;
        this.maxSize = b.maxSize;
        this.minLines = b.minLines;
        this.maxLines = b.maxLines;
        this.sortBy = b.sortBy;
        this.sortOrder = b.sortOrder;
        this.offset = b.offset;
        this.limit = b.limit;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Matches every entry, newest first, with the default page size.
     */
    public static MetadataFilter all() {
        return builder().build();
    }
    
    public static MetadataFilter byTags(String... tags) {
        return builder().tags(tags).build();
    }
    
    /**
     * Checks every criterion except paging and ordering.
     */
    public boolean matches(MetadataIndexEntry entry) {
        if (!entry.hasAllTags(tags)) {
            return false;
        }
        if (type != null && !type.equals(entry.type())) {
            return false;
        }
        if (validationStatus != null && validationStatus != entry.validationStatus()) {
            return false;
        }
        if (text != null && !entry.searchableText().contains(text)) {
            return false;
        }
        if (!inRange(entry.created(), createdAfter, createdBefore)
            || !inRange(entry.updated(), updatedAfter, updatedBefore)) {
            return false;
        }
        if ((minSize != null && entry.sizeBytes() < minSize) || (maxSize != null && entry.sizeBytes() > maxSize)) {
            return false;
        }
        return (minLines == null || entry.lineCount() >= minLines)
            && (maxLines == null || entry.lineCount() <= maxLines);
    }
    
    private static boolean inRange(Instant value, Instant after, Instant before) {
        if (after == null && before == null) {
            return true;
        }
        if (value == null) {
            return false;
        }
        return (after == null || !value.isBefore(after)) && (before == null || !value.isAfter(before));
    }
    
    /**
     * Sort field actually applied: relevance when a text query is set and no
     * field was requested, otherwise the requested field or UPDATED.
     */
    public SortField effectiveSortBy() {
        if (sortBy == null) {
            return text != null ? SortField.RELEVANCE : SortField.UPDATED;
        }
        if (sortBy == SortField.RELEVANCE && text == null) {
            return SortField.UPDATED;
        }
        return sortBy;
    }
    
    public List<String> tags() {
        return tags;
    }
    
    public String type() {
        return type;
    }
    
    public ValidationStatus validationStatus() {
        return validationStatus;
    }
    
    /**
     * Normalized (trimmed, lower-cased) free-text query, or null.
     */
    public String text() {
        return text;
    }
    
    public SortOrder sortOrder() {
        return sortOrder;
    }
    
    public int offset() {
        return offset;
    }
    
    public int limit() {
        return limit;
    }
    
    @Override
    public String toString() {
        return "MetadataFilter[tags=" + tags + ", type=" + type + ", status=" + validationStatus
            + ", text=" + text + ", sortBy=" + effectiveSortBy() + " " + sortOrder
            + ", offset=" + offset + ", limit=" + limit + "]";
    }
    
    // ==================== Builder ====================
    
    public static final class Builder {
        private final List<String> tags = new ArrayList<>();
        private String type;
        private ValidationStatus validationStatus;
        private String text;
        private Instant createdAfter;
        private Instant createdBefore;
        private Instant updatedAfter;
        private Instant updatedBefore;
        private Long minSize;
        private Long maxSize;
        private Integer minLines;
        private Integer maxLines;
        private SortField sortBy;
        private SortOrder sortOrder = SortOrder.DESC;
        private int offset = 0;
        private int limit = DEFAULT_LIMIT;
        
        private Builder() {
        }
        
        /** Entries must carry all of these tags */
        public Builder tags(String... tags) {
            return tags(List.of(tags));
        }
        
        public Builder tags(Collection<String> tags) {
            this.tags.addAll(tags);
            return this;
        }
        
        public Builder type(String type) {
            this.type = type;
            return this;
        }
        
        public Builder validationStatus(ValidationStatus status) {
            this.validationStatus = status;
            return this;
        }
        
        /** Case-insensitive substring of title, description, path, type or tags */
        public Builder text(String text) {
            this.text = text;
            return this;
        }
        
        public Builder createdBetween(Instant after, Instant before) {
            this.createdAfter = after;
            this.createdBefore = before;
            return this;
        }
        
        public Builder updatedBetween(Instant after, Instant before) {
            this.updatedAfter = after;
            this.updatedBefore = before;
            return this;
        }
        
        public Builder sizeBetween(Long minBytes, Long maxBytes) {
            this.minSize = minBytes;
            this.maxSize = maxBytes;
            return this;
        }
        
        public Builder linesBetween(Integer min, Integer max) {
            this.minLines = min;
            this.maxLines = max;
            return this;
        }
        
        public Builder sortBy(SortField sortBy) {
            this.sortBy = sortBy;
            return this;
        }
        
        public Builder sortOrder(SortOrder sortOrder) {
            this.sortOrder = sortOrder;
            return this;
        }
        
        public Builder offset(int offset) {
            if (offset < 0) {
                throw new IllegalArgumentException("offset must be non-negative, got " + offset);
            }
            this.offset = offset;
            return this;
        }
        
        public Builder limit(int limit) {
            if (limit < 1) {
                throw new IllegalArgumentException("limit must be positive, got " + limit);
            }
            this.limit = limit;
            return this;
        }
        
        public MetadataFilter build() {
            if (sortOrder == null) {
                throw new IllegalArgumentException("sortOrder cannot be null");
            }
            return new MetadataFilter(this);
        }
    }
}
