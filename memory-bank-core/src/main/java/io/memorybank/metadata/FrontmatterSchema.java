package io.memorybank.metadata;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * {@link MetadataSchema} assembled from per-field rules.
 *
 * <pre>{@code
 * MetadataSchema schema = FrontmatterSchema.base()
 *     .literal("type", "projectBrief")
 *     .requiredString("title", 1)
 *     .optionalEnum("status", "draft", "active")
 *     .build();
 * }</pre>
 *
 * <p>A later rule for the same field replaces the earlier one.</p>
 */
public final class FrontmatterSchema implements MetadataSchema {
    
    private static final String URN_UUID_PREFIX = "urn:uuid:";
    
    private final Map<String, FieldRule> rules;
    
    private FrontmatterSchema(Map<String, FieldRule> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }
    
    /**
     * Rules shared by every document: optional id, timestamps, tags and text fields.
     */
    public static Builder base() {
        return new Builder()
            .optional("id", FrontmatterSchema::checkId)
            .optionalString("type")
            .optionalString("title")
            .optionalString("description")
            .optionalStringList("tags")
            .optionalTimestamp("created")
            .optionalTimestamp("updated")
            .optionalString("version");
    }
    
    @Override
    public List<String> validate(Map<String, Object> metadata) {
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, FieldRule> rule : rules.entrySet()) {
            String field = rule.getKey();
            Object value = metadata.get(field);
            if (value == null) {
                if (rule.getValue().required()) {
                    errors.add(field + ": is required");
                }
                continue;
            }
            String problem = rule.getValue().check().apply(value);
            if (problem != null) {
                errors.add(field + ": " + problem);
            }
        }
        return errors;
    }
    
    // ==================== Checks ====================
    
    private static String checkId(Object value) {
        if (!(value instanceof String s)) {
            return "must be a string";
        }
        String raw = s.startsWith(URN_UUID_PREFIX) ? s.substring(URN_UUID_PREFIX.length()) : s;
        try {
            UUID parsed = UUID.fromString(raw);
            // UUID.fromString accepts shortened groups
            return parsed.toString().equalsIgnoreCase(raw) ? null : "must be a UUID";
        } catch (IllegalArgumentException e) {
            return "must be a UUID";
        }
    }
    
    private static String checkString(Object value) {
        return value instanceof String ? null : "must be a string";
    }
    
    private static String checkStringList(Object value) {
        if (!(value instanceof List<?> list)) {
            return "must be a list of strings";
        }
        for (Object item : list) {
            if (!(item instanceof String)) {
                return "must be a list of strings";
            }
        }
        return null;
    }
    
    private static String checkTimestamp(Object value) {
        if (!(value instanceof String s)) {
            return "must be an ISO-8601 timestamp";
        }
        try {
            OffsetDateTime.parse(s);
            return null;
        } catch (DateTimeParseException e) {
            return "must be an ISO-8601 timestamp";
        }
    }
    
    private record FieldRule(boolean required, Function<Object, String> check) {}
    
    // ==================== Builder ====================
    
    public static final class Builder {
        
        private final Map<String, FieldRule> rules = new LinkedHashMap<>();
        
        private Builder() {
        }
        
        public Builder literal(String field, String expected) {
            rules.put(field, new FieldRule(true, value -> expected.equals(value)
                ? null : "must be '" + expected + "'"));
            return this;
        }
        
        public Builder requiredString(String field, int minLength) {
            rules.put(field, new FieldRule(true, value -> {
                if (!(value instanceof String s)) {
                    return "must be a string";
                }
                if (s.length() < minLength) {
                    return minLength <= 1
                        ? "must not be empty"
                        : "must be at least " + minLength + " characters";
                }
                return null;
            }));
            return this;
        }
        
        public Builder optionalString(String field) {
            return optional(field, FrontmatterSchema::checkString);
        }
        
        public Builder optionalStringList(String field) {
            return optional(field, FrontmatterSchema::checkStringList);
        }
        
        public Builder optionalTimestamp(String field) {
            return optional(field, FrontmatterSchema::checkTimestamp);
        }
        
        public Builder optionalEnum(String field, String... allowed) {
            Set<String> values = Set.of(allowed);
            String message = "must be one of " + String.join(", ", Arrays.asList(allowed));
            return optional(field, value -> value instanceof String s && values.contains(s) ? null : message);
        }
        
        public Builder optional(String field, Function<Object, String> check) {
            rules.put(field, new FieldRule(false, check));
            return this;
        }
        
        public FrontmatterSchema build() {
            return new FrontmatterSchema(rules);
        }
    }
}
