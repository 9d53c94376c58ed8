package io.memorybank.metadata;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps document types to their front-matter schemas.
 */
public class SchemaRegistry {
    
    private final Map<String, MetadataSchema> schemas = new ConcurrentHashMap<>();
    
    /**
     * Creates a registry without any schema; every document validates as UNKNOWN.
     */
    public SchemaRegistry() {
    }
    
    /**
     * Creates a registry with the built-in schemas for
     * {@code projectBrief}, {@code researchNote}, {@code progress} and {@code systemPattern}.
     */
    public static SchemaRegistry defaults() {
        SchemaRegistry registry = new SchemaRegistry();
        registry.register("projectBrief", FrontmatterSchema.base()
            .literal("type", "projectBrief")
            .requiredString("title", 1)
            .requiredString("description", 10)
            .optionalEnum("status", "draft", "active", "completed", "archived")
            .optionalEnum("priority", "low", "medium", "high", "critical")
            .build());
        registry.register("researchNote", FrontmatterSchema.base()
            .literal("type", "researchNote")
            .requiredString("topic", 1)
            .optionalStringList("sources")
            .optionalEnum("confidence", "low", "medium", "high")
            .build());
        registry.register("progress", FrontmatterSchema.base()
            .literal("type", "progress")
            .optionalString("phase")
            .optionalEnum("status", "not-started", "in-progress", "completed", "blocked")
            .optionalStringList("blockers")
            .build());
        registry.register("systemPattern", FrontmatterSchema.base()
            .literal("type", "systemPattern")
            .requiredString("pattern", 1)
            .optionalEnum("category", "architecture", "design", "performance", "security")
            .build());
        return registry;
    }
    
    public SchemaRegistry register(String type, MetadataSchema schema) {
        schemas.put(type, schema);
        return this;
    }
    
    public Optional<MetadataSchema> get(String type) {
        return type == null ? Optional.empty() : Optional.ofNullable(schemas.get(type));
    }
    
    /**
     * Validates metadata against the schema of the given type.
     */
    public Outcome validate(String type, Map<String, Object> metadata) {
        MetadataSchema schema = type == null ? null : schemas.get(type);
        if (schema == null) {
            return new Outcome(ValidationStatus.UNKNOWN, List.of());
        }
        List<String> errors = schema.validate(metadata);
        return errors.isEmpty()
            ? new Outcome(ValidationStatus.VALID, List.of())
            : new Outcome(ValidationStatus.INVALID, errors);
    }
    
    /**
     * Validation status plus the problems found.
     */
    public record Outcome(ValidationStatus status, List<String> errors) {}
}
