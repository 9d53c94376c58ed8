package io.memorybank;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The fixed set of documents every memory bank contains.
 */
public enum MemoryBankFileType {
    PROJECT_BRIEF("projectBrief", "core/projectBrief.md"),
    PRODUCT_CONTEXT("productContext", "core/productContext.md"),
    ACTIVE_CONTEXT("activeContext", "core/activeContext.md"),
    PROGRESS_CURRENT("progressCurrent", "progress/current.md"),
    PROGRESS_HISTORY("progressHistory", "progress/history.md"),
    PROGRESS_INDEX("progressIndex", "progress/index.md"),
    SYSTEM_PATTERNS_INDEX("systemPatternsIndex", "systemPatterns/index.md"),
    SYSTEM_PATTERNS_ARCHITECTURE("systemPatternsArchitecture", "systemPatterns/architecture.md"),
    SYSTEM_PATTERNS_PATTERNS("systemPatternsPatterns", "systemPatterns/patterns.md"),
    SYSTEM_PATTERNS_SCANNING("systemPatternsScanning", "systemPatterns/scanning.md"),
    TECH_CONTEXT_INDEX("techContextIndex", "techContext/index.md"),
    TECH_CONTEXT_STACK("techContextStack", "techContext/stack.md"),
    TECH_CONTEXT_DEPENDENCIES("techContextDependencies", "techContext/dependencies.md"),
    TECH_CONTEXT_ENVIRONMENT("techContextEnvironment", "techContext/environment.md");
    
    private static final Map<String, MemoryBankFileType> BY_ID = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(MemoryBankFileType::id, Function.identity()));
    
    private static final Map<String, MemoryBankFileType> BY_PATH = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(MemoryBankFileType::relativePath, Function.identity()));
    
    private final String id;
    private final String relativePath;
    
    MemoryBankFileType(String id, String relativePath) {
        this.id = id;
        this.relativePath = relativePath;
    }
    
    /**
     * Stable identifier used by callers, e.g. {@code progressCurrent}.
     */
    public String id() {
        return id;
    }
    
    /**
     * Location below the memory bank root, with {@code /} separators.
     */
    public String relativePath() {
        return relativePath;
    }
    
    /**
     * Directory part of {@link #relativePath()}.
     */
    public String directory() {
        int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? "" : relativePath.substring(0, slash);
    }
    
    public static Optional<MemoryBankFileType> fromId(String id) {
        return Optional.ofNullable(BY_ID.get(id));
    }
    
    public static Optional<MemoryBankFileType> fromRelativePath(String relativePath) {
        return Optional.ofNullable(BY_PATH.get(relativePath));
    }
    
    /**
     * Looks a type up by id first, then by relative path.
     */
    public static Optional<MemoryBankFileType> lookup(String idOrPath) {
        MemoryBankFileType type = BY_ID.get(idOrPath);
        if (type == null) {
            type = BY_PATH.get(idOrPath);
        }
        return Optional.ofNullable(type);
    }
}
