package io.memorybank;

import io.memorybank.cache.CacheStats;
import io.memorybank.metadata.IndexRebuildResult;
import io.memorybank.metadata.IndexStats;
import io.memorybank.metadata.MetadataFilter;
import io.memorybank.metadata.SearchResult;
import io.memorybank.metadata.ValidationStatus;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main interface for working with a memory bank.
 *
 * <p>A MemoryBank keeps a fixed set of markdown documents under one root
 * directory, caches their content and indexes their front-matter. Operations
 * that touch the file system report failures through {@link OperationResult}
 * instead of throwing.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * MemoryBank bank = MemoryBank.create(MemoryBankConfig.defaultConfig(Path.of("memory-bank")));
 * bank.init();
 *
 * // Creates any missing file from its template
 * List<MemoryBankFileType> created = bank.loadFiles().orElseThrow();
 *
 * bank.updateFile(MemoryBankFileType.PROGRESS_CURRENT, "# Current Progress\n\nShipping 1.0\n");
 * String progress = bank.getFile(MemoryBankFileType.PROGRESS_CURRENT).orElseThrow().content();
 *
 * SearchResult arch = bank.searchMetadata(MetadataFilter.byTags("arch")).orElseThrow();
 * }</pre>
 */
public interface MemoryBank extends AutoCloseable {
    
    // ==================== Factory Methods ====================
    
    /**
     * Creates a memory bank rooted at the given directory with default configuration.
     */
    static MemoryBank create(Path root) {
        return create(MemoryBankConfig.defaultConfig(root));
    }
    
    static MemoryBank create(MemoryBankConfig config) {
        return new MemoryBankCore(config);
    }
    
    // ==================== Lifecycle ====================
    
    /**
     * Creates the folder structure and loads the persisted metadata index, if any.
     */
    OperationResult<Void> init();
    
    /**
     * Ensures the root and every standard subdirectory exist. Idempotent.
     */
    OperationResult<Void> initializeFolders();
    
    /**
     * Loads every known file, creating missing ones from their templates.
     *
     * @return The types that had to be created; empty when the store was complete
     */
    OperationResult<List<MemoryBankFileType>> loadFiles();
    
    /**
     * Checks that every known file is present and readable. Never repairs.
     *
     * @return A summary on success; a {@link HealthCheckException} listing
     *         every problem otherwise
     */
    OperationResult<String> checkHealth();
    
    /**
     * Drops all in-memory state. Files on disk are left untouched.
     */
    @Override
    void close();
    
    // ==================== Files ====================
    
    /**
     * Returns a loaded file, re-reading it if it changed on disk.
     *
     * @return Empty if {@link #loadFiles()} has not loaded the type or the file vanished
     */
    Optional<MemoryBankFile> getFile(MemoryBankFileType type);
    
    /**
     * All loaded files in type order.
     */
    List<MemoryBankFile> getAllFiles();
    
    /**
     * Content of all loaded files keyed by relative path.
     */
    Map<String, String> getFilesWithFilenames();
    
    /**
     * Replaces a file's content; the next {@link #getFile} sees exactly this content.
     */
    OperationResult<MemoryBankFile> updateFile(MemoryBankFileType type, String content);
    
    /**
     * Replaces a file given by type id or relative path.
     */
    OperationResult<MemoryBankFile> updateFile(String typeIdOrPath, String content);
    
    /**
     * Writes an arbitrary file below the root.
     */
    OperationResult<Void> writeFileByPath(String relativePath, String content);
    
    /**
     * Validates a loaded file's front-matter against its type's schema.
     *
     * @return VALID or UNKNOWN; INVALID is reported as a {@link ValidationException}
     */
    OperationResult<ValidationStatus> validateFile(MemoryBankFileType type);
    
    // ==================== Cache ====================
    
    OperationResult<Void> invalidateCache();
    
    /**
     * Invalidates the cache entry of one root-relative path.
     */
    OperationResult<Void> invalidateCache(String relativePath);
    
    OperationResult<CacheStats> getCacheStats();
    
    OperationResult<Void> resetCacheStats();
    
    // ==================== Metadata ====================
    
    OperationResult<SearchResult> searchMetadata(MetadataFilter filter);
    
    OperationResult<IndexStats> getIndexStats();
    
    /**
     * Re-indexes every markdown file under the root, replacing the index atomically.
     */
    OperationResult<IndexRebuildResult> rebuildIndex();
}
