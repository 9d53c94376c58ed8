package io.memorybank;

import io.memorybank.cache.CacheEntry;
import io.memorybank.cache.CacheManager;
import io.memorybank.cache.CacheStats;
import io.memorybank.fs.FileStat;
import io.memorybank.fs.PathValidator;
import io.memorybank.fs.RetryingFileOperations;
import io.memorybank.metadata.IndexRebuildResult;
import io.memorybank.metadata.IndexStats;
import io.memorybank.metadata.MetadataFilter;
import io.memorybank.metadata.MetadataIndex;
import io.memorybank.metadata.MetadataIndexEntry;
import io.memorybank.metadata.SchemaRegistry;
import io.memorybank.metadata.SearchResult;
import io.memorybank.metadata.UnsupportedIndexFormatException;
import io.memorybank.metadata.ValidationStatus;
import io.memorybank.parser.Frontmatter;
import io.memorybank.parser.FrontmatterParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Default {@link MemoryBank} implementation.
 *
 * <p>Reads go through the {@link CacheManager}, so edits made outside the
 * engine are picked up on the next access. Writes are atomic on disk and are
 * reflected in the cache and the metadata index before the call returns.</p>
 *
 * <p>Operations on the same path are serialized by a striped lock keyed by the
 * absolute path; different paths proceed concurrently. No threads are created.</p>
 */
public class MemoryBankCore implements MemoryBank {
    
    private static final Logger log = LoggerFactory.getLogger(MemoryBankCore.class);
    
    private static final int LOCK_STRIPES = 32;
    private static final String MARKDOWN_EXTENSION = ".md";
    
    private final MemoryBankConfig config;
    private final PathValidator paths;
    private final RetryingFileOperations fileOps;
    private final CacheManager cache;
    private final MetadataIndex index;
    private final FrontmatterParser parser;
    private final TemplateProvider templates;
    private final Clock clock;
    
    // Loaded files, indexed by MemoryBankFileType ordinal
    private final AtomicReferenceArray<MemoryBankFile> files;
    private final ReentrantLock[] stripes;
    private final ReentrantLock indexFileLock = new ReentrantLock();
    
    public MemoryBankCore(MemoryBankConfig config) {
        this(config, new RetryingFileOperations(config.retryPolicy()), new DefaultTemplateProvider(),
            SchemaRegistry.defaults(), Clock.systemUTC());
    }
    
    public MemoryBankCore(MemoryBankConfig config,
                          RetryingFileOperations fileOps,
                          TemplateProvider templates,
                          SchemaRegistry schemas,
                          Clock clock) {
        this.config = config;
        this.paths = new PathValidator(config.root());
        this.fileOps = fileOps;
        this.cache = new CacheManager(fileOps, config.cacheMaxSize(), config.cacheMaxAge(), clock);
        this.parser = new FrontmatterParser();
        this.index = new MetadataIndex(parser, schemas, clock);
        this.templates = templates;
        this.clock = clock;
        this.files = new AtomicReferenceArray<>(MemoryBankFileType.values().length);
        this.stripes = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }
    
    // ==================== Lifecycle ====================
    
    @Override
    public OperationResult<Void> init() {
        return guard("init", () -> {
            initializeFolders().orElseThrow();
            if (config.persistIndex()) {
                loadPersistedIndex();
            }
            log.info("Memory bank initialized at {}", paths.getRoot());
            return null;
        });
    }
    
    @Override
    public OperationResult<Void> initializeFolders() {
        return guard("initializeFolders", () -> {
            fileOps.mkdir(paths.getRoot()).orElseThrow();
            Set<String> directories = new LinkedHashSet<>();
            for (MemoryBankFileType type : MemoryBankFileType.values()) {
                directories.add(type.directory());
            }
            for (String directory : directories) {
                Path dir = paths.resolveRelative(directory).orElseThrow();
                fileOps.mkdir(dir).orElseThrow();
            }
            log.debug("Ensured {} memory bank folders under {}", directories.size(), paths.getRoot());
            return null;
        });
    }
    
    @Override
    public OperationResult<List<MemoryBankFileType>> loadFiles() {
        return guard("loadFiles", () -> {
            List<MemoryBankFileType> created = new ArrayList<>();
            for (MemoryBankFileType type : MemoryBankFileType.values()) {
                Path path = paths.resolve(type).orElseThrow();
                boolean wasCreated = withLock(path, () -> loadOne(type, path));
                if (wasCreated) {
                    created.add(type);
                }
            }
            persistIndex();
            if (created.isEmpty()) {
                log.debug("All {} memory bank files present", MemoryBankFileType.values().length);
            } else {
                log.info("Created {} missing memory bank files from templates: {}", created.size(), created);
            }
            return List.copyOf(created);
        });
    }
    
    @Override
    public OperationResult<String> checkHealth() {
        return guard("checkHealth", () -> {
            List<String> issues = new ArrayList<>();
            Path root = paths.getRoot();
            
            OperationResult<FileStat> rootStat = fileOps.stat(root);
            boolean rootOk = false;
            if (rootStat.isFailure()) {
                issues.add(String.format("Root directory %s is not accessible: %s",
                    root, rootStat.error().getCode()));
            } else if (!rootStat.value().directory()) {
                issues.add(String.format("Root %s is not a directory", root));
            } else {
                rootOk = true;
            }
            
            Set<String> checkedDirectories = new LinkedHashSet<>();
            for (MemoryBankFileType type : MemoryBankFileType.values()) {
                if (rootOk && checkedDirectories.add(type.directory())) {
                    checkDirectory(type.directory(), issues);
                }
                checkFile(type, issues);
            }
            
            HealthReport report = HealthReport.of(issues, MemoryBankFileType.values().length);
            if (!report.healthy()) {
                throw new HealthCheckException(report);
            }
            return report.summary();
        });
    }
    
    @Override
    public void close() {
        for (int i = 0; i < files.length(); i++) {
            files.set(i, null);
        }
        cache.invalidate();
        index.clear();
        log.info("Memory bank at {} closed", paths.getRoot());
    }
    
    // ==================== Files ====================
    
    @Override
    public Optional<MemoryBankFile> getFile(MemoryBankFileType type) {
        if (type == null || files.get(type.ordinal()) == null) {
            return Optional.empty();
        }
        try {
            Path path = paths.resolve(type).orElseThrow();
            return withLock(path, () -> refresh(type, path));
        } catch (RuntimeException e) {
            log.warn("Serving last known state of {} after refresh failure: {}", type.id(), e.getMessage());
            return Optional.ofNullable(files.get(type.ordinal()));
        }
    }
    
    @Override
    public List<MemoryBankFile> getAllFiles() {
        List<MemoryBankFile> loaded = new ArrayList<>();
        for (MemoryBankFileType type : MemoryBankFileType.values()) {
            getFile(type).ifPresent(loaded::add);
        }
        return loaded;
    }
    
    @Override
    public Map<String, String> getFilesWithFilenames() {
        Map<String, String> byPath = new LinkedHashMap<>();
        for (MemoryBankFile file : getAllFiles()) {
            byPath.put(file.relativePath(), file.content());
        }
        return byPath;
    }
    
    @Override
    public OperationResult<MemoryBankFile> updateFile(MemoryBankFileType type, String content) {
        return guard("updateFile", () -> {
            requireContent(content);
            Path path = paths.resolve(type).orElseThrow();
            MemoryBankFile updated = withLock(path, () -> {
                long mtimeMs = writeThrough(path, content);
                return store(type, type.relativePath(), content, mtimeMs);
            });
            persistIndex();
            log.debug("Updated {}", type.relativePath());
            return updated;
        });
    }
    
    @Override
    public OperationResult<MemoryBankFile> updateFile(String typeIdOrPath, String content) {
        return paths.resolveType(typeIdOrPath)
            .flatMap(path -> updateFile(MemoryBankFileType.lookup(typeIdOrPath).orElseThrow(), content));
    }
    
    @Override
    public OperationResult<Void> writeFileByPath(String relativePath, String content) {
        return guard("writeFileByPath", () -> {
            requireContent(content);
            Path path = paths.resolveRelative(relativePath).orElseThrow();
            String key = paths.relativize(path);
            MemoryBankFileType type = MemoryBankFileType.fromRelativePath(key).orElse(null);
            withLock(path, () -> {
                long mtimeMs = writeThrough(path, content);
                return store(type, key, content, mtimeMs);
            });
            persistIndex();
            log.debug("Wrote {}", key);
            return null;
        });
    }
    
    @Override
    public OperationResult<ValidationStatus> validateFile(MemoryBankFileType type) {
        return guard("validateFile", () -> {
            MemoryBankFile file = getFile(type).orElseThrow(() -> new MemoryBankException(
                ErrorKind.NOT_FOUND, String.format("%s is not loaded", type.id())));
            if (file.validationStatus() == ValidationStatus.INVALID) {
                throw new ValidationException(file.relativePath(), file.validationErrors());
            }
            return file.validationStatus();
        });
    }
    
    // ==================== Cache ====================
    
    @Override
    public OperationResult<Void> invalidateCache() {
        return guard("invalidateCache", () -> {
            cache.invalidate();
            return null;
        });
    }
    
    @Override
    public OperationResult<Void> invalidateCache(String relativePath) {
        return guard("invalidateCache", () -> {
            cache.invalidate(paths.resolveRelative(relativePath).orElseThrow());
            return null;
        });
    }
    
    @Override
    public OperationResult<CacheStats> getCacheStats() {
        return guard("getCacheStats", cache::getStats);
    }
    
    @Override
    public OperationResult<Void> resetCacheStats() {
        return guard("resetCacheStats", () -> {
            cache.resetStats();
            return null;
        });
    }
    
    // ==================== Metadata ====================
    
    @Override
    public OperationResult<SearchResult> searchMetadata(MetadataFilter filter) {
        return guard("searchMetadata", () -> index.search(filter));
    }
    
    @Override
    public OperationResult<IndexStats> getIndexStats() {
        return guard("getIndexStats", index::getStats);
    }
    
    @Override
    public OperationResult<IndexRebuildResult> rebuildIndex() {
        return guard("rebuildIndex", () -> {
            Instant started = clock.instant();
            List<Path> found = fileOps.walk(paths.getRoot()).orElseThrow();
            
            Map<String, String> documents = new TreeMap<>();
            Map<String, Instant> modified = new HashMap<>();
            Map<String, String> errors = new TreeMap<>();
            int processed = 0;
            for (Path path : found) {
                String key = paths.relativize(path);
                if (!key.endsWith(MARKDOWN_EXTENSION) || isHidden(key)) {
                    continue;
                }
                processed++;
                OperationResult<String> read = withLock(path, () -> fileOps.read(path));
                if (read.isSuccess()) {
                    documents.put(key, read.value());
                    fileOps.stat(path).toOptional()
                        .ifPresent(stat -> modified.put(key, Instant.ofEpochMilli(stat.mtimeMs())));
                } else {
                    errors.put(key, read.error().getMessage());
                    log.warn("Skipping {} during reindex: {}", key, read.error().getMessage());
                }
            }
            
            int indexed = index.rebuildAll(documents, modified);
            persistIndex();
            Duration took = Duration.between(started, clock.instant());
            log.info("Reindexed {} of {} markdown files in {} ms", indexed, processed, took.toMillis());
            return new IndexRebuildResult(processed, indexed, errors, took);
        });
    }
    
    // ==================== Accessors ====================
    
    public MemoryBankConfig getConfig() {
        return config;
    }
    
    public PathValidator getPathValidator() {
        return paths;
    }
    
    public MetadataIndex getMetadataIndex() {
        return index;
    }
    
    // ==================== Internal ====================
    
    /**
     * Loads one known file, creating it from its template when missing.
     *
     * @return true if the file had to be created
     */
    private boolean loadOne(MemoryBankFileType type, Path path) {
        OperationResult<String> read = cache.get(path);
        if (read.hasErrorKind(ErrorKind.NOT_FOUND)) {
            String content = renderTemplate(type);
            long mtimeMs = writeThrough(path, content);
            store(type, type.relativePath(), content, mtimeMs);
            log.info("Created missing {} from template", type.relativePath());
            return true;
        }
        String content = read.orElseThrow();
        store(type, type.relativePath(), content, cachedMtime(path));
        return false;
    }
    
    private Optional<MemoryBankFile> refresh(MemoryBankFileType type, Path path) {
        MemoryBankFile current = files.get(type.ordinal());
        if (current == null) {
            return Optional.empty();
        }
        OperationResult<String> read = cache.get(path);
        if (read.hasErrorKind(ErrorKind.NOT_FOUND)) {
            files.set(type.ordinal(), null);
            index.remove(type.relativePath());
            persistIndex();
            log.warn("{} disappeared from disk; dropped it until the next load", type.relativePath());
            return Optional.empty();
        }
        if (read.isFailure()) {
            log.warn("Could not refresh {}: {}", type.relativePath(), read.error().getMessage());
            return Optional.of(current);
        }
        long mtimeMs = cachedMtime(path);
        if (read.value().equals(current.content()) && current.lastUpdated().toEpochMilli() == mtimeMs) {
            return Optional.of(current);
        }
        log.debug("{} changed on disk, refreshing", type.relativePath());
        MemoryBankFile refreshed = store(type, type.relativePath(), read.value(), mtimeMs);
        persistIndex();
        return Optional.of(refreshed);
    }
    
    /**
     * Writes content atomically and records it in the cache.
     *
     * @return The file's modification time after the write
     */
    private long writeThrough(Path path, String content) {
        Path parent = path.getParent();
        if (parent != null) {
            fileOps.mkdir(parent).orElseThrow();
        }
        fileOps.write(path, content).orElseThrow();
        long mtimeMs = fileOps.stat(path).orElseThrow().mtimeMs();
        cache.put(path, content, mtimeMs).orElseThrow();
        
        String cached = cache.peek(path).map(CacheEntry::content).orElse(null);
        if (!content.equals(cached)) {
            throw MemoryBankException.cacheInconsistency(String.format(
                "Cache does not hold the content just written to %s", paths.relativize(path)));
        }
        return mtimeMs;
    }
    
    /**
     * Indexes content and, for known types, replaces the in-memory file.
     */
    private MemoryBankFile store(MemoryBankFileType type, String relativePath, String content, long mtimeMs) {
        MetadataIndexEntry entry = index.upsert(relativePath, content, Instant.ofEpochMilli(mtimeMs));
        if (type == null) {
            return null;
        }
        Frontmatter frontmatter = parser.parse(content);
        MemoryBankFile file = new MemoryBankFile(
            type,
            relativePath,
            content,
            Instant.ofEpochMilli(mtimeMs),
            frontmatter.metadata(),
            frontmatter.body(),
            entry.validationStatus(),
            entry.validationErrors()
        );
        files.set(type.ordinal(), file);
        return file;
    }
    
    private long cachedMtime(Path path) {
        return cache.peek(path)
            .map(CacheEntry::mtimeMs)
            .orElseGet(() -> fileOps.stat(path).orElseThrow().mtimeMs());
    }
    
    private String renderTemplate(MemoryBankFileType type) {
        String now = clock.instant().toString();
        Map<String, Object> frontmatter = new LinkedHashMap<>();
        frontmatter.put("id", "urn:uuid:" + UUID.randomUUID());
        frontmatter.put("title", "Title for " + type.id());
        frontmatter.put("description", "Description for " + type.id());
        frontmatter.put("type", type.id());
        frontmatter.put("tags", List.of("autogenerated"));
        frontmatter.put("created", now);
        frontmatter.put("updated", now);
        return parser.render(frontmatter, templates.templateFor(type));
    }
    
    private void checkDirectory(String directory, List<String> issues) {
        Path dir = paths.resolveRelative(directory).orElseThrow();
        OperationResult<FileStat> stat = fileOps.stat(dir);
        if (stat.isFailure()) {
            issues.add(String.format("Directory %s is missing or inaccessible (%s)", directory, stat.error().getCode()));
        } else if (!stat.value().directory()) {
            issues.add(String.format("%s is not a directory", directory));
        }
    }
    
    private void checkFile(MemoryBankFileType type, List<String> issues) {
        Path path = paths.resolve(type).orElseThrow();
        OperationResult<FileStat> stat = fileOps.stat(path);
        if (stat.isFailure()) {
            issues.add(String.format("%s (%s) is missing or inaccessible (%s)",
                type.relativePath(), type.id(), stat.error().getCode()));
            return;
        }
        if (!stat.value().regularFile()) {
            issues.add(String.format("%s (%s) is not a regular file", type.relativePath(), type.id()));
            return;
        }
        OperationResult<String> read = fileOps.read(path);
        if (read.isFailure()) {
            issues.add(String.format("%s (%s) is not readable (%s)",
                type.relativePath(), type.id(), read.error().getCode()));
        }
    }
    
    private void loadPersistedIndex() {
        Path indexPath = paths.resolveRelative(config.indexFile()).orElseThrow();
        OperationResult<String> read = fileOps.read(indexPath);
        if (read.hasErrorKind(ErrorKind.NOT_FOUND)) {
            log.debug("No persisted metadata index at {}", indexPath);
            return;
        }
        if (read.isFailure()) {
            log.warn("Could not read metadata index {}: {}", indexPath, read.error().getMessage());
            return;
        }
        try {
            index.loadJson(read.value());
        } catch (IOException | UnsupportedIndexFormatException e) {
            log.warn("Ignoring unusable metadata index {}: {}", indexPath, e.getMessage());
        }
    }
    
    private void persistIndex() {
        if (!config.persistIndex()) {
            return;
        }
        indexFileLock.lock();
        try {
            Path indexPath = paths.resolveRelative(config.indexFile()).orElseThrow();
            String json = index.toJson();
            Path parent = indexPath.getParent();
            if (parent != null) {
                fileOps.mkdir(parent).orElseThrow();
            }
            fileOps.write(indexPath, json).orElseThrow();
        } catch (IOException | MemoryBankException e) {
            log.warn("Failed to persist metadata index: {}", e.getMessage());
        } finally {
            indexFileLock.unlock();
        }
    }
    
    private <T> T withLock(Path path, Supplier<T> action) {
        ReentrantLock lock = stripes[Math.floorMod(path.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
    
    private <T> OperationResult<T> guard(String operation, Supplier<T> action) {
        try {
            return OperationResult.success(action.get());
        } catch (MemoryBankException e) {
            if (e.getKind() == ErrorKind.CACHE_INCONSISTENCY) {
                log.error("{} aborted: {}", operation, e.getMessage(), e);
            } else {
                log.debug("{} failed: {}", operation, e.getMessage());
            }
            return OperationResult.failure(e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure in {}", operation, e);
            return OperationResult.failure(new MemoryBankException(
                ErrorKind.INTERNAL, ErrorKind.INTERNAL.name(), operation + " failed: " + e.getMessage(), e));
        }
    }
    
    private static void requireContent(String content) {
        if (content == null) {
            throw new MemoryBankException(ErrorKind.VALIDATION_FAILED, "content cannot be null");
        }
    }
    
    private static boolean isHidden(String relativePath) {
        for (String segment : relativePath.split("/")) {
            if (segment.startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
