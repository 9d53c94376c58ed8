package io.memorybank;

import io.memorybank.cache.CacheStats;
import io.memorybank.metadata.IndexRebuildResult;
import io.memorybank.metadata.MetadataFilter;
import io.memorybank.metadata.MetadataIndexEntry;
import io.memorybank.metadata.SearchResult;
import io.memorybank.metadata.ValidationStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MemoryBankCore - repair-on-read, round trips, health checks and reindexing.
 */
class MemoryBankCoreTest {

    @TempDir
    Path root;

    private MemoryBankCore bank;

    @BeforeEach
    void setUp() {
        bank = new MemoryBankCore(MemoryBankConfig.defaultConfig(root));
        assertTrue(bank.init().isSuccess());
    }

    @AfterEach
    void tearDown() {
        bank.close();
    }

    // ==================== Loading ====================

    @Test
    void testLoadFilesCreatesEveryMissingFile() {
        List<MemoryBankFileType> created = bank.loadFiles().value();

        assertEquals(List.of(MemoryBankFileType.values()), created);
        for (MemoryBankFileType type : MemoryBankFileType.values()) {
            assertTrue(Files.isRegularFile(root.resolve(type.relativePath())), type.id());
        }
    }

    @Test
    void testSecondLoadCreatesNothing() {
        bank.loadFiles();

        assertEquals(List.of(), bank.loadFiles().value());
    }

    @Test
    void testLoadKeepsExistingContent() throws IOException {
        Path brief = root.resolve("core/projectBrief.md");
        Files.writeString(brief, "# Existing brief\n");

        List<MemoryBankFileType> created = bank.loadFiles().value();

        assertFalse(created.contains(MemoryBankFileType.PROJECT_BRIEF));
        assertEquals(13, created.size());
        assertEquals("# Existing brief\n", bank.getFile(MemoryBankFileType.PROJECT_BRIEF).orElseThrow().content());
    }

    @Test
    void testCreatedFilesCarryGeneratedFrontmatter() {
        bank.loadFiles();

        MemoryBankFile file = bank.getFile(MemoryBankFileType.PROGRESS_CURRENT).orElseThrow();

        assertEquals("progressCurrent", file.metadata().get("type"));
        assertEquals("Title for progressCurrent", file.metadata().get("title"));
        assertEquals(List.of("autogenerated"), file.metadata().get("tags"));
        assertTrue(file.metadata().get("id").toString().startsWith("urn:uuid:"));
        assertTrue(file.body().startsWith("# Current Progress"));
    }

    @Test
    void testGetFileIsEmptyBeforeLoad() {
        assertTrue(bank.getFile(MemoryBankFileType.ACTIVE_CONTEXT).isEmpty());
        assertTrue(bank.getAllFiles().isEmpty());
    }

    // ==================== Updates ====================

    @Test
    void testUpdateThenGetReturnsExactContent() {
        bank.loadFiles();
        String content = "---\ntitle: Progress\n---\n# Current\r\n\n  trailing spaces  \n";

        assertTrue(bank.updateFile(MemoryBankFileType.PROGRESS_CURRENT, content).isSuccess());

        assertEquals(content, bank.getFile(MemoryBankFileType.PROGRESS_CURRENT).orElseThrow().content());
    }

    @Test
    void testUpdateByIdAndUnknownId() {
        bank.loadFiles();

        assertTrue(bank.updateFile("techContextStack", "Java 17").isSuccess());
        assertEquals("Java 17", bank.getFile(MemoryBankFileType.TECH_CONTEXT_STACK).orElseThrow().content());
        assertEquals(ErrorKind.UNKNOWN_FILE_TYPE, bank.updateFile("roadmap", "x").errorKind());
        assertEquals(ErrorKind.INVALID_PATH, bank.updateFile("../core/projectBrief.md", "x").errorKind());
    }

    @Test
    void testUpdateIsVisibleInIndex() {
        bank.loadFiles();

        bank.updateFile(MemoryBankFileType.SYSTEM_PATTERNS_ARCHITECTURE,
            "---\ntype: systemPattern\npattern: hexagonal\ntags: [arch, core]\n---\n# Architecture\n");

        SearchResult result = bank.searchMetadata(MetadataFilter.byTags("arch")).value();
        assertEquals(1, result.total());
        assertEquals("systemPatterns/architecture.md", result.entries().get(0).relativePath());
    }

    @Test
    void testExternalEditIsPickedUp() throws IOException {
        bank.loadFiles();
        Path file = root.resolve("core/activeContext.md");
        long before = Files.getLastModifiedTime(file).toMillis();

        Files.writeString(file, "edited elsewhere");
        Files.setLastModifiedTime(file, FileTime.fromMillis(before + 10_000));

        MemoryBankFile reloaded = bank.getFile(MemoryBankFileType.ACTIVE_CONTEXT).orElseThrow();
        assertEquals("edited elsewhere", reloaded.content());
        assertEquals(before + 10_000, reloaded.lastUpdated().toEpochMilli());
    }

    @Test
    void testGetFileWithNullTypeIsEmpty() {
        bank.loadFiles();

        assertTrue(bank.getFile(null).isEmpty());
    }

    @Test
    void testExternalEditReachesPersistedIndex() throws IOException {
        bank.loadFiles();
        Path file = root.resolve("core/activeContext.md");
        long before = Files.getLastModifiedTime(file).toMillis();
        Files.writeString(file, "---\ntags: [external]\n---\nedited elsewhere\n");
        Files.setLastModifiedTime(file, FileTime.fromMillis(before + 10_000));

        bank.getFile(MemoryBankFileType.ACTIVE_CONTEXT);

        MemoryBankCore reopened = new MemoryBankCore(MemoryBankConfig.defaultConfig(root));
        reopened.init();
        assertEquals(1, reopened.searchMetadata(MetadataFilter.byTags("external")).value().total());
        reopened.close();
    }

    @Test
    void testDeletedFileDisappearsAndIsRecreatedOnLoad() throws IOException {
        bank.loadFiles();
        Files.delete(root.resolve("progress/current.md"));

        assertTrue(bank.getFile(MemoryBankFileType.PROGRESS_CURRENT).isEmpty());
        assertEquals(List.of(MemoryBankFileType.PROGRESS_CURRENT), bank.loadFiles().value());
        assertTrue(bank.getFile(MemoryBankFileType.PROGRESS_CURRENT).isPresent());
    }

    @Test
    void testWriteFileByPath() {
        bank.loadFiles();

        assertTrue(bank.writeFileByPath("notes/ideas.md", "---\ntags: [idea]\n---\nsomething\n").isSuccess());

        assertTrue(Files.exists(root.resolve("notes/ideas.md")));
        assertEquals(1, bank.searchMetadata(MetadataFilter.byTags("idea")).value().total());
    }

    @Test
    void testWriteFileByPathToKnownTypeUpdatesLoadedFile() {
        bank.loadFiles();

        bank.writeFileByPath("progress/history.md", "history rewritten");

        assertEquals("history rewritten", bank.getFile(MemoryBankFileType.PROGRESS_HISTORY).orElseThrow().content());
    }

    @Test
    void testWriteFileByPathRejectsTraversal() {
        OperationResult<Void> result = bank.writeFileByPath("../outside.md", "x");

        assertEquals(ErrorKind.INVALID_PATH, result.errorKind());
        assertFalse(Files.exists(root.getParent().resolve("outside.md")));
        assertEquals(ErrorKind.INVALID_PATH, bank.writeFileByPath("/etc/motd", "x").errorKind());
    }

    @Test
    void testNullContentRejected() {
        bank.loadFiles();

        assertEquals(ErrorKind.VALIDATION_FAILED,
            bank.updateFile(MemoryBankFileType.PROJECT_BRIEF, (String) null).errorKind());
    }

    // ==================== Validation ====================

    @Test
    void testGeneratedProjectBriefIsValid() {
        bank.loadFiles();

        assertEquals(ValidationStatus.VALID, bank.validateFile(MemoryBankFileType.PROJECT_BRIEF).value());
        assertEquals(ValidationStatus.UNKNOWN, bank.validateFile(MemoryBankFileType.PROGRESS_INDEX).value());
    }

    @Test
    void testInvalidFrontmatterReportedButNotBlocking() {
        bank.loadFiles();
        String content = "---\ntype: projectBrief\ntitle: Brief\ndescription: short\n---\nbody\n";

        OperationResult<MemoryBankFile> update = bank.updateFile(MemoryBankFileType.PROJECT_BRIEF, content);
        OperationResult<ValidationStatus> validation = bank.validateFile(MemoryBankFileType.PROJECT_BRIEF);

        assertTrue(update.isSuccess());
        assertEquals(ValidationStatus.INVALID, update.value().validationStatus());
        assertEquals(ErrorKind.VALIDATION_FAILED, validation.errorKind());
        ValidationException error = assertInstanceOf(ValidationException.class, validation.error());
        assertEquals("core/projectBrief.md", error.getRelativePath());
        assertFalse(error.getErrors().isEmpty());
    }

    @Test
    void testValidateUnloadedFileIsNotFound() {
        assertEquals(ErrorKind.NOT_FOUND, bank.validateFile(MemoryBankFileType.PROJECT_BRIEF).errorKind());
    }

    // ==================== Health ====================

    @Test
    void testHealthyAfterLoad() {
        bank.loadFiles();

        OperationResult<String> health = bank.checkHealth();

        assertTrue(health.isSuccess());
        assertTrue(health.value().contains("healthy"));
    }

    @Test
    void testHealthReportsEveryMissingFileWithoutRepairing() throws IOException {
        bank.loadFiles();
        Files.delete(root.resolve("core/productContext.md"));
        Files.delete(root.resolve("techContext/environment.md"));

        OperationResult<String> health = bank.checkHealth();

        assertEquals(ErrorKind.HEALTH_CHECK_FAILED, health.errorKind());
        HealthCheckException error = assertInstanceOf(HealthCheckException.class, health.error());
        assertEquals(2, error.getIssues().size());
        assertTrue(error.getIssues().get(0).contains("core/productContext.md"));
        assertTrue(error.getIssues().get(1).contains("techContext/environment.md"));
        assertFalse(Files.exists(root.resolve("core/productContext.md")));
    }

    @Test
    void testHealthOnEmptyStoreListsAllFiles() {
        OperationResult<String> health = bank.checkHealth();

        HealthCheckException error = assertInstanceOf(HealthCheckException.class, health.error());
        assertEquals(MemoryBankFileType.values().length, error.getIssues().size());
        for (MemoryBankFileType type : MemoryBankFileType.values()) {
            assertTrue(error.getIssues().stream().anyMatch(issue -> issue.contains(type.relativePath())));
        }
    }

    // ==================== Cache ====================

    @Test
    void testInvalidateCacheForcesMiss() {
        bank.loadFiles();
        bank.getFile(MemoryBankFileType.PROJECT_BRIEF);
        bank.resetCacheStats();

        bank.invalidateCache("core/projectBrief.md");
        bank.getFile(MemoryBankFileType.PROJECT_BRIEF);

        CacheStats stats = bank.getCacheStats().value();
        assertEquals(1, stats.misses());
        assertEquals(0, stats.hits());
    }

    @Test
    void testRepeatedReadsAreHits() {
        bank.loadFiles();
        bank.resetCacheStats();

        bank.getFile(MemoryBankFileType.PROJECT_BRIEF);
        bank.getFile(MemoryBankFileType.PROJECT_BRIEF);

        CacheStats stats = bank.getCacheStats().value();
        assertEquals(2, stats.hits());
        assertEquals(1.0, stats.hitRate());
    }

    @Test
    void testSmallCacheStillServesAllFiles() {
        MemoryBankCore small = new MemoryBankCore(MemoryBankConfig.defaultConfig(root).withCacheMaxSize(2));
        small.init();
        small.loadFiles();

        assertEquals(MemoryBankFileType.values().length, small.getAllFiles().size());
        CacheStats stats = small.getCacheStats().value();
        assertEquals(2, stats.currentSize());
        assertTrue(stats.evictions() > 0);
        small.close();
    }

    @Test
    void testInvalidateCacheRejectsTraversal() {
        assertEquals(ErrorKind.INVALID_PATH, bank.invalidateCache("../x").errorKind());
        assertTrue(bank.invalidateCache().isSuccess());
    }

    // ==================== Index ====================

    @Test
    void testRebuildIndexDropsDeletedFilesAndSkipsHidden() throws IOException {
        bank.loadFiles();
        bank.writeFileByPath("notes/idea.md", "idea");
        Files.delete(root.resolve("notes/idea.md"));

        IndexRebuildResult result = bank.rebuildIndex().value();

        assertEquals(MemoryBankFileType.values().length, result.filesProcessed());
        assertEquals(MemoryBankFileType.values().length, result.filesIndexed());
        assertEquals(0, result.filesErrored());
        assertEquals(MemoryBankFileType.values().length, bank.getIndexStats().value().totalEntries());
    }

    @Test
    void testRebuildIndexUsesFileTimesForHeaderlessFiles() throws IOException {
        Files.createDirectories(root.resolve("notes"));
        Path a = Files.writeString(root.resolve("notes/a.md"), "# A\n");
        Path z = Files.writeString(root.resolve("notes/z.md"), "# Z\n");
        Instant older = Instant.parse("2020-01-01T00:00:00Z");
        Instant newer = Instant.parse("2021-01-01T00:00:00Z");
        Files.setLastModifiedTime(a, FileTime.from(older));
        Files.setLastModifiedTime(z, FileTime.from(newer));

        assertTrue(bank.rebuildIndex().isSuccess());

        List<MetadataIndexEntry> recent = bank.getMetadataIndex().recentlyUpdated(2);
        assertEquals("notes/z.md", recent.get(0).relativePath());
        assertEquals("notes/a.md", recent.get(1).relativePath());
        assertEquals(older, recent.get(1).updated());
    }

    @Test
    void testReloadDoesNotBumpUpdatedOfUnchangedFile() throws IOException {
        Path brief = Files.createDirectories(root.resolve("core")).resolve("projectBrief.md");
        Files.writeString(brief, "# Existing brief\n");
        Instant modified = Instant.parse("2022-06-01T12:00:00Z");
        Files.setLastModifiedTime(brief, FileTime.from(modified));

        bank.loadFiles();
        bank.loadFiles();

        MetadataIndexEntry entry = bank.getMetadataIndex().get("core/projectBrief.md").orElseThrow();
        assertEquals(modified, entry.updated());
    }

    @Test
    void testIndexPersistedAndReloadedOnInit() {
        bank.loadFiles();
        assertTrue(Files.exists(root.resolve(".index/metadata.json")));

        MemoryBankCore reopened = new MemoryBankCore(MemoryBankConfig.defaultConfig(root));
        reopened.init();

        assertEquals(MemoryBankFileType.values().length, reopened.getIndexStats().value().totalEntries());
        reopened.close();
    }

    @Test
    void testCorruptPersistedIndexIsIgnored() throws IOException {
        Files.createDirectories(root.resolve(".index"));
        Files.writeString(root.resolve(".index/metadata.json"), "{ broken");

        MemoryBankCore reopened = new MemoryBankCore(MemoryBankConfig.defaultConfig(root));

        assertTrue(reopened.init().isSuccess());
        assertEquals(0, reopened.getIndexStats().value().totalEntries());
        reopened.close();
    }

    @Test
    void testCloseClearsLoadedFiles() {
        bank.loadFiles();

        bank.close();

        assertTrue(bank.getFile(MemoryBankFileType.PROJECT_BRIEF).isEmpty());
        assertEquals(0, bank.getCacheStats().value().currentSize());
    }

    // ==================== Configuration ====================

    @Test
    void testConfigFromProperties() {
        Properties props = new Properties();
        props.setProperty("memorybank.cache.max-size", "7");
        props.setProperty("memorybank.cache.max-age", "PT0S");
        props.setProperty("memorybank.retry.max-attempts", "5");
        props.setProperty("memorybank.index.persist", "false");

        MemoryBankConfig config = MemoryBankConfig.fromProperties(root, props);

        assertEquals(7, config.cacheMaxSize());
        assertTrue(config.cacheMaxAge().isZero());
        assertEquals(5, config.retryPolicy().maxAttempts());
        assertFalse(config.persistIndex());
        assertEquals(".index/metadata.json", config.indexFile());
    }

    @Test
    void testInvalidConfigRejected() {
        Properties props = new Properties();
        props.setProperty("memorybank.cache.max-size", "lots");

        assertThrows(IllegalArgumentException.class, () -> MemoryBankConfig.fromProperties(root, props));
        assertThrows(IllegalArgumentException.class,
            () -> MemoryBankConfig.defaultConfig(root).withCacheMaxSize(0));
    }
}
