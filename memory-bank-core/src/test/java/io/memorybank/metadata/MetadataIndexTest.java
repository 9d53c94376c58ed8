package io.memorybank.metadata;

import io.memorybank.MutableClock;
import io.memorybank.parser.FrontmatterParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MetadataIndex - front-matter extraction, filtering, views and persistence.
 */
class MetadataIndexTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private MetadataIndex index;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        index = new MetadataIndex(new FrontmatterParser(), SchemaRegistry.defaults(), clock);
    }

    // ==================== Entry Construction ====================

    @Test
    void testEntryBuiltFromFrontmatter() {
        MetadataIndexEntry entry = index.upsert("systemPatterns/architecture.md", doc(
            "id: 0f8fad5b-d9cb-469f-a165-70867728950e\n"
                + "type: systemPattern\n"
                + "title: Layered Architecture\n"
                + "pattern: layers\n"
                + "tags: [arch, core]\n"
                + "created: 2024-01-01T00:00:00Z\n",
            "# Architecture\nline two\n"));

        assertEquals("0f8fad5b-d9cb-469f-a165-70867728950e", entry.id());
        assertEquals("systemPattern", entry.type());
        assertEquals("Layered Architecture", entry.title());
        assertEquals(List.of("arch", "core"), List.copyOf(entry.tags()));
        assertEquals(ValidationStatus.VALID, entry.validationStatus());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), entry.created());
        assertEquals(START, entry.updated());
        assertTrue(entry.sizeBytes() > 0);
    }

    @Test
    void testMissingHeaderProducesMinimalEntry() {
        MetadataIndexEntry entry = index.upsert("notes/plain.md", "# Plain\n\nNo header here\n");

        assertEquals("unknown", entry.type());
        assertTrue(entry.tags().isEmpty());
        assertEquals(ValidationStatus.UNKNOWN, entry.validationStatus());
        assertEquals("notes/plain.md", entry.id());
        assertEquals("plain", entry.title());
        assertEquals(3, entry.lineCount());
    }

    @Test
    void testMalformedHeaderDoesNotFailIndexing() {
        MetadataIndexEntry entry = index.upsert("broken.md", "---\ntags: [oops\n---\nbody\n");

        assertEquals("unknown", entry.type());
        assertEquals(ValidationStatus.UNKNOWN, entry.validationStatus());
        assertFalse(entry.validationErrors().isEmpty());
    }

    @Test
    void testSchemaViolationMarksEntryInvalid() {
        MetadataIndexEntry entry = index.upsert("core/projectBrief.md",
            doc("type: projectBrief\ntitle: Brief\ndescription: short\nstatus: unknown-status\n", "body"));

        assertEquals(ValidationStatus.INVALID, entry.validationStatus());
        assertTrue(entry.validationErrors().stream().anyMatch(e -> e.startsWith("description")));
        assertTrue(entry.validationErrors().stream().anyMatch(e -> e.startsWith("status")));
    }

    @Test
    void testUpdatedIsMonotonicAcrossUpserts() {
        index.upsert("a.md", doc("updated: 2030-01-01T00:00:00Z\n", "v1"));

        clock.advance(Duration.ofHours(1));
        MetadataIndexEntry second = index.upsert("a.md", doc("updated: 2020-01-01T00:00:00Z\n", "v2"));

        assertEquals(Instant.parse("2030-01-01T00:00:00Z"), second.updated());
    }

    @Test
    void testCreatedKeptFromPreviousEntry() {
        index.upsert("a.md", "v1");

        clock.advance(Duration.ofHours(1));
        MetadataIndexEntry second = index.upsert("a.md", "v2");

        assertEquals(START, second.created());
        assertEquals(START.plus(Duration.ofHours(1)), second.updated());
    }

    @Test
    void testRemovedEntryStartsFresh() {
        index.upsert("a.md", doc("updated: 2030-01-01T00:00:00Z\n", "v1"));
        assertTrue(index.remove("a.md"));

        MetadataIndexEntry recreated = index.upsert("a.md", "v2");

        assertEquals(START, recreated.updated());
        assertFalse(index.remove("missing.md"));
    }

    @Test
    void testFileTimeUsedWhenHeaderHasNoTimestamps() {
        Instant modified = Instant.parse("2020-03-01T08:00:00Z");

        MetadataIndexEntry entry = index.upsert("notes/plain.md", "no header", modified);

        assertEquals(modified, entry.created());
        assertEquals(modified, entry.updated());
        assertEquals(START, entry.lastIndexed());
    }

    @Test
    void testUnchangedFileTimeDoesNotBumpUpdated() {
        Instant modified = Instant.parse("2020-03-01T08:00:00Z");
        index.upsert("notes/plain.md", "no header", modified);

        clock.advance(Duration.ofDays(1));
        MetadataIndexEntry again = index.upsert("notes/plain.md", "no header", modified);

        assertEquals(modified, again.updated());
        assertEquals(START.plus(Duration.ofDays(1)), again.lastIndexed());
    }

    @Test
    void testRebuildOrdersByFileTime() {
        Instant older = Instant.parse("2020-01-01T00:00:00Z");
        Instant newer = Instant.parse("2021-01-01T00:00:00Z");

        index.rebuildAll(
            Map.of("notes/a.md", "first", "notes/z.md", "second"),
            Map.of("notes/a.md", older, "notes/z.md", newer));

        assertEquals(older, index.get("notes/a.md").orElseThrow().updated());
        assertEquals(List.of("notes/z.md", "notes/a.md"), paths(index.recentlyUpdated(2)));
    }

    // ==================== Queries ====================

    @Test
    void testTagQueryRequiresAllTags() {
        index.upsert("arch.md", doc("tags: [arch, core]\n", "a"));
        index.upsert("core.md", doc("tags: [core]\n", "c"));

        List<MetadataIndexEntry> result = index.query(MetadataFilter.byTags("arch"));

        assertEquals(1, result.size());
        assertEquals("arch.md", result.get(0).relativePath());
        assertEquals(2, index.query(MetadataFilter.byTags("CORE")).size());
        assertEquals(1, index.query(MetadataFilter.byTags("arch", "core")).size());
    }

    @Test
    void testTypeAndStatusFilters() {
        index.upsert("p.md", doc("type: progress\nstatus: in-progress\n", "p"));
        index.upsert("bad.md", doc("type: progress\nstatus: sideways\n", "b"));
        index.upsert("n.md", doc("type: note\n", "n"));

        assertEquals(2, index.query(MetadataFilter.builder().type("progress").build()).size());
        List<MetadataIndexEntry> invalid = index.query(MetadataFilter.builder()
            .validationStatus(ValidationStatus.INVALID).build());
        assertEquals(List.of("bad.md"), paths(invalid));
        assertEquals(List.of("n.md"), paths(index.query(MetadataFilter.builder()
            .validationStatus(ValidationStatus.UNKNOWN).build())));
    }

    @Test
    void testTextSearchRanksPhraseMatchesFirst() {
        index.upsert("a.md", doc("title: Caching notes\ndescription: about the lru cache strategy\n", "a"));
        index.upsert("b.md", doc("title: LRU cache strategy\n", "b"));
        index.upsert("c.md", doc("title: Unrelated\n", "c"));

        SearchResult result = index.search(MetadataFilter.builder().text("lru cache").build());

        assertEquals(2, result.total());
        assertEquals("b.md", result.entries().get(0).relativePath());
    }

    @Test
    void testPagingReportsTotalAndHasMore() {
        for (int i = 0; i < 5; i++) {
            index.upsert("n" + i + ".md", "note " + i);
            clock.advance(Duration.ofMinutes(1));
        }

        SearchResult page = index.search(MetadataFilter.builder()
            .sortBy(SortField.UPDATED).sortOrder(SortOrder.ASC).offset(1).limit(2).build());

        assertEquals(5, page.total());
        assertTrue(page.hasMore());
        assertEquals(List.of("n1.md", "n2.md"), paths(page.entries()));

        SearchResult last = index.search(MetadataFilter.builder()
            .sortBy(SortField.UPDATED).sortOrder(SortOrder.ASC).offset(4).limit(2).build());
        assertFalse(last.hasMore());
        assertEquals(1, last.entries().size());
    }

    @Test
    void testDerivedViews() {
        index.upsert("small.md", "x");
        clock.advance(Duration.ofMinutes(1));
        index.upsert("large.md", "x".repeat(500));
        clock.advance(Duration.ofMinutes(1));
        index.upsert("medium.md", "x".repeat(50));

        assertEquals(List.of("medium.md", "large.md"), paths(index.recentlyUpdated(2)));
        assertEquals(List.of("large.md", "medium.md", "small.md"), paths(index.largest(10)));
    }

    @Test
    void testStats() {
        index.upsert("a.md", doc("type: progress\ntags: [arch]\n", "a"));
        index.upsert("b.md", doc("type: progress\ntags: [arch, core]\n", "b"));
        index.upsert("c.md", "plain");

        IndexStats stats = index.getStats();

        assertEquals(3, stats.totalEntries());
        assertEquals(2, stats.byType().get("progress"));
        assertEquals(1, stats.byType().get("unknown"));
        assertEquals(2, stats.byTag().get("arch"));
        assertEquals(2, stats.byValidationStatus().get(ValidationStatus.VALID));
        assertEquals(Map.of("arch", 2, "core", 1), stats.byTag());
    }

    // ==================== Rebuild & Persistence ====================

    @Test
    void testRebuildReplacesIndex() {
        index.upsert("stale.md", "gone soon");
        index.upsert("kept.md", doc("updated: 2030-01-01T00:00:00Z\n", "v1"));

        int count = index.rebuildAll(Map.of("kept.md", "v2", "new.md", "fresh"));

        assertEquals(2, count);
        assertTrue(index.get("stale.md").isEmpty());
        assertEquals(Instant.parse("2030-01-01T00:00:00Z"), index.get("kept.md").orElseThrow().updated());
        assertEquals(START, index.getStats().lastBuilt());
    }

    @Test
    void testJsonRoundTripPreservesEntries() throws IOException {
        index.upsert("a.md", doc("type: progress\ntags: [arch]\n", "a"));
        index.upsert("b.md", "plain");

        MetadataIndex restored = new MetadataIndex(new FrontmatterParser(), SchemaRegistry.defaults(), clock);
        int loaded = restored.loadJson(index.toJson());

        assertEquals(2, loaded);
        assertEquals(index.entries(), restored.entries());
    }

    @Test
    void testUnknownFormatVersionRejected() {
        UnsupportedIndexFormatException e = assertThrows(UnsupportedIndexFormatException.class,
            () -> index.loadJson("{\"formatVersion\": 99, \"entries\": []}"));

        assertEquals(99, e.getVersion());
    }

    @Test
    void testMalformedJsonRejected() {
        assertThrows(IOException.class, () -> index.loadJson("{not json"));
    }

    private static String doc(String header, String body) {
        return "---\n" + header + "---\n" + body;
    }

    private static List<String> paths(List<MetadataIndexEntry> entries) {
        return entries.stream().map(MetadataIndexEntry::relativePath).collect(Collectors.toList());
    }
}
