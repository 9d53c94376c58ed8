package io.memorybank.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.memorybank.parser.Frontmatter;
import io.memorybank.parser.FrontmatterParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Queryable metadata derived from the front-matter of indexed documents.
 *
 * <p>Readers always see a complete, immutable snapshot. Writers build a new
 * map under the instance monitor and publish it with a single volatile write,
 * so a query never observes a half-applied update or rebuild.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * MetadataIndex index = new MetadataIndex(new FrontmatterParser(), SchemaRegistry.defaults());
 * index.upsert("core/projectBrief.md", content);
 *
 * List<MetadataIndexEntry> arch = index.query(MetadataFilter.byTags("arch"));
 * List<MetadataIndexEntry> newest = index.recentlyUpdated(5);
 * }</pre>
 */
public class MetadataIndex {
    
    private static final Logger log = LoggerFactory.getLogger(MetadataIndex.class);
    
    static final int FORMAT_VERSION = 1;
    
    private final FrontmatterParser parser;
    private final SchemaRegistry schemas;
    private final Clock clock;
    private final ObjectMapper jsonMapper;
    
    private final Object lock = new Object();
    private volatile Map<String, MetadataIndexEntry> snapshot = Map.of();
    private volatile Instant lastBuilt;
    
    public MetadataIndex(FrontmatterParser parser, SchemaRegistry schemas) {
        this(parser, schemas, Clock.systemUTC());
    }
    
    public MetadataIndex(FrontmatterParser parser, SchemaRegistry schemas, Clock clock) {
        this.parser = parser;
        this.schemas = schemas;
        this.clock = clock;
        this.jsonMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }
    
    // ==================== Modification ====================
    
    /**
     * Indexes (or re-indexes) one document with no known modification time.
     */
    public MetadataIndexEntry upsert(String relativePath, String content) {
        return upsert(relativePath, content, null);
    }
    
    /**
     * Indexes (or re-indexes) one document.
     *
     * @param relativePath Root-relative path with '/' separators
     * @param content Full document text
     * @param modified File modification time, used when the header carries no
     *                 timestamps; null falls back to the index clock
     * @return The stored entry
     */
    public MetadataIndexEntry upsert(String relativePath, String content, Instant modified) {
        synchronized (lock) {
            Map<String, MetadataIndexEntry> current = snapshot;
            MetadataIndexEntry entry = buildEntry(relativePath, content, current.get(relativePath), modified, clock.instant());
            Map<String, MetadataIndexEntry> next = new HashMap<>(current);
            next.put(relativePath, entry);
            snapshot = Collections.unmodifiableMap(next);
            log.debug("Indexed {} (type={}, status={})", relativePath, entry.type(), entry.validationStatus());
            return entry;
        }
    }
    
    /**
     * Removes a document from the index.
     *
     * @return true if an entry was removed
     */
    public boolean remove(String relativePath) {
        synchronized (lock) {
            Map<String, MetadataIndexEntry> current = snapshot;
            if (!current.containsKey(relativePath)) {
                return false;
            }
            Map<String, MetadataIndexEntry> next = new HashMap<>(current);
            next.remove(relativePath);
            snapshot = Collections.unmodifiableMap(next);
            log.debug("Removed {} from index", relativePath);
            return true;
        }
    }
    
    public int rebuildAll(Map<String, String> pathsAndContents) {
        return rebuildAll(pathsAndContents, Map.of());
    }
    
    /**
     * Replaces the whole index with entries built from the given documents.
     *
     * <p>Paths absent from {@code pathsAndContents} are dropped. Paths that
     * remain keep their {@code created} and monotonic {@code updated} times.</p>
     *
     * @param pathsAndContents Document text by root-relative path
     * @param modifiedTimes File modification times by root-relative path; may be partial
     * @return Number of indexed entries
     */
    public int rebuildAll(Map<String, String> pathsAndContents, Map<String, Instant> modifiedTimes) {
        synchronized (lock) {
            Map<String, MetadataIndexEntry> previous = snapshot;
            Instant now = clock.instant();
            Map<String, MetadataIndexEntry> next = new HashMap<>();
            for (Map.Entry<String, String> doc : pathsAndContents.entrySet()) {
                String path = doc.getKey();
                next.put(path, buildEntry(path, doc.getValue(), previous.get(path), modifiedTimes.get(path), now));
            }
            snapshot = Collections.unmodifiableMap(next);
            lastBuilt = now;
            log.info("Rebuilt metadata index: {} entries ({} before)", next.size(), previous.size());
            return next.size();
        }
    }
    
    public void clear() {
        synchronized (lock) {
            snapshot = Map.of();
        }
    }
    
    // ==================== Queries ====================
    
    /**
     * Returns the page of matching entries selected by the filter.
     */
    public List<MetadataIndexEntry> query(MetadataFilter filter) {
        return search(filter).entries();
    }
    
    /**
     * Filters, sorts and pages the index.
     */
    public SearchResult search(MetadataFilter filter) {
        List<MetadataIndexEntry> matches = snapshot.values().stream()
            .filter(filter::matches)
            .collect(Collectors.toCollection(ArrayList::new));
        
        matches.sort(comparator(filter));
        
        int total = matches.size();
        int from = Math.min(filter.offset(), total);
        int to = (int) Math.min((long) from + filter.limit(), total);
        return new SearchResult(matches.subList(from, to), total, filter.offset(), filter.limit(), to < total);
    }
    
    /**
     * Most recently updated entries first.
     */
    public List<MetadataIndexEntry> recentlyUpdated(int limit) {
        return snapshot.values().stream()
            .sorted(Comparator.comparing(MetadataIndexEntry::updated).reversed()
                .thenComparing(MetadataIndexEntry::relativePath))
            .limit(limit)
            .collect(Collectors.toList());
    }
    
    /**
     * Largest entries first.
     */
    public List<MetadataIndexEntry> largest(int limit) {
        return snapshot.values().stream()
            .sorted(Comparator.comparingLong(MetadataIndexEntry::sizeBytes).reversed()
                .thenComparing(MetadataIndexEntry::relativePath))
            .limit(limit)
            .collect(Collectors.toList());
    }
    
    public Optional<MetadataIndexEntry> get(String relativePath) {
        return Optional.ofNullable(snapshot.get(relativePath));
    }
    
    /**
     * All entries ordered by path.
     */
    public List<MetadataIndexEntry> entries() {
        return snapshot.values().stream()
            .sorted(Comparator.comparing(MetadataIndexEntry::relativePath))
            .collect(Collectors.toList());
    }
    
    public int size() {
        return snapshot.size();
    }
    
    public SortedSet<String> allTags() {
        SortedSet<String> tags = new TreeSet<>();
        for (MetadataIndexEntry entry : snapshot.values()) {
            tags.addAll(entry.tags());
        }
        return tags;
    }
    
    public SortedSet<String> allTypes() {
        return snapshot.values().stream()
            .map(MetadataIndexEntry::type)
            .collect(Collectors.toCollection(TreeSet::new));
    }
    
    public IndexStats getStats() {
        Map<String, MetadataIndexEntry> current = snapshot;
        Map<ValidationStatus, Integer> byStatus = new EnumMap<>(ValidationStatus.class);
        for (ValidationStatus status : ValidationStatus.values()) {
            byStatus.put(status, 0);
        }
        Map<String, Integer> byType = new TreeMap<>();
        Map<String, Integer> byTag = new TreeMap<>();
        long totalBytes = 0;
        long totalLines = 0;
        for (MetadataIndexEntry entry : current.values()) {
            byStatus.merge(entry.validationStatus(), 1, Integer::sum);
            byType.merge(entry.type(), 1, Integer::sum);
            for (String tag : entry.tags()) {
                byTag.merge(tag, 1, Integer::sum);
            }
            totalBytes += entry.sizeBytes();
            totalLines += entry.lineCount();
        }
        return new IndexStats(current.size(), byStatus, byType, byTag, totalBytes, totalLines, lastBuilt);
    }
    
    // ==================== Persistence ====================
    
    /**
     * Serializes the current snapshot as versioned JSON.
     */
    public String toJson() throws IOException {
        IndexDocument document = new IndexDocument(FORMAT_VERSION, clock.instant(), lastBuilt, entries());
        return jsonMapper.writeValueAsString(document);
    }
    
    /**
     * Replaces the index with a snapshot produced by {@link #toJson()}.
     *
     * @return Number of loaded entries
     * @throws IOException if the JSON is malformed
     * @throws UnsupportedIndexFormatException if the format version is not supported
     */
    public int loadJson(String json) throws IOException {
        JsonNode root = jsonMapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("Metadata index JSON must be an object");
        }
        int version = root.path("formatVersion").asInt(-1);
        if (version != FORMAT_VERSION) {
            throw new UnsupportedIndexFormatException(version);
        }
        IndexDocument document = jsonMapper.treeToValue(root, IndexDocument.class);
        
        Map<String, MetadataIndexEntry> loaded = new HashMap<>();
        if (document.entries() != null) {
            for (MetadataIndexEntry entry : document.entries()) {
                loaded.put(entry.relativePath(), entry);
            }
        }
        synchronized (lock) {
            snapshot = Collections.unmodifiableMap(loaded);
            lastBuilt = document.lastBuilt();
        }
        log.info("Loaded {} metadata index entries", loaded.size());
        return loaded.size();
    }
    
    /**
     * On-disk shape of a persisted index.
     */
    public record IndexDocument(
        int formatVersion,
        Instant generatedAt,
        Instant lastBuilt,
        List<MetadataIndexEntry> entries
    ) {}
    
    // ==================== Entry Construction ====================
    
    private MetadataIndexEntry buildEntry(String relativePath, String content, MetadataIndexEntry previous,
                                          Instant modified, Instant now) {
        Frontmatter frontmatter = parser.parse(content);
        Map<String, Object> meta = frontmatter.metadata();
        
        String type = stringValue(meta.get("type"));
        if (type == null || type.isBlank()) {
            type = MetadataIndexEntry.UNKNOWN_TYPE;
        }
        String id = stringValue(meta.get("id"));
        String title = stringValue(meta.get("title"));
        
        Instant fileTime = modified != null ? modified : now;
        Instant created = parseInstant(meta.get("created"));
        if (created == null) {
            created = previous != null ? previous.created() : fileTime;
        }
        Instant updated = parseInstant(meta.get("updated"));
        if (updated == null) {
            updated = fileTime;
        }
        if (previous != null && previous.updated() != null && previous.updated().isAfter(updated)) {
            updated = previous.updated();
        }
        
        ValidationStatus status;
        List<String> errors;
        if (frontmatter.isMalformed()) {
            status = ValidationStatus.UNKNOWN;
            errors = List.of("Malformed frontmatter: " + frontmatter.error());
        } else {
            SchemaRegistry.Outcome outcome = schemas.validate(type, meta);
            status = outcome.status();
            errors = outcome.errors();
        }
        
        return new MetadataIndexEntry(
            relativePath,
            id != null ? id : relativePath,
            type,
            title != null ? title : fileTitle(relativePath),
            stringValue(meta.get("description")),
            tagsOf(meta.get("tags")),
            status,
            errors,
            content.getBytes(StandardCharsets.UTF_8).length,
            content.isEmpty() ? 0 : (int) content.lines().count(),
            created,
            updated,
            now
        );
    }
    
    private static Comparator<MetadataIndexEntry> comparator(MetadataFilter filter) {
        SortField field = filter.effectiveSortBy();
        Comparator<MetadataIndexEntry> byPath = Comparator.comparing(MetadataIndexEntry::relativePath);
        if (field == SortField.RELEVANCE) {
            String text = filter.text();
            Comparator<MetadataIndexEntry> byScore = Comparator.comparingDouble(
                (MetadataIndexEntry e) -> relevance(text, e.searchableText())).reversed();
            return byScore.thenComparing(MetadataIndexEntry::updated, Comparator.reverseOrder()).thenComparing(byPath);
        }
        Comparator<MetadataIndexEntry> primary = switch (field) {
            case CREATED -> Comparator.comparing(MetadataIndexEntry::created);
            case TITLE -> Comparator.comparing((MetadataIndexEntry e) -> e.title().toLowerCase(Locale.ROOT));
            case SIZE -> Comparator.comparingLong(MetadataIndexEntry::sizeBytes);
            default -> Comparator.comparing(MetadataIndexEntry::updated);
        };
        if (filter.sortOrder() == SortOrder.DESC) {
            primary = primary.reversed();
        }
        return primary.thenComparing(byPath);
    }
    
    /**
     * Scores a text match: whole-phrase matches rank above word matches and
     * earlier phrase positions rank higher.
     */
    static double relevance(String query, String searchableText) {
        if (query == null || query.isEmpty() || searchableText.isEmpty()) {
            return 0.0;
        }
        int position = searchableText.indexOf(query);
        if (position >= 0) {
            return 0.8 + (1.0 - (double) position / searchableText.length()) * 0.2;
        }
        String[] queryWords = query.split("\\s+");
        String[] textWords = searchableText.split("\\s+");
        int matching = 0;
        for (String queryWord : queryWords) {
            for (String textWord : textWords) {
                if (!textWord.isEmpty() && (textWord.contains(queryWord) || queryWord.contains(textWord))) {
                    matching++;
                    break;
                }
            }
        }
        return (double) matching / queryWords.length * 0.6;
    }
    
    private static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }
    
    private static Set<String> tagsOf(Object value) {
        Set<String> tags = new LinkedHashSet<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && !item.toString().isBlank()) {
                    tags.add(item.toString().trim());
                }
            }
        } else if (value instanceof String s) {
            for (String part : s.split(",")) {
                if (!part.isBlank()) {
                    tags.add(part.trim());
                }
            }
        }
        return tags;
    }
    
    static Instant parseInstant(Object value) {
        if (!(value instanceof String s) || s.isBlank()) {
            return null;
        }
        try {
            if (s.length() == 10) {
                return LocalDate.parse(s).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable timestamp '{}'", s);
            return null;
        }
    }
    
    private static String fileTitle(String relativePath) {
        int slash = relativePath.lastIndexOf('/');
        String name = relativePath.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
