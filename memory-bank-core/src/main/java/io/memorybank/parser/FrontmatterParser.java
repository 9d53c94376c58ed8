package io.memorybank.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the {@code ---} delimited YAML header of markdown documents.
 *
 * <p>Parsing never throws: a malformed header yields empty metadata and an
 * error message so callers can still index the document.</p>
 */
public class FrontmatterParser {
    
    private static final Logger log = LoggerFactory.getLogger(FrontmatterParser.class);
    
    private static final Pattern FRONTMATTER_PATTERN = Pattern.compile(
        "^---[ \\t]*\\n(?:(.*?)\\n)?---[ \\t]*(?:\\n(.*))?$", Pattern.DOTALL);
    
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};
    
    private final ObjectMapper yamlMapper;
    
    public FrontmatterParser() {
        YAMLFactory factory = YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .build();
        this.yamlMapper = new ObjectMapper(factory);
    }
    
    public Frontmatter parse(String content) {
        if (content == null || content.isEmpty()) {
            return Frontmatter.absent("");
        }
        String normalized = content.replace("\r\n", "\n");
        Matcher matcher = FRONTMATTER_PATTERN.matcher(normalized);
        if (!matcher.matches()) {
            return Frontmatter.absent(content);
        }
        
        String header = matcher.group(1);
        String body = matcher.group(2) != null ? matcher.group(2) : "";
        if (header == null || header.isBlank()) {
            return new Frontmatter(Map.of(), body, true, null);
        }
        try {
            Map<String, Object> metadata = yamlMapper.readValue(header, MAP_TYPE);
            if (metadata == null) {
                metadata = Map.of();
            }
            return new Frontmatter(Collections.unmodifiableMap(metadata), body, true, null);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to parse frontmatter: {}", e.getMessage());
            return new Frontmatter(Map.of(), body, true, e.getMessage());
        }
    }
    
    /**
     * Renders a header block followed by the body.
     */
    public String render(Map<String, Object> metadata, String body) {
        try {
            String yaml = yamlMapper.writeValueAsString(metadata);
            StringBuilder sb = new StringBuilder("---\n").append(yaml);
            if (!yaml.endsWith("\n")) {
                sb.append('\n');
            }
            sb.append("---\n");
            if (body != null) {
                sb.append(body);
            }
            return sb.toString();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata cannot be rendered as YAML: " + e.getMessage(), e);
        }
    }
}
