package io.kvoperator.upgrade;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.hash.Hashing;
import io.kvoperator.models.InstanceTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content hashes of instance templates.
 * <p>
 * Templates are rendered as canonical JSON (sorted properties and map keys) before hashing, so
 * equal templates always hash equally regardless of how their maps were built.
 */
public class RevisionHasher {

    private static final int HASH_LENGTH = 16;

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    /**
     * Hash of version, image, configuration and resources.
     */
    public String revision(InstanceTemplate template) {
        Map<String, Object> content = baseContent(template);
        content.put("config", configOf(template));
        return hash(content);
    }

    /**
     * Hash of the template without its configuration.
     */
    public String baseRevision(InstanceTemplate template) {
        return hash(baseContent(template));
    }

    public String configHash(InstanceTemplate template) {
        return hash(configOf(template));
    }

    private Map<String, Object> baseContent(InstanceTemplate template) {
        Map<String, Object> content = new TreeMap<>();
        content.put("version", template.getVersion());
        content.put("image", template.getImage());
        content.put("resources", template.getResources());
        return content;
    }

    private static Map<String, Object> configOf(InstanceTemplate template) {
        return template.getConfig() != null ? template.getConfig() : Map.of();
    }

    private String hash(Object content) {
        try {
            String canonical = canonicalMapper.writeValueAsString(content);
            return Hashing.sha256()
                    .hashString(canonical, StandardCharsets.UTF_8)
                    .toString()
                    .substring(0, HASH_LENGTH);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render template as canonical JSON", e);
        }
    }
}
