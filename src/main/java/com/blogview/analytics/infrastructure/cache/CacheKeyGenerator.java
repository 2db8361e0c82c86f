package com.blogview.analytics.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Deterministic cache keys: {@code analytics:<operation>:<md5 of canonical params>}.
 *
 * Parameters are serialized with sorted properties and map keys, so the key does not
 * depend on insertion order. Unordered collections must be passed in sorted form
 * (see {@code FlatFilter#toCanonicalMap}).
 */
@Component
public class CacheKeyGenerator {

    static final String PREFIX = "analytics";

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .addModule(new JavaTimeModule())
            .build();

    public String generateKey(String operation, Object params) {
        byte[] canonical = canonicalize(params).getBytes(StandardCharsets.UTF_8);
        return PREFIX + ":" + operation + ":" + DigestUtils.md5DigestAsHex(canonical);
    }

    public String canonicalize(Object params) {
        try {
            return canonicalMapper.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cache parameters are not serializable", e);
        }
    }
}
