/* (C)2026 */
package com.ammann.analytics.cache;

import com.ammann.analytics.exception.AnalyticsException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic cache keys of the form {@code namespace:hash}.
 *
 * <p>The parameters are serialized to JSON with map keys and record properties
 * in sorted order, hashed with SHA-256, and the first 16 hex characters of the
 * digest form the hash part. Equal parameters give equal keys regardless of the
 * order they were added in.
 */
public final class AnalyticsCacheKey {

    private static final int HASH_LENGTH = 16;

    private static final ObjectMapper CANONICAL_MAPPER =
            JsonMapper.builder()
                    .addModule(new JavaTimeModule())
                    .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .build();

    private AnalyticsCacheKey() {
    }

    /**
     * Key for {@code params} under {@code namespace}.
     *
     * @throws AnalyticsException if the parameters cannot be serialized
     */
    public static String of(String namespace, Object params) {
        String canonical;
        try {
            canonical = CANONICAL_MAPPER.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new AnalyticsException("Cannot serialize cache key parameters for " + namespace, e);
        }
        return namespace + ":" + sha256Hex(canonical).substring(0, HASH_LENGTH);
    }

    public static Builder builder(String operation) {
        return new Builder(operation);
    }

    private static String sha256Hex(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Collects the dimensions of an analytics request: operation, platform,
     * time range, output shape and free-form parameters.
     */
    public static final class Builder {
        private final String operation;
        private final Map<String, Object> params = new TreeMap<>();

        private Builder(String operation) {
            this.operation = operation;
        }

        public Builder platform(String platform) {
            return param("platform", platform);
        }

        public Builder timeRange(Instant from, Instant to) {
            param("from", from);
            return param("to", to);
        }

        /** Output shape, such as {@code summary} or {@code series}. */
        public Builder shape(String shape) {
            return param("shape", shape);
        }

        public Builder param(String name, Object value) {
            if (value != null) {
                params.put(name, value);
            }
            return this;
        }

        public String build() {
            return of(operation, params);
        }
    }
}
