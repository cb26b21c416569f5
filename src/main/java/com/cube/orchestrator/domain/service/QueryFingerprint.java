package com.cube.orchestrator.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stable identity of a query: SHA-256 over the canonical JSON of
 * data source, SQL and parameters.
 */
public final class QueryFingerprint {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private QueryFingerprint() {
    }

    public static String of(String dataSource, String sql, List<Object> params) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("dataSource", dataSource);
        canonical.put("sql", sql);
        canonical.put("params", params != null ? params : new ArrayList<>());
        try {
            return sha256(CANONICAL.writeValueAsString(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Query parameters are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * First 8 hex characters of the SHA-256 of {@code value}; used in table names.
     */
    public static String shortHash(String value) {
        return sha256(value == null ? "" : value).substring(0, 8);
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
