package com.pipecache.document;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

public final class ContentHasher {
    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .findAndAddModules()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private ContentHasher() {
    }

    public static String hash(String id, String pageContent, Map<String, Object> metadata, List<String> parentHashes) {
        Map<String, Object> canonical = new TreeMap<>();
        if (id != null) {
            canonical.put("id", id);
        }
        canonical.put("page_content", pageContent == null ? "" : pageContent);
        canonical.put("metadata", metadata == null ? Map.of() : metadata);
        canonical.put("parent_hashes", parentHashes == null ? List.of() : parentHashes);
        try {
            return sha256(CANONICAL.writeValueAsBytes(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document metadata is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    public static String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
