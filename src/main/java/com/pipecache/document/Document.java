package com.pipecache.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Document(
        @JsonProperty("id") String id,
        @JsonProperty("hash") String hash,
        @JsonProperty("parent_hashes") List<String> parentHashes,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("page_content") String pageContent) {

    public Document {
        Objects.requireNonNull(hash, "hash");
        parentHashes = parentHashes == null ? List.of() : List.copyOf(parentHashes);
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        pageContent = pageContent == null ? "" : pageContent;
    }

    public static Document create(String id, String pageContent, Map<String, Object> metadata) {
        return create(id, pageContent, metadata, List.of());
    }

    public static Document create(String id, String pageContent, Map<String, Object> metadata, List<String> parentHashes) {
        String hash = ContentHasher.hash(id, pageContent, metadata, parentHashes);
        return new Document(id, hash, parentHashes, metadata, pageContent);
    }

    public String logicalId() {
        return id == null ? hash : id;
    }

    public boolean hashMatchesContent() {
        return hash.equals(ContentHasher.hash(id, pageContent, metadata, parentHashes));
    }

    public Document withParentHashes(List<String> newParentHashes) {
        return create(id, pageContent, metadata, newParentHashes);
    }

    public Document withMetadataEntry(String key, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(metadata);
        updated.put(key, value);
        return create(id, pageContent, updated, parentHashes);
    }
}
