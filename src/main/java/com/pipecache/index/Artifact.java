package com.pipecache.index;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Artifact(
        @JsonProperty("custom_id") String logicalId,
        @JsonProperty("uuid") String hash,
        @JsonProperty("parent_uuids") List<String> parentHashes,
        @JsonProperty("metadata") Map<String, Object> metadata) {

    public static final String STORED_AT = "stored_at";

    public Artifact {
        Objects.requireNonNull(hash, "hash");
        logicalId = logicalId == null ? hash : logicalId;
        parentHashes = parentHashes == null ? List.of() : List.copyOf(parentHashes);
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Optional<Instant> storedAt() {
        Object value = metadata.get(STORED_AT);
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(value.toString()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
