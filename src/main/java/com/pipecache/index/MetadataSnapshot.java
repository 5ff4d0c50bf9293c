package com.pipecache.index;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MetadataSnapshot(@JsonProperty("artifacts") List<Artifact> artifacts) {

    public MetadataSnapshot {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    public static MetadataSnapshot empty() {
        return new MetadataSnapshot(List.of());
    }
}
