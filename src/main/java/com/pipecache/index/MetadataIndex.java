package com.pipecache.index;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

public interface MetadataIndex {

    void add(Artifact artifact);

    // validated as a whole before anything is inserted
    void addAll(List<Artifact> artifacts);

    List<Boolean> existsById(List<String> ids);

    List<Boolean> existsByHash(List<String> hashes);

    Stream<String> select(Selector selector);

    Optional<Artifact> get(String hash);

    Optional<Artifact> latestById(String logicalId);

    int remove(Selector selector);

    int removeByHashes(Collection<String> hashes);

    int size();

    MetadataSnapshot snapshot();

    void restore(MetadataSnapshot snapshot);

    void save();

    void load();
}
