package com.pipecache.index;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipecache.store.DuplicateArtifactException;
import com.pipecache.store.IntegrityException;

public class InMemoryMetadataIndex implements MetadataIndex {
    private static final Logger log = LoggerFactory.getLogger(InMemoryMetadataIndex.class);

    private final Path snapshotPath;
    private final WritePolicy writePolicy;
    private final MetadataSnapshotStore snapshotStore;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantLock saveLock = new ReentrantLock();
    private final Map<String, IndexedArtifact> byHash = new LinkedHashMap<>();
    private final Map<String, List<String>> hashesById = new HashMap<>();
    private final Map<String, Set<String>> childrenByParent = new HashMap<>();
    private long nextSequence;

    public InMemoryMetadataIndex(Path snapshotPath) {
        this(snapshotPath, WritePolicy.REJECT);
    }

    public InMemoryMetadataIndex(Path snapshotPath, WritePolicy writePolicy) {
        this(snapshotPath, writePolicy, new MetadataSnapshotStore());
    }

    InMemoryMetadataIndex(Path snapshotPath, WritePolicy writePolicy, MetadataSnapshotStore snapshotStore) {
        this.snapshotPath = snapshotPath;
        this.writePolicy = writePolicy;
        this.snapshotStore = snapshotStore;
    }

    public static InMemoryMetadataIndex load(Path snapshotPath, WritePolicy writePolicy) {
        InMemoryMetadataIndex index = new InMemoryMetadataIndex(snapshotPath, writePolicy);
        index.load();
        return index;
    }

    public Path snapshotPath() {
        return snapshotPath;
    }

    public WritePolicy writePolicy() {
        return writePolicy;
    }

    @Override
    public void add(Artifact artifact) {
        addAll(List.of(artifact));
    }

    @Override
    public void addAll(List<Artifact> artifacts) {
        lock.writeLock().lock();
        try {
            validate(artifacts);
            for (Artifact artifact : artifacts) {
                insert(artifact);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Boolean> existsById(List<String> ids) {
        lock.readLock().lock();
        try {
            return ids.stream().map(hashesById::containsKey).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Boolean> existsByHash(List<String> hashes) {
        lock.readLock().lock();
        try {
            return hashes.stream().map(byHash::containsKey).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Stream<String> select(Selector selector) {
        lock.readLock().lock();
        try {
            List<String> matches;
            if (selector.isEmpty()) {
                matches = List.of();
            } else if (isIndexable(selector)) {
                matches = indexedLookup(selector);
            } else {
                matches = byHash.values().stream()
                        .map(IndexedArtifact::artifact)
                        .filter(selector::matches)
                        .map(Artifact::hash)
                        .toList();
            }
            return matches.stream();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Artifact> get(String hash) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byHash.get(hash)).map(IndexedArtifact::artifact);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Artifact> latestById(String logicalId) {
        lock.readLock().lock();
        try {
            List<String> hashes = hashesById.get(logicalId);
            if (hashes == null || hashes.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(byHash.get(hashes.get(hashes.size() - 1)).artifact());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int remove(Selector selector) {
        lock.writeLock().lock();
        try {
            return removeByHashes(select(selector).toList());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int removeByHashes(Collection<String> hashes) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            for (String hash : new LinkedHashSet<>(hashes)) {
                if (unlink(hash)) {
                    removed++;
                }
            }
            log.debug("Removed {} of {} requested artifacts", removed, hashes.size());
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return byHash.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public MetadataSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new MetadataSnapshot(byHash.values().stream().map(IndexedArtifact::artifact).toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void save() {
        saveLock.lock();
        try {
            snapshotStore.save(snapshotPath, snapshot());
        } finally {
            saveLock.unlock();
        }
    }

    @Override
    public void load() {
        restore(snapshotStore.load(snapshotPath));
    }

    @Override
    public void restore(MetadataSnapshot loaded) {
        lock.writeLock().lock();
        try {
            byHash.clear();
            hashesById.clear();
            childrenByParent.clear();
            nextSequence = 0;
            for (Artifact artifact : loaded.artifacts()) {
                if (byHash.containsKey(artifact.hash())) {
                    log.warn("Snapshot {} lists artifact {} more than once, keeping the last entry", snapshotPath, artifact.hash());
                }
                insert(artifact);
            }
            log.debug("Restored {} artifacts for {}", byHash.size(), snapshotPath);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void validate(List<Artifact> artifacts) {
        Set<String> batch = new HashSet<>();
        for (Artifact artifact : artifacts) {
            String hash = artifact.hash();
            if (batch.contains(hash) || (writePolicy == WritePolicy.REJECT && byHash.containsKey(hash))) {
                throw new DuplicateArtifactException(hash);
            }
            for (String parent : artifact.parentHashes()) {
                if (!byHash.containsKey(parent) && !batch.contains(parent)) {
                    throw new IntegrityException(hash, "Artifact " + hash + " references unknown parent " + parent);
                }
            }
            batch.add(hash);
        }
    }

    private void insert(Artifact artifact) {
        unlink(artifact.hash());
        byHash.put(artifact.hash(), new IndexedArtifact(nextSequence++, artifact));
        hashesById.computeIfAbsent(artifact.logicalId(), unused -> new ArrayList<>()).add(artifact.hash());
        for (String parent : artifact.parentHashes()) {
            childrenByParent.computeIfAbsent(parent, unused -> new LinkedHashSet<>()).add(artifact.hash());
        }
    }

    private boolean unlink(String hash) {
        IndexedArtifact removed = byHash.remove(hash);
        if (removed == null) {
            return false;
        }
        Artifact artifact = removed.artifact();
        List<String> versions = hashesById.get(artifact.logicalId());
        if (versions != null) {
            versions.remove(hash);
            if (versions.isEmpty()) {
                hashesById.remove(artifact.logicalId());
            }
        }
        for (String parent : artifact.parentHashes()) {
            Set<String> children = childrenByParent.get(parent);
            if (children != null) {
                children.remove(hash);
                if (children.isEmpty()) {
                    childrenByParent.remove(parent);
                }
            }
        }
        return true;
    }

    private static boolean isIndexable(Selector selector) {
        return selector.clauses().stream().allMatch(clause -> clause instanceof SelectorClause.IdIn
                || clause instanceof SelectorClause.HashIn
                || clause instanceof SelectorClause.ParentHashIn);
    }

    private List<String> indexedLookup(Selector selector) {
        TreeMap<Long, String> bySequence = new TreeMap<>();
        for (SelectorClause clause : selector.clauses()) {
            if (clause instanceof SelectorClause.IdIn idClause) {
                idClause.ids().forEach(id -> collect(hashesById.get(id), bySequence));
            } else if (clause instanceof SelectorClause.HashIn hashClause) {
                collect(hashClause.hashes(), bySequence);
            } else if (clause instanceof SelectorClause.ParentHashIn parentClause) {
                parentClause.parentHashes().forEach(parent -> collect(childrenByParent.get(parent), bySequence));
            }
        }
        return List.copyOf(bySequence.values());
    }

    private void collect(Collection<String> hashes, Map<Long, String> bySequence) {
        if (hashes == null) {
            return;
        }
        for (String hash : hashes) {
            IndexedArtifact indexed = byHash.get(hash);
            if (indexed != null) {
                bySequence.put(indexed.sequence(), hash);
            }
        }
    }

    private record IndexedArtifact(long sequence, Artifact artifact) {
    }
}
