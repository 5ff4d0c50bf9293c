package com.pipecache.artifact;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipecache.document.Document;
import com.pipecache.document.DocumentSerializer;
import com.pipecache.document.JsonDocumentSerializer;
import com.pipecache.index.Artifact;
import com.pipecache.index.InMemoryMetadataIndex;
import com.pipecache.index.MetadataIndex;
import com.pipecache.index.MetadataSnapshot;
import com.pipecache.index.Selector;
import com.pipecache.index.SnapshotLock;
import com.pipecache.index.WritePolicy;
import com.pipecache.store.ArtifactStoreException;
import com.pipecache.store.ContentStore;
import com.pipecache.store.FileSystemContentStore;
import com.pipecache.store.IntegrityException;

public class FileSystemArtifactLayer implements ArtifactLayer {
    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactLayer.class);

    public static final String METADATA_FILE = "metadata.json";
    public static final String LOCK_SUFFIX = ".lock";

    private final ContentStore contentStore;
    private final MetadataIndex index;
    private final DocumentSerializer serializer;
    private final ReadMode defaultReadMode;
    private final Path lockPath;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    public FileSystemArtifactLayer(Path root) {
        this(root, WritePolicy.REJECT, ReadMode.STREAMING, true);
    }

    public FileSystemArtifactLayer(Path root, WritePolicy writePolicy, ReadMode defaultReadMode, boolean fileLocking) {
        this(new FileSystemContentStore(root),
                InMemoryMetadataIndex.load(root.resolve(METADATA_FILE), writePolicy),
                new JsonDocumentSerializer(),
                defaultReadMode,
                fileLocking ? root.resolve(METADATA_FILE + LOCK_SUFFIX) : null,
                Clock.systemUTC());
    }

    public FileSystemArtifactLayer(
            ContentStore contentStore,
            MetadataIndex index,
            DocumentSerializer serializer,
            ReadMode defaultReadMode,
            Path lockPath,
            Clock clock) {
        this.contentStore = Objects.requireNonNull(contentStore, "contentStore");
        this.index = Objects.requireNonNull(index, "index");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.defaultReadMode = Objects.requireNonNull(defaultReadMode, "defaultReadMode");
        this.lockPath = lockPath;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ContentStore contentStore() {
        return contentStore;
    }

    public MetadataIndex index() {
        return index;
    }

    @Override
    public void add(List<Document> documents) {
        write(documents, false);
    }

    @Override
    public List<Document> addMissing(List<Document> documents) {
        return write(documents, true);
    }

    @Override
    public List<Boolean> exists(List<String> logicalIds) {
        return index.existsById(logicalIds);
    }

    @Override
    public List<Boolean> existsByHash(List<String> hashes) {
        return index.existsByHash(hashes);
    }

    @Override
    public Stream<Document> getMatchingDocuments(Selector selector) {
        return getMatchingDocuments(selector, defaultReadMode);
    }

    @Override
    public Stream<Document> getMatchingDocuments(Selector selector, ReadMode readMode) {
        List<String> hashes = index.select(selector).toList();
        return hashes.stream()
                .map(hash -> load(hash, readMode))
                .flatMap(Optional::stream);
    }

    @Override
    public Document getDocument(String hash) {
        byte[] payload = contentStore.get(hash);
        Document document;
        try {
            document = serializer.deserialize(payload);
        } catch (IllegalArgumentException e) {
            throw new IntegrityException(hash, "Stored payload " + hash + " is not a readable document", e);
        }
        if (!hash.equals(document.hash()) || !document.hashMatchesContent()) {
            throw new IntegrityException(hash, "Stored payload " + hash + " does not match its content hash");
        }
        return document;
    }

    @Override
    public List<Document> getChildDocuments(String parentHash) {
        return getMatchingDocuments(Selector.byParentHashes(Set.of(parentHash)), ReadMode.COMPLETE).toList();
    }

    @Override
    public RemovalResult remove(Selector selector, boolean deletePayloads) {
        writeLock.lock();
        try (SnapshotLock ignored = acquireSnapshotLock()) {
            List<String> hashes = index.select(selector).toList();
            MetadataSnapshot previous = index.snapshot();
            int removed = index.removeByHashes(hashes);
            saveOrRestore(previous);
            int deleted = 0;
            if (deletePayloads) {
                for (String hash : hashes) {
                    if (contentStore.delete(hash)) {
                        deleted++;
                    }
                }
            }
            log.info("Removed artifacts={} payloadsDeleted={} selector={}", removed, deleted, selector);
            return new RemovalResult(removed, deleted);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int collectGarbage() {
        writeLock.lock();
        try (SnapshotLock ignored = acquireSnapshotLock()) {
            Set<String> referenced = index.snapshot().artifacts().stream()
                    .map(Artifact::hash)
                    .collect(Collectors.toSet());
            int deleted = 0;
            for (String hash : contentStore.hashes()) {
                if (!referenced.contains(hash) && contentStore.delete(hash)) {
                    deleted++;
                }
            }
            log.info("Garbage collection deleted {} orphaned payloads", deleted);
            return deleted;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void refresh() {
        writeLock.lock();
        try {
            index.load();
        } finally {
            writeLock.unlock();
        }
    }

    private List<Document> write(List<Document> documents, boolean skipIndexed) {
        if (documents.isEmpty()) {
            return List.of();
        }
        for (Document document : documents) {
            if (!document.hashMatchesContent()) {
                throw new IntegrityException(document.hash(),
                        "Document " + document.logicalId() + " carries hash " + document.hash() + " that does not match its content");
            }
        }
        writeLock.lock();
        try (SnapshotLock ignored = acquireSnapshotLock()) {
            List<Document> pending = documents;
            if (skipIndexed) {
                List<Boolean> indexed = index.existsByHash(documents.stream().map(Document::hash).toList());
                Set<String> seen = new HashSet<>();
                pending = new ArrayList<>();
                for (int i = 0; i < documents.size(); i++) {
                    if (!indexed.get(i) && seen.add(documents.get(i).hash())) {
                        pending.add(documents.get(i));
                    }
                }
                if (pending.isEmpty()) {
                    log.debug("All {} documents already stored", documents.size());
                    return List.of();
                }
            }
            String storedAt = Instant.now(clock).toString();
            List<Artifact> artifacts = pending.stream()
                    .map(document -> toArtifact(document, storedAt))
                    .toList();

            for (Document document : pending) {
                contentStore.put(document.hash(), serializer.serialize(document));
            }
            MetadataSnapshot previous = index.snapshot();
            try {
                index.addAll(artifacts);
            } catch (ArtifactStoreException e) {
                log.warn("Index rejected batch of {} documents, payloads stay unreferenced until garbage collection: {}",
                        pending.size(), e.getMessage());
                throw e;
            }
            saveOrRestore(previous);
            log.debug("Stored {} documents", pending.size());
            return List.copyOf(pending);
        } finally {
            writeLock.unlock();
        }
    }

    private void saveOrRestore(MetadataSnapshot previous) {
        try {
            index.save();
        } catch (ArtifactStoreException e) {
            log.warn("Snapshot save failed, restoring {} indexed artifacts: {}", previous.artifacts().size(), e.getMessage());
            index.restore(previous);
            throw e;
        }
    }

    private SnapshotLock acquireSnapshotLock() {
        if (lockPath == null) {
            return null;
        }
        SnapshotLock snapshotLock = SnapshotLock.acquire(lockPath);
        try {
            index.load();
        } catch (ArtifactStoreException e) {
            snapshotLock.close();
            throw e;
        }
        return snapshotLock;
    }

    private Optional<Document> load(String hash, ReadMode readMode) {
        try {
            return Optional.of(getDocument(hash));
        } catch (ArtifactStoreException e) {
            if (readMode == ReadMode.COMPLETE) {
                throw e;
            }
            log.warn("Skipping artifact {}: {}", hash, e.getMessage());
            return Optional.empty();
        }
    }

    private static Artifact toArtifact(Document document, String storedAt) {
        Map<String, Object> metadata = new LinkedHashMap<>(document.metadata());
        metadata.put(Artifact.STORED_AT, storedAt);
        return new Artifact(document.logicalId(), document.hash(), document.parentHashes(), metadata);
    }
}
