package com.pipecache.index;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.pipecache.store.PersistenceException;

public class MetadataSnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(MetadataSnapshotStore.class);

    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public MetadataSnapshot load(Path path) {
        try {
            if (!Files.exists(path) || Files.size(path) == 0L) {
                return MetadataSnapshot.empty();
            }
            return mapper.readValue(path.toFile(), MetadataSnapshot.class);
        } catch (IOException e) {
            throw new PersistenceException("Unable to read metadata snapshot " + path, e);
        }
    }

    public void save(Path path, MetadataSnapshot snapshot) {
        Path directory = path.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + path.getFileName(), ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic rename unsupported for {}, falling back to replace", path);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved metadata snapshot path={} artifacts={}", path, snapshot.artifacts().size());
        } catch (IOException e) {
            throw new PersistenceException("Unable to write metadata snapshot " + path, e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    log.warn("Unable to remove temp snapshot {}", temp, e);
                }
            }
        }
    }
}
