package com.pipecache.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FileSystemContentStore implements ContentStore {
    private static final Logger log = LoggerFactory.getLogger(FileSystemContentStore.class);
    private static final Pattern HASH_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

    // names containing a dot (temp files, metadata.json) are never payloads
    private final Path root;

    public FileSystemContentStore(Path root) {
        this.root = root;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new PersistenceException("Unable to create content store root " + root, e);
        }
    }

    public Path root() {
        return root;
    }

    @Override
    public void put(String hash, byte[] payload) {
        Path target = pathFor(hash);
        if (Files.exists(target)) {
            verifyExisting(hash, target, payload);
            return;
        }
        Path temp = null;
        try {
            temp = Files.createTempFile(root, "." + hash + ".", ".tmp");
            Files.write(temp, payload);
            publish(temp, target);
            log.debug("Stored payload hash={} bytes={}", hash, payload.length);
        } catch (FileAlreadyExistsException e) {
            verifyExisting(hash, target, payload);
        } catch (IOException e) {
            throw new PersistenceException("Unable to write payload " + hash, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    @Override
    public byte[] get(String hash) {
        try {
            return Files.readAllBytes(pathFor(hash));
        } catch (NoSuchFileException e) {
            throw new ArtifactNotFoundException(hash);
        } catch (IOException e) {
            throw new PersistenceException("Unable to read payload " + hash, e);
        }
    }

    @Override
    public boolean exists(String hash) {
        return Files.isRegularFile(pathFor(hash));
    }

    @Override
    public boolean delete(String hash) {
        try {
            return Files.deleteIfExists(pathFor(hash));
        } catch (IOException e) {
            throw new PersistenceException("Unable to delete payload " + hash, e);
        }
    }

    @Override
    public Set<String> hashes() {
        try (Stream<Path> files = Files.list(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> HASH_PATTERN.matcher(name).matches())
                    .collect(Collectors.toSet());
        } catch (IOException e) {
            throw new PersistenceException("Unable to list content store root " + root, e);
        }
    }

    private Path pathFor(String hash) {
        if (hash == null || !HASH_PATTERN.matcher(hash).matches()) {
            throw new IllegalArgumentException("Invalid content hash: " + hash);
        }
        return root.resolve(hash);
    }

    private void publish(Path temp, Path target) throws IOException {
        try {
            Files.createLink(target, temp);
        } catch (UnsupportedOperationException e) {
            // no hard links on this file system
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException notAtomic) {
                Files.move(temp, target);
            }
        }
    }

    private void verifyExisting(String hash, Path target, byte[] payload) {
        byte[] existing;
        try {
            existing = Files.readAllBytes(target);
        } catch (IOException e) {
            throw new PersistenceException("Unable to read payload " + hash, e);
        }
        if (!Arrays.equals(existing, payload)) {
            throw new IntegrityException(hash, "Hash collision: " + hash + " is already stored with a different payload");
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Unable to remove temp file {}", temp, e);
        }
    }
}
