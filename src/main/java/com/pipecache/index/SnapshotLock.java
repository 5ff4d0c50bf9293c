package com.pipecache.index;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

import com.pipecache.store.PersistenceException;

/**
 * Exclusive lock on a sidecar file, held around load-mutate-save of the snapshot so that
 * several processes sharing one store root do not lose each other's writes.
 *
 * <p>OS file locks are held per JVM, so threads of one process first queue on a per-path
 * {@link ReentrantLock}. A thread that already holds the lock for a path may acquire it again;
 * only the outermost acquisition owns the file lock.</p>
 */
public final class SnapshotLock implements AutoCloseable {
    private static final ConcurrentMap<Path, ReentrantLock> PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final ReentrantLock processLock;
    private final FileChannel channel;
    private final FileLock lock;

    private SnapshotLock(ReentrantLock processLock, FileChannel channel, FileLock lock) {
        this.processLock = processLock;
        this.channel = channel;
        this.lock = lock;
    }

    public static SnapshotLock acquire(Path lockPath) {
        Path key = lockPath.toAbsolutePath().normalize();
        ReentrantLock processLock = PROCESS_LOCKS.computeIfAbsent(key, unused -> new ReentrantLock());
        processLock.lock();
        if (processLock.getHoldCount() > 1) {
            return new SnapshotLock(processLock, null, null);
        }
        FileChannel channel = null;
        try {
            if (key.getParent() != null) {
                Files.createDirectories(key.getParent());
            }
            channel = FileChannel.open(key, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            return new SnapshotLock(processLock, channel, channel.lock());
        } catch (IOException e) {
            closeChannel(channel, e);
            processLock.unlock();
            throw new PersistenceException("Unable to lock " + lockPath, e);
        } catch (RuntimeException e) {
            closeChannel(channel, e);
            processLock.unlock();
            throw e;
        }
    }

    @Override
    public void close() {
        if (channel == null) {
            processLock.unlock();
            return;
        }
        try (channel) {
            lock.release();
        } catch (IOException e) {
            throw new PersistenceException("Unable to release snapshot lock", e);
        } finally {
            processLock.unlock();
        }
    }

    private static void closeChannel(FileChannel channel, Exception cause) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException suppressed) {
            cause.addSuppressed(suppressed);
        }
    }
}
