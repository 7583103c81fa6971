package com.aquawatch.service.store;

import com.aquawatch.pipeline.api.BlobStore;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Blob store backed by a directory. Keys are relative paths such as {@code processed/03339000/1700000000.csv}.
 */
public class FileBlobStore implements BlobStore {
    private final Path root;
    private final ReentrantLock lock = new ReentrantLock();

    public FileBlobStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public Optional<byte[]> load(String key) {
        Path file = resolve(key);
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading blob " + key, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void save(String key, byte[] bytes) {
        Path file = resolve(key);
        lock.lock();
        try {
            Files.createDirectories(file.getParent());
            Path temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            try {
                Files.write(temp, bytes);
                moveIntoPlace(temp, file);
            } catch (IOException e) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
                throw e;
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing blob " + key, e);
        } finally {
            lock.unlock();
        }
    }

    private static void moveIntoPlace(Path temp, Path file) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Blob key is required");
        }
        Path file = root.resolve(key).normalize();
        if (!file.startsWith(root) || file.equals(root)) {
            throw new IllegalArgumentException("Blob key escapes store root: " + key);
        }
        return file;
    }
}
