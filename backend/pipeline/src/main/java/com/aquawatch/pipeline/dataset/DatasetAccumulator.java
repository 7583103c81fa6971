package com.aquawatch.pipeline.dataset;

import com.aquawatch.pipeline.api.BlobStore;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Byte-level append of encoded rows onto the dataset stored at a key. Row shape is not checked.
 * Concurrent appends to one key race; the last save wins.
 */
public class DatasetAccumulator {
    private static final Logger LOGGER = Logger.getLogger(DatasetAccumulator.class.getName());

    private final BlobStore blobStore;

    public DatasetAccumulator(BlobStore blobStore) {
        this.blobStore = Objects.requireNonNull(blobStore, "blobStore is required");
    }

    /**
     * Appends {@code newBytes} to whatever is stored at {@code key}, saves the result and returns it.
     */
    public byte[] append(String key, byte[] newBytes) {
        byte[] merged = merge(loadExisting(key), newBytes);
        blobStore.save(key, merged);
        return merged;
    }

    public static byte[] merge(byte[] existing, byte[] newBytes) {
        if (existing == null || existing.length == 0) {
            return newBytes.clone();
        }
        boolean needsSeparator = existing[existing.length - 1] != '\n';
        byte[] merged = new byte[existing.length + (needsSeparator ? 1 : 0) + newBytes.length];
        System.arraycopy(existing, 0, merged, 0, existing.length);
        int offset = existing.length;
        if (needsSeparator) {
            merged[offset++] = '\n';
        }
        System.arraycopy(newBytes, 0, merged, offset, newBytes.length);
        return merged;
    }

    private byte[] loadExisting(String key) {
        try {
            Optional<byte[]> existing = blobStore.load(key);
            if (existing.isEmpty()) {
                LOGGER.info("No existing dataset at " + key + "; creating new");
            }
            return existing.orElse(null);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed reading existing dataset at " + key + "; creating new", e);
            return null;
        }
    }
}
