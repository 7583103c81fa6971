package com.aquawatch.pipeline.api;

import java.util.Optional;

/**
 * Key-addressed byte storage with last-writer-wins semantics.
 */
public interface BlobStore {
    Optional<byte[]> load(String key);

    void save(String key, byte[] bytes);
}
