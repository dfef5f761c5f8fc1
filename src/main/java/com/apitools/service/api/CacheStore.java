package com.apitools.service.api;

import java.util.Optional;

/**
 * Key/value storage for serialized specifications.
 */
public interface CacheStore {

    /**
     * @return The stored bytes, or empty on a miss. An unreadable entry is a miss.
     */
    Optional<byte[]> get(String key);

    /**
     * Stores {@code value} under {@code key}, replacing any previous entry.
     *
     * @throws com.apitools.exception.ApiToolsException if the entry cannot be written.
     */
    void put(String key, byte[] value);
}
