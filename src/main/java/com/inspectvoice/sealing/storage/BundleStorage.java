package com.inspectvoice.sealing.storage;

import java.util.Map;
import java.util.Optional;

/**
 * Object storage for sealed archives. Objects are written once and never replaced:
 * putting a key that already holds different bytes fails, putting identical bytes again
 * is a no-op.
 */
public interface BundleStorage {

    String CONTENT_TYPE = "application/zip";

    /**
     * @throws StorageException if the object could not be stored or the key already holds
     *                          different content
     */
    void put(String objectKey, byte[] archive, Map<String, String> metadata);

    /**
     * @return the archive, or empty if no object exists under the key
     * @throws StorageException on any other storage failure
     */
    Optional<byte[]> get(String objectKey);

    boolean isAccessible();
}
