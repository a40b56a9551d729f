package com.inspectvoice.sealing.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Test-friendly, in-memory object store.
 */
@ApplicationScoped
@Named("in-memory-storage")
public class InMemoryBundleStorage implements BundleStorage {

    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private final Map<String, Map<String, String>> metadata = new ConcurrentHashMap<>();

    @Override
    public void put(String objectKey, byte[] archive, Map<String, String> objectMetadata) {
        byte[] existing = objects.putIfAbsent(objectKey, archive.clone());
        if (existing != null) {
            if (Arrays.equals(existing, archive)) {
                return;
            }
            throw new StorageException("Object already exists with different content: " + objectKey);
        }
        metadata.put(objectKey, Map.copyOf(objectMetadata));
    }

    @Override
    public Optional<byte[]> get(String objectKey) {
        byte[] data = objects.get(objectKey);
        return data == null ? Optional.empty() : Optional.of(data.clone());
    }

    @Override
    public boolean isAccessible() {
        return true;
    }

    public Map<String, String> metadataOf(String objectKey) {
        return metadata.getOrDefault(objectKey, Map.of());
    }

    public boolean contains(String objectKey) {
        return objects.containsKey(objectKey);
    }

    public int size() {
        return objects.size();
    }
}
