package com.inspectvoice.sealing.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Map;
import java.util.Optional;

/**
 * Facade that selects the active BundleStorage implementation based on configuration.
 */
@ApplicationScoped
public class BundleStorageFacade implements BundleStorage {

    @ConfigProperty(name = "app.storage.mode", defaultValue = "s3")
    String mode;

    @ConfigProperty(name = "app.storage.key-prefix", defaultValue = "sealed-exports/")
    String keyPrefix;

    @Inject
    @Named("s3-storage")
    S3BundleStorage s3Storage;

    @Inject
    @Named("in-memory-storage")
    InMemoryBundleStorage inMemoryStorage;

    private BundleStorage delegate() {
        if ("in-memory".equalsIgnoreCase(mode)) {
            return inMemoryStorage;
        }
        return s3Storage;
    }

    /**
     * {@code {prefix}{tenantId}/{bundleId}.zip}
     */
    public String objectKey(String tenantId, String bundleId) {
        return keyPrefix + tenantId + "/" + bundleId + ".zip";
    }

    @Override
    public void put(String objectKey, byte[] archive, Map<String, String> metadata) {
        delegate().put(objectKey, archive, metadata);
    }

    @Override
    public Optional<byte[]> get(String objectKey) {
        return delegate().get(objectKey);
    }

    @Override
    public boolean isAccessible() {
        return delegate().isAccessible();
    }
}
