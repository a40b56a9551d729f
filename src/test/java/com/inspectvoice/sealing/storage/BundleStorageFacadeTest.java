package com.inspectvoice.sealing.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BundleStorageFacadeTest {

    private BundleStorageFacade facade;
    private InMemoryBundleStorage inMemory;

    @BeforeEach
    void setUp() {
        inMemory = new InMemoryBundleStorage();
        facade = new BundleStorageFacade();
        facade.mode = "in-memory";
        facade.keyPrefix = "sealed-exports/";
        facade.inMemoryStorage = inMemory;
    }

    @Test
    void objectKeyIsTenantScoped() {
        assertThat(facade.objectKey("t1", "b1")).isEqualTo("sealed-exports/t1/b1.zip");
    }

    @Test
    void inMemoryModeStoresAndReadsBack() {
        facade.put("k1", new byte[]{1, 2, 3}, Map.of("tenant_id", "t1"));

        assertThat(facade.get("k1").orElseThrow()).containsExactly(1, 2, 3);
        assertThat(facade.get("missing")).isEmpty();
        assertThat(inMemory.metadataOf("k1")).containsEntry("tenant_id", "t1");
        assertThat(facade.isAccessible()).isTrue();
    }

    @Test
    void objectsAreWriteOnce() {
        facade.put("k1", new byte[]{1}, Map.of());

        assertThatThrownBy(() -> facade.put("k1", new byte[]{2}, Map.of()))
                .isInstanceOf(StorageException.class);
        assertThat(facade.get("k1").orElseThrow()).containsExactly(1);
    }

    @Test
    void repeatingIdenticalPutIsANoOp() {
        facade.put("k1", new byte[]{1, 2}, Map.of());

        facade.put("k1", new byte[]{1, 2}, Map.of());

        assertThat(facade.get("k1").orElseThrow()).containsExactly(1, 2);
    }

    @Test
    void storedBytesAreCopied() {
        byte[] original = {1, 2};
        facade.put("k1", original, Map.of());
        original[0] = 9;

        assertThat(facade.get("k1").orElseThrow()).containsExactly(1, 2);
    }
}
