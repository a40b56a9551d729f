package com.inspectvoice.sealing.archive;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entries of a bundle archive read back into memory, in archive order.
 */
public final class BundleArchive {

    private final Map<String, byte[]> entries;

    BundleArchive(Map<String, byte[]> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /** Raw {@code manifest.json} bytes, exactly as signed. */
    public byte[] manifestBytes() {
        return entries.get(BundlePaths.MANIFEST_ENTRY).clone();
    }

    public String signature() {
        return new String(entries.get(BundlePaths.SIGNATURE_ENTRY), StandardCharsets.UTF_8).trim();
    }

    public Optional<byte[]> entry(String path) {
        byte[] data = entries.get(path);
        return data == null ? Optional.empty() : Optional.of(data.clone());
    }

    /** Every entry path, manifest members included. */
    public Set<String> paths() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }
}
