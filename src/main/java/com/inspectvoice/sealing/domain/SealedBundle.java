package com.inspectvoice.sealing.domain;

/**
 * Output of packaging, held only until it has been uploaded and recorded.
 * Discarding it before the ledger append cancels the seal.
 */
public final class SealedBundle {

    private final String bundleId;
    private final byte[] archiveBytes;
    private final ExportManifest manifest;
    private final String manifestJson;
    private final String manifestSha256;
    private final String manifestSignature;

    public SealedBundle(String bundleId,
                        byte[] archiveBytes,
                        ExportManifest manifest,
                        String manifestJson,
                        String manifestSha256,
                        String manifestSignature) {
        this.bundleId = bundleId;
        this.archiveBytes = archiveBytes.clone();
        this.manifest = manifest;
        this.manifestJson = manifestJson;
        this.manifestSha256 = manifestSha256;
        this.manifestSignature = manifestSignature;
    }

    public String getBundleId() {
        return bundleId;
    }

    public byte[] getArchiveBytes() {
        return archiveBytes.clone();
    }

    public ExportManifest getManifest() {
        return manifest;
    }

    public String getManifestJson() {
        return manifestJson;
    }

    public String getManifestSha256() {
        return manifestSha256;
    }

    public String getManifestSignature() {
        return manifestSignature;
    }

    public long getTotalBytes() {
        return archiveBytes.length;
    }
}
