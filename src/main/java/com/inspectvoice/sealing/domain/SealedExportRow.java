package com.inspectvoice.sealing.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Append-only chain-of-custody entry, one per sealed bundle.
 * <p>
 * Rows are never updated or deleted by the service. {@code sequence} is the 1-based
 * position in the tenant chain and is assigned by the ledger when the row is appended;
 * rows built before the append carry {@code 0}.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class SealedExportRow {

    private final String bundleId;
    private final String tenantId;
    private final ExportType exportType;
    private final String sourceId;
    private final int fileCount;
    private final long totalBytes;
    private final String storageKey;
    private final String manifestSha256;
    private final String manifestSig;
    private final String signingKeyId;
    private final String prevBundleHash;
    private final String generatedBy;
    private final String generatedAt;
    private final Instant createdAt;
    private final long sequence;

    @JsonCreator
    public SealedExportRow(
            @JsonProperty("bundle_id") String bundleId,
            @JsonProperty("tenant_id") String tenantId,
            @JsonProperty("export_type") ExportType exportType,
            @JsonProperty("source_id") String sourceId,
            @JsonProperty("file_count") int fileCount,
            @JsonProperty("total_bytes") long totalBytes,
            @JsonProperty("storage_key") String storageKey,
            @JsonProperty("manifest_sha256") String manifestSha256,
            @JsonProperty("manifest_sig") String manifestSig,
            @JsonProperty("signing_key_id") String signingKeyId,
            @JsonProperty("prev_bundle_hash") String prevBundleHash,
            @JsonProperty("generated_by") String generatedBy,
            @JsonProperty("generated_at") String generatedAt,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("sequence") long sequence) {
        this.bundleId = bundleId;
        this.tenantId = tenantId;
        this.exportType = exportType;
        this.sourceId = sourceId;
        this.fileCount = fileCount;
        this.totalBytes = totalBytes;
        this.storageKey = storageKey;
        this.manifestSha256 = manifestSha256;
        this.manifestSig = manifestSig;
        this.signingKeyId = signingKeyId;
        this.prevBundleHash = prevBundleHash;
        this.generatedBy = generatedBy;
        this.generatedAt = generatedAt;
        this.createdAt = createdAt;
        this.sequence = sequence;
    }

    /**
     * Builds the row for a freshly sealed and uploaded bundle.
     */
    public static SealedExportRow forBundle(SealedBundle bundle, String storageKey, Instant createdAt) {
        ExportManifest manifest = bundle.getManifest();
        return new SealedExportRow(
                bundle.getBundleId(),
                manifest.getTenantId(),
                manifest.getExportType(),
                manifest.getSourceId(),
                manifest.getFiles().size(),
                bundle.getTotalBytes(),
                storageKey,
                bundle.getManifestSha256(),
                bundle.getManifestSignature(),
                manifest.getSigningKeyId(),
                manifest.getPrevBundleHash(),
                manifest.getGeneratedBy() != null ? manifest.getGeneratedBy().getUserId() : null,
                manifest.getGeneratedAt(),
                createdAt,
                0L);
    }

    /**
     * Copy with the chain position assigned by the ledger.
     */
    public SealedExportRow withSequence(long assignedSequence) {
        return new SealedExportRow(bundleId, tenantId, exportType, sourceId, fileCount, totalBytes, storageKey,
                manifestSha256, manifestSig, signingKeyId, prevBundleHash, generatedBy, generatedAt, createdAt,
                assignedSequence);
    }

    @JsonProperty("bundle_id")
    public String getBundleId() {
        return bundleId;
    }

    @JsonProperty("tenant_id")
    public String getTenantId() {
        return tenantId;
    }

    @JsonProperty("export_type")
    public ExportType getExportType() {
        return exportType;
    }

    @JsonProperty("source_id")
    public String getSourceId() {
        return sourceId;
    }

    @JsonProperty("file_count")
    public int getFileCount() {
        return fileCount;
    }

    @JsonProperty("total_bytes")
    public long getTotalBytes() {
        return totalBytes;
    }

    @JsonProperty("storage_key")
    public String getStorageKey() {
        return storageKey;
    }

    @JsonProperty("manifest_sha256")
    public String getManifestSha256() {
        return manifestSha256;
    }

    @JsonProperty("manifest_sig")
    public String getManifestSig() {
        return manifestSig;
    }

    @JsonProperty("signing_key_id")
    public String getSigningKeyId() {
        return signingKeyId;
    }

    @JsonProperty("prev_bundle_hash")
    public String getPrevBundleHash() {
        return prevBundleHash;
    }

    @JsonProperty("generated_by")
    public String getGeneratedBy() {
        return generatedBy;
    }

    @JsonProperty("generated_at")
    public String getGeneratedAt() {
        return generatedAt;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("sequence")
    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "SealedExportRow{bundleId='" + bundleId + "', tenantId='" + tenantId + "', sequence=" + sequence
                + ", manifestSha256='" + manifestSha256 + "', prevBundleHash='" + prevBundleHash + "'}";
    }
}
