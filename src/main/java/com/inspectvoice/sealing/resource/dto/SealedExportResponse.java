package com.inspectvoice.sealing.resource.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.inspectvoice.sealing.domain.SealedExportRow;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;

/**
 * A recorded bundle as returned by the API.
 */
@Schema(description = "Sealed export")
@JsonInclude(JsonInclude.Include.ALWAYS)
public class SealedExportResponse {

    @JsonProperty("bundle_id")
    public String bundleId;

    @JsonProperty("tenant_id")
    public String tenantId;

    @JsonProperty("export_type")
    public String exportType;

    @JsonProperty("source_id")
    public String sourceId;

    @JsonProperty("file_count")
    public int fileCount;

    @JsonProperty("total_bytes")
    public long totalBytes;

    @JsonProperty("storage_key")
    public String storageKey;

    @JsonProperty("manifest_sha256")
    public String manifestSha256;

    @JsonProperty("manifest_sig")
    public String manifestSig;

    @JsonProperty("signing_key_id")
    public String signingKeyId;

    @JsonProperty("prev_bundle_hash")
    public String prevBundleHash;

    @JsonProperty("generated_by")
    public String generatedBy;

    @JsonProperty("generated_at")
    public String generatedAt;

    @JsonProperty("created_at")
    public Instant createdAt;

    @JsonProperty("sequence")
    public long sequence;

    @Schema(description = "Public verification URL")
    @JsonProperty("verify_url")
    public String verifyUrl;

    public static SealedExportResponse from(SealedExportRow row, String verifyUrl) {
        SealedExportResponse response = new SealedExportResponse();
        response.bundleId = row.getBundleId();
        response.tenantId = row.getTenantId();
        response.exportType = row.getExportType() != null ? row.getExportType().getWireValue() : null;
        response.sourceId = row.getSourceId();
        response.fileCount = row.getFileCount();
        response.totalBytes = row.getTotalBytes();
        response.storageKey = row.getStorageKey();
        response.manifestSha256 = row.getManifestSha256();
        response.manifestSig = row.getManifestSig();
        response.signingKeyId = row.getSigningKeyId();
        response.prevBundleHash = row.getPrevBundleHash();
        response.generatedBy = row.getGeneratedBy();
        response.generatedAt = row.getGeneratedAt();
        response.createdAt = row.getCreatedAt();
        response.sequence = row.getSequence();
        response.verifyUrl = verifyUrl;
        return response;
    }
}
