package com.inspectvoice.sealing.resource.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.inspectvoice.sealing.domain.ExportManifest;
import com.inspectvoice.sealing.verify.VerificationResult;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Public verification outcome. Never carries file contents or key material.
 */
@Schema(description = "Verification response")
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerificationResponse {

    @Schema(example = "true")
    public boolean valid;

    @Schema(description = "Reason code", example = "valid")
    public String reason;

    public String detail;

    @JsonProperty("bundle_id")
    public String bundleId;

    @JsonProperty("export_type")
    public String exportType;

    @JsonProperty("generated_at")
    public String generatedAt;

    @JsonProperty("file_count")
    public Integer fileCount;

    @JsonProperty("signature_algorithm")
    public String signatureAlgorithm;

    @JsonProperty("signing_key_id")
    public String signingKeyId;

    @JsonProperty("manifest_sha256")
    public String manifestSha256;

    @JsonProperty("prev_bundle_hash")
    public String prevBundleHash;

    @Schema(description = "Whether the bundle was compared against the chain-of-custody ledger")
    @JsonProperty("chain_checked")
    public boolean chainChecked;

    public static VerificationResponse from(VerificationResult result) {
        VerificationResponse response = new VerificationResponse();
        response.valid = result.isValid();
        response.reason = result.getReason().getCode();
        response.detail = result.getDetail();
        response.manifestSha256 = result.getManifestSha256();
        response.chainChecked = result.isChainChecked();

        ExportManifest manifest = result.getManifest();
        if (manifest != null) {
            response.bundleId = manifest.getBundleId();
            response.exportType = manifest.getExportType() != null ? manifest.getExportType().getWireValue() : null;
            response.generatedAt = manifest.getGeneratedAt();
            response.fileCount = manifest.getFiles().size();
            response.signatureAlgorithm = manifest.getSignatureAlgorithm();
            response.signingKeyId = manifest.getSigningKeyId();
            response.prevBundleHash = manifest.getPrevBundleHash();
        }
        return response;
    }

    public static VerificationResponse rejected(String reason, String detail) {
        VerificationResponse response = new VerificationResponse();
        response.valid = false;
        response.reason = reason;
        response.detail = detail;
        return response;
    }
}
