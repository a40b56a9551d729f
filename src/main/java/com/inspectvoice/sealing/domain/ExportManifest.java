package com.inspectvoice.sealing.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * The signed description of a bundle: what it contains, who produced it, and which
 * manifest preceded it in the tenant's chain.
 * <p>
 * This is also the wire format third parties verify against, so every field is
 * always serialised (absent values as {@code null}) and the class is immutable.
 * {@code prev_bundle_hash} is the only field that links bundles together.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class ExportManifest {

    public static final int CURRENT_VERSION = 1;

    private final int version;
    private final String bundleId;
    private final String generatedAt;
    private final GeneratedBy generatedBy;
    private final String tenantId;
    private final ExportType exportType;
    private final String sourceId;
    private final String signatureAlgorithm;
    private final String signingKeyId;
    private final String verifyUrl;
    private final String prevBundleHash;
    private final List<ManifestFileEntry> files;

    @JsonCreator
    public ExportManifest(
            @JsonProperty("version") int version,
            @JsonProperty("bundle_id") String bundleId,
            @JsonProperty("generated_at") String generatedAt,
            @JsonProperty("generated_by") GeneratedBy generatedBy,
            @JsonProperty("tenant_id") String tenantId,
            @JsonProperty("export_type") ExportType exportType,
            @JsonProperty("source_id") String sourceId,
            @JsonProperty("signature_algorithm") String signatureAlgorithm,
            @JsonProperty("signing_key_id") String signingKeyId,
            @JsonProperty("verify_url") String verifyUrl,
            @JsonProperty("prev_bundle_hash") String prevBundleHash,
            @JsonProperty("files") List<ManifestFileEntry> files) {
        this.version = version;
        this.bundleId = bundleId;
        this.generatedAt = generatedAt;
        this.generatedBy = generatedBy;
        this.tenantId = tenantId;
        this.exportType = exportType;
        this.sourceId = sourceId;
        this.signatureAlgorithm = signatureAlgorithm;
        this.signingKeyId = signingKeyId;
        this.verifyUrl = verifyUrl;
        this.prevBundleHash = prevBundleHash;
        this.files = files == null ? List.of() : List.copyOf(files);
    }

    @JsonProperty("version")
    public int getVersion() {
        return version;
    }

    @JsonProperty("bundle_id")
    public String getBundleId() {
        return bundleId;
    }

    @JsonProperty("generated_at")
    public String getGeneratedAt() {
        return generatedAt;
    }

    @JsonProperty("generated_by")
    public GeneratedBy getGeneratedBy() {
        return generatedBy;
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

    @JsonProperty("signature_algorithm")
    public String getSignatureAlgorithm() {
        return signatureAlgorithm;
    }

    @JsonProperty("signing_key_id")
    public String getSigningKeyId() {
        return signingKeyId;
    }

    @JsonProperty("verify_url")
    public String getVerifyUrl() {
        return verifyUrl;
    }

    @JsonProperty("prev_bundle_hash")
    public String getPrevBundleHash() {
        return prevBundleHash;
    }

    @JsonProperty("files")
    public List<ManifestFileEntry> getFiles() {
        return files;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExportManifest)) {
            return false;
        }
        ExportManifest that = (ExportManifest) o;
        return version == that.version
                && Objects.equals(bundleId, that.bundleId)
                && Objects.equals(generatedAt, that.generatedAt)
                && Objects.equals(generatedBy, that.generatedBy)
                && Objects.equals(tenantId, that.tenantId)
                && exportType == that.exportType
                && Objects.equals(sourceId, that.sourceId)
                && Objects.equals(signatureAlgorithm, that.signatureAlgorithm)
                && Objects.equals(signingKeyId, that.signingKeyId)
                && Objects.equals(verifyUrl, that.verifyUrl)
                && Objects.equals(prevBundleHash, that.prevBundleHash)
                && Objects.equals(files, that.files);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, bundleId, generatedAt, generatedBy, tenantId, exportType, sourceId,
                signatureAlgorithm, signingKeyId, verifyUrl, prevBundleHash, files);
    }

    @Override
    public String toString() {
        return "ExportManifest{bundleId='" + bundleId + "', tenantId='" + tenantId
                + "', exportType=" + exportType + ", files=" + files.size() + "}";
    }
}
