package com.inspectvoice.sealing.verify;

import com.inspectvoice.sealing.domain.ExportManifest;

/**
 * Outcome of verifying one bundle.
 * <p>
 * Manifest-derived fields are {@code null} when verification stopped before the manifest
 * could be read. {@code chainChecked} tells whether the ledger comparison ran.
 */
public final class VerificationResult {

    private final VerificationReason reason;
    private final String detail;
    private final ExportManifest manifest;
    private final String manifestSha256;
    private final boolean chainChecked;

    private VerificationResult(VerificationReason reason,
                               String detail,
                               ExportManifest manifest,
                               String manifestSha256,
                               boolean chainChecked) {
        this.reason = reason;
        this.detail = detail;
        this.manifest = manifest;
        this.manifestSha256 = manifestSha256;
        this.chainChecked = chainChecked;
    }

    static VerificationResult valid(ExportManifest manifest, String manifestSha256, boolean chainChecked) {
        return new VerificationResult(VerificationReason.VALID, null, manifest, manifestSha256, chainChecked);
    }

    static VerificationResult failure(VerificationReason reason, String detail) {
        return new VerificationResult(reason, detail, null, null, false);
    }

    static VerificationResult failure(VerificationReason reason, String detail,
                                      ExportManifest manifest, String manifestSha256, boolean chainChecked) {
        return new VerificationResult(reason, detail, manifest, manifestSha256, chainChecked);
    }

    public boolean isValid() {
        return reason == VerificationReason.VALID;
    }

    public VerificationReason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }

    public ExportManifest getManifest() {
        return manifest;
    }

    public String getManifestSha256() {
        return manifestSha256;
    }

    public boolean isChainChecked() {
        return chainChecked;
    }

    public String getBundleId() {
        return manifest != null ? manifest.getBundleId() : null;
    }

    @Override
    public String toString() {
        return "VerificationResult{reason=" + reason + ", bundleId=" + getBundleId()
                + ", chainChecked=" + chainChecked + (detail != null ? ", detail='" + detail + "'" : "") + "}";
    }
}
