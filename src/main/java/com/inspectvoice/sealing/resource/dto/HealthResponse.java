package com.inspectvoice.sealing.resource.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Health check response.
 */
@Schema(description = "Health response")
public class HealthResponse {

    @Schema(example = "UP")
    public String status;

    @Schema(example = "true")
    public boolean storageAccessible;

    @Schema(example = "true")
    public boolean ledgerAvailable;

    @Schema(example = "true")
    public boolean signingKeyConfigured;

    public HealthResponse(String status, boolean storageAccessible, boolean ledgerAvailable, boolean signingKeyConfigured) {
        this.status = status;
        this.storageAccessible = storageAccessible;
        this.ledgerAvailable = ledgerAvailable;
        this.signingKeyConfigured = signingKeyConfigured;
    }

    public String getStatus() {
        return status;
    }

    public boolean isStorageAccessible() {
        return storageAccessible;
    }

    public boolean isLedgerAvailable() {
        return ledgerAvailable;
    }

    public boolean isSigningKeyConfigured() {
        return signingKeyConfigured;
    }
}
