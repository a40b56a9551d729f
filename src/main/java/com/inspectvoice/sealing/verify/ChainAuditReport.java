package com.inspectvoice.sealing.verify;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Result of a tenant hash-chain audit")
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChainAuditReport {

    public enum Status { VALID, BROKEN, EMPTY }

    public record BrokenLink(
            @JsonProperty("bundle_id") String bundleId,
            @JsonProperty("sequence") long sequence,
            @JsonProperty("expected_prev_hash") String expectedPrevHash,
            @JsonProperty("actual_prev_hash") String actualPrevHash
    ) {}

    @JsonProperty("tenant_id")
    private final String tenantId;

    @JsonProperty("status")
    private final Status status;

    @JsonProperty("total_entries")
    private final long totalEntries;

    @Schema(description = "Rows whose link was confirmed before the first break")
    @JsonProperty("verified_entries")
    private final long verifiedEntries;

    @JsonProperty("head_hash")
    private final String headHash;

    @JsonProperty("audited_at")
    private final Instant auditedAt;

    @JsonProperty("broken_link")
    private final BrokenLink brokenLink;

    public ChainAuditReport(String tenantId, Status status, long totalEntries, long verifiedEntries,
                            String headHash, Instant auditedAt, BrokenLink brokenLink) {
        this.tenantId = tenantId;
        this.status = status;
        this.totalEntries = totalEntries;
        this.verifiedEntries = verifiedEntries;
        this.headHash = headHash;
        this.auditedAt = auditedAt;
        this.brokenLink = brokenLink;
    }

    public String getTenantId() {
        return tenantId;
    }

    public Status getStatus() {
        return status;
    }

    public long getTotalEntries() {
        return totalEntries;
    }

    public long getVerifiedEntries() {
        return verifiedEntries;
    }

    public String getHeadHash() {
        return headHash;
    }

    public Instant getAuditedAt() {
        return auditedAt;
    }

    public BrokenLink getBrokenLink() {
        return brokenLink;
    }
}
