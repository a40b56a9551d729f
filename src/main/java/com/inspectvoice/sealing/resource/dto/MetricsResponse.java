package com.inspectvoice.sealing.resource.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * Metrics response.
 */
@Schema(description = "Metrics response")
public class MetricsResponse {

    @Schema(description = "Storage accessible")
    public boolean storageAccessible;

    @Schema(description = "Ledger reachable")
    public boolean ledgerAvailable;

    @Schema(description = "Active signing key id")
    public String activeSigningKeyId;

    @Schema(description = "Number of retired keys still accepted for verification")
    public int legacySigningKeyCount;

    @Schema(description = "JVM uptime in ms")
    public long jvmUptime;

    @Schema(description = "JVM used memory in bytes")
    public long jvmMemory;

    @Schema(description = "Sealing and verification counters")
    public Map<String, Long> sealingCounters;
}
