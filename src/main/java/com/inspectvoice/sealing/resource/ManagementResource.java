package com.inspectvoice.sealing.resource;

import com.inspectvoice.sealing.SealedExportApplication;
import com.inspectvoice.sealing.crypto.SigningKeyResolver;
import com.inspectvoice.sealing.ledger.ChainLedgerFacade;
import com.inspectvoice.sealing.resource.dto.HealthResponse;
import com.inspectvoice.sealing.resource.dto.MetricsResponse;
import com.inspectvoice.sealing.storage.BundleStorageFacade;
import com.inspectvoice.sealing.util.SealingMetrics;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.lang.management.ManagementFactory;

@Path("/v1/manage")
@Produces(MediaType.APPLICATION_JSON)
@Tag(name = "Management", description = "Health and metrics endpoints")
public class ManagementResource {

    @Inject
    BundleStorageFacade bundleStorage;

    @Inject
    ChainLedgerFacade chainLedger;

    @Inject
    SigningKeyResolver signingKeyResolver;

    @Inject
    SealingMetrics sealingMetrics;

    @GET
    @Path("/health")
    @Operation(summary = "Health check")
    @APIResponse(responseCode = "200", description = "Service can seal")
    @APIResponse(responseCode = "503", description = "A dependency is down")
    public Response health() {
        boolean storageAccessible = bundleStorage.isAccessible();
        boolean ledgerAvailable = chainLedger.isAvailable();
        boolean keyConfigured = signingKeyResolver.isActiveKeyConfigured();
        boolean shuttingDown = SealedExportApplication.isShuttingDown();
        boolean up = !shuttingDown && storageAccessible && ledgerAvailable && keyConfigured;

        String status = shuttingDown ? "DOWN" : (up ? "UP" : "DEGRADED");
        HealthResponse body = new HealthResponse(status, storageAccessible, ledgerAvailable, keyConfigured);
        return up
                ? Response.ok(body).build()
                : Response.status(Response.Status.SERVICE_UNAVAILABLE).entity(body).build();
    }

    @GET
    @Path("/metrics")
    @Operation(summary = "Get sealing metrics", description = "Operational counters")
    @APIResponse(responseCode = "200", description = "Metrics retrieved")
    public Response getMetrics() {
        MetricsResponse metrics = new MetricsResponse();
        metrics.storageAccessible = bundleStorage.isAccessible();
        metrics.ledgerAvailable = chainLedger.isAvailable();
        metrics.activeSigningKeyId = signingKeyResolver.isActiveKeyConfigured()
                ? signingKeyResolver.activeKey().getKeyId()
                : null;
        metrics.legacySigningKeyCount = signingKeyResolver.getLegacyKeyCount();
        metrics.jvmUptime = ManagementFactory.getRuntimeMXBean().getUptime();
        metrics.jvmMemory = Runtime.getRuntime().totalMemory() - Runtime.getRuntime().freeMemory();
        metrics.sealingCounters = sealingMetrics.snapshot();
        return Response.ok(metrics).build();
    }
}
