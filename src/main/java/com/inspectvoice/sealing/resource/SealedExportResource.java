package com.inspectvoice.sealing.resource;

import com.inspectvoice.sealing.domain.BundleFile;
import com.inspectvoice.sealing.domain.ExportType;
import com.inspectvoice.sealing.domain.GeneratedBy;
import com.inspectvoice.sealing.domain.SealedExportRow;
import com.inspectvoice.sealing.ledger.ChainLedgerFacade;
import com.inspectvoice.sealing.ledger.LedgerException;
import com.inspectvoice.sealing.manifest.ManifestBuilder;
import com.inspectvoice.sealing.resource.dto.ErrorResponse;
import com.inspectvoice.sealing.resource.dto.SealExportRequest;
import com.inspectvoice.sealing.resource.dto.SealedExportListResponse;
import com.inspectvoice.sealing.resource.dto.SealedExportResponse;
import com.inspectvoice.sealing.seal.SealRequest;
import com.inspectvoice.sealing.seal.SealingException;
import com.inspectvoice.sealing.seal.SealingService;
import com.inspectvoice.sealing.storage.BundleStorage;
import com.inspectvoice.sealing.storage.BundleStorageFacade;
import com.inspectvoice.sealing.storage.StorageException;
import com.inspectvoice.sealing.verify.ChainAuditReport;
import com.inspectvoice.sealing.verify.ChainAuditor;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Sealed export API used by the export features and the admin UI.
 */
@Path("/v1/sealed-exports")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(name = "Sealed exports", description = "Seal, list and download tamper-evident export bundles")
public class SealedExportResource {

    private static final Logger LOG = Logger.getLogger(SealedExportResource.class);

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 100;

    @Inject
    SealingService sealingService;

    @Inject
    ChainLedgerFacade chainLedger;

    @Inject
    BundleStorageFacade bundleStorage;

    @Inject
    ChainAuditor chainAuditor;

    @Inject
    ManifestBuilder manifestBuilder;

    @Inject
    Validator validator;

    @POST
    @Operation(summary = "Seal an export", description = "Packages, signs, uploads and chains a bundle")
    @APIResponses({
            @APIResponse(responseCode = "201", description = "Bundle sealed",
                    content = @Content(schema = @Schema(implementation = SealedExportResponse.class))),
            @APIResponse(responseCode = "400", description = "Invalid request",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @APIResponse(responseCode = "409", description = "Chain contention, retry"),
            @APIResponse(responseCode = "503", description = "Storage or ledger unavailable")
    })
    public Response seal(SealExportRequest body) {
        if (body == null) {
            return ResourceErrors.invalidInput("request body is required");
        }
        Set<ConstraintViolation<SealExportRequest>> violations = validator.validate(body);
        if (!violations.isEmpty()) {
            ConstraintViolation<SealExportRequest> first = violations.iterator().next();
            return ResourceErrors.invalidInput(first.getPropertyPath() + " " + first.getMessage());
        }

        SealRequest request;
        try {
            request = toSealRequest(body);
        } catch (IllegalArgumentException e) {
            return ResourceErrors.invalidInput(e.getMessage());
        }

        try {
            SealedExportRow row = sealingService.seal(request);
            return Response.status(Response.Status.CREATED)
                    .entity(SealedExportResponse.from(row, manifestBuilder.verifyUrl(row.getBundleId())))
                    .build();
        } catch (SealingException e) {
            if (e.getFailure() == SealingException.Failure.INVALID_INPUT) {
                LOG.warnf("Rejected seal request for tenant %s: %s", body.tenantId, e.getMessage());
            } else {
                LOG.errorf(e, "Seal failed for tenant %s: failure=%s, bundle=%s, orphanedKey=%s",
                        body.tenantId, e.getFailure(), e.getBundleId(), e.getStorageKey());
            }
            return ResourceErrors.fromSealing(e);
        }
    }

    private static SealRequest toSealRequest(SealExportRequest body) {
        ExportType exportType = ExportType.fromWireValue(body.exportType);
        List<BundleFile> files = new ArrayList<>(body.files.size());
        for (SealExportRequest.FilePayload file : body.files) {
            byte[] data;
            try {
                data = Base64.getDecoder().decode(file.contentBase64);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("content_base64 of " + file.path + " is not valid base64");
            }
            files.add(new BundleFile(file.path, data, file.contentType));
        }
        return new SealRequest(body.tenantId, exportType, body.sourceId,
                new GeneratedBy(body.generatedBy.userId, body.generatedBy.displayName), files);
    }

    @GET
    @Operation(summary = "List sealed exports", description = "Newest first, paged")
    @APIResponse(responseCode = "200", description = "Page of sealed exports")
    public Response list(@QueryParam("tenant_id") String tenantId,
                         @QueryParam("export_type") String exportType,
                         @QueryParam("limit") Integer limit,
                         @QueryParam("offset") Integer offset) {
        if (tenantId == null || tenantId.isBlank()) {
            return ResourceErrors.invalidInput("tenant_id is required");
        }
        int pageLimit = limit == null || limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        int pageOffset = offset == null || offset < 0 ? 0 : offset;

        ExportType filter = null;
        if (exportType != null && !exportType.isBlank()) {
            try {
                filter = ExportType.fromWireValue(exportType);
            } catch (IllegalArgumentException e) {
                return ResourceErrors.invalidInput(e.getMessage());
            }
        }

        try {
            List<SealedExportRow> rows = filter == null
                    ? chainLedger.listByTenant(tenantId, pageLimit, pageOffset)
                    : filteredPage(tenantId, filter, pageLimit, pageOffset);
            List<SealedExportResponse> items = new ArrayList<>(rows.size());
            for (SealedExportRow row : rows) {
                items.add(SealedExportResponse.from(row, manifestBuilder.verifyUrl(row.getBundleId())));
            }
            return Response.ok(new SealedExportListResponse(items, pageLimit, pageOffset)).build();
        } catch (LedgerException e) {
            LOG.errorf(e, "Failed to list sealed exports for tenant %s", tenantId);
            return ResourceErrors.ledgerUnavailable();
        }
    }

    private List<SealedExportRow> filteredPage(String tenantId, ExportType filter, int limit, int offset) {
        List<SealedExportRow> chain = chainLedger.chainOf(tenantId);
        List<SealedExportRow> page = new ArrayList<>();
        int skipped = 0;
        for (int i = chain.size() - 1; i >= 0 && page.size() < limit; i--) {
            SealedExportRow row = chain.get(i);
            if (row.getExportType() != filter) {
                continue;
            }
            if (skipped < offset) {
                skipped++;
                continue;
            }
            page.add(row);
        }
        return page;
    }

    @GET
    @Path("/{bundleId}")
    @Operation(summary = "Get a sealed export")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Ledger row"),
            @APIResponse(responseCode = "404", description = "Unknown bundle")
    })
    public Response get(@PathParam("bundleId") String bundleId) {
        try {
            Optional<SealedExportRow> row = chainLedger.findByBundleId(bundleId);
            if (row.isEmpty()) {
                return ResourceErrors.of(Response.Status.NOT_FOUND, "BUNDLE_NOT_FOUND", "Bundle not found: " + bundleId);
            }
            return Response.ok(SealedExportResponse.from(row.get(), manifestBuilder.verifyUrl(bundleId))).build();
        } catch (LedgerException e) {
            LOG.errorf(e, "Failed to read sealed export %s", bundleId);
            return ResourceErrors.ledgerUnavailable();
        }
    }

    @GET
    @Path("/{bundleId}/download")
    @Produces({BundleStorage.CONTENT_TYPE, MediaType.APPLICATION_JSON})
    @Operation(summary = "Download a sealed bundle", description = "Returns the archive exactly as stored")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Zip archive"),
            @APIResponse(responseCode = "404", description = "Unknown bundle or missing archive")
    })
    public Response download(@PathParam("bundleId") String bundleId) {
        Optional<SealedExportRow> row;
        try {
            row = chainLedger.findByBundleId(bundleId);
        } catch (LedgerException e) {
            LOG.errorf(e, "Failed to read sealed export %s", bundleId);
            return ResourceErrors.ledgerUnavailable();
        }
        if (row.isEmpty()) {
            return ResourceErrors.of(Response.Status.NOT_FOUND, "BUNDLE_NOT_FOUND", "Bundle not found: " + bundleId);
        }

        Optional<byte[]> archive;
        try {
            archive = bundleStorage.get(row.get().getStorageKey());
        } catch (StorageException e) {
            LOG.errorf(e, "Failed to fetch archive %s for bundle %s", row.get().getStorageKey(), bundleId);
            return ResourceErrors.storageUnavailable();
        }
        if (archive.isEmpty()) {
            LOG.errorf("Archive %s missing from storage for recorded bundle %s", row.get().getStorageKey(), bundleId);
            return ResourceErrors.of(Response.Status.NOT_FOUND, "ARCHIVE_NOT_FOUND", "Archive not found for bundle " + bundleId);
        }

        return Response.ok(archive.get(), BundleStorage.CONTENT_TYPE)
                .header("Content-Disposition", "attachment; filename=\"InspectVoice_Bundle_" + bundleId + ".zip\"")
                .header("X-Bundle-Id", bundleId)
                .header("X-Manifest-SHA256", row.get().getManifestSha256())
                .build();
    }

    @GET
    @Path("/tenants/{tenantId}/chain-audit")
    @Operation(summary = "Audit a tenant chain", description = "Checks every prev_bundle_hash link in the ledger")
    @APIResponse(responseCode = "200", description = "Audit report",
            content = @Content(schema = @Schema(implementation = ChainAuditReport.class)))
    public Response chainAudit(@PathParam("tenantId") String tenantId) {
        try {
            return Response.ok(chainAuditor.audit(tenantId)).build();
        } catch (LedgerException e) {
            LOG.errorf(e, "Chain audit failed for tenant %s", tenantId);
            return ResourceErrors.ledgerUnavailable();
        }
    }
}
