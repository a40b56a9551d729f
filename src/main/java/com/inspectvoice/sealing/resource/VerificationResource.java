package com.inspectvoice.sealing.resource;

import com.inspectvoice.sealing.ledger.LedgerException;
import com.inspectvoice.sealing.resource.dto.VerificationResponse;
import com.inspectvoice.sealing.storage.StorageException;
import com.inspectvoice.sealing.verify.BundleVerifier;
import com.inspectvoice.sealing.verify.VerificationReason;
import com.inspectvoice.sealing.verify.VerificationResult;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.util.regex.Pattern;

/**
 * Public verification API. This is where a bundle's {@code verify_url} points.
 * <p>
 * No authentication; {@link com.inspectvoice.sealing.filter.VerifyRateLimitFilter}
 * limits each client IP.
 */
@Path("/api/v1/verify")
@Produces(MediaType.APPLICATION_JSON)
@Tag(name = "Verification", description = "Public bundle verification")
public class VerificationResource {

    private static final Logger LOG = Logger.getLogger(VerificationResource.class);
    private static final Pattern UUID_V4 = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-4[0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

    @Inject
    BundleVerifier bundleVerifier;

    @GET
    @Path("/{bundleId}")
    @Operation(summary = "Verify a recorded bundle",
            description = "Re-checks the stored archive against its signature, file digests and the tenant chain")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Verification ran; see valid and reason",
                    content = @Content(schema = @Schema(implementation = VerificationResponse.class))),
            @APIResponse(responseCode = "400", description = "Invalid bundle id"),
            @APIResponse(responseCode = "404", description = "Bundle not found"),
            @APIResponse(responseCode = "429", description = "Rate limited")
    })
    public Response verifyStored(@PathParam("bundleId") String bundleId) {
        if (bundleId == null || !UUID_V4.matcher(bundleId).matches()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(VerificationResponse.rejected("invalid_bundle_id", "Invalid bundle ID format"))
                    .build();
        }

        try {
            VerificationResult result = bundleVerifier.verifyStored(bundleId.toLowerCase());
            if (result.getReason() == VerificationReason.BUNDLE_NOT_FOUND) {
                return Response.status(Response.Status.NOT_FOUND)
                        .entity(VerificationResponse.from(result))
                        .build();
            }
            return Response.ok(VerificationResponse.from(result)).build();
        } catch (LedgerException e) {
            LOG.errorf(e, "Ledger error verifying bundle %s", bundleId);
            return ResourceErrors.ledgerUnavailable();
        } catch (StorageException e) {
            LOG.errorf(e, "Storage error verifying bundle %s", bundleId);
            return ResourceErrors.storageUnavailable();
        }
    }

    @POST
    @Consumes({"application/zip", MediaType.APPLICATION_OCTET_STREAM})
    @Operation(summary = "Verify an uploaded bundle",
            description = "Checks a bundle archive supplied in the request body")
    @APIResponse(responseCode = "200", description = "Verification ran; see valid and reason",
            content = @Content(schema = @Schema(implementation = VerificationResponse.class)))
    public Response verifyUpload(byte[] archive) {
        VerificationResult result = bundleVerifier.verify(archive);
        return Response.ok(VerificationResponse.from(result)).build();
    }
}
