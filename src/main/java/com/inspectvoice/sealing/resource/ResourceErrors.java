package com.inspectvoice.sealing.resource;

import com.inspectvoice.sealing.resource.dto.ErrorResponse;
import com.inspectvoice.sealing.seal.SealingException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Maps failures to {@link ErrorResponse}s the same way for every endpoint.
 */
final class ResourceErrors {

    private ResourceErrors() {
    }

    static Response of(Response.Status status, String code, String message) {
        return of(status.getStatusCode(), code, message);
    }

    static Response of(int status, String code, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(code, message))
                .build();
    }

    static Response invalidInput(String message) {
        return of(Response.Status.BAD_REQUEST, SealingException.Failure.INVALID_INPUT.name(), message);
    }

    static Response fromSealing(SealingException e) {
        SealingException.Failure failure = e.getFailure();
        // Internal details stay in the log for server-side failures
        String message = failure == SealingException.Failure.INVALID_INPUT
                ? e.getMessage()
                : describe(failure);
        return of(failure.getHttpStatus(), failure.name(), message);
    }

    static Response ledgerUnavailable() {
        return of(Response.Status.SERVICE_UNAVAILABLE, SealingException.Failure.LEDGER_FAILED.name(),
                "Chain-of-custody ledger unavailable");
    }

    static Response storageUnavailable() {
        return of(Response.Status.SERVICE_UNAVAILABLE, SealingException.Failure.STORAGE_FAILED.name(),
                "Bundle storage unavailable");
    }

    private static String describe(SealingException.Failure failure) {
        switch (failure) {
            case SIGNING_KEY_UNAVAILABLE:
                return "Signing key unavailable";
            case STORAGE_FAILED:
                return "Bundle upload failed";
            case LEDGER_FAILED:
                return "Chain-of-custody ledger write failed";
            case CHAIN_CONTENTION:
                return "Concurrent exports for this tenant; retry the request";
            default:
                return "Sealing failed";
        }
    }
}
