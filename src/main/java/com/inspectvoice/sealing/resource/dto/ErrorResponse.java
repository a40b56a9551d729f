package com.inspectvoice.sealing.resource.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Standard error response for API endpoints.
 * <p>
 * Shared by every resource so failures look the same everywhere.
 */
@Schema(description = "Error response")
public class ErrorResponse {

    @Schema(example = "INVALID_INPUT")
    public String code;

    @Schema(example = "at least one file is required")
    public String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
