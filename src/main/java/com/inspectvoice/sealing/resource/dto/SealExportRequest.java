package com.inspectvoice.sealing.resource.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

/**
 * Seal request. File contents travel base64-encoded.
 */
@Schema(description = "Seal export request")
public class SealExportRequest {

    @NotBlank
    @Schema(description = "Tenant (organisation) id", example = "org-42")
    @JsonProperty("tenant_id")
    public String tenantId;

    @NotBlank
    @Schema(description = "pdf_report, defect_export or claims_pack", example = "pdf_report")
    @JsonProperty("export_type")
    public String exportType;

    @Schema(description = "Inspection or record the export was produced from (optional)")
    @JsonProperty("source_id")
    public String sourceId;

    @Valid
    @NotNull
    @JsonProperty("generated_by")
    public GeneratedByPayload generatedBy;

    @Valid
    @NotEmpty
    @JsonProperty("files")
    public List<FilePayload> files;

    public static class GeneratedByPayload {

        @NotBlank
        @JsonProperty("user_id")
        public String userId;

        @JsonProperty("display_name")
        public String displayName;
    }

    public static class FilePayload {

        @NotBlank
        @Schema(example = "report.pdf")
        @JsonProperty("path")
        public String path;

        @NotNull
        @Schema(description = "File bytes, standard base64")
        @JsonProperty("content_base64")
        public String contentBase64;

        @NotBlank
        @Schema(example = "application/pdf")
        @JsonProperty("content_type")
        public String contentType;
    }
}
