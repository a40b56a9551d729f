package com.inspectvoice.sealing.seal;

import com.inspectvoice.sealing.domain.BundleFile;
import com.inspectvoice.sealing.domain.ExportType;
import com.inspectvoice.sealing.domain.GeneratedBy;

import java.util.List;

/**
 * What an export feature hands over for sealing.
 */
public final class SealRequest {

    private final String tenantId;
    private final ExportType exportType;
    private final String sourceId;
    private final GeneratedBy generatedBy;
    private final List<BundleFile> files;

    public SealRequest(String tenantId,
                       ExportType exportType,
                       String sourceId,
                       GeneratedBy generatedBy,
                       List<BundleFile> files) {
        this.tenantId = tenantId;
        this.exportType = exportType;
        this.sourceId = sourceId;
        this.generatedBy = generatedBy;
        this.files = files == null ? List.of() : List.copyOf(files);
    }

    public String getTenantId() {
        return tenantId;
    }

    public ExportType getExportType() {
        return exportType;
    }

    /** Optional id of the inspection or record the export was produced from. */
    public String getSourceId() {
        return sourceId;
    }

    public GeneratedBy getGeneratedBy() {
        return generatedBy;
    }

    public List<BundleFile> getFiles() {
        return files;
    }

    @Override
    public String toString() {
        return "SealRequest{tenantId='" + tenantId + "', exportType=" + exportType
                + ", sourceId='" + sourceId + "', files=" + files.size() + "}";
    }
}
