package com.inspectvoice.sealing.resource.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of a tenant's sealed exports, newest first.
 */
@Schema(description = "Sealed export page")
public class SealedExportListResponse {

    public List<SealedExportResponse> items = new ArrayList<>();

    public int limit;

    public int offset;

    public int count;

    public SealedExportListResponse(List<SealedExportResponse> items, int limit, int offset) {
        this.items = items;
        this.limit = limit;
        this.offset = offset;
        this.count = items.size();
    }
}
