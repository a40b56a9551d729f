package com.inspectvoice.sealing.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of export kinds that can be sealed.
 */
public enum ExportType {

    PDF_REPORT("pdf_report"),
    DEFECT_EXPORT("defect_export"),
    CLAIMS_PACK("claims_pack");

    private final String wireValue;

    ExportType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Parses the manifest/wire value. Case-insensitive.
     *
     * @throws IllegalArgumentException for anything outside the closed set
     */
    @JsonCreator
    public static ExportType fromWireValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("export_type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExportType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown export_type: " + value);
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
