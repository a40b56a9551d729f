package com.inspectvoice.sealing.verify;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a bundle did or did not verify. Callers branch on the code, never on a bare boolean.
 */
public enum VerificationReason {
    VALID("valid"),
    MALFORMED_ARCHIVE("malformed_archive"),
    MALFORMED_MANIFEST("malformed_manifest"),
    UNKNOWN_KEY("unknown_key"),
    SIGNATURE_INVALID("signature_invalid"),
    FILE_MISSING("file_missing"),
    FILE_HASH_MISMATCH("file_hash_mismatch"),
    UNDECLARED_FILE("undeclared_file"),
    CHAIN_MISMATCH("chain_mismatch"),
    BUNDLE_NOT_FOUND("bundle_not_found");

    private final String code;

    VerificationReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /** Content or history was altered, as opposed to an unreadable or unknown bundle. */
    public boolean indicatesTampering() {
        switch (this) {
            case SIGNATURE_INVALID:
            case FILE_MISSING:
            case FILE_HASH_MISMATCH:
            case UNDECLARED_FILE:
            case CHAIN_MISMATCH:
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return code;
    }
}
