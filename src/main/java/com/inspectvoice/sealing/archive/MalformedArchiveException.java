package com.inspectvoice.sealing.archive;

/**
 * The bytes are not a readable sealed bundle (not a zip, unsafe entries, or missing
 * manifest members).
 */
public class MalformedArchiveException extends RuntimeException {
    public MalformedArchiveException(String message) {
        super(message);
    }

    public MalformedArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
