package com.inspectvoice.sealing.seal;

/**
 * Raised when a seal cannot complete. The {@link Failure} kind decides the HTTP status
 * the REST layer answers with.
 * <p>
 * {@code storageKey} is set when an archive was uploaded but never recorded in the
 * ledger; that object is orphaned and self-verifying.
 */
public class SealingException extends RuntimeException {

    public enum Failure {
        INVALID_INPUT(400),
        SIGNING_KEY_UNAVAILABLE(500),
        STORAGE_FAILED(503),
        LEDGER_FAILED(503),
        CHAIN_CONTENTION(409);

        private final int httpStatus;

        Failure(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int getHttpStatus() {
            return httpStatus;
        }
    }

    private final Failure failure;
    private final String bundleId;
    private final String storageKey;

    public SealingException(Failure failure, String message) {
        this(failure, message, null, null, null);
    }

    public SealingException(Failure failure, String message, Throwable cause) {
        this(failure, message, null, null, cause);
    }

    public SealingException(Failure failure, String message, String bundleId, String storageKey, Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.bundleId = bundleId;
        this.storageKey = storageKey;
    }

    public Failure getFailure() {
        return failure;
    }

    public String getBundleId() {
        return bundleId;
    }

    public String getStorageKey() {
        return storageKey;
    }
}
