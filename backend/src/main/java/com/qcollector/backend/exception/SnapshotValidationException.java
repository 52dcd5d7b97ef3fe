package com.qcollector.backend.exception;

/**
 * A backup snapshot does not have the expected shape. Raised before anything is persisted.
 */
public class SnapshotValidationException extends RuntimeException {

    public SnapshotValidationException(String message) {
        super(message);
    }
}
