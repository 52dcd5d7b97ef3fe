package com.qcollector.backend.exception;

public class SchemaExecutorException extends RuntimeException {

    public enum Reason {
        TABLE_NOT_FOUND(false),
        COLUMN_NOT_FOUND(false),
        COLUMN_EXISTS(false),
        TYPE_CONVERSION(false),
        CONSTRAINT_VIOLATION(false),
        LOCK_TIMEOUT(true),
        CONNECTION_LOST(true);

        private final boolean transientFailure;

        Reason(boolean transientFailure) {
            this.transientFailure = transientFailure;
        }

        public boolean isTransient() {
            return transientFailure;
        }
    }

    private final Reason reason;

    public SchemaExecutorException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SchemaExecutorException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public boolean isTransient() {
        return reason.isTransient();
    }
}
