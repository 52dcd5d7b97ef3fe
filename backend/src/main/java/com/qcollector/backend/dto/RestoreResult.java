package com.qcollector.backend.dto;

/**
 * Outcome of writing a backup back into its table. Restores report failure through this
 * object instead of throwing.
 */
public record RestoreResult(boolean success, String message, int restoredCount) {

    public static RestoreResult restored(int count) {
        return new RestoreResult(true, "Restored " + count + " records", count);
    }

    public static RestoreResult failed(String message) {
        return new RestoreResult(false, message, 0);
    }
}
