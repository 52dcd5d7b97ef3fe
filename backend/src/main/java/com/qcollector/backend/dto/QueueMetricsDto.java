package com.qcollector.backend.dto;

/**
 * Queue-wide counts. {@code delayed} is the subset of {@code waiting} held back by a retry backoff.
 */
public record QueueMetricsDto(long waiting, long delayed, long active, long completed, long failed, boolean paused) {

    public long total() {
        return waiting + active + completed + failed;
    }
}
