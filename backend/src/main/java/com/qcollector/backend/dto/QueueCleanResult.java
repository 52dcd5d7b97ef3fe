package com.qcollector.backend.dto;

public record QueueCleanResult(int completedRemoved, int failedRemoved) {
}
