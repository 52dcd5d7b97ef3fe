package com.qcollector.backend.dto;

public record QueueStatusDto(long waiting, long active, long completed, long failed) {

    public long total() {
        return waiting + active + completed + failed;
    }
}
