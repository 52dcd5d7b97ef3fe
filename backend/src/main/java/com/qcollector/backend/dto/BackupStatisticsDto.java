package com.qcollector.backend.dto;

import java.util.Map;

public record BackupStatisticsDto(long totalBackups, long totalRecords, Map<String, TypeTotals> byType) {

    public record TypeTotals(long count, long records) {
    }
}
