package com.jobmarket.etl.ingest.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record QualityReport(
    String batchId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    int totalRecords,
    int accepted,
    int flagged,
    int rejected,
    int loaded,
    int duplicates,
    int loadFailed,
    int notAttempted,
    int duplicateIdCount,
    Map<String, Long> reasonCounts,
    Map<String, Double> fieldCompleteness,
    List<RejectedRecordEntry> rejectedRecords,
    List<LoadFailureEntry> loadFailures,
    Map<String, Long> skillCounts,
    Map<String, Long> seniorityDistribution
) {

    public record RejectedRecordEntry(
        int recordIndex,
        String externalId,
        List<String> reasons
    ) {
    }

    public record LoadFailureEntry(
        int recordIndex,
        String externalId,
        LoadStatus status,
        int attempts,
        String detail
    ) {
    }
}
