package com.jobmarket.etl.ingest.model;

public record LoadResult(
    int recordIndex,
    String externalId,
    LoadStatus status,
    Long jobId,
    int attempts,
    String detail
) {

    public static LoadResult loaded(int recordIndex, String externalId, long jobId, int attempts) {
        return new LoadResult(recordIndex, externalId, LoadStatus.LOADED, jobId, attempts, null);
    }

    public static LoadResult skipped(int recordIndex, String externalId) {
        return new LoadResult(recordIndex, externalId, LoadStatus.SKIPPED, null, 0, null);
    }

    public static LoadResult notAttempted(int recordIndex, String externalId, String detail) {
        return new LoadResult(recordIndex, externalId, LoadStatus.NOT_ATTEMPTED, null, 0, detail);
    }
}
