package com.jobmarket.etl.ingest.model;

/**
 * Result of the per-record stages that run before loading. {@code job} is {@code null} for rejected
 * records; {@code decoded} is {@code null} only when decoding itself could not run.
 */
public record ProcessedRecord(
    int recordIndex,
    DecodedJobRecord decoded,
    RecordDecision decision,
    NormalizedJob job
) {

    public String externalId() {
        return decision.externalId();
    }
}
