package com.jobmarket.etl.ingest.service;

/**
 * Thrown inside a record's load transaction when its external id is already stored and replace
 * was not requested. Unchecked so the surrounding transaction rolls back.
 */
public class DuplicateJobException extends RuntimeException {
    private final String externalId;

    public DuplicateJobException(String externalId) {
        super("Job " + externalId + " is already stored");
        this.externalId = externalId;
    }

    public String getExternalId() {
        return externalId;
    }
}
