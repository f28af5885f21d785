package com.jobmarket.etl.ingest.model;

public enum DecisionOutcome {
    ACCEPTED,
    FLAGGED,
    REJECTED
}
