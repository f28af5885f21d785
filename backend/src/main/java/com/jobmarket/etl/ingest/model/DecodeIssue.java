package com.jobmarket.etl.ingest.model;

public record DecodeIssue(
    String field,
    String rawValue
) {
}
