package com.jobmarket.etl.ingest.service;

import com.jobmarket.etl.ingest.model.LoadResult;

import java.util.List;

public record BatchLoadOutcome(
    List<LoadResult> results,
    boolean aborted
) {
}
