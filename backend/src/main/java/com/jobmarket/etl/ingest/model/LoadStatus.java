package com.jobmarket.etl.ingest.model;

public enum LoadStatus {
    LOADED,
    DUPLICATE,
    LOAD_FAILED,
    NOT_ATTEMPTED,
    SKIPPED
}
