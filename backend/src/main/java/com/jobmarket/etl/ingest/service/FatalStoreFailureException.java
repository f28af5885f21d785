package com.jobmarket.etl.ingest.service;

/** The store cannot be reached; the rest of the batch is abandoned. */
public class FatalStoreFailureException extends RuntimeException {
    public FatalStoreFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
