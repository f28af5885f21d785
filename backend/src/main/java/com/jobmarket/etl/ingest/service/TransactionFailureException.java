package com.jobmarket.etl.ingest.service;

public class TransactionFailureException extends RuntimeException {
    private final int attempts;

    public TransactionFailureException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
