package com.jobmarket.etl.ingest.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveIngestRunException extends RuntimeException {
    public ActiveIngestRunException(String message) {
        super(message);
    }
}
