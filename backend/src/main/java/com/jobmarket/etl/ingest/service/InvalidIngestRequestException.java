package com.jobmarket.etl.ingest.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidIngestRequestException extends RuntimeException {
    public InvalidIngestRequestException(String message) {
        super(message);
    }
}
