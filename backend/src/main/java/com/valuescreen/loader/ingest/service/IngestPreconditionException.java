package com.valuescreen.loader.ingest.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class IngestPreconditionException extends RuntimeException {
    public IngestPreconditionException(String message) {
        super(message);
    }
}
