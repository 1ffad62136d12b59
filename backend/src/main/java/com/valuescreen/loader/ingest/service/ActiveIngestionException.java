package com.valuescreen.loader.ingest.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveIngestionException extends RuntimeException {
    public ActiveIngestionException(String message) {
        super(message);
    }
}
