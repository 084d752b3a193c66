package com.example.fundlens.api;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// No source, and no cache entry, had anything for the requested instrument
@ResponseStatus(HttpStatus.NOT_FOUND)
public class NoDataAvailableException extends RuntimeException {
    public NoDataAvailableException(String message) {
        super(message);
    }
}
