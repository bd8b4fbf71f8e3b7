package com.feedreader.ingest.feed.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidFetchRequestException extends RuntimeException {
    public InvalidFetchRequestException(String message) {
        super(message);
    }
}
