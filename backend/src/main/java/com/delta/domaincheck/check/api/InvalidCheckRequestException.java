package com.delta.domaincheck.check.api;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidCheckRequestException extends RuntimeException {
    public InvalidCheckRequestException(String message) {
        super(message);
    }
}
