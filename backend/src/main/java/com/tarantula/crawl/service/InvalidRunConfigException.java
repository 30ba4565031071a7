package com.tarantula.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidRunConfigException extends RuntimeException {
    public InvalidRunConfigException(String message) {
        super(message);
    }
}
