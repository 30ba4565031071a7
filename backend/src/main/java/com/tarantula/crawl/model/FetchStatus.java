package com.tarantula.crawl.model;

public enum FetchStatus {
    OK,
    HTTP_ERROR,
    TIMEOUT,
    CONNECTION,
    REDIRECT_LIMIT,
    BODY_TOO_LARGE;

    public boolean isFailure() {
        return this != OK;
    }
}
