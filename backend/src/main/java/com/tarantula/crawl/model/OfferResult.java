package com.tarantula.crawl.model;

public enum OfferResult {
    ACCEPTED,
    DUPLICATE,
    DEPTH_EXCEEDED,
    SCHEME_UNSUPPORTED,
    MALFORMED,
    CLOSED;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
