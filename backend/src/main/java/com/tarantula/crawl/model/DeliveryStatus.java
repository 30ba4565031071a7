package com.tarantula.crawl.model;

public enum DeliveryStatus {
    QUEUED,
    // queue full, event discarded
    DROPPED,
    // run has no callback destination
    SKIPPED
}
