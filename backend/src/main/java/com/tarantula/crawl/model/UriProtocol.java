package com.tarantula.crawl.model;

public enum UriProtocol {
    HTTP,
    HTTPS,
    // "//example.com/path", inherits the page scheme
    IMPLICIT
}
