package com.tarantula.crawl.model;

/**
 * Where an href points, relative to the page it was found on.
 */
public enum UriScope {
    // "/"
    ROOT,
    // "/deeplink", "deeplink", "https://example.com/deeplink"
    SAME_DOMAIN,
    // "https://sub.example.com/deeplink"
    DIFFERENT_SUBDOMAIN,
    // "https://elsewhere.org/"
    EXTERNAL,
    // "#section"
    ANCHOR,
    // "mailto:someone@example.com"
    MAILTO,
    // "data:image/png;base64,..."
    EMBEDDED_IMAGE,
    // "javascript:void(0)"
    CODE,
    // "tel:+123", "ftp://..."
    UNKNOWN_PREFIX
}
