package com.tarantula.crawl.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An outbound link found on a page.
 *
 * @param url       normalized absolute URL
 * @param scope     position of the target relative to the page host
 * @param protocol  how the href spelled its scheme, null for relative hrefs
 * @param sourceTag element the link was read from
 */
public record Link(
    String url,
    UriScope scope,
    UriProtocol protocol,
    @JsonProperty("source_tag") String sourceTag
) {
}
