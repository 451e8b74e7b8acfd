package com.williamcallahan.cleanhtml.domain.cleaning;

import java.util.Objects;

/**
 * Result of a cleaning endpoint.
 *
 * @param html produced markup or text
 */
public record HtmlCleanResponse(String html) {

    public HtmlCleanResponse {
        Objects.requireNonNull(html, "HTML cannot be null");
    }
}
