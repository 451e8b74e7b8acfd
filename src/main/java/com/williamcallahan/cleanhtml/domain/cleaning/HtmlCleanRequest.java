package com.williamcallahan.cleanhtml.domain.cleaning;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Markup or text submitted for cleaning, paragraph reconstruction or quote normalization.
 *
 * @param content submitted text
 * @param lineBreaks whether paragraph reconstruction converts single newlines to line breaks
 */
public record HtmlCleanRequest(String content, boolean lineBreaks) {

    /**
     * Creates a request, treating missing content as empty and missing line-break flag as on.
     *
     * @param content submitted text
     * @param lineBreaks line-break flag, may be null
     * @return normalized request
     */
    @JsonCreator
    public static HtmlCleanRequest create(@JsonProperty("content") String content,
                                          @JsonProperty("lineBreaks") Boolean lineBreaks) {
        return new HtmlCleanRequest(content == null ? "" : content, lineBreaks == null || lineBreaks);
    }

    public HtmlCleanRequest {
        Objects.requireNonNull(content, "Content cannot be null");
    }
}
