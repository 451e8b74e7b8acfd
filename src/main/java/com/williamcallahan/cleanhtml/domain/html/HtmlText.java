package com.williamcallahan.cleanhtml.domain.html;

import com.williamcallahan.cleanhtml.support.AsciiTextNormalizer;

import java.util.Objects;

/**
 * Decoded character data inside a fragment.
 *
 * @param content text exactly as decoded by the parser (entities resolved)
 */
public record HtmlText(String content) implements HtmlNode {

    public HtmlText {
        Objects.requireNonNull(content, "Text content cannot be null");
    }

    @Override
    public String textContent() {
        return content;
    }

    @Override
    public boolean isBlankText() {
        return AsciiTextNormalizer.isBlankIncludingNbsp(content);
    }
}
