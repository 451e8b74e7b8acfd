package com.williamcallahan.cleanhtml.service.html;

import com.williamcallahan.cleanhtml.domain.cleaning.AllowedTags;

/**
 * Allowlist enforcer applied between the two normalization passes.
 *
 * <p>Implementations emit UTF-8 text with non-ASCII characters unescaped, never keep inline
 * style properties, drop elements that are empty or hold only non-breaking spaces, and keep
 * exactly the tags and attributes in the supplied allowlist. Output must be well formed.
 */
@FunctionalInterface
public interface SanitizingFilter {

    /**
     * Filters a serialized fragment.
     *
     * @param fragmentText fragment markup
     * @param allowedTags tags and attributes that may survive
     * @return filtered, well-formed fragment markup
     */
    String filter(String fragmentText, AllowedTags allowedTags);
}
