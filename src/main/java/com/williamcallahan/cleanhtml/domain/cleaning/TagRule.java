package com.williamcallahan.cleanhtml.domain.cleaning;

import com.williamcallahan.cleanhtml.support.AsciiTextNormalizer;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One allowlist entry: a tag name and the attributes it may keep.
 *
 * @param tagName lowercase tag name
 * @param attributes permitted attribute names, in declaration order
 */
public record TagRule(String tagName, Set<String> attributes) {

    public TagRule {
        Objects.requireNonNull(tagName, "Tag name cannot be null");
        tagName = AsciiTextNormalizer.toLowerAscii(tagName);
        attributes = attributes == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(attributes));
    }

    public TagRule(String tagName, String... attributes) {
        this(tagName, new LinkedHashSet<>(List.of(attributes)));
    }

    /**
     * Renders the rule the way allowlist configurations are usually written, e.g. {@code img[src|alt]}.
     *
     * @return compact rule description
     */
    public String describe() {
        if (attributes.isEmpty()) {
            return tagName;
        }
        return tagName + "[" + String.join("|", attributes) + "]";
    }
}
