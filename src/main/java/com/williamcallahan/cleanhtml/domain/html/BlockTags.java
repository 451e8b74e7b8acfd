package com.williamcallahan.cleanhtml.domain.html;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fixed set of block-level tag names.
 *
 * <p>Block tags are never wrapped inside an automatic paragraph and always start on their
 * own line when text is reconstructed into paragraphs.
 */
public final class BlockTags {

    private static final List<String> ORDERED_NAMES = List.of(
            "table", "thead", "tfoot", "caption", "col", "colgroup", "tbody", "tr", "td", "th",
            "div", "dl", "dd", "dt", "ul", "ol", "li", "pre", "select", "option", "form", "map",
            "area", "blockquote", "address", "math", "style", "p",
            "h1", "h2", "h3", "h4", "h5", "h6",
            "hr", "fieldset", "noscript", "legend", "section", "article", "aside", "hgroup",
            "header", "footer", "nav", "figure", "figcaption", "details", "menu", "summary");

    /** Every block tag name, lowercase. */
    public static final Set<String> NAMES = Set.copyOf(ORDERED_NAMES);

    // Longest first so that "colgroup" wins over "col" inside a regex alternation.
    private static final String ALTERNATION = ORDERED_NAMES.stream()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .collect(Collectors.joining("|", "(?:", ")"));

    private BlockTags() {}

    /**
     * Reports whether a tag name is block-level.
     *
     * @param tagName lowercase tag name
     * @return true for members of the block set
     */
    public static boolean isBlock(String tagName) {
        return tagName != null && NAMES.contains(tagName);
    }

    /**
     * Returns a non-capturing regex group matching any block tag name.
     *
     * @return regex alternation such as {@code (?:blockquote|...|p)}
     */
    public static String alternation() {
        return ALTERNATION;
    }
}
