package com.williamcallahan.cleanhtml.domain.html;

/**
 * Immutable node of a parsed HTML fragment: either an element or a run of text.
 *
 * <p>Nodes carry no identity beyond their position in the tree, so every transform
 * builds a new tree instead of mutating the old one.
 */
public sealed interface HtmlNode permits HtmlElement, HtmlText {

    /**
     * Returns the concatenated text of this node and its descendants.
     *
     * @return decoded text content, never null
     */
    String textContent();

    /**
     * Reports whether this node is text made only of whitespace.
     *
     * @return true for whitespace-only text nodes
     */
    default boolean isBlankText() {
        return false;
    }
}
