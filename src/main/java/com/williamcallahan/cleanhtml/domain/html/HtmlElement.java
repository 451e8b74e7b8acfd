package com.williamcallahan.cleanhtml.domain.html;

import com.williamcallahan.cleanhtml.support.AsciiTextNormalizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Element node with a lowercase tag name, its attributes and ordered children.
 *
 * @param tagName lowercase tag name
 * @param attributes attribute values keyed by name; iteration follows source order
 * @param children child nodes in document order
 */
public record HtmlElement(String tagName, Map<String, String> attributes, List<HtmlNode> children)
        implements HtmlNode {

    public HtmlElement {
        Objects.requireNonNull(tagName, "Tag name cannot be null");
        if (tagName.isBlank()) {
            throw new IllegalArgumentException("Tag name cannot be blank");
        }
        tagName = AsciiTextNormalizer.toLowerAscii(tagName);
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates an attribute-less element.
     *
     * @param tagName tag name
     * @param children child nodes
     * @return new element
     */
    public static HtmlElement of(String tagName, HtmlNode... children) {
        return new HtmlElement(tagName, Map.of(), List.of(children));
    }

    /**
     * Returns a copy with a different tag name and the same attributes and children.
     *
     * @param newTagName replacement tag name
     * @return renamed element
     */
    public HtmlElement renamed(String newTagName) {
        return new HtmlElement(newTagName, attributes, children);
    }

    /**
     * Returns a copy holding different children.
     *
     * @param newChildren replacement children
     * @return element with the same name and attributes
     */
    public HtmlElement withChildren(List<HtmlNode> newChildren) {
        return new HtmlElement(tagName, attributes, newChildren);
    }

    /**
     * Checks the tag name against a list of candidates.
     *
     * @param candidates lowercase tag names
     * @return true when this element carries one of them
     */
    public boolean isNamed(String... candidates) {
        for (String candidate : candidates) {
            if (tagName.equals(candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns children that are not whitespace-only text.
     *
     * @return significant children in order
     */
    public List<HtmlNode> significantChildren() {
        return children.stream().filter(child -> !child.isBlankText()).toList();
    }

    @Override
    public String textContent() {
        StringBuilder text = new StringBuilder();
        for (HtmlNode child : children) {
            text.append(child.textContent());
        }
        return text.toString();
    }
}
