package com.williamcallahan.cleanhtml.domain.cleaning;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tag and attribute allowlist handed to the sanitizing filter.
 *
 * @param rules allowed tags with their permitted attributes
 */
public record AllowedTags(List<TagRule> rules) {

    /** Tags that survive cleaning regardless of options, unless everything is stripped. */
    public static final List<TagRule> BASELINE = List.of(
            new TagRule("h1"), new TagRule("h2"), new TagRule("h3"), new TagRule("h4"), new TagRule("h5"),
            new TagRule("p"), new TagRule("strong"), new TagRule("b"),
            new TagRule("ul"), new TagRule("ol"), new TagRule("li"),
            new TagRule("hr"), new TagRule("pre"), new TagRule("code"));

    public AllowedTags {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * Returns an allowlist that permits no tags at all.
     *
     * @return empty allowlist
     */
    public static AllowedTags none() {
        return new AllowedTags(List.of());
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /**
     * Returns the allowed tag names.
     *
     * @return tag names in declaration order
     */
    public Set<String> tagNames() {
        return rules.stream().map(TagRule::tagName).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public boolean allows(String tagName) {
        return rule(tagName).isPresent();
    }

    /**
     * Looks up the rule for a tag.
     *
     * @param tagName lowercase tag name
     * @return the rule, or empty when the tag is not allowed
     */
    public Optional<TagRule> rule(String tagName) {
        return rules.stream().filter(rule -> rule.tagName().equals(tagName)).findFirst();
    }

    /**
     * Renders the allowlist as a comma separated rule list for diagnostics.
     *
     * @return e.g. {@code h1,h2,p,img[src|alt]}
     */
    public String describe() {
        return rules.stream().map(TagRule::describe).collect(Collectors.joining(","));
    }
}
