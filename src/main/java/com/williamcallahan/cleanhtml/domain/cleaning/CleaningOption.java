package com.williamcallahan.cleanhtml.domain.cleaning;

import java.util.List;
import java.util.Optional;

/**
 * Names the settable cleaning switches and the tags each one adds to the allowlist.
 */
public enum CleaningOption {
    IMAGES("images", List.of(new TagRule("img", "src", "alt"))),
    ITALICS("italics", List.of(new TagRule("em"), new TagRule("i"))),
    LINKS("links", List.of(new TagRule("a", "href", "target"))),
    STRIP("strip", List.of()),
    TABLE("table", List.of(new TagRule("table"), new TagRule("tr"), new TagRule("td")));

    private final String key;
    private final List<TagRule> addedTags;

    CleaningOption(String key, List<TagRule> addedTags) {
        this.key = key;
        this.addedTags = addedTags;
    }

    /**
     * Returns the external option name used in option maps.
     *
     * @return option key such as {@code images}
     */
    public String key() {
        return key;
    }

    List<TagRule> addedTags() {
        return addedTags;
    }

    /**
     * Resolves an option by its exact key.
     *
     * @param rawKey caller supplied key
     * @return matching option, or empty for unknown keys
     */
    public static Optional<CleaningOption> fromKey(String rawKey) {
        if (rawKey == null) {
            return Optional.empty();
        }
        for (CleaningOption option : values()) {
            if (option.key.equals(rawKey)) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }
}
