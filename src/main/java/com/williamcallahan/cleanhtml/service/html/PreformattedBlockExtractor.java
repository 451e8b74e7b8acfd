package com.williamcallahan.cleanhtml.service.html;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Swaps complete {@code <pre>} blocks for numbered placeholders and puts them back later.
 *
 * <p>One instance serves a single reconstruction call. Placeholders are themselves empty
 * {@code pre} elements, so the paragraph rules treat them as block tags.
 */
final class PreformattedBlockExtractor {

    private static final Pattern OPENING_TAG = Pattern.compile("<pre(?=[\\s/>])", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLOSING_TAG = Pattern.compile("</pre>", Pattern.CASE_INSENSITIVE);
    private static final String PLACEHOLDER_TEMPLATE = "<pre autop-pre-tag-%d></pre>";
    private static final Pattern PLACEHOLDER = Pattern.compile("<pre autop-pre-tag-\\d+></pre>");

    private final Map<String, String> blocksByPlaceholder = new LinkedHashMap<>();

    /**
     * Replaces every complete preformatted block with a placeholder.
     *
     * <p>Text after the last closing tag is left alone, which also leaves an unterminated
     * {@code <pre>} unprotected.
     *
     * @param text reconstruction input
     * @return text with placeholders in place of preformatted blocks
     */
    String extract(String text) {
        if (!OPENING_TAG.matcher(text).find()) {
            return text;
        }
        StringBuilder protectedText = new StringBuilder(text.length());
        Matcher closingMatcher = CLOSING_TAG.matcher(text);
        int segmentStart = 0;
        while (closingMatcher.find()) {
            String segment = text.substring(segmentStart, closingMatcher.start());
            String closingTag = closingMatcher.group();
            Matcher openingMatcher = OPENING_TAG.matcher(segment);
            if (openingMatcher.find()) {
                String placeholder = String.format(PLACEHOLDER_TEMPLATE, blocksByPlaceholder.size());
                blocksByPlaceholder.put(placeholder, segment.substring(openingMatcher.start()) + closingTag);
                protectedText.append(segment, 0, openingMatcher.start()).append(placeholder);
            } else {
                // stray closing tag without an opening: keep it as plain text
                protectedText.append(segment).append(closingTag);
            }
            segmentStart = closingMatcher.end();
        }
        protectedText.append(text, segmentStart, text.length());
        return protectedText.toString();
    }

    /**
     * Puts every recorded block back in place of its placeholder.
     *
     * @param text reconstructed text still holding placeholders
     * @return text with the original blocks restored
     * @throws PlaceholderRestorationException when a placeholder is missing or duplicated
     */
    String restore(String text) {
        if (blocksByPlaceholder.isEmpty()) {
            return text;
        }
        Map<String, Integer> occurrences = new HashMap<>();
        Matcher counter = PLACEHOLDER.matcher(text);
        while (counter.find()) {
            occurrences.merge(counter.group(), 1, Integer::sum);
        }
        for (String placeholder : blocksByPlaceholder.keySet()) {
            int count = occurrences.getOrDefault(placeholder, 0);
            if (count == 0) {
                throw new PlaceholderRestorationException("Placeholder missing from output: " + placeholder);
            }
            if (count > 1) {
                throw new PlaceholderRestorationException("Placeholder appears more than once: " + placeholder);
            }
        }
        // one pass, so restored blocks are never rescanned
        return PLACEHOLDER.matcher(text).replaceAll(match -> Matcher.quoteReplacement(
                blocksByPlaceholder.getOrDefault(match.group(), match.group())));
    }

    int placeholderCount() {
        return blocksByPlaceholder.size();
    }
}
