package com.williamcallahan.cleanhtml.service.html;

/**
 * Replaces typographic quotation marks with their ASCII equivalents.
 */
public final class QuoteNormalizer {

    // « » “ ” „ ‟
    private static final String DOUBLE_QUOTES = "\u00ab\u00bb\u201c\u201d\u201e\u201f";
    // ‘ ’ ‚ ‛ ‹ ›
    private static final String SINGLE_QUOTES = "\u2018\u2019\u201a\u201b\u2039\u203a";

    private QuoteNormalizer() {}

    /**
     * Maps curly, low-9 and angle quotes to {@code "} or {@code '}.
     *
     * @param text text to normalize, may be null
     * @return text with ASCII quotes only, or an empty string for null input
     */
    public static String normalizeQuotes(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (DOUBLE_QUOTES.indexOf(current) >= 0) {
                normalized.append('"');
            } else if (SINGLE_QUOTES.indexOf(current) >= 0) {
                normalized.append('\'');
            } else {
                normalized.append(current);
            }
        }
        return normalized.toString();
    }
}
