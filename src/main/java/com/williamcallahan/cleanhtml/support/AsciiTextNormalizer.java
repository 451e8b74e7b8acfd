package com.williamcallahan.cleanhtml.support;

/**
 * Lowercases ASCII letters without consulting the default locale.
 *
 * <p>Tag and attribute names are ASCII identifiers, so a locale-aware lowercase
 * (for example the Turkish dotless i) must never apply to them.
 */
public final class AsciiTextNormalizer {

    private static final int CASE_OFFSET = 'a' - 'A';
    private static final char NBSP = '\u00a0';

    private AsciiTextNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * Converts ASCII uppercase letters to lowercase, leaving other characters unchanged.
     *
     * @param text the input text to normalize (may be null)
     * @return the normalized text, or empty string if null
     */
    public static String toLowerAscii(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current >= 'A' && current <= 'Z') {
                normalized.append((char) (current + CASE_OFFSET));
            } else {
                normalized.append(current);
            }
        }
        return normalized.toString();
    }

    /**
     * Reports whether the text holds only whitespace or non-breaking spaces.
     *
     * @param text text to inspect (may be null)
     * @return true for null, empty, or whitespace-only text
     */
    public static boolean isBlankIncludingNbsp(String text) {
        if (text == null) {
            return true;
        }
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (!Character.isWhitespace(current) && current != NBSP) {
                return false;
            }
        }
        return true;
    }
}
