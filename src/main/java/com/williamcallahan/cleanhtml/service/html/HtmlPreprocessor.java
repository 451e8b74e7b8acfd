package com.williamcallahan.cleanhtml.service.html;

import java.util.regex.Pattern;

/**
 * Text-level cleanup of raw pasted HTML before it reaches the parser.
 *
 * <p>These are plain string rewrites, not tag-aware ones: they also touch attribute values
 * and the inside of {@code <pre>} regions.
 */
public final class HtmlPreprocessor {

    /** Minimal document head so the parser reads the content as UTF-8. */
    public static final String DOCUMENT_HEADER = "<!DOCTYPE html><meta charset=\"utf-8\">"
            + "<meta http-equiv=\"Content-Type\" content=\"text/html; charset=utf-8\">";

    private static final String SPACE_OR_NBSP = "(?:[\\s\\u00a0]|&nbsp;)";

    private static final Pattern REPEATED_SPACE = Pattern.compile(SPACE_OR_NBSP + "{2,}");
    private static final Pattern SPACE_AFTER_OPENING_TAG = Pattern.compile("<(\\w*)>" + SPACE_OR_NBSP);
    // Spreadsheet exports separate rows with a double line break.
    private static final Pattern DOUBLE_LINE_BREAK =
            Pattern.compile("\\s*<br\\s*/?>\\s*<br\\s*/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMPTY_ELEMENT =
            Pattern.compile("<(\\w+)[^>]*>" + SPACE_OR_NBSP + "*</\\1>");

    private HtmlPreprocessor() {}

    /**
     * Normalizes whitespace, converts line-break pairs into paragraph starts, drops empty
     * element pairs and prefixes the UTF-8 document header.
     *
     * @param html raw HTML, may be null
     * @return text ready for permissive parsing
     */
    public static String preprocess(String html) {
        String text = html == null ? "" : html;
        text = REPEATED_SPACE.matcher(text).replaceAll(" ");
        text = SPACE_AFTER_OPENING_TAG.matcher(text).replaceAll("<$1>");
        text = DOUBLE_LINE_BREAK.matcher(text).replaceAll("<p>");
        text = EMPTY_ELEMENT.matcher(text).replaceAll("");
        return DOCUMENT_HEADER + text;
    }
}
