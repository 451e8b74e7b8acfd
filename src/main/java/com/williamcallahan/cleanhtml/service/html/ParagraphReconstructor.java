package com.williamcallahan.cleanhtml.service.html;

import com.williamcallahan.cleanhtml.domain.html.BlockTags;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns loosely delimited text into paragraph-wrapped, block-aware HTML.
 *
 * <p>Blank lines become paragraph boundaries, block-level tags are kept out of the generated
 * paragraphs, and single newlines optionally become {@code <br />}. Complete {@code <pre>}
 * blocks pass through byte for byte. The rewrites below are order sensitive; each one
 * operates on the whole text.
 */
public final class ParagraphReconstructor {

    private static final String BLOCKS = BlockTags.alternation();
    private static final String BLOCK_TAG = "</?" + BLOCKS + "(?=[\\s/>])[^>]*>";
    private static final String LINE_BREAK_TAG = "<br\\s*/?>";
    private static final String INSERTED_LINE_BREAK = "<br />";
    private static final String NEWLINE_MARKER = "<AutopPreserveNewline />";

    // block spacing
    private static final Pattern DOUBLE_LINE_BREAK =
            Pattern.compile(LINE_BREAK_TAG + "\\s*" + LINE_BREAK_TAG, Pattern.CASE_INSENSITIVE);
    private static final Pattern BLOCK_OPENING =
            Pattern.compile("(<" + BLOCKS + "(?=[\\s/>])[^>]*>)", Pattern.CASE_INSENSITIVE);
    private static final Pattern BLOCK_CLOSING = Pattern.compile("(</" + BLOCKS + ">)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CARRIAGE_RETURN = Pattern.compile("\\r\\n|\\r");
    private static final Pattern OBJECT_TAG = Pattern.compile("<object", Pattern.CASE_INSENSITIVE);
    private static final Pattern PARAM_TAG = Pattern.compile("\\s*<param([^>]*)>\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMBED_CLOSING = Pattern.compile("\\s*</embed>\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n\\n+");

    // paragraphs
    private static final Pattern PARAGRAPH_BOUNDARY = Pattern.compile("\\n\\s*\\n");
    private static final Pattern EMPTY_PARAGRAPH = Pattern.compile("<p>\\s*</p>");
    private static final Pattern TEXT_BEFORE_CONTAINER_CLOSE =
            Pattern.compile("<p>([^<]+)</(div|address|form)>", Pattern.CASE_INSENSITIVE);
    private static final Pattern PARAGRAPH_AROUND_BLOCK =
            Pattern.compile("<p>\\s*(" + BLOCK_TAG + ")\\s*</p>", Pattern.CASE_INSENSITIVE);
    private static final Pattern PARAGRAPH_AROUND_LIST_ITEM =
            Pattern.compile("<p>(<li.+?)</p>", Pattern.CASE_INSENSITIVE);
    private static final Pattern PARAGRAPH_BEFORE_BLOCKQUOTE =
            Pattern.compile("<p><blockquote([^>]*)>", Pattern.CASE_INSENSITIVE);
    private static final String BLOCKQUOTE_THEN_PARAGRAPH_CLOSE = "</blockquote></p>";
    private static final String PARAGRAPH_THEN_BLOCKQUOTE_CLOSE = "</p></blockquote>";
    private static final Pattern PARAGRAPH_OPENING_BEFORE_BLOCK =
            Pattern.compile("<p>\\s*(" + BLOCK_TAG + ")", Pattern.CASE_INSENSITIVE);
    private static final Pattern PARAGRAPH_CLOSING_AFTER_BLOCK =
            Pattern.compile("(" + BLOCK_TAG + ")\\s*</p>", Pattern.CASE_INSENSITIVE);

    // line breaks
    private static final Pattern SCRIPT_OR_STYLE =
            Pattern.compile("<(script|style).*?</\\1>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    // a run of whitespace is only considered from its start, so "<br> \n" is not split past the tag
    private static final Pattern UNBROKEN_NEWLINE =
            Pattern.compile("(?<!<br\\s{0,8}/?>)(?<!\\s)\\s*\\n", Pattern.CASE_INSENSITIVE);
    private static final Pattern LINE_BREAK_AFTER_BLOCK =
            Pattern.compile("(" + BLOCK_TAG + ")\\s*" + LINE_BREAK_TAG, Pattern.CASE_INSENSITIVE);
    private static final Pattern LINE_BREAK_BEFORE_BLOCK = Pattern.compile(
            LINE_BREAK_TAG + "(\\s*</?(?:p|li|div|dl|dd|dt|th|pre|td|ul|ol)(?=[\\s/>])[^>]*>)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_NEWLINE_IN_LAST_PARAGRAPH = Pattern.compile("\\n</p>$");

    private ParagraphReconstructor() {}

    /**
     * Reconstructs paragraphs and converts remaining single newlines into line breaks.
     *
     * @param text loosely formatted text or HTML
     * @return paragraph-wrapped HTML, or an empty string for blank input
     */
    public static String reconstruct(String text) {
        return reconstruct(text, true);
    }

    /**
     * Reconstructs paragraphs.
     *
     * @param text loosely formatted text or HTML
     * @param insertLineBreaks whether single newlines inside paragraphs become {@code <br />}
     * @return paragraph-wrapped HTML, or an empty string for blank input
     */
    public static String reconstruct(String text, boolean insertLineBreaks) {
        if (text == null || text.trim().isEmpty()) {
            return "";
        }
        PreformattedBlockExtractor preformattedBlocks = new PreformattedBlockExtractor();
        String html = preformattedBlocks.extract(text + "\n");
        html = spaceOutBlocks(html);
        html = wrapParagraphs(html);
        html = cleanUpParagraphs(html);
        if (insertLineBreaks) {
            html = insertLineBreaks(html);
        }
        html = LINE_BREAK_AFTER_BLOCK.matcher(html).replaceAll("$1");
        html = LINE_BREAK_BEFORE_BLOCK.matcher(html).replaceAll("$1");
        html = TRAILING_NEWLINE_IN_LAST_PARAGRAPH.matcher(html).replaceAll("</p>");
        return preformattedBlocks.restore(html);
    }

    /**
     * Puts block tags on their own lines and normalizes newlines.
     */
    static String spaceOutBlocks(String text) {
        String spaced = DOUBLE_LINE_BREAK.matcher(text).replaceAll("\n\n");
        spaced = BLOCK_OPENING.matcher(spaced).replaceAll("\n$1");
        spaced = BLOCK_CLOSING.matcher(spaced).replaceAll("$1\n\n");
        spaced = CARRIAGE_RETURN.matcher(spaced).replaceAll("\n");
        if (OBJECT_TAG.matcher(spaced).find()) {
            // param and embed must stay contiguous inside object
            spaced = PARAM_TAG.matcher(spaced).replaceAll("<param$1>");
            spaced = EMBED_CLOSING.matcher(spaced).replaceAll("</embed>");
        }
        return EXCESS_NEWLINES.matcher(spaced).replaceAll("\n\n");
    }

    private static String wrapParagraphs(String text) {
        StringBuilder wrapped = new StringBuilder(text.length() + 32);
        for (String chunk : PARAGRAPH_BOUNDARY.split(text)) {
            if (chunk.isEmpty()) {
                continue;
            }
            wrapped.append("<p>").append(trimNewlines(chunk)).append("</p>\n");
        }
        return wrapped.toString();
    }

    private static String cleanUpParagraphs(String html) {
        String cleaned = EMPTY_PARAGRAPH.matcher(html).replaceAll("");
        cleaned = TEXT_BEFORE_CONTAINER_CLOSE.matcher(cleaned).replaceAll("<p>$1</p></$2>");
        cleaned = PARAGRAPH_AROUND_BLOCK.matcher(cleaned).replaceAll("$1");
        cleaned = PARAGRAPH_AROUND_LIST_ITEM.matcher(cleaned).replaceAll("$1");
        cleaned = PARAGRAPH_BEFORE_BLOCKQUOTE.matcher(cleaned).replaceAll("<blockquote$1><p>");
        cleaned = cleaned.replace(BLOCKQUOTE_THEN_PARAGRAPH_CLOSE, PARAGRAPH_THEN_BLOCKQUOTE_CLOSE);
        cleaned = PARAGRAPH_OPENING_BEFORE_BLOCK.matcher(cleaned).replaceAll("$1");
        return PARAGRAPH_CLOSING_AFTER_BLOCK.matcher(cleaned).replaceAll("$1");
    }

    private static String insertLineBreaks(String html) {
        String guarded = SCRIPT_OR_STYLE.matcher(html)
                .replaceAll(match -> Matcher.quoteReplacement(match.group().replace("\n", NEWLINE_MARKER)));
        guarded = UNBROKEN_NEWLINE.matcher(guarded).replaceAll(INSERTED_LINE_BREAK + "\n");
        return guarded.replace(NEWLINE_MARKER, "\n");
    }

    private static String trimNewlines(String chunk) {
        int start = 0;
        int end = chunk.length();
        while (start < end && chunk.charAt(start) == '\n') {
            start++;
        }
        while (end > start && chunk.charAt(end - 1) == '\n') {
            end--;
        }
        return chunk.substring(start, end);
    }
}
