package com.williamcallahan.cleanhtml.service.html;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies paragraph reconstruction around blank lines, block tags and preformatted text.
 */
class ParagraphReconstructorTest {

    @Test
    void blankLinesSeparateParagraphs() {
        assertEquals("<p>Line one</p>\n<p>Line two</p>\n",
                ParagraphReconstructor.reconstruct("Line one\n\nLine two", false));
    }

    @Test
    void singleNewlineBecomesLineBreak() {
        assertEquals("<p>Line one<br />\nLine two</p>\n",
                ParagraphReconstructor.reconstruct("Line one\nLine two", true));
    }

    @Test
    void singleNewlineStaysWhenLineBreaksAreOff() {
        assertEquals("<p>Line one\nLine two</p>\n",
                ParagraphReconstructor.reconstruct("Line one\nLine two", false));
    }

    @Test
    void doubleLineBreakTagStartsNewParagraph() {
        String html = ParagraphReconstructor.reconstruct("a<br /><br />b");

        assertEquals("<p>a</p>\n<p>b</p>\n", html);
    }

    @Test
    void doubleLineBreakVariantsNeverSurviveSideBySide() {
        String html = ParagraphReconstructor.reconstruct("first<br>\n<BR/>second line\nthird");

        assertFalse(html.matches("(?s).*<br\\s*/?>\\s*<br\\s*/?>.*"), "Adjacent line breaks should not remain: " + html);
        assertTrue(html.contains("<p>first</p>"), html);
    }

    @Test
    void blankInputProducesEmptyString() {
        assertEquals("", ParagraphReconstructor.reconstruct("  \n\t "));
        assertEquals("", ParagraphReconstructor.reconstruct(null));
    }

    @Test
    void blockquoteContentIsWrappedInside() {
        assertEquals("<blockquote><p>Quote</p></blockquote>\n",
                ParagraphReconstructor.reconstruct("<blockquote>Quote</blockquote>"));
        assertEquals("<blockquote><p>Quote</p></blockquote>\n",
                ParagraphReconstructor.reconstruct("<blockquote>Quote</blockquote>", false));
    }

    @Test
    void headingIsNotWrappedInParagraph() {
        assertEquals("<h2>Title</h2>\n<p>Text</p>\n",
                ParagraphReconstructor.reconstruct("<h2>Title</h2>\nText"));
    }

    @Test
    void listMarkupPassesThroughWithoutParagraphs() {
        String list = "<ul>\n<li>One</li>\n<li>Two</li>\n</ul>";

        assertEquals("<ul>\n<li>One</li>\n<li>Two</li>\n</ul>\n", ParagraphReconstructor.reconstruct(list));
    }

    @Test
    void preformattedInteriorIsPreservedByteForByte() {
        String html = ParagraphReconstructor.reconstruct("Intro\n\n<pre>line 1\n\n    line 2</pre>\n\nOutro");

        assertEquals("<p>Intro</p>\n<pre>line 1\n\n    line 2</pre>\n<p>Outro</p>\n", html);
    }

    @Test
    void standalonePreformattedBlockIsNotWrapped() {
        assertEquals("<pre>x\n\ny</pre>\n", ParagraphReconstructor.reconstruct("<pre>x\n\ny</pre>"));
    }

    @Test
    void unterminatedPreformattedBlockIsLeftUnprotected() {
        String html = ParagraphReconstructor.reconstruct("<pre>open\n\nrest");

        assertFalse(html.contains("autop-pre-tag"), html);
        assertTrue(html.contains("<p>rest</p>"), html);
    }

    @Test
    void objectParametersStayContiguous() {
        String input = "<object width=\"1\">\n  <param name=\"movie\" value=\"x\" />\n"
                + "  <param name=\"q\" value=\"y\" />\n</object>";

        String html = ParagraphReconstructor.reconstruct(input);

        assertTrue(html.contains("<object width=\"1\"><param name=\"movie\" value=\"x\" />"
                + "<param name=\"q\" value=\"y\" /></object>"), html);
    }

    @Test
    void textBeforeContainerCloseGetsItsOwnParagraph() {
        String html = ParagraphReconstructor.reconstruct("<div>Line one\n\nLine two</div>", false);

        assertTrue(html.contains("<p>Line two</p></div>"), html);
    }

    @Test
    void carriageReturnsAreNormalized() {
        assertEquals("<p>One</p>\n<p>Two</p>\n", ParagraphReconstructor.reconstruct("One\r\n\r\nTwo", false));
    }

    @Test
    void textIsNeverDropped() {
        String input = "Alpha beta\n\n<div>gamma</div>\ndelta <em>epsilon</em>\n\n<pre>zeta</pre>";

        String html = ParagraphReconstructor.reconstruct(input);

        for (String word : new String[] {"Alpha beta", "gamma", "delta", "<em>epsilon</em>", "<pre>zeta</pre>"}) {
            assertTrue(html.contains(word), "Missing " + word + " in " + html);
        }
    }

    @Test
    void manualLineBreakVariantsAreNotDoubled() {
        assertEquals("<p>a<br>\nb</p>\n", ParagraphReconstructor.reconstruct("a<br>\nb", true));
        assertEquals("<p>a<br/>\nb</p>\n", ParagraphReconstructor.reconstruct("a<br/>\nb", true));
        assertEquals("<p>a<BR />\nb</p>\n", ParagraphReconstructor.reconstruct("a<BR />\nb", true));
        assertEquals("<p>a<br> \nb</p>\n", ParagraphReconstructor.reconstruct("a<br> \nb", true));
    }

    @Test
    void scriptNewlinesDoNotBecomeLineBreaks() {
        String html = ParagraphReconstructor.reconstruct("Intro\n<script>var a = 1;\nvar b = 2;</script>\nOutro", true);

        assertTrue(html.contains("<script>var a = 1;\nvar b = 2;</script>"), html);
        assertTrue(html.contains("Intro<br />\n"), html);
        assertFalse(html.contains("AutopPreserveNewline"), html);
    }

    @Test
    void styleNewlinesDoNotBecomeLineBreaks() {
        String html = ParagraphReconstructor.reconstruct("<style>p {\ncolor: red;\n}</style>", true);

        assertTrue(html.contains("p {\ncolor: red;\n}"), html);
        assertFalse(html.contains("AutopPreserveNewline"), html);
    }

    @Test
    void listItemIsNotWrappedInParagraph() {
        assertEquals("<li>One</li>\n", ParagraphReconstructor.reconstruct("<li>One</li>", false));
        assertEquals("<LI>One</LI>\n", ParagraphReconstructor.reconstruct("<LI>One</LI>", false));
    }

    @Test
    void textBeforeUppercaseContainerCloseGetsItsOwnParagraph() {
        String html = ParagraphReconstructor.reconstruct("<DIV>Line one\n\nLine two</DIV>", false);

        assertTrue(html.contains("<p>Line two</p></DIV>"), html);
    }

    @Test
    void preformattedBlockHoldingPlaceholderLikeTextIsRestored() {
        String html = ParagraphReconstructor.reconstruct("<pre>x<pre autop-pre-tag-1></pre> and <pre>y</pre>", false);

        assertTrue(html.contains("<pre>x<pre autop-pre-tag-1></pre>"), html);
        assertTrue(html.contains("<pre>y</pre>"), html);
        assertTrue(html.contains(" and "), html);
        assertEquals(html.indexOf("<pre>y</pre>"), html.lastIndexOf("<pre>y</pre>"), html);
    }

    @Test
    void spaceOutBlocksCollapsesExcessNewlines() {
        assertEquals("a\n\nb", ParagraphReconstructor.spaceOutBlocks("a\n\n\n\nb"));
    }
}
