package com.williamcallahan.cleanhtml.service.html;

import com.williamcallahan.cleanhtml.domain.html.HtmlElement;
import com.williamcallahan.cleanhtml.domain.html.HtmlFragment;
import com.williamcallahan.cleanhtml.domain.html.HtmlText;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies jsoup parse trees are converted into fragments.
 */
class FragmentParserTest {

    @Test
    void returnsBodyContentOfDocument() {
        HtmlFragment fragment = FragmentParser.parseDocument(
                HtmlPreprocessor.DOCUMENT_HEADER + "<p>One</p><p>Two</p>");

        assertEquals(List.of(HtmlElement.of("p", new HtmlText("One")), HtmlElement.of("p", new HtmlText("Two"))),
                fragment.nodes());
    }

    @Test
    void wrapsLooseInlineContentInParagraph() {
        HtmlFragment fragment = FragmentParser.parseDocument("Loose <b>text</b>\n<p>Block</p>");

        assertEquals(2, fragment.nodes().size());
        assertEquals(HtmlElement.of("p", new HtmlText("Loose "), HtmlElement.of("b", new HtmlText("text"))),
                fragment.nodes().get(0));
    }

    @Test
    void dropsComments() {
        HtmlFragment fragment = FragmentParser.parseDocument("<p>a<!-- note -->b</p>");

        HtmlElement paragraph = assertInstanceOf(HtmlElement.class, fragment.nodes().get(0));
        assertEquals("ab", paragraph.textContent());
        assertEquals(2, paragraph.children().size());
    }

    @Test
    void wellFormedParseAddsNoImpliedStructure() {
        HtmlFragment fragment = FragmentParser.parseWellFormed("<table><tr><td>A</td></tr></table>\nloose text");

        HtmlElement table = assertInstanceOf(HtmlElement.class, fragment.nodes().get(0));
        HtmlElement row = assertInstanceOf(HtmlElement.class, table.children().get(0));
        assertEquals("tr", row.tagName());
        assertTrue(fragment.nodes().get(1) instanceof HtmlText, "Loose text should stay unwrapped");
    }
}
